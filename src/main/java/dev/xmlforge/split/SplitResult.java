package dev.xmlforge.split;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a split run written to disk.
 *
 * @param chunks number of chunk files written
 * @param elements number of matched elements across all chunks
 * @param sourcesProcessed sources read to their end
 * @param skippedSources identifiers of malformed sources skipped under {@link
 *     SourceErrorPolicy#SKIP}
 * @param outputDir directory holding the chunk files
 * @param files chunk files in emission order
 */
public record SplitResult(
    int chunks,
    long elements,
    int sourcesProcessed,
    List<String> skippedSources,
    Path outputDir,
    List<Path> files) {

  public SplitResult {
    skippedSources = List.copyOf(skippedSources);
    files = List.copyOf(files);
  }
}
