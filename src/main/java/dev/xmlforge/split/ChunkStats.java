package dev.xmlforge.split;

import java.util.List;

/**
 * Counters of a chunk stream, as of the moment they were taken.
 *
 * @param sourcesProcessed sources read to their end
 * @param skippedSources identifiers of sources abandoned under {@link SourceErrorPolicy#SKIP}
 * @param elementsMatched matched elements taken so far
 * @param chunksEmitted chunks handed out so far
 */
public record ChunkStats(
    int sourcesProcessed, List<String> skippedSources, long elementsMatched, int chunksEmitted) {

  public ChunkStats {
    skippedSources = List.copyOf(skippedSources);
  }
}
