package dev.xmlforge.split;

import dev.xmlforge.source.SourceCursor;
import dev.xmlforge.source.TreeSourceResolver;
import dev.xmlforge.tree.XmlTreeWriter;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the split pipeline: input location -> sources -> chunk stream -> sink.
 *
 * <p>Whether a malformed source aborts the run or is skipped is decided by {@link
 * SplitOptions#onSourceError()}; the configured default comes from {@link SplitProperties}.
 */
@Service
public class SplitService {

  private static final Logger log = LoggerFactory.getLogger(SplitService.class);

  private final TreeSourceResolver sourceResolver;
  private final StreamingPartitioner partitioner;
  private final XmlTreeWriter treeWriter;
  private final SplitProperties properties;

  public SplitService(
      TreeSourceResolver sourceResolver,
      StreamingPartitioner partitioner,
      XmlTreeWriter treeWriter,
      SplitProperties properties) {
    this.sourceResolver = sourceResolver;
    this.partitioner = partitioner;
    this.treeWriter = treeWriter;
    this.properties = properties;
  }

  /** Options for {@code matchTag} with the configured defaults. */
  public SplitOptions defaultOptions(String matchTag) {
    return properties.toOptions(matchTag);
  }

  /**
   * Opens a lazy chunk stream over the input (pull mode). The input location is resolved
   * immediately, so a missing or unreadable location fails here rather than on first read.
   * The caller must close the stream.
   */
  public ChunkStream stream(Path input, SplitOptions options) {
    SourceCursor sources =
        sourceResolver.resolve(input, options.pattern(), options.recursive());
    return partitioner.partition(sources, options);
  }

  /** Reads every chunk into memory. */
  public List<Chunk> collect(Path input, SplitOptions options) {
    CollectingChunkSink sink = new CollectingChunkSink();
    stream(input, options).drainTo(sink);
    return sink.chunks();
  }

  /**
   * Splits the input into numbered chunk files (push mode).
   *
   * @param input a document, a directory or a ZIP archive
   * @param outputDir directory receiving {@code chunk_NNNN.xml}; created if absent
   * @param options match tag, chunk size and source handling
   * @return what was written
   */
  public SplitResult split(Path input, Path outputDir, SplitOptions options) {
    log.info(
        "Splitting {} on <{}> into chunks of {} (pattern: {}, recursive: {}, on source error: {})",
        input,
        options.matchTag(),
        options.chunkSize(),
        options.pattern(),
        options.recursive(),
        options.onSourceError());

    ChunkStream chunks = stream(input, options);
    DirectoryChunkSink sink;
    try {
      sink = new DirectoryChunkSink(outputDir, treeWriter);
    } catch (RuntimeException e) {
      chunks.close();
      throw e;
    }
    ChunkStats stats = chunks.drainTo(sink);

    if (!stats.skippedSources().isEmpty()) {
      log.warn(
          "Skipped {} malformed sources: {}",
          stats.skippedSources().size(),
          stats.skippedSources());
    }
    log.info(
        "Wrote {} chunks ({} elements from {} sources) to {}",
        stats.chunksEmitted(),
        stats.elementsMatched(),
        stats.sourcesProcessed(),
        outputDir);
    return new SplitResult(
        stats.chunksEmitted(),
        stats.elementsMatched(),
        stats.sourcesProcessed(),
        stats.skippedSources(),
        outputDir,
        sink.writtenFiles());
  }
}
