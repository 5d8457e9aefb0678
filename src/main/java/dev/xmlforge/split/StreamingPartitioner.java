package dev.xmlforge.split;

import dev.xmlforge.source.SourceCursor;
import org.springframework.stereotype.Component;

/**
 * Splits the documents of a {@link SourceCursor} into bounded chunks of matched elements.
 *
 * <p>Every chunk holds exactly {@code chunkSize} elements except the last one of the run, which
 * holds the remainder. Elements keep document order, and sources are visited in the order the
 * cursor yields them, so numbering is deterministic for a deterministic enumeration.
 */
@Component
public class StreamingPartitioner {

  public ChunkStream partition(SourceCursor sources, String matchTag, int chunkSize) {
    return partition(sources, SplitOptions.of(matchTag, chunkSize));
  }

  /**
   * Returns a lazy chunk stream. Nothing is read until the first chunk is requested; the caller
   * closes the stream, which also closes the cursor.
   */
  public ChunkStream partition(SourceCursor sources, SplitOptions options) {
    return new ChunkStream(sources, options);
  }
}
