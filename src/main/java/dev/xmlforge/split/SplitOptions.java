package dev.xmlforge.split;

import java.util.Objects;

/**
 * Settings of one split run.
 *
 * @param matchTag tag of the elements collected into chunks
 * @param chunkSize number of elements per chunk, at least 1
 * @param pattern glob matched against file names when the input is a directory
 * @param recursive whether a directory input is searched at every depth
 * @param containerTag tag of the synthetic element wrapping each chunk
 * @param onSourceError policy applied when a source is malformed
 */
public record SplitOptions(
    String matchTag,
    int chunkSize,
    String pattern,
    boolean recursive,
    String containerTag,
    SourceErrorPolicy onSourceError) {

  public static final int DEFAULT_CHUNK_SIZE = 1000;
  public static final String DEFAULT_PATTERN = "*.xml";
  public static final String DEFAULT_CONTAINER_TAG = "chunk";

  public SplitOptions {
    if (matchTag == null || matchTag.isBlank()) {
      throw new IllegalArgumentException("matchTag must not be blank");
    }
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be at least 1, got: " + chunkSize);
    }
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("pattern must not be blank");
    }
    if (containerTag == null || containerTag.isBlank()) {
      throw new IllegalArgumentException("containerTag must not be blank");
    }
    Objects.requireNonNull(onSourceError, "onSourceError must not be null");
  }

  /** Options with every default applied. */
  public static SplitOptions of(String matchTag) {
    return of(matchTag, DEFAULT_CHUNK_SIZE);
  }

  public static SplitOptions of(String matchTag, int chunkSize) {
    return new SplitOptions(
        matchTag,
        chunkSize,
        DEFAULT_PATTERN,
        false,
        DEFAULT_CONTAINER_TAG,
        SourceErrorPolicy.FAIL);
  }

  public SplitOptions withSourceErrorPolicy(SourceErrorPolicy policy) {
    return new SplitOptions(matchTag, chunkSize, pattern, recursive, containerTag, policy);
  }

  public SplitOptions withDirectoryScan(String pattern, boolean recursive) {
    return new SplitOptions(matchTag, chunkSize, pattern, recursive, containerTag, onSourceError);
  }
}
