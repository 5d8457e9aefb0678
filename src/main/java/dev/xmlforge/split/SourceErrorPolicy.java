package dev.xmlforge.split;

/** What a chunk stream does when one source turns out to be malformed or unreadable. */
public enum SourceErrorPolicy {
  /** Propagate the error and release every open handle. */
  FAIL,
  /** Log the failure, abandon the source and continue with the next one. */
  SKIP
}
