package dev.xmlforge.hierarchy;

/** What rebuilding does with a node whose parent identity does not resolve. */
public enum OrphanPolicy {
  /** Leave the node out of the rebuilt tree and log a warning. */
  DROP,
  /** Refuse to rebuild. */
  FAIL
}
