package dev.xmlforge.hierarchy;

/** What rebuilding does when two nodes carry the same identity. */
public enum DuplicateIdPolicy {
  /** The node seen last owns the identity; children referencing it attach there. */
  LAST_WINS,
  /** Refuse to rebuild. */
  FAIL
}
