package dev.xmlforge.hierarchy;

/** Source of identities for self-nesting nodes that do not carry one. */
@FunctionalInterface
public interface IdGenerator {

  /** Returns a new non-empty identity. Uniqueness is best effort. */
  String nextId();
}
