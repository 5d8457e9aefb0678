package dev.xmlforge.exception;

/**
 * Raised when a flattened sequence cannot be turned back into a tree: no top-level element, an
 * unresolvable parent reference under the fail-fast orphan policy, or a duplicated identity under
 * the fail-fast duplicate policy.
 */
public class StructuralException extends XmlForgeException {

  public StructuralException(String message) {
    super(message);
  }
}
