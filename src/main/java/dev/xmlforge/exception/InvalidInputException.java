package dev.xmlforge.exception;

/** Raised when an input location is neither a document, a directory nor an archive. */
public class InvalidInputException extends XmlForgeException {

  public InvalidInputException(String message) {
    super(message);
  }
}
