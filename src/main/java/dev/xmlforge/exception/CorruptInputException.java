package dev.xmlforge.exception;

/** Raised when an archive exists but cannot be opened as a ZIP file. */
public class CorruptInputException extends XmlForgeException {

  public CorruptInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
