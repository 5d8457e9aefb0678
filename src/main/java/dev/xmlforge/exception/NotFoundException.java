package dev.xmlforge.exception;

/** Raised when an input location does not exist or holds no document matching the request. */
public class NotFoundException extends XmlForgeException {

  public NotFoundException(String message) {
    super(message);
  }
}
