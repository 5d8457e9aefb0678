package dev.xmlforge.exception;

import org.jspecify.annotations.Nullable;

/** Base class for every failure raised by the split and hierarchy pipelines. */
public class XmlForgeException extends RuntimeException {

  public XmlForgeException(String message) {
    super(message);
  }

  public XmlForgeException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
