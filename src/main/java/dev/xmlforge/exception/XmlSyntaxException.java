package dev.xmlforge.exception;

import org.jspecify.annotations.Nullable;

/**
 * Malformed XML found while reading one source. Carries the identifier of the offending source
 * and, when the parser reported one, the position of the error.
 */
public class XmlSyntaxException extends XmlForgeException {

  private final String sourceId;
  private final int line;
  private final int column;

  public XmlSyntaxException(
      String sourceId, int line, int column, String detail, @Nullable Throwable cause) {
    super(formatMessage(sourceId, line, column, detail), cause);
    this.sourceId = sourceId;
    this.line = line;
    this.column = column;
  }

  public String getSourceId() {
    return sourceId;
  }

  /** Line of the error, or -1 if unknown. */
  public int getLine() {
    return line;
  }

  /** Column of the error, or -1 if unknown. */
  public int getColumn() {
    return column;
  }

  private static String formatMessage(String sourceId, int line, int column, String detail) {
    if (line < 0) {
      return "Malformed XML in " + sourceId + ": " + detail;
    }
    return "Malformed XML in %s at line %d, column %d: %s"
        .formatted(sourceId, line, column, detail);
  }
}
