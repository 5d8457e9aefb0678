package dev.xmlforge.split;

import dev.xmlforge.exception.XmlSyntaxException;
import dev.xmlforge.source.SourceDescriptor;
import dev.xmlforge.tree.XmlNode;
import dev.xmlforge.tree.XmlStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.jspecify.annotations.Nullable;

/**
 * Pull reader that surfaces only the completed subtrees of one source whose tag equals the match
 * tag.
 *
 * <p>Everything outside a match is consumed event by event and checked for well-formedness by the
 * StAX parser, but never built into nodes. The only tree state the reader holds is the last match
 * it returned, which {@link #release()} drops, so memory does not grow with the document. A
 * match-tag element nested inside a match belongs to the enclosing match.
 */
final class MatchedElementReader implements AutoCloseable {

  private final SourceDescriptor source;
  private final String matchTag;
  private final InputStream stream;
  private final XMLStreamReader reader;
  private @Nullable XmlNode current;
  private int matches;

  private MatchedElementReader(
      SourceDescriptor source, String matchTag, InputStream stream, XMLStreamReader reader) {
    this.source = source;
    this.matchTag = matchTag;
    this.stream = stream;
    this.reader = reader;
  }

  static MatchedElementReader open(SourceDescriptor source, String matchTag) {
    InputStream stream;
    try {
      stream = source.openStream();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open " + source.identifier(), e);
    }
    try {
      return new MatchedElementReader(
          source, matchTag, stream, XmlStreams.openReader(stream, source.identifier()));
    } catch (RuntimeException e) {
      closeStream(stream, e);
      throw e;
    }
  }

  SourceDescriptor source() {
    return source;
  }

  /**
   * Advances to the next matching element and returns it detached from any parent.
   *
   * @return the next match, or null once the document has been read to its end
   * @throws XmlSyntaxException if the document is malformed
   */
  @Nullable XmlNode nextMatch() {
    try {
      while (reader.hasNext()) {
        if (reader.next() == XMLStreamConstants.START_ELEMENT
            && matchTag.equals(XmlStreams.qualifiedName(reader))) {
          current = XmlStreams.readElement(reader);
          matches++;
          return current;
        }
      }
      return null;
    } catch (XMLStreamException e) {
      throw XmlStreams.syntaxError(source.identifier(), e);
    }
  }

  /** Drops the reader's reference to the match most recently returned. */
  void release() {
    current = null;
  }

  /** Returns true while a returned match has not been released. */
  boolean holdsMatch() {
    return current != null;
  }

  int matchCount() {
    return matches;
  }

  @Override
  public void close() {
    current = null;
    try {
      reader.close();
    } catch (XMLStreamException e) {
      closeStream(stream, e);
      throw XmlStreams.syntaxError(source.identifier(), e);
    }
    try {
      stream.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close " + source.identifier(), e);
    }
  }

  private static void closeStream(InputStream stream, Exception primary) {
    try {
      stream.close();
    } catch (IOException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }
}
