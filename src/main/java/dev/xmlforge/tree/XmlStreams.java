package dev.xmlforge.tree;

import dev.xmlforge.exception.XmlSyntaxException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.jspecify.annotations.Nullable;

/**
 * StAX plumbing shared by the whole-document reader and the streaming partitioner.
 *
 * <p>Readers are created with DTD processing and external entities disabled. Element and
 * attribute names keep their prefix ({@code ns:Product}); namespace declarations are carried as
 * plain {@code xmlns} attributes so a written node can be read back.
 */
public final class XmlStreams {

  private static final XMLInputFactory INPUT_FACTORY = createInputFactory();

  private XmlStreams() {
    // utility class
  }

  private static XMLInputFactory createInputFactory() {
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    return factory;
  }

  /**
   * Opens a pull reader over the given stream.
   *
   * @param in the document bytes; the caller keeps ownership and closes it
   * @param sourceId identifier reported in syntax errors
   */
  public static XMLStreamReader openReader(InputStream in, String sourceId) {
    try {
      return INPUT_FACTORY.createXMLStreamReader(in);
    } catch (XMLStreamException e) {
      throw syntaxError(sourceId, e);
    }
  }

  /**
   * Reads the element the reader is positioned on, with its whole subtree. On return the reader is
   * positioned on the matching {@code END_ELEMENT}.
   */
  public static XmlNode readElement(XMLStreamReader reader) throws XMLStreamException {
    if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
      throw new IllegalStateException("reader is not positioned on a start element");
    }
    XmlNode root = startNode(reader);
    Deque<XmlNode> open = new ArrayDeque<>();
    Deque<StringBuilder> texts = new ArrayDeque<>();
    open.push(root);
    texts.push(new StringBuilder());

    while (!open.isEmpty()) {
      switch (reader.next()) {
        case XMLStreamConstants.START_ELEMENT -> {
          XmlNode node = startNode(reader);
          open.peek().append(node);
          open.push(node);
          texts.push(new StringBuilder());
        }
        case XMLStreamConstants.CHARACTERS,
            XMLStreamConstants.CDATA,
            XMLStreamConstants.SPACE -> texts.peek().append(reader.getText());
        case XMLStreamConstants.END_ELEMENT -> open.pop().setText(normalizeText(texts.pop()));
        default -> {
          // comments and processing instructions are not part of the tree model
        }
      }
    }
    return root;
  }

  /** Qualified name of the element the reader is positioned on. */
  public static String qualifiedName(XMLStreamReader reader) {
    return qualify(reader.getPrefix(), reader.getLocalName());
  }

  private static XmlNode startNode(XMLStreamReader reader) {
    XmlNode node = new XmlNode(qualifiedName(reader));
    for (int i = 0; i < reader.getNamespaceCount(); i++) {
      String prefix = reader.getNamespacePrefix(i);
      String uri = reader.getNamespaceURI(i);
      node.setAttribute(
          prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix, uri == null ? "" : uri);
    }
    for (int i = 0; i < reader.getAttributeCount(); i++) {
      node.setAttribute(
          qualify(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)),
          reader.getAttributeValue(i));
    }
    return node;
  }

  private static String qualify(@Nullable String prefix, String localName) {
    return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
  }

  private static @Nullable String normalizeText(StringBuilder text) {
    String trimmed = text.toString().trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** Wraps a parser failure, keeping the position the parser reported. */
  public static XmlSyntaxException syntaxError(String sourceId, XMLStreamException e) {
    Location location = e.getLocation();
    int line = location != null ? location.getLineNumber() : -1;
    int column = location != null ? location.getColumnNumber() : -1;
    String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new XmlSyntaxException(sourceId, line, column, detail, e);
  }

  /** Closes a reader, reporting a failure as a syntax error of the source. */
  public static void close(XMLStreamReader reader, String sourceId) {
    try {
      reader.close();
    } catch (XMLStreamException e) {
      throw syntaxError(sourceId, e);
    }
  }

  /** Closes a reader after {@code primary} was thrown, keeping any close failure as suppressed. */
  public static void closeAfterFailure(XMLStreamReader reader, RuntimeException primary) {
    try {
      reader.close();
    } catch (XMLStreamException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }
}
