package dev.xmlforge.tree;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.util.Map;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.springframework.stereotype.Component;

/**
 * Serializes an {@link XmlNode} subtree as a standalone UTF-8 document with an XML declaration
 * and two-space indentation. Escaping is left to the StAX writer.
 */
@Component
public class XmlTreeWriter {

  private static final String INDENT = "  ";
  private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

  /**
   * Writes the node to a file.
   *
   * @param options open options, e.g. {@code CREATE_NEW} to refuse overwriting
   */
  public void write(XmlNode node, Path path, OpenOption... options) {
    try (OutputStream out = Files.newOutputStream(path, options)) {
      write(node, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + path, e);
    }
  }

  public String toXmlString(XmlNode node) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    write(node, out);
    return out.toString(StandardCharsets.UTF_8);
  }

  /** Writes the node to the stream. The stream is flushed but not closed. */
  public void write(XmlNode node, OutputStream out) {
    try {
      XMLStreamWriter writer =
          OUTPUT_FACTORY.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
      writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
      writer.writeCharacters("\n");
      writeNode(writer, node, 0);
      writer.writeCharacters("\n");
      writer.writeEndDocument();
      writer.flush();
      writer.close();
    } catch (XMLStreamException e) {
      throw new UncheckedIOException(
          new IOException("Failed to serialize <" + node.getTag() + ">", e));
    }
  }

  private void writeNode(XMLStreamWriter writer, XmlNode node, int depth)
      throws XMLStreamException {
    writer.writeCharacters(INDENT.repeat(depth));
    if (node.childCount() == 0 && node.getText() == null) {
      writer.writeEmptyElement(node.getTag());
      writeAttributes(writer, node);
      return;
    }

    writer.writeStartElement(node.getTag());
    writeAttributes(writer, node);
    if (node.getText() != null) {
      writer.writeCharacters(node.getText());
    }
    if (node.childCount() > 0) {
      for (XmlNode child : node.getChildren()) {
        writer.writeCharacters("\n");
        writeNode(writer, child, depth + 1);
      }
      writer.writeCharacters("\n");
      writer.writeCharacters(INDENT.repeat(depth));
    }
    writer.writeEndElement();
  }

  private void writeAttributes(XMLStreamWriter writer, XmlNode node) throws XMLStreamException {
    for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
      writer.writeAttribute(attribute.getKey(), attribute.getValue());
    }
  }
}
