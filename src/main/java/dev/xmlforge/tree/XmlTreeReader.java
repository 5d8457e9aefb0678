package dev.xmlforge.tree;

import dev.xmlforge.exception.NotFoundException;
import dev.xmlforge.exception.XmlSyntaxException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.springframework.stereotype.Component;

/**
 * Parses a whole document into an {@link XmlNode} tree. Used by the hierarchy pipeline, which
 * works on already-parsed trees; the split pipeline never materializes a full document.
 */
@Component
public class XmlTreeReader {

  public XmlNode read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new NotFoundException("File not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }

  public XmlNode readString(String xml) {
    return read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "<string>");
  }

  /**
   * Reads the root element of the stream. The stream is not closed.
   *
   * @throws XmlSyntaxException if the document is not well-formed or has no root element
   */
  public XmlNode read(InputStream in, String sourceId) {
    XMLStreamReader reader = XmlStreams.openReader(in, sourceId);
    XmlNode root;
    try {
      root = readRoot(reader, sourceId);
    } catch (RuntimeException e) {
      XmlStreams.closeAfterFailure(reader, e);
      throw e;
    }
    XmlStreams.close(reader, sourceId);
    return root;
  }

  private static XmlNode readRoot(XMLStreamReader reader, String sourceId) {
    try {
      while (reader.hasNext()) {
        if (reader.next() == XMLStreamConstants.START_ELEMENT) {
          XmlNode root = XmlStreams.readElement(reader);
          // drain the epilogue so trailing garbage is reported
          while (reader.hasNext()) {
            reader.next();
          }
          return root;
        }
      }
      throw new XmlSyntaxException(sourceId, -1, -1, "document has no root element", null);
    } catch (XMLStreamException e) {
      throw XmlStreams.syntaxError(sourceId, e);
    }
  }
}
