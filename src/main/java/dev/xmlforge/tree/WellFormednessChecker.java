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
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that a document parses, without building a tree. Schema validation is not attempted.
 */
@Component
public class WellFormednessChecker {

  private static final Logger log = LoggerFactory.getLogger(WellFormednessChecker.class);

  /** Returns false for a missing, unreadable or malformed file. */
  public boolean isWellFormed(Path path) {
    try {
      check(path);
      return true;
    } catch (NotFoundException | XmlSyntaxException | UncheckedIOException e) {
      log.debug("{} is not well-formed: {}", path, e.getMessage());
      return false;
    }
  }

  /** Returns false for a blank or malformed string. */
  public boolean isWellFormed(String xml) {
    if (xml == null || xml.isBlank()) {
      return false;
    }
    try {
      scan(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "<string>");
      return true;
    } catch (XmlSyntaxException e) {
      log.debug("String is not well-formed: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Parses the whole file.
   *
   * @throws NotFoundException if the file does not exist
   * @throws XmlSyntaxException at the first syntax error, or if there is no root element
   */
  public void check(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new NotFoundException("File not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      scan(in, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }

  private void scan(InputStream in, String sourceId) {
    XMLStreamReader reader = XmlStreams.openReader(in, sourceId);
    try {
      scanEvents(reader, sourceId);
    } catch (RuntimeException e) {
      XmlStreams.closeAfterFailure(reader, e);
      throw e;
    }
    XmlStreams.close(reader, sourceId);
  }

  private static void scanEvents(XMLStreamReader reader, String sourceId) {
    try {
      boolean sawRoot = false;
      while (reader.hasNext()) {
        if (reader.next() == XMLStreamReader.START_ELEMENT) {
          sawRoot = true;
        }
      }
      if (!sawRoot) {
        throw new XmlSyntaxException(sourceId, -1, -1, "document has no root element", null);
      }
    } catch (XMLStreamException e) {
      throw XmlStreams.syntaxError(sourceId, e);
    }
  }
}
