package dev.xmlforge.source;

import static dev.xmlforge.fixture.XmlFixtures.writeFile;
import static dev.xmlforge.fixture.XmlFixtures.writeZip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.xmlforge.exception.CorruptInputException;
import dev.xmlforge.exception.InvalidInputException;
import dev.xmlforge.exception.NotFoundException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class TreeSourceResolverTest {

  private final TreeSourceResolver resolver = new TreeSourceResolver();

  @TempDir Path dir;

  @Test
  void singleFileYieldsOneSource() throws Exception {
    Path file = writeFile(dir, "one.xml", "<a/>");

    try (SourceCursor cursor = resolver.resolve(file)) {
      assertThat(cursor.kind()).isEqualTo(SourceKind.FILE);
      assertThat(identifiers(cursor)).containsExactly(file.toString());
    }
  }

  @Test
  void directoryPatternSelectsMatchingFilesInOrder() throws Exception {
    writeFile(dir, "data_002.xml", "<a/>");
    writeFile(dir, "other.xml", "<a/>");
    writeFile(dir, "data_001.xml", "<a/>");

    try (SourceCursor cursor = resolver.resolve(dir, "data_*.xml", false)) {
      assertThat(cursor.kind()).isEqualTo(SourceKind.DIRECTORY);
      assertThat(identifiers(cursor))
          .containsExactly(
              dir.resolve("data_001.xml").toString(), dir.resolve("data_002.xml").toString());
    }
  }

  @Test
  void nestedFilesAreOnlyFoundWhenRecursive() throws Exception {
    writeFile(dir, "top.xml", "<a/>");
    writeFile(dir, "sub/deep.xml", "<a/>");

    try (SourceCursor flat = resolver.resolve(dir, "*.xml", false)) {
      assertThat(flat.size()).isEqualTo(1);
    }
    try (SourceCursor recursive = resolver.resolve(dir, "*.xml", true)) {
      assertThat(identifiers(recursive))
          .containsExactly(
              dir.resolve("sub/deep.xml").toString(), dir.resolve("top.xml").toString());
    }
  }

  @Test
  void directoryWithoutMatchesNamesPatternAndMode() throws Exception {
    writeFile(dir, "notes.txt", "hello");

    assertThatThrownBy(() -> resolver.resolve(dir, "*.xml", true))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("*.xml")
        .hasMessageContaining("recursive");
    assertThatThrownBy(() -> resolver.resolve(dir, "*.xml", false))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("top level only");
  }

  @Test
  void archiveYieldsXmlEntriesInArchiveOrder() throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("b.xml", "<b/>");
    entries.put("readme.txt", "not xml");
    entries.put("nested/a.XML", "<a/>");
    entries.put("__MACOSX/._b.xml", "junk");
    entries.put("nested/.hidden.xml", "<h/>");
    Path zip = writeZip(dir.resolve("bundle.zip"), entries);

    try (SourceCursor cursor = resolver.resolve(zip)) {
      assertThat(cursor.kind()).isEqualTo(SourceKind.ARCHIVE);
      assertThat(identifiers(cursor)).containsExactly(zip + "!/b.xml", zip + "!/nested/a.XML");
    }
  }

  @Test
  void archiveEntriesAreReadable() throws Exception {
    Path zip = writeZip(dir.resolve("bundle.zip"), Map.of("doc.xml", "<doc>hi</doc>"));

    try (SourceCursor cursor = resolver.resolve(zip)) {
      SourceDescriptor source = cursor.next();
      try (InputStream in = source.openStream()) {
        assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8))
            .isEqualTo("<doc>hi</doc>");
      }
    }
  }

  @Test
  void archiveIsReleasedOnceExhausted() throws Exception {
    Path zip = writeZip(dir.resolve("bundle.zip"), Map.of("doc.xml", "<doc/>"));

    SourceCursor cursor = resolver.resolve(zip);
    assertThat(cursor.isOpen()).isTrue();
    cursor.next();
    assertThat(cursor.isOpen()).isTrue();

    assertThat(cursor.hasNext()).isFalse();
    assertThat(cursor.isOpen()).isFalse();
  }

  @Test
  void closingEarlyReleasesTheArchive() throws Exception {
    Path zip = writeZip(dir.resolve("bundle.zip"), Map.of("a.xml", "<a/>", "b.xml", "<b/>"));

    SourceCursor cursor = resolver.resolve(zip);
    cursor.next();
    cursor.close();

    assertThat(cursor.isOpen()).isFalse();
    cursor.close();
  }

  @Test
  void archiveWithoutXmlEntriesIsNotFound() throws Exception {
    Path zip = writeZip(dir.resolve("docs.zip"), Map.of("readme.txt", "nothing here"));

    assertThatThrownBy(() -> resolver.resolve(zip))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("No XML entries");
  }

  @Test
  void malformedArchiveIsCorrupt() throws Exception {
    Path zip = Files.writeString(dir.resolve("broken.zip"), "this is not a zip archive");

    assertThatThrownBy(() -> resolver.resolve(zip)).isInstanceOf(CorruptInputException.class);
  }

  @Test
  void missingLocationIsNotFound() {
    assertThatThrownBy(() -> resolver.resolve(dir.resolve("absent.zip")))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("absent.zip");
  }

  @Test
  @EnabledOnOs(OS.LINUX)
  void deviceFileIsInvalidInput() {
    assertThatThrownBy(() -> resolver.resolve(Path.of("/dev/null")))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void reservedEntriesAreNotDocuments() {
    assertThat(TreeSourceResolver.isDocumentEntry(new ZipEntry("a/b.xml"))).isTrue();
    assertThat(TreeSourceResolver.isDocumentEntry(new ZipEntry("a/"))).isFalse();
    assertThat(TreeSourceResolver.isDocumentEntry(new ZipEntry("__MACOSX/a.xml"))).isFalse();
    assertThat(TreeSourceResolver.isDocumentEntry(new ZipEntry("a/.b.xml"))).isFalse();
    assertThat(TreeSourceResolver.isDocumentEntry(new ZipEntry("a/b.json"))).isFalse();
  }

  private static List<String> identifiers(SourceCursor cursor) {
    List<String> ids = new ArrayList<>();
    while (cursor.hasNext()) {
      ids.add(cursor.next().identifier());
    }
    return ids;
  }
}
