package dev.xmlforge.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.jspecify.annotations.Nullable;

/**
 * One document to read: a file, a file found in a directory, or an entry of an open archive.
 *
 * <p>Archive entries borrow the archive handle owned by the {@link SourceCursor} that produced
 * them; the stream returned by {@link #openStream()} is only valid while that cursor is open.
 *
 * @param identifier human-readable id used in logs and errors ({@code data.zip!/a/b.xml} for
 *     archive entries)
 * @param kind the kind of the location this document was drawn from
 * @param path the document file, or the archive file for archive entries
 * @param archive the enclosing archive; null unless {@code kind} is {@link SourceKind#ARCHIVE}
 * @param entry the archive entry; null unless {@code kind} is {@link SourceKind#ARCHIVE}
 */
public record SourceDescriptor(
    String identifier,
    SourceKind kind,
    Path path,
    @Nullable ZipFile archive,
    @Nullable ZipEntry entry) {

  public SourceDescriptor {
    Objects.requireNonNull(identifier, "identifier must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(path, "path must not be null");
    if ((archive == null) != (entry == null)) {
      throw new IllegalArgumentException("archive and entry must be given together");
    }
  }

  static SourceDescriptor file(Path path, SourceKind kind) {
    return new SourceDescriptor(path.toString(), kind, path, null, null);
  }

  static SourceDescriptor archiveEntry(Path archivePath, ZipFile archive, ZipEntry entry) {
    return new SourceDescriptor(
        archivePath + "!/" + entry.getName(), SourceKind.ARCHIVE, archivePath, archive, entry);
  }

  /** Opens the document bytes. The caller closes the stream. */
  public InputStream openStream() throws IOException {
    if (archive != null && entry != null) {
      return archive.getInputStream(entry);
    }
    return Files.newInputStream(path);
  }
}
