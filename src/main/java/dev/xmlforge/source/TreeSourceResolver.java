package dev.xmlforge.source;

import dev.xmlforge.exception.CorruptInputException;
import dev.xmlforge.exception.InvalidInputException;
import dev.xmlforge.exception.NotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies an input location as a single document, a directory or a ZIP archive and opens a
 * {@link SourceCursor} over the documents it holds.
 *
 * <p>Directory matches are ordered by their path relative to the directory, archive entries keep
 * archive order, so the enumeration is deterministic for a given location.
 */
@Component
public class TreeSourceResolver {

  private static final Logger log = LoggerFactory.getLogger(TreeSourceResolver.class);

  public static final String DEFAULT_PATTERN = "*.xml";

  static final String DOCUMENT_EXTENSION = ".xml";
  static final String ARCHIVE_EXTENSION = ".zip";
  private static final String MACOS_METADATA_DIR = "__MACOSX/";

  public SourceCursor resolve(Path location) {
    return resolve(location, DEFAULT_PATTERN, false);
  }

  /**
   * Opens the documents held by a location.
   *
   * @param location a document, a directory or a {@code .zip} archive
   * @param pattern glob matched against file names when the location is a directory
   * @param recursive whether a directory is searched at every depth or only at the top level
   * @throws NotFoundException if the location is missing or holds no matching document
   * @throws InvalidInputException if the location is neither a file nor a directory
   * @throws CorruptInputException if the archive cannot be opened
   */
  public SourceCursor resolve(Path location, String pattern, boolean recursive) {
    if (!Files.exists(location)) {
      throw new NotFoundException("Path not found: " + location);
    }
    SourceKind kind = classify(location);
    log.debug("Resolved {} as {}", location, kind);
    return switch (kind) {
      case FILE -> SourceCursor.of(kind, List.of(SourceDescriptor.file(location, kind)));
      case DIRECTORY -> openDirectory(location, pattern, recursive);
      case ARCHIVE -> openArchive(location);
    };
  }

  SourceKind classify(Path location) {
    if (Files.isDirectory(location)) {
      return SourceKind.DIRECTORY;
    }
    if (!Files.isRegularFile(location)) {
      throw new InvalidInputException(
          "Not a file, a directory or an archive: " + location);
    }
    String name = location.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(ARCHIVE_EXTENSION) ? SourceKind.ARCHIVE : SourceKind.FILE;
  }

  private SourceCursor openDirectory(Path directory, String pattern, boolean recursive) {
    PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    List<Path> matches;
    try (Stream<Path> entries = recursive ? Files.walk(directory) : Files.list(directory)) {
      matches =
          entries
              .filter(Files::isRegularFile)
              .filter(path -> matcher.matches(path.getFileName()))
              .sorted(Comparator.comparing(path -> directory.relativize(path).toString()))
              .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + directory, e);
    }

    if (matches.isEmpty()) {
      throw new NotFoundException(
          "No files matching '%s' found in %s (%s)"
              .formatted(pattern, directory, recursive ? "recursive" : "top level only"));
    }
    log.debug("Found {} files matching '{}' in {}", matches.size(), pattern, directory);
    return SourceCursor.of(
        SourceKind.DIRECTORY,
        matches.stream().map(path -> SourceDescriptor.file(path, SourceKind.DIRECTORY)).toList());
  }

  private SourceCursor openArchive(Path archivePath) {
    ZipFile archive;
    try {
      archive = new ZipFile(archivePath.toFile());
    } catch (ZipException e) {
      throw new CorruptInputException("Invalid ZIP archive: " + archivePath, e);
    } catch (IOException e) {
      throw new CorruptInputException("Cannot open ZIP archive: " + archivePath, e);
    }

    List<SourceDescriptor> sources = new ArrayList<>();
    Enumeration<? extends ZipEntry> entries = archive.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      if (isDocumentEntry(entry)) {
        sources.add(SourceDescriptor.archiveEntry(archivePath, archive, entry));
      }
    }

    if (sources.isEmpty()) {
      try {
        archive.close();
      } catch (IOException e) {
        log.warn("Failed to close archive {}: {}", archivePath, e.getMessage());
      }
      throw new NotFoundException("No XML entries found in archive: " + archivePath);
    }
    log.debug("Found {} XML entries in {}", sources.size(), archivePath);
    return new SourceCursor(SourceKind.ARCHIVE, sources, archive);
  }

  static boolean isDocumentEntry(ZipEntry entry) {
    if (entry.isDirectory()) {
      return false;
    }
    String name = entry.getName();
    if (name.startsWith(MACOS_METADATA_DIR)) {
      return false;
    }
    String lastSegment = name.substring(name.lastIndexOf('/') + 1);
    if (lastSegment.startsWith(".")) {
      return false;
    }
    return lastSegment.toLowerCase(Locale.ROOT).endsWith(DOCUMENT_EXTENSION);
  }
}
