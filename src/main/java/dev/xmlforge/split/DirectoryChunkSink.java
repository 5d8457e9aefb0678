package dev.xmlforge.split;

import dev.xmlforge.tree.XmlTreeWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each chunk to its own file {@code chunk_NNNN.xml} in an output directory.
 *
 * <p>The index is zero-padded to four digits so lexical and numeric order coincide for the first
 * ten thousand chunks. Files are created with {@link StandardOpenOption#CREATE_NEW}: an existing
 * file is never overwritten or appended to.
 */
public class DirectoryChunkSink implements ChunkSink {

  private static final Logger log = LoggerFactory.getLogger(DirectoryChunkSink.class);

  static final String FILE_NAME_FORMAT = "chunk_%04d.xml";

  private final Path outputDir;
  private final XmlTreeWriter writer;
  private final List<Path> written = new ArrayList<>();

  /** Creates the output directory, with missing parents, if it does not exist. */
  public DirectoryChunkSink(Path outputDir, XmlTreeWriter writer) {
    this.outputDir = outputDir;
    this.writer = writer;
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create output directory " + outputDir, e);
    }
  }

  public static String fileName(int index) {
    return FILE_NAME_FORMAT.formatted(index);
  }

  @Override
  public void emit(Chunk chunk) {
    Path target = outputDir.resolve(fileName(chunk.index()));
    writer.write(
        chunk.container(), target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    written.add(target);
    log.debug("Wrote chunk {} ({} elements) to {}", chunk.index(), chunk.size(), target);
  }

  public Path outputDir() {
    return outputDir;
  }

  /** Files written so far, in emission order. */
  public List<Path> writtenFiles() {
    return Collections.unmodifiableList(written);
  }
}
