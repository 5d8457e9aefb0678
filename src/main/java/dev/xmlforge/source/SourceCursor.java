package dev.xmlforge.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.ZipFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy, one-at-a-time sequence of documents drawn from one input location.
 *
 * <p>For archives the cursor owns the {@link ZipFile}: it is released as soon as
 * {@link #hasNext()} reports exhaustion, which the partitioner only asks once the previous entry
 * has been fully read, or by {@link #close()} when iteration is abandoned early.
 */
public final class SourceCursor implements Iterator<SourceDescriptor>, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SourceCursor.class);

  private final SourceKind kind;
  private final List<SourceDescriptor> sources;
  private @Nullable ZipFile archive;
  private int position;

  SourceCursor(SourceKind kind, List<SourceDescriptor> sources, @Nullable ZipFile archive) {
    this.kind = kind;
    this.sources = List.copyOf(sources);
    this.archive = archive;
  }

  /** Cursor over an explicit list of documents, none of which borrow an archive handle. */
  public static SourceCursor of(SourceKind kind, List<SourceDescriptor> sources) {
    return new SourceCursor(kind, sources, null);
  }

  public SourceKind kind() {
    return kind;
  }

  /** Number of documents this cursor enumerates in total. */
  public int size() {
    return sources.size();
  }

  @Override
  public boolean hasNext() {
    boolean more = position < sources.size();
    if (!more) {
      close();
    }
    return more;
  }

  @Override
  public SourceDescriptor next() {
    if (position >= sources.size()) {
      throw new NoSuchElementException();
    }
    return sources.get(position++);
  }

  /** Returns true while the archive handle, if any, is still held. */
  public boolean isOpen() {
    return archive != null;
  }

  @Override
  public void close() {
    ZipFile held = archive;
    if (held == null) {
      return;
    }
    archive = null;
    try {
      held.close();
      log.debug("Released archive {}", held.getName());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close archive " + held.getName(), e);
    }
  }
}
