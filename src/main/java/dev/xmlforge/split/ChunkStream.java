package dev.xmlforge.split;

import dev.xmlforge.exception.XmlSyntaxException;
import dev.xmlforge.source.SourceCursor;
import dev.xmlforge.source.SourceDescriptor;
import dev.xmlforge.tree.XmlNode;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy sequence of chunks over every source of a cursor, in enumeration order.
 *
 * <p>Work happens only when the next chunk is requested: sources are opened one at a time and
 * read until the in-progress group reaches the chunk size. The chunk counter belongs to the
 * stream, so two streams never share numbering.
 *
 * <p>Closing the stream releases the current source and the cursor, also when iteration is
 * abandoned before the end. A source failure under {@link SourceErrorPolicy#FAIL} closes the
 * stream before the error propagates.
 */
public final class ChunkStream implements Iterator<Chunk>, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ChunkStream.class);

  private final SourceCursor sources;
  private final SplitOptions options;
  private final List<XmlNode> group = new ArrayList<>();
  private final List<String> skippedSources = new ArrayList<>();
  private @Nullable MatchedElementReader reader;
  private @Nullable Chunk pending;
  private boolean exhausted;
  private int nextIndex;
  private int sourcesProcessed;
  private long elementsMatched;

  ChunkStream(SourceCursor sources, SplitOptions options) {
    this.sources = sources;
    this.options = options;
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !exhausted) {
      pending = advance();
    }
    return pending != null;
  }

  @Override
  public Chunk next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Chunk chunk = pending;
    pending = null;
    return chunk;
  }

  /** Drains the stream into a sink, closing the stream afterwards. */
  public ChunkStats drainTo(ChunkSink sink) {
    try {
      while (hasNext()) {
        sink.emit(next());
      }
    } finally {
      close();
    }
    return stats();
  }

  public ChunkStats stats() {
    return new ChunkStats(sourcesProcessed, skippedSources, elementsMatched, nextIndex);
  }

  private @Nullable Chunk advance() {
    while (true) {
      MatchedElementReader current = reader;
      if (current == null) {
        if (!sources.hasNext()) {
          exhausted = true;
          return group.isEmpty() ? null : emitGroup();
        }
        current = openNext(sources.next());
        if (current == null) {
          continue;
        }
        reader = current;
      }

      XmlNode match;
      try {
        match = current.nextMatch();
      } catch (XmlSyntaxException | UncheckedIOException e) {
        reader = null;
        closeAfterFailure(current, e);
        handleSourceFailure(current.source(), e);
        continue;
      }

      if (match == null) {
        reader = null;
        current.close();
        sourcesProcessed++;
        log.debug(
            "Finished {} ({} matching <{}> elements)",
            current.source().identifier(),
            current.matchCount(),
            options.matchTag());
        continue;
      }

      group.add(match);
      current.release();
      elementsMatched++;
      if (group.size() >= options.chunkSize()) {
        return emitGroup();
      }
    }
  }

  private @Nullable MatchedElementReader openNext(SourceDescriptor source) {
    log.debug("Reading {}", source.identifier());
    try {
      return MatchedElementReader.open(source, options.matchTag());
    } catch (XmlSyntaxException | UncheckedIOException e) {
      handleSourceFailure(source, e);
      return null;
    }
  }

  private void handleSourceFailure(SourceDescriptor source, RuntimeException e) {
    if (options.onSourceError() == SourceErrorPolicy.FAIL) {
      close();
      throw e;
    }
    log.warn("Skipping {}: {}", source.identifier(), e.getMessage());
    skippedSources.add(source.identifier());
  }

  private void closeAfterFailure(MatchedElementReader failed, RuntimeException primary) {
    try {
      failed.close();
    } catch (RuntimeException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }

  private Chunk emitGroup() {
    Chunk chunk = Chunk.of(nextIndex++, options.containerTag(), group);
    group.clear();
    log.debug("Emitting chunk {} with {} elements", chunk.index(), chunk.size());
    return chunk;
  }

  @Override
  public void close() {
    exhausted = true;
    pending = null;
    group.clear();
    MatchedElementReader current = reader;
    reader = null;
    try {
      if (current != null) {
        current.close();
      }
    } finally {
      sources.close();
    }
  }
}
