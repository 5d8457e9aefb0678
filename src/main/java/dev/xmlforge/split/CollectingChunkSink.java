package dev.xmlforge.split;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Keeps every chunk in memory. Meant for small inputs and tests. */
public class CollectingChunkSink implements ChunkSink {

  private final List<Chunk> chunks = new ArrayList<>();

  @Override
  public void emit(Chunk chunk) {
    chunks.add(chunk);
  }

  public List<Chunk> chunks() {
    return Collections.unmodifiableList(chunks);
  }
}
