package dev.xmlforge.split;

/** Receives chunks in emission order. */
@FunctionalInterface
public interface ChunkSink {

  void emit(Chunk chunk);
}
