package dev.xmlforge.split;

import static dev.xmlforge.fixture.XmlFixtures.recordNumbers;
import static dev.xmlforge.fixture.XmlFixtures.records;
import static org.assertj.core.api.Assertions.assertThat;

import dev.xmlforge.source.TreeSourceResolver;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/**
 * Property-based tests for the chunking invariants: chunk count and sizes follow from the number
 * of matches and the chunk size alone, and concatenating the chunks reproduces every match in
 * document order, sources taken in enumeration order.
 */
class StreamingPartitionerPropertyTest {

  private final TreeSourceResolver resolver = new TreeSourceResolver();
  private final StreamingPartitioner partitioner = new StreamingPartitioner();

  @Property(tries = 60)
  void chunkSizesAndOrderFollowFromTheMatchCount(
      @ForAll @Size(min = 1, max = 4) List<@IntRange(min = 0, max = 25) Integer> recordsPerSource,
      @ForAll @IntRange(min = 1, max = 10) int chunkSize)
      throws IOException {
    Path dir = Files.createTempDirectory("partition-property");
    try {
      List<String> expected = new ArrayList<>();
      int next = 1;
      for (int i = 0; i < recordsPerSource.size(); i++) {
        int count = recordsPerSource.get(i);
        Files.writeString(dir.resolve("source_%02d.xml".formatted(i)), records(next, count));
        for (int n = next; n < next + count; n++) {
          expected.add(Integer.toString(n));
        }
        next += count;
      }
      int total = expected.size();

      CollectingChunkSink sink = new CollectingChunkSink();
      partitioner
          .partition(resolver.resolve(dir, "*.xml", false), "record", chunkSize)
          .drainTo(sink);
      List<Chunk> chunks = sink.chunks();

      assertThat(chunks).hasSize((total + chunkSize - 1) / chunkSize);
      for (int i = 0; i < chunks.size(); i++) {
        assertThat(chunks.get(i).index()).isEqualTo(i);
        if (i < chunks.size() - 1) {
          assertThat(chunks.get(i).size()).isEqualTo(chunkSize);
        } else {
          int remainder = total % chunkSize;
          assertThat(chunks.get(i).size()).isEqualTo(remainder == 0 ? chunkSize : remainder);
        }
      }
      List<String> actual = new ArrayList<>();
      for (Chunk chunk : chunks) {
        actual.addAll(recordNumbers(chunk.elements()));
      }
      assertThat(actual).containsExactlyElementsOf(expected);
    } finally {
      deleteRecursively(dir);
    }
  }

  private static void deleteRecursively(Path dir) throws IOException {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths
          .sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.delete(path);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
    }
  }
}
