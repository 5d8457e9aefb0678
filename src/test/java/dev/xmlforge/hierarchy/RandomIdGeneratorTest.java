package dev.xmlforge.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RandomIdGeneratorTest {

  @Test
  void tokensHaveTheConfiguredLengthAndAlphabet() {
    RandomIdGenerator generator = new RandomIdGenerator(12);

    for (int i = 0; i < 100; i++) {
      assertThat(generator.nextId()).hasSize(12).matches("[a-z0-9]+");
    }
  }

  @Test
  void defaultLengthIsEight() {
    assertThat(new RandomIdGenerator().nextId()).hasSize(8);
  }

  @Test
  void sameSeedGivesSameSequence() {
    RandomIdGenerator first = new RandomIdGenerator(8, new Random(7));
    RandomIdGenerator second = new RandomIdGenerator(8, new Random(7));

    assertThat(first.nextId()).isEqualTo(second.nextId());
  }

  @Test
  void tokensAreRarelyRepeated() {
    RandomIdGenerator generator = new RandomIdGenerator();
    Set<String> seen = new HashSet<>();

    for (int i = 0; i < 10_000; i++) {
      seen.add(generator.nextId());
    }

    // 36^8 values: a repeat among 10k draws has a probability below 1e-4
    assertThat(seen.size()).isGreaterThanOrEqualTo(9_999);
  }

  @Test
  void rejectsLengthsBelowTheMinimum() {
    assertThatThrownBy(() -> new RandomIdGenerator(3))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
