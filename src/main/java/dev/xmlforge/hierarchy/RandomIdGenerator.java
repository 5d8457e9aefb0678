package dev.xmlforge.hierarchy;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Fixed-length random tokens of lowercase letters and digits.
 *
 * <p>Tokens are not guaranteed to be unique: with the default length of 8 there are 36^8
 * (about 2.8e12) values, so collisions are rare but possible across large or repeated runs.
 */
public class RandomIdGenerator implements IdGenerator {

  public static final int DEFAULT_LENGTH = 8;
  static final int MIN_LENGTH = 4;

  private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

  private final Random random;
  private final int length;

  public RandomIdGenerator() {
    this(DEFAULT_LENGTH);
  }

  public RandomIdGenerator(int length) {
    this(length, new SecureRandom());
  }

  RandomIdGenerator(int length, Random random) {
    if (length < MIN_LENGTH) {
      throw new IllegalArgumentException("id length must be at least " + MIN_LENGTH);
    }
    this.length = length;
    this.random = random;
  }

  @Override
  public String nextId() {
    char[] token = new char[length];
    for (int i = 0; i < length; i++) {
      token[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    }
    return new String(token);
  }

  public int length() {
    return length;
  }
}
