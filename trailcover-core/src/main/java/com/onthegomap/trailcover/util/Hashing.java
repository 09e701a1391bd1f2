package com.onthegomap.trailcover.util;

import java.nio.charset.StandardCharsets;

/**
 * Static hash functions and hashing utilities.
 */
public final class Hashing {

  /**
   * Initial hash for the FNV-1 and FNV-1a 64-bit hash function.
   */
  public static final long FNV1_64_INIT = 0xcbf29ce484222325L;
  private static final long FNV1_PRIME_64 = 1099511628211L;

  private Hashing() {}

  /**
   * Computes the hash using the FNV-1a 64-bit hash function, starting with the initial hash.
   * <p>
   * The hash generation must always start with {@link #FNV1_64_INIT} as initial hash but this version comes in handy
   * when generating the hash for multiple values consecutively.
   *
   * @param initHash the initial hash
   * @param data     the data to generate the hash for
   * @return the generated hash
   */
  public static long fnv1a64(long initHash, byte... data) {
    long hash = initHash;
    if (data == null) {
      return hash;
    }
    for (byte datum : data) {
      hash ^= (datum & 0xff);
      hash *= FNV1_PRIME_64;
    }
    return hash;
  }

  /**
   * Computes the hash using the FNV-1a 64-bit hash function.
   *
   * @param data the data to generate the hash for
   * @return the hash
   */
  public static long fnv1a64(byte... data) {
    return fnv1a64(FNV1_64_INIT, data);
  }

  /** Continues {@code initHash} with the 8 big-endian bytes of {@code value}. */
  public static long fnv1a64(long initHash, long value) {
    long hash = initHash;
    for (int shift = 56; shift >= 0; shift -= 8) {
      hash ^= (value >>> shift) & 0xff;
      hash *= FNV1_PRIME_64;
    }
    return hash;
  }

  /** Continues {@code initHash} with the UTF-8 bytes of {@code value} followed by a separator. */
  public static long fnv1a64(long initHash, String value) {
    // length prefix so that ("ab", "c") and ("a", "bc") hash differently
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return fnv1a64(fnv1a64(initHash, (long) bytes.length), bytes);
  }
}
