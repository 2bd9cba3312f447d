package com.zenlib.util;

/**
 * Static hash functions used to index interned expressions.
 * <p>
 * Hashes are only ever used to pick a bucket, equality of the hashed values is always checked separately.
 */
public final class Hashing {

  /**
   * Initial hash for the FNV-1a 32-bit hash function.
   */
  public static final int FNV1_32_INIT = 0x811c9dc5;
  private static final int FNV1_PRIME_32 = 16777619;

  private Hashing() {}

  /**
   * Mixes the 8 bytes of {@code value} into {@code hash} using the FNV-1a 32-bit hash function, low byte first.
   *
   * @param hash  the hash so far, start with {@link #FNV1_32_INIT}
   * @param value the value to mix in
   * @return the updated hash
   */
  public static int fnv1a32(int hash, long value) {
    for (int shift = 0; shift < Long.SIZE; shift += Byte.SIZE) {
      hash ^= (int) ((value >>> shift) & 0xff);
      hash *= FNV1_PRIME_32;
    }
    return hash;
  }
}
