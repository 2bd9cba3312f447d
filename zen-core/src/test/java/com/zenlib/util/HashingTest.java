package com.zenlib.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashingTest {

  private static int hash(long... values) {
    int hash = Hashing.FNV1_32_INIT;
    for (long value : values) {
      hash = Hashing.fnv1a32(hash, value);
    }
    return hash;
  }

  @Test
  void testFnv1a32() {
    assertEquals(Hashing.FNV1_32_INIT, hash());
    assertNotEquals(hash(1L, 2L), hash(2L, 1L));
    assertNotEquals(hash(1L), hash(1L << 32));
    assertNotEquals(hash(0L), hash(0L, 0L));
  }

  @Test
  void testMixesEveryByte() {
    for (int shift = 0; shift < Long.SIZE; shift += Byte.SIZE) {
      assertNotEquals(hash(0L), hash(1L << shift), "byte at " + shift);
    }
  }
}
