package com.slack.distributor.hash;

import java.nio.charset.StandardCharsets;

/**
 * Incremental FNV-1a over the UTF-8 bytes of strings. Both widths must stay byte-for-byte
 * compatible with the write path, which shards and fingerprints series with the same functions.
 */
final class Fnv {
  static final int OFFSET_32 = 0x811c9dc5;
  static final int PRIME_32 = 16777619;

  static final long OFFSET_64 = 0xcbf29ce484222325L;
  static final long PRIME_64 = 1099511628211L;

  private Fnv() {}

  static int add32(int h, String s) {
    for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
      h ^= b & 0xff;
      h *= PRIME_32;
    }
    return h;
  }

  static long add64(long h, String s) {
    for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
      h = addByte64(h, b);
    }
    return h;
  }

  static long addByte64(long h, byte b) {
    h ^= b & 0xff;
    h *= PRIME_64;
    return h;
  }
}
