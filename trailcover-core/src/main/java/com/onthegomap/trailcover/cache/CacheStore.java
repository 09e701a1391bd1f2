package com.onthegomap.trailcover.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Byte storage for cached artifacts, keyed by strings like {@code segments-0123456789abcdef}.
 * <p>
 * Implementations must be safe to call from multiple threads, and a {@link #read(String)} must never observe a partial
 * {@link #write(String, byte[])}.
 */
public interface CacheStore {

  /** Returns the bytes stored under {@code key}, or empty if there are none. */
  Optional<byte[]> read(String key) throws IOException;

  /** Stores {@code bytes} under {@code key}, replacing anything stored there before. */
  void write(String key, byte[] bytes) throws IOException;

  /** Removes the entry for {@code key} if there is one. */
  void delete(String key) throws IOException;

  /** Removes every entry. */
  void clear() throws IOException;
}
