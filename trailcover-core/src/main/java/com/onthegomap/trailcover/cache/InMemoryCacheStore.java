package com.onthegomap.trailcover.cache;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link CacheStore} that keeps entries in a map, for runs that should not touch disk.
 */
@ThreadSafe
public class InMemoryCacheStore implements CacheStore {

  private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> read(String key) {
    byte[] bytes = entries.get(key);
    return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
  }

  @Override
  public void write(String key, byte[] bytes) {
    entries.put(key, bytes.clone());
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  @Override
  public void clear() {
    entries.clear();
  }

  @Override
  public String toString() {
    return "InMemoryCacheStore{" + entries.size() + " entries}";
  }

  /** Returns the keys of every stored entry, sorted. */
  public Set<String> keys() {
    return new TreeSet<>(entries.keySet());
  }
}
