package com.onthegomap.trailcover.cache;

import com.onthegomap.trailcover.stats.Counter;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.util.Try;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes expensive artifacts of a coverage run in a {@link CacheStore}, keyed by a {@link Fingerprint} of their
 * inputs.
 * <p>
 * The cache never makes a run fail: an entry that cannot be read or decoded is treated as a miss and recomputed, and a
 * result that cannot be written is still returned.
 */
@ThreadSafe
public class ArtifactCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactCache.class);

  private final CacheStore store;
  private final Stats stats;
  private final Counter.MultiThreadCounter hits;
  private final Counter.MultiThreadCounter misses;
  private volatile boolean readsEnabled = true;

  public ArtifactCache(CacheStore store, Stats stats) {
    this.store = store;
    this.stats = stats;
    this.hits = stats.longCounter("cache_hits");
    this.misses = stats.longCounter("cache_misses");
  }

  /** Returns a cache that keeps nothing between runs. */
  public static ArtifactCache inMemory(Stats stats) {
    return new ArtifactCache(new InMemoryCacheStore(), stats);
  }

  /**
   * Returns the artifact stored for {@code kind} and {@code fingerprint}, or computes it with {@code compute}, stores
   * it and returns it.
   */
  public <T> T getOrCompute(String kind, Fingerprint fingerprint, ArtifactCodec<T> codec, Supplier<T> compute) {
    String key = fingerprint.key(kind);
    Optional<T> cached = readsEnabled ? read(key, codec) : Optional.empty();
    if (cached.isPresent()) {
      hits.inc();
      LOGGER.debug("Cache hit for {}", key);
      return cached.get();
    }
    misses.inc();
    T result = compute.get();
    write(key, codec, result);
    return result;
  }

  private <T> Optional<T> read(String key, ArtifactCodec<T> codec) {
    Try<Optional<byte[]>> bytes = Try.apply(() -> store.read(key));
    if (bytes.isFailure()) {
      LOGGER.warn("Unable to read cache entry {}: {}", key, bytes.exception().toString());
      stats.dataError("cache_read_failed");
      return Optional.empty();
    }
    if (bytes.get().isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(codec.fromBytes(bytes.get().get()));
    } catch (ArtifactCodec.CorruptArtifactException e) {
      LOGGER.warn("Discarding corrupt cache entry {}: {}", key, e.getMessage());
      stats.dataError("cache_corrupt");
      deleteQuietly(key);
      return Optional.empty();
    }
  }

  private <T> void write(String key, ArtifactCodec<T> codec, T value) {
    try {
      store.write(key, codec.toBytes(value));
    } catch (IOException e) {
      LOGGER.warn("Unable to write cache entry {}: {}", key, e.toString());
      stats.dataError("cache_write_failed");
    }
  }

  private void deleteQuietly(String key) {
    try {
      store.delete(key);
    } catch (IOException e) {
      LOGGER.warn("Unable to delete cache entry {}: {}", key, e.toString());
    }
  }

  /**
   * Removes every cached entry so the next run recomputes everything.
   * <p>
   * If the entries cannot all be removed, this cache stops reading from its store so stale entries are never reused,
   * and keeps writing fresh results over them.
   */
  public void invalidateAll() {
    try {
      store.clear();
      LOGGER.info("Cleared cache {}", store);
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Unable to clear cache {}, recomputing everything without reading it: {}", store, e.toString());
      stats.dataError("cache_clear_failed");
      readsEnabled = false;
    }
  }

  public CacheStore store() {
    return store;
  }
}
