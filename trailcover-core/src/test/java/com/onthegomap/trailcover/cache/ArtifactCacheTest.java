package com.onthegomap.trailcover.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.SegmentedNetwork;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.track.PointCloud;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ArtifactCacheTest {

  private static final PointCloud CLOUD = PointCloud.of(List.of(LatLon.of(1, 2), LatLon.of(3, 4)));
  private static final Fingerprint FINGERPRINT = new Fingerprint(42);

  private final Stats stats = Stats.inMemory();
  private final InMemoryCacheStore store = new InMemoryCacheStore();
  private final ArtifactCache cache = new ArtifactCache(store, stats);
  private final AtomicInteger computed = new AtomicInteger();

  private PointCloud get() {
    return cache.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> {
      computed.incrementAndGet();
      return CLOUD;
    });
  }

  private long counter(String name) {
    return stats.counters().get(name).getAsLong();
  }

  @Test
  void testMissThenHit() {
    assertEquals(CLOUD, get());
    assertEquals(Set.of("track-000000000000002a"), store.keys());
    assertEquals(CLOUD, get());
    assertEquals(1, computed.get());
    assertEquals(1, counter("cache_hits"));
    assertEquals(1, counter("cache_misses"));
  }

  @Test
  void testDifferentFingerprintsAreDifferentEntries() {
    get();
    cache.getOrCompute("track", new Fingerprint(43), ArtifactCodecs.POINT_CLOUD, () -> PointCloud.EMPTY);
    assertEquals(2, store.keys().size());
    assertEquals(CLOUD, get());
  }

  @Test
  void testCorruptEntryIsRecomputedAndReplaced() throws IOException {
    store.write(FINGERPRINT.key("track"), new byte[]{1, 2, 3});
    assertEquals(CLOUD, get());
    assertEquals(1, computed.get());
    assertEquals(Map.of("cache_corrupt", 1L), stats.dataErrors());
    assertEquals(CLOUD, ArtifactCodecs.POINT_CLOUD.fromBytes(store.read(FINGERPRINT.key("track")).orElseThrow()));
    assertEquals(CLOUD, get());
    assertEquals(1, computed.get());
  }

  @Test
  void testEntryOfOtherKindIsCorrupt() throws IOException {
    store.write(FINGERPRINT.key("track"), ArtifactCodecs.SEGMENTS.toBytes(
      new SegmentedNetwork(List.of(), 0)));
    assertEquals(CLOUD, get());
    assertEquals(Map.of("cache_corrupt", 1L), stats.dataErrors());
  }

  @Test
  void testFailingStoreDoesNotFailTheRun() {
    var failing = new CacheStore() {
      @Override
      public Optional<byte[]> read(String key) throws IOException {
        throw new IOException("read failed");
      }

      @Override
      public void write(String key, byte[] bytes) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public void delete(String key) throws IOException {
        throw new IOException("delete failed");
      }

      @Override
      public void clear() throws IOException {
        throw new IOException("clear failed");
      }
    };
    var failingCache = new ArtifactCache(failing, stats);
    assertEquals(CLOUD, failingCache.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> CLOUD));
    assertEquals(Map.of("cache_read_failed", 1L, "cache_write_failed", 1L), stats.dataErrors());
    failingCache.invalidateAll();
    assertEquals(1L, stats.dataErrors().get("cache_clear_failed"));
  }

  @Test
  void testClearFailureStopsReadingStaleEntries() {
    get();
    var unclearable = new CacheStore() {
      @Override
      public Optional<byte[]> read(String key) {
        return store.read(key);
      }

      @Override
      public void write(String key, byte[] bytes) {
        store.write(key, bytes);
      }

      @Override
      public void delete(String key) {
        store.delete(key);
      }

      @Override
      public void clear() {
        throw new UncheckedIOException(new IOException("permission denied"));
      }
    };
    Stats noCacheStats = Stats.inMemory();
    var noCache = new ArtifactCache(unclearable, noCacheStats);
    noCache.invalidateAll();
    assertEquals(Map.of("cache_clear_failed", 1L), noCacheStats.dataErrors());

    PointCloud fresh = PointCloud.of(List.of(LatLon.of(5, 6)));
    assertEquals(fresh, noCache.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> fresh));
    assertEquals(fresh, noCache.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> fresh));
    assertEquals(0, noCacheStats.counters().get("cache_hits").getAsLong());
    assertEquals(2, noCacheStats.counters().get("cache_misses").getAsLong());
    // fresh results still replace the stale entry
    var reader = new ArtifactCache(store, Stats.inMemory());
    assertEquals(fresh, reader.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> CLOUD));
  }

  @Test
  void testInvalidateAll() {
    get();
    cache.invalidateAll();
    assertTrue(store.keys().isEmpty());
    get();
    assertEquals(2, computed.get());
  }

  @Test
  void testInMemory() {
    var inMemory = ArtifactCache.inMemory(stats);
    assertTrue(inMemory.store() instanceof InMemoryCacheStore);
    assertEquals(CLOUD, inMemory.getOrCompute("track", FINGERPRINT, ArtifactCodecs.POINT_CLOUD, () -> CLOUD));
  }
}
