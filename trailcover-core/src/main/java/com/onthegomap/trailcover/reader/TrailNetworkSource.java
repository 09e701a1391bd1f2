package com.onthegomap.trailcover.reader;

import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.Way;
import java.util.List;

/**
 * Where the trail network comes from.
 */
public interface TrailNetworkSource {

  /** Returns a string ID for this source to use in logs. */
  String id();

  /** Returns a fingerprint that changes whenever {@link #readWays()} would return something different. */
  Fingerprint fingerprint();

  /**
   * Returns every trail way from this source.
   *
   * @throws java.io.UncheckedIOException if the source cannot be read
   */
  List<Way> readWays();

  /** Returns a source that serves {@code ways} from memory. */
  static TrailNetworkSource of(String id, List<Way> ways) {
    List<Way> copy = List.copyOf(ways);
    var builder = Fingerprint.builder().add(id).add((long) copy.size());
    for (Way way : copy) {
      builder.add(way.id()).add(way.type().name()).add(way.name() == null ? "" : way.name())
        .add((long) way.points().size());
      for (LatLon point : way.points()) {
        builder.add(point.lat()).add(point.lon());
      }
    }
    Fingerprint fingerprint = builder.build();
    return new TrailNetworkSource() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public Fingerprint fingerprint() {
        return fingerprint;
      }

      @Override
      public List<Way> readWays() {
        return copy;
      }
    };
  }
}
