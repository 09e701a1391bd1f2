package com.onthegomap.trailcover.track;

import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.LatLon;
import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * A recorded GPS trace.
 *
 * @param id     identifies where the trace came from, for example {@code "morning-run.gpx#0"}
 * @param name   activity name to show in logs
 * @param points recorded positions in order
 */
public record Track(String id, String name, List<LatLon> points) {

  public Track {
    points = List.copyOf(points);
    if (points.isEmpty()) {
      throw new IllegalArgumentException("track " + id + " has no points");
    }
  }

  public Track(String id, List<LatLon> points) {
    this(id, id, points);
  }

  /** Returns the bounding box of this track, x is longitude and y is latitude. */
  public Envelope envelope() {
    return GeoUtils.envelope(points);
  }

  /** Returns a fingerprint of the recorded positions, independent of where they were read from. */
  public Fingerprint fingerprint() {
    var builder = Fingerprint.builder().add((long) points.size());
    for (LatLon point : points) {
      builder.add(point.lat()).add(point.lon());
    }
    return builder.build();
  }
}
