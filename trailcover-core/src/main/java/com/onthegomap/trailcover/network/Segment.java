package com.onthegomap.trailcover.network;

import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.LatLon;
import java.util.List;

/**
 * A piece of trail between two intersections (or way ends). Nodes shared with other trails only ever appear as the
 * first or last point.
 */
public record Segment(SegmentId id, List<LatLon> points, TrailType type) {

  public Segment {
    points = List.copyOf(points);
    if (points.size() < 2) {
      throw new IllegalArgumentException("segment " + id + " needs at least 2 points, got " + points.size());
    }
  }

  public LatLon first() {
    return points.get(0);
  }

  public LatLon last() {
    return points.get(points.size() - 1);
  }

  /** Returns the haversine length of this segment in meters. */
  public double lengthMeters() {
    return GeoUtils.lengthMeters(points);
  }
}
