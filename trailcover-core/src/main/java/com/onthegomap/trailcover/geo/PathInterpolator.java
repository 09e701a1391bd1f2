package com.onthegomap.trailcover.geo;

import java.util.ArrayList;
import java.util.List;

/**
 * Resamples a polyline into points at a fixed arc-length spacing.
 * <p>
 * Used with a coarse spacing for trail segments and a fine spacing for GPS tracks. The first and last points of the
 * input are always kept, and in between a point is emitted at every whole multiple of the spacing along the line,
 * linearly interpolated in lat/lon between the two original points that bracket it.
 */
public class PathInterpolator {

  private PathInterpolator() {}

  /**
   * Returns points spaced {@code spacingMeters} apart along {@code path}.
   * <p>
   * For a path of length {@code L} the result has between {@code ceil(L/s)} and {@code ceil(L/s) + 2} points. An empty
   * path gives an empty list and a single point gives that point.
   *
   * @throws IllegalArgumentException if {@code spacingMeters} is not positive
   */
  public static List<LatLon> interpolate(List<LatLon> path, double spacingMeters) {
    if (!(spacingMeters > 0)) {
      throw new IllegalArgumentException("spacing must be > 0, was " + spacingMeters);
    }
    int size = path.size();
    if (size == 0) {
      return List.of();
    } else if (size == 1) {
      return List.of(path.get(0));
    }
    LatLon first = path.get(0);
    LatLon last = path.get(size - 1);
    List<LatLon> result = new ArrayList<>(estimateSize(path, spacingMeters));
    result.add(first);
    double traveled = 0;
    long step = 1;
    double next = spacingMeters;
    for (int i = 1; i < size; i++) {
      LatLon a = path.get(i - 1);
      LatLon b = path.get(i);
      double edge = GeoUtils.haversineMeters(a, b);
      if (edge <= 0) {
        continue;
      }
      double end = traveled + edge;
      // a sample landing exactly on the end of the path is the last point, added below
      while (next < end) {
        result.add(a.interpolate(b, (next - traveled) / edge));
        step++;
        next = step * spacingMeters;
      }
      traveled = end;
    }
    result.add(last);
    return result;
  }

  private static int estimateSize(List<LatLon> path, double spacing) {
    double estimate = Math.ceil(GeoUtils.lengthMeters(path) / spacing) + 2;
    return (int) Math.min(Integer.MAX_VALUE - 8, estimate);
  }
}
