package com.onthegomap.trailcover.network;

import com.onthegomap.trailcover.geo.LatLon;
import java.util.List;

/**
 * A trail as read from the network source, before it is split at intersections.
 *
 * @param id     stable identifier from the source, the OpenStreetMap way ID
 * @param points nodes of the trail in order
 * @param type   trail type from the {@code highway} tag
 * @param name   trail name, or {@code null} if the way has none
 */
public record Way(long id, List<LatLon> points, TrailType type, String name) {

  public Way {
    points = List.copyOf(points);
    if (type == null) {
      type = TrailType.OTHER;
    }
  }

  public Way(long id, List<LatLon> points, TrailType type) {
    this(id, points, type, null);
  }
}
