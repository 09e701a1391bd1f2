package com.onthegomap.trailcover.track;

import com.onthegomap.trailcover.geo.LatLon;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * An immutable set of sample points stored as a flat array of {@code lat, lon} pairs.
 */
public final class PointCloud {

  public static final PointCloud EMPTY = new PointCloud(new double[0]);

  private final double[] coords;

  private PointCloud(double[] coords) {
    this.coords = coords;
  }

  /** Returns a cloud backed by {@code latLons}, which must hold {@code lat, lon} pairs and must not be modified. */
  public static PointCloud wrap(double[] latLons) {
    if (latLons.length % 2 != 0) {
      throw new IllegalArgumentException("expected lat/lon pairs, got " + latLons.length + " values");
    }
    return new PointCloud(latLons);
  }

  public static PointCloud of(List<LatLon> points) {
    double[] coords = new double[points.size() * 2];
    int i = 0;
    for (LatLon point : points) {
      coords[i++] = point.lat();
      coords[i++] = point.lon();
    }
    return new PointCloud(coords);
  }

  /** Returns a cloud with the points of every cloud in {@code clouds}, in iteration order. */
  public static PointCloud concat(Collection<PointCloud> clouds) {
    int length = 0;
    for (PointCloud cloud : clouds) {
      length += cloud.coords.length;
    }
    double[] coords = new double[length];
    int offset = 0;
    for (PointCloud cloud : clouds) {
      System.arraycopy(cloud.coords, 0, coords, offset, cloud.coords.length);
      offset += cloud.coords.length;
    }
    return new PointCloud(coords);
  }

  public int size() {
    return coords.length / 2;
  }

  public boolean isEmpty() {
    return coords.length == 0;
  }

  public double lat(int i) {
    return coords[i * 2];
  }

  public double lon(int i) {
    return coords[i * 2 + 1];
  }

  public LatLon get(int i) {
    return new LatLon(lat(i), lon(i));
  }

  /** Returns the bounding box of all points, x is longitude and y is latitude. */
  public Envelope envelope() {
    Envelope envelope = new Envelope();
    for (int i = 0; i < coords.length; i += 2) {
      envelope.expandToInclude(coords[i + 1], coords[i]);
    }
    return envelope;
  }

  /** Returns a copy of the packed {@code lat, lon} pairs. */
  public double[] toArray() {
    return coords.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PointCloud other && Arrays.equals(coords, other.coords));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coords);
  }

  @Override
  public String toString() {
    return "PointCloud{size=" + size() + "}";
  }
}
