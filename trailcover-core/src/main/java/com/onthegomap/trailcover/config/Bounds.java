package com.onthegomap.trailcover.config;

import com.onthegomap.trailcover.geo.LatLon;
import org.locationtech.jts.geom.Envelope;

/**
 * The region of interest: GPS tracks with no point inside it are dropped, and the coverage grid is laid over it.
 */
public record Bounds(Envelope latLon) {

  /** Region the trail network was surveyed over. */
  public static final Bounds DEFAULT = new Bounds(new Envelope(5.03539, 5.21463, 44.6178, 44.68416));

  public Bounds {
    if (latLon == null || latLon.isNull() || latLon.getArea() <= 0) {
      throw new IllegalArgumentException("bounds must be a non-empty region, was " + latLon);
    }
    latLon = new Envelope(latLon);
  }

  public static Bounds of(double west, double south, double east, double north) {
    return new Bounds(new Envelope(west, east, south, north));
  }

  public double west() {
    return latLon.getMinX();
  }

  public double east() {
    return latLon.getMaxX();
  }

  public double south() {
    return latLon.getMinY();
  }

  public double north() {
    return latLon.getMaxY();
  }

  /** Returns true if {@code point} is inside or on the edge of this region. */
  public boolean contains(LatLon point) {
    return latLon.contains(point.lon(), point.lat());
  }

  @Override
  public Envelope latLon() {
    return new Envelope(latLon);
  }

  @Override
  public String toString() {
    return "Bounds[" + west() + "," + south() + "," + east() + "," + north() + "]";
  }
}
