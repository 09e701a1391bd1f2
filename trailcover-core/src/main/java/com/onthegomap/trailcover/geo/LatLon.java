package com.onthegomap.trailcover.geo;

/**
 * A WGS84 coordinate in degrees.
 * <p>
 * Equality is exact: two points are only equal when both components are bit-for-bit the same. Use
 * {@link GeoUtils#quantize(LatLon, double)} to compare points within a tolerance.
 */
public record LatLon(double lat, double lon) {

  public LatLon {
    if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
      throw new IllegalArgumentException("lat and lon must be finite, got " + lat + "," + lon);
    }
  }

  public static LatLon of(double lat, double lon) {
    return new LatLon(lat, lon);
  }

  /** Returns the point {@code fraction} of the way from this point to {@code other}, interpolating lat and lon. */
  public LatLon interpolate(LatLon other, double fraction) {
    return new LatLon(lat + (other.lat - lat) * fraction, lon + (other.lon - lon) * fraction);
  }

  @Override
  public String toString() {
    return "(" + lat + "," + lon + ")";
  }
}
