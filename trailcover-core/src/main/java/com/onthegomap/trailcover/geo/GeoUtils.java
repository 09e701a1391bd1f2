package com.onthegomap.trailcover.geo;

import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * A collection of utilities for measuring distances between lat/lon coordinates on a spherical earth.
 */
public class GeoUtils {

  /** Mean earth radius used for every haversine distance. */
  public static final double EARTH_RADIUS_METERS = 6_371_000;
  private static final double RADIANS_PER_DEGREE = Math.PI / 180;
  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;
  /** Latitudes past this are treated as this close to the pole when converting meters to longitude degrees. */
  public static final double MAX_LAT = 89.9;
  private static final long LOWER_32_BIT_MASK = (1L << 32) - 1L;
  /** Smallest quantization step that keeps both packed components inside 32 bits. */
  public static final double MIN_QUANTIZATION_STEP = 1e-7;

  // should not instantiate
  private GeoUtils() {}

  /** Returns the great-circle distance in meters between two points. */
  public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
    double phi1 = lat1 * RADIANS_PER_DEGREE;
    double phi2 = lat2 * RADIANS_PER_DEGREE;
    double dPhi = phi2 - phi1;
    double dLambda = (lon2 - lon1) * RADIANS_PER_DEGREE;
    double sinDPhi = Math.sin(dPhi / 2);
    double sinDLambda = Math.sin(dLambda / 2);
    double a = sinDPhi * sinDPhi + Math.cos(phi1) * Math.cos(phi2) * sinDLambda * sinDLambda;
    return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1, Math.sqrt(a)));
  }

  /** Returns the great-circle distance in meters between two points. */
  public static double haversineMeters(LatLon a, LatLon b) {
    return haversineMeters(a.lat(), a.lon(), b.lat(), b.lon());
  }

  /** Returns the sum of the haversine distances between consecutive points of {@code path}. */
  public static double lengthMeters(List<LatLon> path) {
    double total = 0;
    for (int i = 1; i < path.size(); i++) {
      total += haversineMeters(path.get(i - 1), path.get(i));
    }
    return total;
  }

  /** Returns the number of degrees of latitude that span {@code meters}. */
  public static double metersToLatDegrees(double meters) {
    return meters / EARTH_RADIUS_METERS * DEGREES_PER_RADIAN;
  }

  /**
   * Returns the number of degrees of longitude such that two points at latitude {@code lat} separated by that many
   * degrees are at least {@code meters} apart.
   * <p>
   * Longitude degrees shrink toward the poles, so callers that need a span valid over a range of latitudes should pass
   * the latitude farthest from the equator.
   */
  public static double metersToLonDegrees(double meters, double lat) {
    double clampedLat = Math.min(MAX_LAT, Math.abs(lat)) * RADIANS_PER_DEGREE;
    double ratio = Math.sin(meters / (2 * EARTH_RADIUS_METERS)) / Math.cos(clampedLat);
    if (ratio >= 1) {
      return 360;
    }
    return Math.min(360, 2 * Math.asin(ratio) * DEGREES_PER_RADIAN);
  }

  /** Returns the bounding box of {@code points} with x as longitude and y as latitude. */
  public static Envelope envelope(List<LatLon> points) {
    Envelope envelope = new Envelope();
    for (LatLon point : points) {
      envelope.expandToInclude(point.lon(), point.lat());
    }
    return envelope;
  }

  /**
   * Snaps {@code point} to a grid with {@code step} degree spacing and packs the result into a single long: latitude
   * index in the upper 32 bits, longitude index in the lower 32 bits.
   *
   * @throws IllegalArgumentException if {@code step} is smaller than {@link #MIN_QUANTIZATION_STEP}
   */
  public static long quantize(LatLon point, double step) {
    if (!(step >= MIN_QUANTIZATION_STEP)) {
      throw new IllegalArgumentException("quantization step must be >= " + MIN_QUANTIZATION_STEP + ", was " + step);
    }
    long lat = Math.round(point.lat() / step);
    long lon = Math.round(point.lon() / step);
    return (lat << 32) | (lon & LOWER_32_BIT_MASK);
  }
}
