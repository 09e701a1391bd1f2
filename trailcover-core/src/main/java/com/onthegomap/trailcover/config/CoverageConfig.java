package com.onthegomap.trailcover.config;

import com.onthegomap.trailcover.geo.GeoUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Holder for the tunables of a coverage run.
 */
public record CoverageConfig(
  Arguments arguments,
  int threads,
  Duration logInterval,
  double matchRadius,
  double trackSpacing,
  double segmentSpacing,
  double coverageThreshold,
  double splitTolerance,
  double indexCellSize,
  Bounds bounds,
  Path cacheDir,
  boolean noCache,
  List<String> trailTypes,
  double gridSize
) {

  public static final double DEFAULT_MATCH_RADIUS = 10;
  public static final double DEFAULT_TRACK_SPACING = 2;
  public static final double DEFAULT_SEGMENT_SPACING = 5;
  public static final double DEFAULT_COVERAGE_THRESHOLD = 0.5;
  public static final double DEFAULT_SPLIT_TOLERANCE = 1e-6;
  public static final double DEFAULT_GRID_SIZE = 200;
  public static final List<String> DEFAULT_TRAIL_TYPES = List.of("path", "track", "footway");

  public CoverageConfig {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (!(matchRadius > 0)) {
      throw new IllegalArgumentException("match_radius must be > 0, was " + matchRadius);
    }
    if (!(trackSpacing > 0)) {
      throw new IllegalArgumentException("track_spacing must be > 0, was " + trackSpacing);
    }
    if (!(segmentSpacing > 0)) {
      throw new IllegalArgumentException("segment_spacing must be > 0, was " + segmentSpacing);
    }
    if (!(coverageThreshold >= 0 && coverageThreshold <= 1)) {
      throw new IllegalArgumentException("coverage_threshold must be between 0 and 1, was " + coverageThreshold);
    }
    if (!(splitTolerance >= GeoUtils.MIN_QUANTIZATION_STEP)) {
      throw new IllegalArgumentException(
        "split_tolerance must be >= " + GeoUtils.MIN_QUANTIZATION_STEP + ", was " + splitTolerance);
    }
    if (!(indexCellSize > 0)) {
      throw new IllegalArgumentException("index_cell_size must be > 0, was " + indexCellSize);
    }
    if (!(gridSize > 0)) {
      throw new IllegalArgumentException("grid_size must be > 0, was " + gridSize);
    }
    if (bounds == null) {
      throw new IllegalArgumentException("bounds must be set");
    }
    trailTypes = List.copyOf(trailTypes);
  }

  public static CoverageConfig defaults() {
    return from(Arguments.of());
  }

  public static CoverageConfig from(Arguments arguments) {
    double matchRadius = arguments.getDouble("match_radius",
      "distance in meters within which a GPS sample counts as traversing a trail sample", DEFAULT_MATCH_RADIUS);
    return new CoverageConfig(
      arguments,
      arguments.threads(),
      arguments.getDuration("log_interval", "time between logs", "10s"),
      matchRadius,
      arguments.getDouble("track_spacing", "spacing in meters between interpolated GPS samples",
        DEFAULT_TRACK_SPACING),
      arguments.getDouble("segment_spacing", "spacing in meters between interpolated trail samples",
        DEFAULT_SEGMENT_SPACING),
      arguments.getDouble("coverage_threshold", "fraction of matched samples for a segment to count as covered",
        DEFAULT_COVERAGE_THRESHOLD),
      arguments.getDouble("split_tolerance", "degrees within which two trail nodes are considered the same node",
        DEFAULT_SPLIT_TOLERANCE),
      arguments.getDouble("index_cell_size", "size in meters of spatial index cells", matchRadius),
      new Bounds(arguments.bounds("bounds", "region of interest as west,south,east,north",
        Bounds.DEFAULT.latLon())),
      arguments.file("cache_dir", "directory for cached intermediate results", Path.of("data", "cache")),
      arguments.getBoolean("no_cache", "clear the cache and recompute everything", false),
      arguments.getList("trail_types", "highway tag values to keep from the trail network", DEFAULT_TRAIL_TYPES),
      arguments.getDouble("grid_size", "size in meters of coverage grid cells", DEFAULT_GRID_SIZE)
    );
  }
}
