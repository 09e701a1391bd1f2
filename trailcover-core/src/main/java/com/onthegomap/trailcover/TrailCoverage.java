package com.onthegomap.trailcover;

import com.onthegomap.trailcover.cache.ArtifactCache;
import com.onthegomap.trailcover.cache.FileCacheStore;
import com.onthegomap.trailcover.config.Arguments;
import com.onthegomap.trailcover.config.CoverageConfig;
import com.onthegomap.trailcover.coverage.CoverageGrid;
import com.onthegomap.trailcover.export.CoverageExporter;
import com.onthegomap.trailcover.reader.GpxReader;
import com.onthegomap.trailcover.reader.OverpassJsonReader;
import com.onthegomap.trailcover.reader.TrackSource;
import com.onthegomap.trailcover.reader.TrailNetworkSource;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.stats.Timers;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level API for computing trail coverage from input files, that sets up the cache, inputs and outputs from
 * {@link Arguments} then runs a {@link CoverageEngine}.
 * <p>
 * For example:
 * <pre>{@code
 * TrailCoverage.create(arguments)
 *   .setNetwork(Path.of("data", "osm_trails.json"))
 *   .setActivities(Path.of("activities"))
 *   .setOutput(Path.of("web", "data.json"))
 *   .run();
 * }</pre>
 */
public class TrailCoverage {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrailCoverage.class);

  private final Arguments arguments;
  private final Stats stats;
  private final Timers.Finishable overallTimer;
  private final CoverageConfig config;
  private TrailNetworkSource network = null;
  private TrackSource activities = null;
  private Path output = null;
  private boolean ran = false;

  private TrailCoverage(Arguments arguments) {
    this.arguments = arguments.withExactlyOnceLogging();
    stats = this.arguments.getStats();
    overallTimer = stats.startStageQuietly("overall");
    config = CoverageConfig.from(this.arguments);
  }

  /** Returns a new empty runner that will get configuration from {@code arguments}. */
  public static TrailCoverage create(Arguments arguments) {
    return new TrailCoverage(arguments);
  }

  /**
   * Reads the trail network from an Overpass {@code out geom} JSON file at {@code network} argument, or
   * {@code defaultPath} if not set.
   *
   * @throws IllegalArgumentException if the file does not exist
   */
  public TrailCoverage setNetwork(Path defaultPath) {
    Path path = arguments.inputFile("network", "overpass JSON file with the trail network", defaultPath);
    return setNetwork(new OverpassJsonReader(path, config.trailTypes(), stats));
  }

  public TrailCoverage setNetwork(TrailNetworkSource source) {
    this.network = source;
    return this;
  }

  /**
   * Reads GPS tracks from the {@code .gpx} files in the directory at {@code activities} argument, or
   * {@code defaultPath} if not set.
   *
   * @throws IllegalArgumentException if the directory does not exist
   */
  public TrailCoverage setActivities(Path defaultPath) {
    Path path = arguments.inputFile("activities", "directory of GPX activities", defaultPath);
    return setActivities(new GpxReader(path, config.bounds(), stats));
  }

  public TrailCoverage setActivities(TrackSource source) {
    this.activities = source;
    return this;
  }

  /** Writes the JSON export to {@code output} argument, or {@code defaultPath} if not set. */
  public TrailCoverage setOutput(Path defaultPath) {
    this.output = arguments.file("output", "JSON export of segments and grid cells", defaultPath);
    return this;
  }

  public CoverageConfig config() {
    return config;
  }

  public Stats stats() {
    return stats;
  }

  /**
   * Computes coverage and writes the export if an output was set.
   *
   * @return the segments and their coverage
   * @throws IllegalArgumentException if inputs are missing or this runner already ran
   * @throws IOException              if the export cannot be written
   */
  public CoverageRun run() throws IOException {
    if (network == null) {
      throw new IllegalArgumentException("No trail network specified");
    }
    if (activities == null) {
      throw new IllegalArgumentException("No activities specified");
    }
    if (ran) {
      throw new IllegalArgumentException("Can only run once");
    }
    ran = true;

    LOGGER.info("Computing coverage of {} by {} in these phases:", network.id(), activities.id());
    LOGGER.info("  read_network: Read trail ways (skipped when segments are cached)");
    LOGGER.info("  segment: Split ways into segments at shared nodes");
    LOGGER.info("  read_tracks: Read GPS tracks (skipped when coverage is cached)");
    LOGGER.info("  sample: Resample tracks every {}m", config.trackSpacing());
    LOGGER.info("  index: Index track samples in {}m cells", config.indexCellSize());
    LOGGER.info("  classify: Check segment samples every {}m against a {}m radius", config.segmentSpacing(),
      config.matchRadius());
    if (output != null) {
      LOGGER.info("  export: Write segments and {}m grid to {}", config.gridSize(), output);
    }

    ArtifactCache cache = new ArtifactCache(new FileCacheStore(config.cacheDir()), stats);
    if (config.noCache()) {
      cache.invalidateAll();
    }
    CoverageRun result = new CoverageEngine(config, stats, cache).run(network, activities);

    if (output != null) {
      var timer = stats.startStage("export");
      try {
        CoverageGrid grid = CoverageGrid.compute(result.segments(), result.coverage(), config.bounds(),
          config.gridSize());
        new CoverageExporter(config.bounds(), result, grid).export(output);
      } finally {
        timer.stop();
      }
    }

    overallTimer.stop();
    LOGGER.info("FINISHED!");
    stats.printSummary();
    stats.close();
    return result;
  }
}
