package com.onthegomap.trailcover;

import com.onthegomap.trailcover.cache.ArtifactCache;
import com.onthegomap.trailcover.cache.ArtifactCodecs;
import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.config.CoverageConfig;
import com.onthegomap.trailcover.coverage.CoverageClassifier;
import com.onthegomap.trailcover.coverage.CoverageResult;
import com.onthegomap.trailcover.index.GridIndex;
import com.onthegomap.trailcover.network.NetworkSegmenter;
import com.onthegomap.trailcover.network.SegmentedNetwork;
import com.onthegomap.trailcover.network.Way;
import com.onthegomap.trailcover.reader.TrackSource;
import com.onthegomap.trailcover.reader.TrailNetworkSource;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.stats.Timers;
import com.onthegomap.trailcover.track.PointCloud;
import com.onthegomap.trailcover.track.Track;
import com.onthegomap.trailcover.track.TrackSampler;
import com.onthegomap.trailcover.util.Format;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the stages of a coverage computation: segment the trail network, sample the GPS tracks, index the samples, then
 * classify each segment.
 * <p>
 * {@link #run(List, List)} computes everything from scratch. {@link #run(TrailNetworkSource, TrackSource)} reuses the
 * segmented network, track samples and coverage result of earlier runs from the {@link ArtifactCache} when their
 * inputs have not changed, and only reads the inputs it needs to recompute.
 */
public class CoverageEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoverageEngine.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final CoverageConfig config;
  private final Stats stats;
  private final ArtifactCache cache;
  private final NetworkSegmenter segmenter;
  private final TrackSampler sampler;
  private final CoverageClassifier classifier;

  public CoverageEngine(CoverageConfig config, Stats stats, ArtifactCache cache) {
    this.config = config;
    this.stats = stats;
    this.cache = cache;
    this.segmenter = new NetworkSegmenter(config.splitTolerance(), stats);
    this.sampler = new TrackSampler(config.trackSpacing(), config.threads(), stats, config.logInterval());
    this.classifier = new CoverageClassifier(config.segmentSpacing(), config.threads(), stats, config.logInterval());
  }

  /** Computes the coverage of {@code ways} by {@code tracks} without reading or writing the cache. */
  public CoverageRun run(List<Way> ways, List<Track> tracks) {
    SegmentedNetwork network = stage("segment", () -> segmenter.segment(ways));
    CoverageResult coverage = classify(network, tracks, sampler::sample);
    return finish(network, coverage);
  }

  /** Computes the coverage of the ways in {@code networkSource} by the tracks in {@code trackSource}. */
  public CoverageRun run(TrailNetworkSource networkSource, TrackSource trackSource) {
    Fingerprint segmentsFingerprint = Fingerprint.builder()
      .add(networkSource.fingerprint())
      .add(config.splitTolerance())
      .build();
    SegmentedNetwork network = cache.getOrCompute(ArtifactCodecs.SEGMENTS.kind(), segmentsFingerprint,
      ArtifactCodecs.SEGMENTS,
      () -> {
        List<Way> ways = stage("read_network", networkSource::readWays);
        return stage("segment", () -> segmenter.segment(ways));
      });

    Fingerprint coverageFingerprint = Fingerprint.builder()
      .add(segmentsFingerprint)
      .add(trackSource.fingerprint())
      .add(config.matchRadius())
      .add(config.coverageThreshold())
      .add(config.segmentSpacing())
      .add(config.trackSpacing())
      .add(config.indexCellSize())
      .build();
    CoverageResult coverage = cache.getOrCompute(ArtifactCodecs.COVERAGE.kind(), coverageFingerprint,
      ArtifactCodecs.COVERAGE,
      () -> classify(network, stage("read_tracks", trackSource::readTracks), this::sampleCached));
    return finish(network, coverage);
  }

  private PointCloud sampleCached(Track track) {
    Fingerprint fingerprint = Fingerprint.builder()
      .add(track.fingerprint())
      .add(config.trackSpacing())
      .build();
    return cache.getOrCompute(ArtifactCodecs.POINT_CLOUD.kind(), fingerprint, ArtifactCodecs.POINT_CLOUD,
      () -> sampler.sample(track));
  }

  private CoverageResult classify(SegmentedNetwork network, List<Track> tracks,
    Function<Track, PointCloud> trackSampler) {
    List<PointCloud> clouds = stage("sample", () -> sampler.sampleAll(tracks, trackSampler));
    GridIndex index = stage("index", () -> {
      GridIndex result = GridIndex.build(PointCloud.concat(clouds), config.indexCellSize());
      LOGGER.info("Indexed {} samples from {} tracks: {}", FORMAT.integer(result.size()),
        FORMAT.integer(tracks.size()), result);
      return result;
    });
    return stage("classify", () -> classifier.classify(network.segments(), index, config.matchRadius(),
      config.coverageThreshold()));
  }

  private CoverageRun finish(SegmentedNetwork network, CoverageResult coverage) {
    CoverageRun run = new CoverageRun(network, coverage);
    LOGGER.info("Covered {} of {} segments, {} of {}",
      FORMAT.integer(coverage.coveredCount()),
      FORMAT.integer(coverage.size()),
      FORMAT.kilometers(coverage.coveredLengthMeters()),
      FORMAT.kilometers(coverage.totalLengthMeters()));
    if (network.skippedWays() > 0) {
      LOGGER.warn("Skipped {} malformed ways", network.skippedWays());
    }
    return run;
  }

  private <T> T stage(String name, Supplier<T> task) {
    Timers.Finishable timer = stats.startStage(name);
    try {
      return task.get();
    } finally {
      timer.stop();
    }
  }
}
