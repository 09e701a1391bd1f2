package com.onthegomap.trailcover.coverage;

import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.geo.PathInterpolator;
import com.onthegomap.trailcover.index.GridIndex;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.stats.Counter;
import com.onthegomap.trailcover.stats.ProgressLoggers;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.worker.Worker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides which segments were traversed by sampling each one and checking how many samples have a GPS point nearby.
 * <p>
 * Segments are classified in parallel. Each worker claims the next unclassified segment index and writes its result to
 * that slot, so no two threads ever touch the same slot.
 */
public class CoverageClassifier {

  private final double segmentSpacing;
  private final int threads;
  private final Stats stats;
  private final Duration logInterval;

  public CoverageClassifier(double segmentSpacing, int threads, Stats stats, Duration logInterval) {
    if (!(segmentSpacing > 0)) {
      throw new IllegalArgumentException("segment spacing must be > 0, was " + segmentSpacing);
    }
    this.segmentSpacing = segmentSpacing;
    this.threads = threads;
    this.stats = stats;
    this.logInterval = logInterval;
  }

  /** Returns the coverage of one segment. */
  public static SegmentCoverage classify(Segment segment, GridIndex index, double spacing, double matchRadius,
    double threshold) {
    List<LatLon> samples = PathInterpolator.interpolate(segment.points(), spacing);
    int matched = 0;
    for (LatLon sample : samples) {
      if (index.hasPointWithin(sample, matchRadius)) {
        matched++;
      }
    }
    double length = segment.lengthMeters();
    if (samples.isEmpty()) {
      return new SegmentCoverage(segment.id(), Coverage.UNCOVERED, 0, length, 0, 0);
    }
    double fraction = matched * 1d / samples.size();
    return new SegmentCoverage(segment.id(), Coverage.of(fraction, threshold), fraction, length, samples.size(),
      matched);
  }

  /**
   * Returns the coverage of every segment, in the same order as {@code segments}.
   *
   * @throws IllegalArgumentException if {@code threshold} is outside [0, 1] or {@code matchRadius} is negative
   */
  public CoverageResult classify(List<Segment> segments, GridIndex index, double matchRadius, double threshold) {
    if (!(threshold >= 0 && threshold <= 1)) {
      throw new IllegalArgumentException("threshold must be between 0 and 1, was " + threshold);
    }
    if (!(matchRadius >= 0)) {
      throw new IllegalArgumentException("match radius must be >= 0, was " + matchRadius);
    }
    SegmentCoverage[] results = new SegmentCoverage[segments.size()];
    if (!segments.isEmpty()) {
      AtomicInteger next = new AtomicInteger();
      Counter.MultiThreadCounter covered = stats.longCounter("segments_covered");
      Worker worker = new Worker("classify", stats, Math.min(threads, segments.size()), () -> {
        Counter counter = covered.counterForThread();
        int i;
        while ((i = next.getAndIncrement()) < results.length) {
          SegmentCoverage result = classify(segments.get(i), index, segmentSpacing, matchRadius, threshold);
          results[i] = result;
          if (result.covered()) {
            counter.inc();
          }
        }
      });
      ProgressLoggers loggers = ProgressLoggers.create()
        .addRatePercentCounter("segments", segments.size(), () -> Math.min(next.get(), results.length))
        .addRatePercentCounter("covered", segments.size(), covered)
        .addThreadPoolStats("classify", worker);
      worker.awaitAndLog(loggers, logInterval);
    }
    return new CoverageResult(List.of(results), matchRadius, threshold);
  }
}
