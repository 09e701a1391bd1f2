package com.onthegomap.trailcover.track;

import com.onthegomap.trailcover.geo.PathInterpolator;
import com.onthegomap.trailcover.stats.Counter;
import com.onthegomap.trailcover.stats.ProgressLoggers;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.worker.Worker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Turns GPS tracks into dense point clouds by resampling them at a fixed spacing.
 */
public class TrackSampler {

  private final double spacing;
  private final int threads;
  private final Stats stats;
  private final Duration logInterval;

  public TrackSampler(double spacing, int threads, Stats stats, Duration logInterval) {
    if (!(spacing > 0)) {
      throw new IllegalArgumentException("spacing must be > 0, was " + spacing);
    }
    this.spacing = spacing;
    this.threads = threads;
    this.stats = stats;
    this.logInterval = logInterval;
  }

  /** Returns the samples along a single track. */
  public PointCloud sample(Track track) {
    return PointCloud.of(PathInterpolator.interpolate(track.points(), spacing));
  }

  /** Samples every track in parallel and returns the clouds in the same order as {@code tracks}. */
  public List<PointCloud> sampleAll(List<Track> tracks) {
    return sampleAll(tracks, this::sample);
  }

  /**
   * Same as {@link #sampleAll(List)} but gets each track's cloud from {@code sampler}, which may return a previously
   * computed cloud instead of calling {@link #sample(Track)}.
   */
  public List<PointCloud> sampleAll(List<Track> tracks, Function<Track, PointCloud> sampler) {
    PointCloud[] results = new PointCloud[tracks.size()];
    if (tracks.isEmpty()) {
      return List.of();
    }
    AtomicInteger next = new AtomicInteger();
    Counter.MultiThreadCounter samples = stats.longCounter("track_samples");
    Worker worker = new Worker("sample", stats, Math.min(threads, tracks.size()), () -> {
      Counter counter = samples.counterForThread();
      int i;
      while ((i = next.getAndIncrement()) < results.length) {
        PointCloud cloud = sampler.apply(tracks.get(i));
        results[i] = cloud;
        counter.incBy(cloud.size());
      }
    });
    ProgressLoggers loggers = ProgressLoggers.create()
      .addRatePercentCounter("tracks", tracks.size(), () -> Math.min(next.get(), results.length))
      .addRatePercentCounter("samples", 0, samples)
      .addThreadPoolStats("sample", worker);
    worker.awaitAndLog(loggers, logInterval);
    return List.of(results);
  }
}
