package com.onthegomap.trailcover.stats;

import com.onthegomap.trailcover.util.Format;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * A snapshot of the wall, CPU and GC time this JVM has consumed, subtracted from a later snapshot to time a stage.
 */
public record ProcessTime(Duration wall, Optional<Duration> cpu, Duration gc) {

  /** Takes a snapshot of current wall and CPU time of this JVM. */
  public static ProcessTime now() {
    return new ProcessTime(Duration.ofNanos(System.nanoTime()), ProcessInfo.getProcessCpuTime(),
      ProcessInfo.getGcTime());
  }

  /** Returns the amount of time elapsed between {@code other} and {@code this}. */
  ProcessTime minus(ProcessTime other) {
    return new ProcessTime(
      wall.minus(other.wall),
      cpu.flatMap(thisCpu -> other.cpu.map(thisCpu::minus)),
      gc.minus(other.gc)
    );
  }

  public String toString(Locale locale) {
    Format format = Format.forLocale(locale);
    Optional<String> deltaCpu = cpu.map(format::duration);
    String avgCpus = cpu.map(cpuTime -> " avg:" + format.decimal(cpuTime.toNanos() * 1d / Math.max(1, wall.toNanos())))
      .orElse("");
    String gcString = gc.compareTo(Duration.ofSeconds(1)) > 0 ? (" gc:" + format.duration(gc)) : "";
    return format.duration(wall) + " cpu:" + deltaCpu.orElse("-") + gcString + avgCpus;
  }

  @Override
  public String toString() {
    return toString(Format.DEFAULT_LOCALE);
  }
}
