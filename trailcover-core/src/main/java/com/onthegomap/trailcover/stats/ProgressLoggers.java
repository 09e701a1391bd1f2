package com.onthegomap.trailcover.stats;

import static com.onthegomap.trailcover.util.Exceptions.throwFatalException;
import static com.onthegomap.trailcover.util.Format.padLeft;

import com.onthegomap.trailcover.util.Format;
import com.onthegomap.trailcover.worker.Worker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleFunction;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the progress of a long-running stage (items complete, throughput, CPU and memory usage).
 */
@SuppressWarnings("UnusedReturnValue")
public class ProgressLoggers {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggers.class);
  private final List<ProgressLogger> loggers = new ArrayList<>();
  private final Format format;

  private ProgressLoggers(Locale locale) {
    this.format = Format.forLocale(locale);
  }

  public static ProgressLoggers create() {
    return createForLocale(Format.DEFAULT_LOCALE);
  }

  public static ProgressLoggers createForLocale(Locale locale) {
    return new ProgressLoggers(locale);
  }

  /**
   * Adds "name: [ numCompleted pctComplete% rate/s ]" to the logger where {@code total} is the total number of items to
   * process.
   */
  public ProgressLoggers addRatePercentCounter(String name, long total, LongSupplier getValue) {
    AtomicLong last = new AtomicLong(getValue.getAsLong());
    AtomicLong lastTime = new AtomicLong(System.nanoTime());
    loggers.add(new ProgressLogger(name, () -> {
      long now = System.nanoTime();
      long valueNow = getValue.getAsLong();
      double timeDiff = Math.max(1, now - lastTime.get()) * 1d / TimeUnit.SECONDS.toNanos(1);
      double valueDiff = valueNow - last.get();
      if (valueDiff < 0) {
        valueDiff = valueNow;
      }
      last.set(valueNow);
      lastTime.set(now);
      String percent = total == 0 ? "" : (" " + padLeft(format.percent(1f * valueNow / total), 4));
      return "[ " + format.numeric(valueNow, true) + percent + " " + format.numeric(valueDiff / timeDiff, true) +
        "/s ]";
    }));
    return this;
  }

  /** Adds a fixed or computed string to the output. */
  public ProgressLoggers add(String name, Supplier<String> value) {
    loggers.add(new ProgressLogger(name, value));
    return this;
  }

  /** Adds the average number of CPUs and % time in GC since last log along with memory usage to the output. */
  public ProgressLoggers addProcessStats() {
    addDeltaLogger("cpus", () -> ProcessInfo.getProcessCpuTime().orElse(Duration.ZERO), format::decimal);
    addDeltaLogger("gc", ProcessInfo::getGcTime, format::percent);
    loggers.add(new ProgressLogger("mem",
      () -> format.storage(ProcessInfo.getUsedMemoryBytes(), false) + "/" +
        format.storage(ProcessInfo.getMaxMemoryBytes(), false)));
    return this;
  }

  // keeps track of the value each time it is invoked and logs the rate of change
  private void addDeltaLogger(String name, Supplier<Duration> supplier, DoubleFunction<String> formatter) {
    AtomicLong lastValue = new AtomicLong(supplier.get().toNanos());
    AtomicLong lastTime = new AtomicLong(System.nanoTime());
    loggers.add(new ProgressLogger(name, () -> {
      long currentValue = supplier.get().toNanos();
      long currentTime = System.nanoTime();
      double rate = 1d * (currentValue - lastValue.get()) / Math.max(1, currentTime - lastTime.get());
      lastTime.set(currentTime);
      lastValue.set(currentValue);
      return padLeft(formatter.apply(rate), 3);
    }));
  }

  /** Adds the number of threads in a {@link Worker} pool to the output. */
  public ProgressLoggers addThreadPoolStats(String name, Worker worker) {
    loggers.add(new ProgressLogger(name, () -> worker.getThreads() + " threads"));
    return this;
  }

  public void log() {
    LOGGER.info(getLog());
  }

  public String getLog() {
    return loggers.stream()
      .map(Object::toString)
      .collect(Collectors.joining(""));
  }

  /** Invoke {@link #log()} at a fixed duration until {@code future} completes. */
  public void awaitAndLog(Future<?> future, Duration logInterval) {
    while (!await(future, logInterval)) {
      log();
    }
    log();
  }

  /** Returns true if the future is done, false if {@code duration} has elapsed. */
  private static boolean await(Future<?> future, Duration duration) {
    try {
      future.get(duration.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    } catch (ExecutionException e) {
      return throwFatalException(e.getCause());
    } catch (TimeoutException e) {
      return false;
    }
  }

  private record ProgressLogger(String name, Supplier<String> fn) {

    @Override
    public String toString() {
      return " " + name + ": " + fn.get();
    }
  }
}
