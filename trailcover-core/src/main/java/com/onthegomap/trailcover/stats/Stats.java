package com.onthegomap.trailcover.stats;

import com.onthegomap.trailcover.util.Format;
import com.onthegomap.trailcover.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects statistics about stages of a coverage run, and about input elements that had to be skipped, to report at the
 * end of the run.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /**
   * Logs the time each stage took, the final value of each counter, and the number of data errors of each kind.
   */
  default void printSummary() {
    Format format = Format.defaultInstance();
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : counters().entrySet()) {
      logger.info("\t{}\t{}", entry.getKey(), format.integer(entry.getValue().getAsLong()));
    }
    var errors = dataErrors();
    if (!errors.isEmpty()) {
      logger.info("data errors:");
      for (var entry : errors.entrySet()) {
        logger.info("\t{}\t{}", entry.getKey(), format.integer(entry.getValue()));
      }
    }
  }

  /**
   * Records that a long-running stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    return startStage(name, true);
  }

  /** Same as {@link #startStage(String)} except does not log that it started, or set the logging prefix. */
  default Timers.Finishable startStageQuietly(String name) {
    return startStage(name, false);
  }

  default Timers.Finishable startStage(String name, boolean log) {
    if (log) {
      LogUtil.setStage(name);
    }
    var timer = timers().startTimer(name, log);
    return () -> {
      timer.stop();
      if (log) {
        LogUtil.clearStage();
      }
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Returns the counters registered through {@link #longCounter(String)} keyed by name. */
  Map<String, LongSupplier> counters();

  /**
   * Returns and starts tracking a new counter with {@code name} optimized for the caller to increment from multiple
   * threads.
   */
  Counter.MultiThreadCounter longCounter(String name);

  /**
   * Records that an input element was discarded where {@code errorCode} identifies the kind of failure.
   */
  void dataError(String errorCode);

  /** Returns the number of data errors recorded so far, keyed by error code. */
  Map<String, Long> dataErrors();

  @Override
  default void close() {}

  /**
   * A stat collector that keeps everything in memory to report through {@link #printSummary()}.
   */
  class InMemory implements Stats {

    /** use {@link #inMemory()} */
    private InMemory() {}

    private final Timers timers = new Timers();
    private final Map<String, LongSupplier> counters = new ConcurrentSkipListMap<>();
    private final Map<String, Counter.MultiThreadCounter> dataErrors = new ConcurrentHashMap<>();

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public Map<String, LongSupplier> counters() {
      return counters;
    }

    @Override
    public Counter.MultiThreadCounter longCounter(String name) {
      Counter.MultiThreadCounter counter = Counter.newMultiThreadCounter();
      counters.put(name, counter);
      return counter;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, key -> Counter.newMultiThreadCounter()).inc();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      dataErrors.forEach((key, value) -> result.put(key, value.get()));
      return result;
    }
  }
}
