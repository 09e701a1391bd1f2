package com.onthegomap.trailcover.geo;

import com.onthegomap.trailcover.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by unexpected input geometry that should be handled to avoid halting the entire run for bad data we
 * are sure to encounter in the wild, like a trail with a single node or a GPS segment with no points.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;
  private final boolean nonFatal;

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param stat    string that uniquely defines this error that will be used to count number of occurrences in stats
   * @param message description of the error to log that should be detailed enough that you can find the offending
   *                input from it
   * @param cause   the original exception that was thrown
   */
  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
    this.nonFatal = false;
  }

  /**
   * Constructs a new exception with a detailed error message.
   *
   * @param stat     string that uniquely defines this error that will be used to count number of occurrences in stats
   * @param message  description of the error to log that should be detailed enough that you can find the offending
   *                 input from it
   * @param nonFatal When true, won't cause an assertion error when logged
   */
  public GeometryException(String stat, String message, boolean nonFatal) {
    super(message);
    this.stat = stat;
    this.nonFatal = nonFatal;
  }

  /** Returns the unique code for this error condition to use for counting the number of occurrences in stats. */
  public String stat() {
    return stat;
  }

  /** Prints the error and also increments a stat counter for this error. */
  public void log(Stats stats, String statPrefix, String logPrefix) {
    stats.dataError(statPrefix + "_" + stat());
    log(logPrefix);
  }

  /** Prints the error but does not increment any stats. */
  public void log(String logContext) {
    String log = logContext + ": " + getMessage();
    LOGGER.warn(log);
    assert nonFatal : log; // make unit tests fail if fatal
  }
}
