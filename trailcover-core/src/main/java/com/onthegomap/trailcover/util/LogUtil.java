package com.onthegomap.trailcover.util;

import java.util.regex.Pattern;
import org.slf4j.MDC;

/**
 * Tags log lines from the current thread with the coverage stage it is working on, for example {@code [classify] } or
 * {@code [sample:worker] }, through the {@code stage} key of the SLF4J {@link MDC} that the log pattern prints.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";
  private static final String PREFIX = "[";
  private static final String SUFFIX = "] ";

  private LogUtil() {}

  /** Tags subsequent logs from this thread with {@code [stage] }. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, PREFIX + stage + SUFFIX);
  }

  /**
   * Tags subsequent logs from a worker thread with {@code [stage:child] }, dropping a leading {@code stage_} from
   * {@code child} so {@code classify_worker} under {@code classify} logs as {@code [classify:worker] }.
   */
  public static void setStage(String stage, String child) {
    if (stage == null) {
      setStage(child);
    } else {
      setStage(stage + ":" + child.replaceFirst("^" + Pattern.quote(stage) + "_?", ""));
    }
  }

  /** Stops tagging logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage logs from this thread are tagged with, or {@code null} if there is none. */
  public static String getStage() {
    String tag = MDC.get(STAGE_KEY);
    if (tag == null || !tag.startsWith(PREFIX) || !tag.endsWith(SUFFIX)) {
      return null;
    }
    return tag.substring(PREFIX.length(), tag.length() - SUFFIX.length());
  }
}
