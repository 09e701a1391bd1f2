package com.onthegomap.trailcover.coverage;

/** Whether a segment has been traversed by a GPS track. */
public enum Coverage {
  UNCLASSIFIED,
  COVERED,
  UNCOVERED;

  /** Returns {@link #COVERED} when {@code fraction} reaches {@code threshold}, otherwise {@link #UNCOVERED}. */
  public static Coverage of(double fraction, double threshold) {
    return fraction >= threshold ? COVERED : UNCOVERED;
  }
}
