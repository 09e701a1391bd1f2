package com.onthegomap.trailcover.network;

/**
 * Identifies a segment by the way it was cut from and its position along that way, so the same input always produces
 * the same IDs.
 */
public record SegmentId(long wayId, int ordinal) implements Comparable<SegmentId> {

  public SegmentId {
    if (ordinal < 0) {
      throw new IllegalArgumentException("ordinal must be >= 0, was " + ordinal);
    }
  }

  @Override
  public int compareTo(SegmentId o) {
    int result = Long.compare(wayId, o.wayId);
    return result != 0 ? result : Integer.compare(ordinal, o.ordinal);
  }

  @Override
  public String toString() {
    return wayId + ":" + ordinal;
  }
}
