package com.onthegomap.trailcover.network;

import java.util.List;

/**
 * The result of splitting a trail network: every segment in a stable order, indexed by position, plus the number of
 * ways that were dropped because they were malformed.
 */
public record SegmentedNetwork(List<Segment> segments, int skippedWays) {

  public SegmentedNetwork {
    segments = List.copyOf(segments);
  }

  public int size() {
    return segments.size();
  }

  public Segment get(int index) {
    return segments.get(index);
  }

  public double totalLengthMeters() {
    return segments.stream().mapToDouble(Segment::lengthMeters).sum();
  }
}
