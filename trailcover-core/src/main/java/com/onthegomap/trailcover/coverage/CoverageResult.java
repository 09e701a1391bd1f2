package com.onthegomap.trailcover.coverage;

import java.util.List;

/**
 * Coverage of every segment of a network, in the same order as the network's segments.
 *
 * @param segments    one entry per segment
 * @param matchRadius distance in meters used to match samples
 * @param threshold   matched fraction at or above which a segment counts as covered
 */
public record CoverageResult(List<SegmentCoverage> segments, double matchRadius, double threshold) {

  public CoverageResult {
    segments = List.copyOf(segments);
  }

  public int size() {
    return segments.size();
  }

  public SegmentCoverage get(int index) {
    return segments.get(index);
  }

  public int coveredCount() {
    return (int) segments.stream().filter(SegmentCoverage::covered).count();
  }

  public double totalLengthMeters() {
    return segments.stream().mapToDouble(SegmentCoverage::lengthMeters).sum();
  }

  public double coveredLengthMeters() {
    return segments.stream().filter(SegmentCoverage::covered).mapToDouble(SegmentCoverage::lengthMeters).sum();
  }
}
