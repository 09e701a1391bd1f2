package com.onthegomap.trailcover.coverage;

import com.onthegomap.trailcover.network.SegmentId;

/**
 * How much of one segment was traversed.
 *
 * @param id           the segment
 * @param coverage     the classification
 * @param fraction     share of the segment's sample points that had a GPS sample nearby, between 0 and 1
 * @param lengthMeters haversine length of the segment
 * @param samples      number of sample points taken along the segment
 * @param matched      number of those that had a GPS sample nearby
 */
public record SegmentCoverage(
  SegmentId id,
  Coverage coverage,
  double fraction,
  double lengthMeters,
  int samples,
  int matched
) {

  public SegmentCoverage {
    if (!(fraction >= 0 && fraction <= 1)) {
      throw new IllegalArgumentException("fraction must be between 0 and 1, was " + fraction);
    }
    if (matched < 0 || matched > samples) {
      throw new IllegalArgumentException("matched must be between 0 and " + samples + ", was " + matched);
    }
  }

  public boolean covered() {
    return coverage == Coverage.COVERED;
  }
}
