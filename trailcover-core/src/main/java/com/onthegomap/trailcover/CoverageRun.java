package com.onthegomap.trailcover;

import com.onthegomap.trailcover.coverage.CoverageResult;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.network.SegmentedNetwork;
import java.util.List;

/**
 * The outcome of a coverage run: the segmented trail network and the coverage of each of its segments.
 * <p>
 * {@code coverage.get(i)} always describes {@code network.get(i)}.
 */
public record CoverageRun(SegmentedNetwork network, CoverageResult coverage) {

  public CoverageRun {
    if (network.size() != coverage.size()) {
      throw new IllegalArgumentException(
        "network has " + network.size() + " segments but coverage has " + coverage.size());
    }
    for (int i = 0; i < network.size(); i++) {
      if (!network.get(i).id().equals(coverage.get(i).id())) {
        throw new IllegalArgumentException(
          "segment " + i + " is " + network.get(i).id() + " but coverage is for " + coverage.get(i).id());
      }
    }
  }

  public List<Segment> segments() {
    return network.segments();
  }

  /** Number of input ways skipped because they had fewer than 2 distinct points. */
  public int skippedWays() {
    return network.skippedWays();
  }
}
