package com.onthegomap.trailcover.coverage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.geo.PathInterpolator;
import com.onthegomap.trailcover.index.GridIndex;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.network.SegmentId;
import com.onthegomap.trailcover.network.TrailType;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.track.PointCloud;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CoverageClassifierTest {

  private static final double D = 0.001;
  private final Stats stats = Stats.inMemory();

  private static Segment segment(long wayId, int ordinal, LatLon... points) {
    return new Segment(new SegmentId(wayId, ordinal), List.of(points), TrailType.PATH);
  }

  private static GridIndex trackIndex(LatLon... track) {
    return GridIndex.build(PointCloud.of(PathInterpolator.interpolate(List.of(track), 2)), 10);
  }

  private CoverageClassifier classifier(int threads) {
    return new CoverageClassifier(5, threads, stats, Duration.ofSeconds(10));
  }

  @Test
  void testTrackAlongOneBranch() {
    List<Segment> segments = List.of(
      segment(1, 0, LatLon.of(0, 0), LatLon.of(0, D)),
      segment(1, 1, LatLon.of(0, D), LatLon.of(0, 2 * D)),
      segment(2, 0, LatLon.of(0, D), LatLon.of(D, D))
    );
    GridIndex index = trackIndex(LatLon.of(0, 0), LatLon.of(0, D));

    CoverageResult result = classifier(2).classify(segments, index, 10, 0.5);

    assertEquals(3, result.size());
    assertEquals(new SegmentId(1, 0), result.get(0).id());
    assertEquals(Coverage.COVERED, result.get(0).coverage());
    assertEquals(1, result.get(0).fraction());
    for (int i = 1; i < 3; i++) {
      SegmentCoverage coverage = result.get(i);
      assertEquals(segments.get(i).id(), coverage.id());
      assertEquals(Coverage.UNCOVERED, coverage.coverage());
      // only samples next to the shared node can match
      assertTrue(coverage.fraction() > 0 && coverage.fraction() < 0.15, "fraction " + coverage.fraction());
    }
    assertEquals(1, result.coveredCount());
    assertEquals(segments.get(0).lengthMeters(), result.coveredLengthMeters(), 1e-9);
    assertEquals(1, stats.counters().get("segments_covered").getAsLong());
  }

  @Test
  void testSingleSegmentCounts() {
    Segment segment = segment(1, 0, LatLon.of(0, 0), LatLon.of(0, D));
    SegmentCoverage coverage = CoverageClassifier.classify(segment, trackIndex(LatLon.of(0, 0), LatLon.of(0, D)), 5,
      10, 0.5);
    assertEquals(coverage.samples(), coverage.matched());
    assertEquals(PathInterpolator.interpolate(segment.points(), 5).size(), coverage.samples());
    assertEquals(segment.lengthMeters(), coverage.lengthMeters(), 1e-9);
  }

  @Test
  void testNoTracksLeavesEverythingUncovered() {
    List<Segment> segments = List.of(segment(1, 0, LatLon.of(0, 0), LatLon.of(0, D)));
    CoverageResult result = classifier(1).classify(segments, GridIndex.build(PointCloud.EMPTY, 10), 10, 0.5);
    assertEquals(Coverage.UNCOVERED, result.get(0).coverage());
    assertEquals(0, result.get(0).fraction());
  }

  @Test
  void testNoSegments() {
    CoverageResult result = classifier(4).classify(List.of(), trackIndex(LatLon.of(0, 0), LatLon.of(0, D)), 10, 0.5);
    assertEquals(0, result.size());
  }

  @Test
  void testThresholdZeroCoversEverything() {
    List<Segment> segments = List.of(segment(1, 0, LatLon.of(10, 10), LatLon.of(10, 10 + D)));
    CoverageResult result = classifier(1).classify(segments, trackIndex(LatLon.of(0, 0), LatLon.of(0, D)), 10, 0);
    assertEquals(Coverage.COVERED, result.get(0).coverage());
  }

  @Test
  void testRejectsBadParameters() {
    var classifier = classifier(1);
    var index = GridIndex.build(PointCloud.EMPTY, 10);
    assertThrows(IllegalArgumentException.class, () -> classifier.classify(List.of(), index, 10, 1.5));
    assertThrows(IllegalArgumentException.class, () -> classifier.classify(List.of(), index, -1, 0.5));
    assertThrows(IllegalArgumentException.class, () -> new CoverageClassifier(0, 1, stats, Duration.ofSeconds(1)));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 8})
  void testMonotonicInThreshold(int threads) {
    Random random = new Random(threads);
    List<Segment> segments = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      double lat = random.nextDouble() * 0.01;
      double lon = random.nextDouble() * 0.01;
      segments.add(segment(i, 0, LatLon.of(lat, lon),
        LatLon.of(lat + (random.nextDouble() - 0.5) * D, lon + (random.nextDouble() - 0.5) * D)));
    }
    List<LatLon> samples = new ArrayList<>();
    for (int t = 0; t < 20; t++) {
      double lat = random.nextDouble() * 0.01;
      double lon = random.nextDouble() * 0.01;
      samples.addAll(PathInterpolator.interpolate(List.of(LatLon.of(lat, lon), LatLon.of(lat + D, lon + D)), 2));
    }
    GridIndex index = GridIndex.build(PointCloud.of(samples), 10);

    CoverageResult previous = null;
    for (double threshold = 0; threshold <= 1; threshold += 0.125) {
      CoverageResult result = classifier(threads).classify(segments, index, 10, threshold);
      assertEquals(threshold, result.threshold());
      for (int i = 0; i < segments.size(); i++) {
        SegmentCoverage coverage = result.get(i);
        assertEquals(segments.get(i).id(), coverage.id());
        assertTrue(coverage.fraction() >= 0 && coverage.fraction() <= 1);
        assertEquals(coverage.fraction() >= threshold, coverage.covered());
        if (previous != null) {
          assertEquals(previous.get(i).fraction(), coverage.fraction());
          if (coverage.covered()) {
            assertTrue(previous.get(i).covered(), "covered at " + threshold + " but not at a lower threshold");
          }
        }
      }
      previous = result;
    }
  }
}
