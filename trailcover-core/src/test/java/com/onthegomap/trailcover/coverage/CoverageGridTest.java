package com.onthegomap.trailcover.coverage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.trailcover.config.Bounds;
import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.network.SegmentId;
import com.onthegomap.trailcover.network.TrailType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CoverageGridTest {

  private static final Bounds BOUNDS = Bounds.of(0, 0, 0.01, 0.01);

  private static Segment segment(long wayId, LatLon... points) {
    return new Segment(new SegmentId(wayId, 0), List.of(points), TrailType.PATH);
  }

  private static CoverageResult coverage(List<Segment> segments, boolean... covered) {
    List<SegmentCoverage> result = new ArrayList<>();
    for (int i = 0; i < segments.size(); i++) {
      result.add(new SegmentCoverage(segments.get(i).id(), covered[i] ? Coverage.COVERED : Coverage.UNCOVERED,
        covered[i] ? 1 : 0, segments.get(i).lengthMeters(), 10, covered[i] ? 10 : 0));
    }
    return new CoverageResult(result, 10, 0.5);
  }

  @Test
  void testLayout() {
    CoverageGrid grid = CoverageGrid.compute(List.of(), coverage(List.of()), BOUNDS, 200);
    var config = grid.config();
    assertEquals(GeoUtils.metersToLatDegrees(200), config.dlat(), 1e-12);
    assertTrue(config.dlon() >= config.dlat());
    assertEquals(6, config.rows());
    assertEquals(6, config.cols());
    assertEquals(36, grid.cells().size());
    assertEquals(List.of(), grid.trailCells());
    assertEquals(0, config.cellId(LatLon.of(0.0001, 0.0001), BOUNDS));
    assertEquals(7, config.cellId(LatLon.of(config.dlat() * 1.5, config.dlon() * 1.5), BOUNDS));
    assertEquals(-1, config.cellId(LatLon.of(-0.001, 0.005), BOUNDS));
  }

  @Test
  void testCellRingIsClosed() {
    var config = CoverageGrid.compute(List.of(), coverage(List.of()), BOUNDS, 200).config();
    var ring = config.cellRing(1, 2);
    assertEquals(5, ring.size());
    assertEquals(ring.get(0)[0], ring.get(4)[0]);
    assertEquals(ring.get(0)[1], ring.get(4)[1]);
    assertEquals(2 * config.dlon(), ring.get(0)[0], 1e-12);
    assertEquals(config.dlat(), ring.get(0)[1], 1e-12);
    assertEquals(2 * config.dlat(), ring.get(2)[1], 1e-12);
  }

  @Test
  void testLengthSplitAcrossTouchedCells() {
    Segment inOneCell = segment(1, LatLon.of(0.0001, 0.0001), LatLon.of(0.0001, 0.0005));
    Segment acrossTwoCells = segment(2, LatLon.of(0.0002, 0.0001), LatLon.of(0.0002, 0.0030));
    Segment outside = segment(3, LatLon.of(0.02, 0.02), LatLon.of(0.021, 0.021));
    List<Segment> segments = List.of(inOneCell, acrossTwoCells, outside);

    CoverageGrid grid = CoverageGrid.compute(segments, coverage(segments, true, false, true), BOUNDS, 200);

    assertEquals(List.of(List.of(0), List.of(0, 1), List.of()), grid.segmentCells());
    var trailCells = grid.trailCells();
    assertEquals(2, trailCells.size());

    var cell0 = grid.cells().get(0);
    assertTrue(cell0.hasTrail());
    assertTrue(cell0.visited());
    assertEquals(List.of(0, 1), cell0.segmentIds());
    double km0 = inOneCell.lengthMeters() / 1000;
    double km1 = acrossTwoCells.lengthMeters() / 1000;
    assertEquals(km0 + km1 / 2, cell0.trailKm(), 1e-9);
    assertEquals(km0, cell0.coveredKm(), 1e-9);

    var cell1 = grid.cells().get(1);
    assertEquals(0, cell1.row());
    assertEquals(1, cell1.col());
    assertTrue(cell1.hasTrail());
    assertFalse(cell1.visited());
    assertEquals(km1 / 2, cell1.trailKm(), 1e-9);
    assertEquals(0, cell1.coveredKm());
    assertEquals(List.of(1), cell1.segmentIds());
  }

  @Test
  void testRejectsMismatchedInputs() {
    Segment segment = segment(1, LatLon.of(0.0001, 0.0001), LatLon.of(0.0001, 0.0005));
    var empty = coverage(List.of());
    assertThrows(IllegalArgumentException.class,
      () -> CoverageGrid.compute(List.of(segment), empty, BOUNDS, 200));
    assertThrows(IllegalArgumentException.class,
      () -> CoverageGrid.compute(List.of(), empty, BOUNDS, 0));
  }
}
