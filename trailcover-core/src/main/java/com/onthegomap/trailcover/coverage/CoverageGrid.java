package com.onthegomap.trailcover.coverage;

import com.onthegomap.trailcover.config.Bounds;
import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.geo.PathInterpolator;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.util.Format;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A coarse overlay of square cells over the region of interest that summarizes how much trail each cell holds and how
 * much of it was covered.
 * <p>
 * Each segment is sampled every {@value #DISCRETIZE_STEP_METERS} meters to find the cells it passes through, and its
 * length is split evenly across them. A cell is visited when any covered segment passes through it.
 */
public record CoverageGrid(Config config, List<Cell> cells, List<List<Integer>> segmentCells) {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoverageGrid.class);
  public static final double DISCRETIZE_STEP_METERS = 20;

  public CoverageGrid {
    cells = List.copyOf(cells);
    segmentCells = segmentCells.stream().map(List::copyOf).toList();
  }

  /**
   * Cell layout: cell {@code (row, col)} spans latitudes {@code originLat + row * dlat} to
   * {@code originLat + (row + 1) * dlat} and the same for longitude with {@code dlon}.
   */
  public record Config(double cellSizeMeters, double originLon, double originLat, double dlat, double dlon, int cols,
    int rows) {

    /** Returns the ID of the cell containing {@code point}, or -1 if it falls outside the grid. */
    public int cellId(LatLon point, Bounds bounds) {
      if (!bounds.contains(point)) {
        return -1;
      }
      int col = (int) Math.floor((point.lon() - originLon) / dlon);
      int row = (int) Math.floor((point.lat() - originLat) / dlat);
      if (col < 0 || row < 0 || col >= cols || row >= rows) {
        return -1;
      }
      return row * cols + col;
    }

    /** Returns the closed ring of {@code [lon, lat]} corners of the cell at {@code row, col}. */
    public List<double[]> cellRing(int row, int col) {
      double west = originLon + col * dlon;
      double south = originLat + row * dlat;
      double east = west + dlon;
      double north = south + dlat;
      return List.of(
        new double[]{west, south},
        new double[]{east, south},
        new double[]{east, north},
        new double[]{west, north},
        new double[]{west, south}
      );
    }
  }

  /** Totals for one cell, lengths in kilometers. */
  public record Cell(int id, int row, int col, boolean hasTrail, boolean visited, double trailKm, double coveredKm,
    List<Integer> segmentIds) {

    public Cell {
      segmentIds = List.copyOf(segmentIds);
    }
  }

  /**
   * Lays a grid of {@code cellSizeMeters} cells over {@code bounds} and assigns each segment to the cells it touches.
   * <p>
   * Cell width in degrees of longitude is computed at the center latitude of {@code bounds}.
   *
   * @param segments segments in arena order
   * @param coverage coverage of each segment, same order as {@code segments}
   */
  public static CoverageGrid compute(List<Segment> segments, CoverageResult coverage, Bounds bounds,
    double cellSizeMeters) {
    if (!(cellSizeMeters > 0)) {
      throw new IllegalArgumentException("cell size must be > 0, was " + cellSizeMeters);
    }
    if (segments.size() != coverage.size()) {
      throw new IllegalArgumentException(
        "got " + segments.size() + " segments but coverage for " + coverage.size());
    }
    double centerLat = (bounds.south() + bounds.north()) / 2;
    double dlat = GeoUtils.metersToLatDegrees(cellSizeMeters);
    double dlon = dlat / Math.cos(Math.toRadians(centerLat));
    int cols = (int) Math.ceil((bounds.east() - bounds.west()) / dlon);
    int rows = (int) Math.ceil((bounds.north() - bounds.south()) / dlat);
    Config config = new Config(cellSizeMeters, bounds.west(), bounds.south(), dlat, dlon, cols, rows);

    int total = cols * rows;
    double[] trailKm = new double[total];
    double[] coveredKm = new double[total];
    boolean[] visited = new boolean[total];
    List<List<Integer>> cellSegments = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      cellSegments.add(new ArrayList<>());
    }

    List<List<Integer>> segmentCells = new ArrayList<>(segments.size());
    for (int s = 0; s < segments.size(); s++) {
      SegmentCoverage segmentCoverage = coverage.get(s);
      boolean covered = segmentCoverage.covered();
      TreeSet<Integer> touched = new TreeSet<>();
      for (LatLon point : PathInterpolator.interpolate(segments.get(s).points(), DISCRETIZE_STEP_METERS)) {
        int cellId = config.cellId(point, bounds);
        if (cellId >= 0) {
          touched.add(cellId);
        }
      }
      double kmPerCell = touched.isEmpty() ? 0 : segmentCoverage.lengthMeters() / 1000 / touched.size();
      for (int cellId : touched) {
        trailKm[cellId] += kmPerCell;
        if (covered) {
          coveredKm[cellId] += kmPerCell;
          visited[cellId] = true;
        }
        cellSegments.get(cellId).add(s);
      }
      segmentCells.add(List.copyOf(touched));
    }

    List<Cell> cells = new ArrayList<>(total);
    for (int id = 0; id < total; id++) {
      List<Integer> ids = cellSegments.get(id);
      cells.add(new Cell(id, id / cols, id % cols, !ids.isEmpty(), visited[id], trailKm[id], coveredKm[id], ids));
    }
    CoverageGrid grid = new CoverageGrid(config, cells, segmentCells);
    long trailCells = grid.trailCells().size();
    long visitedCells = grid.trailCells().stream().filter(Cell::visited).count();
    LOGGER.info("Grid: {}x{} cells, {} with trails, {} visited ({})", cols, rows, trailCells, visitedCells,
      Format.defaultInstance().percent(trailCells == 0 ? 0 : visitedCells * 1d / trailCells));
    return grid;
  }

  /** Returns the cells that at least one segment passes through. */
  public List<Cell> trailCells() {
    return cells.stream().filter(Cell::hasTrail).toList();
  }
}
