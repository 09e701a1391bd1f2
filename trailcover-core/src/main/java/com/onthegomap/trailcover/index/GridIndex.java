package com.onthegomap.trailcover.index;

import com.carrotsearch.hppc.DoubleArrayList;
import com.carrotsearch.hppc.LongObjectHashMap;
import com.carrotsearch.hppc.cursors.LongObjectCursor;
import com.onthegomap.trailcover.collection.Hppc;
import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.track.PointCloud;
import javax.annotation.concurrent.ThreadSafe;
import org.locationtech.jts.geom.Envelope;

/**
 * Buckets points into a uniform lat/lon grid to answer "is any point within {@code radius} meters of here?" without
 * scanning every point.
 * <p>
 * Rows are {@code cellSize} meters tall. Columns are widened for the latitude farthest from the equator so they are at
 * least {@code cellSize} meters wide everywhere in the indexed region, which means a query only needs to look at the
 * ring of cells {@code ceil(radius / cellSize)} around the one the query falls in (3x3 when the radius is no bigger than
 * a cell). Answers match a brute-force scan over all points.
 * <p>
 * The grid does not wrap around the antimeridian.
 * <p>
 * Immutable once built so any number of threads can query it.
 */
@ThreadSafe
public final class GridIndex {

  /** Cells smaller than this would blow up the number of cells for no gain in precision. */
  public static final double MIN_CELL_SIZE_METERS = 1;
  private static final long LOWER_32_BIT_MASK = (1L << 32) - 1L;

  private final double cellSize;
  private final double originLat;
  private final double originLon;
  private final double latStep;
  private final double lonStep;
  private final double maxAbsLat;
  private final long maxRow;
  private final long maxCol;
  private final int size;
  private final LongObjectHashMap<double[]> cells;

  private GridIndex(double cellSize, Envelope envelope, int size, LongObjectHashMap<double[]> cells,
    double latStep, double lonStep) {
    this.cellSize = cellSize;
    this.size = size;
    this.cells = cells;
    this.latStep = latStep;
    this.lonStep = lonStep;
    if (envelope.isNull()) {
      originLat = originLon = maxAbsLat = 0;
      maxRow = maxCol = -1;
    } else {
      originLat = envelope.getMinY();
      originLon = envelope.getMinX();
      maxAbsLat = Math.max(Math.abs(envelope.getMinY()), Math.abs(envelope.getMaxY()));
      maxRow = (long) Math.floor((envelope.getMaxY() - originLat) / latStep);
      maxCol = (long) Math.floor((envelope.getMaxX() - originLon) / lonStep);
    }
  }

  /**
   * Returns an index over every point in {@code points} with cells {@code cellSizeMeters} on a side, or
   * {@link #MIN_CELL_SIZE_METERS} if smaller.
   */
  public static GridIndex build(PointCloud points, double cellSizeMeters) {
    if (Double.isNaN(cellSizeMeters)) {
      throw new IllegalArgumentException("cell size must be a number");
    }
    double cellSize = Math.max(MIN_CELL_SIZE_METERS, cellSizeMeters);
    Envelope envelope = points.envelope();
    double maxAbsLat = envelope.isNull() ? 0 : Math.max(Math.abs(envelope.getMinY()), Math.abs(envelope.getMaxY()));
    double latStep = GeoUtils.metersToLatDegrees(cellSize);
    double lonStep = GeoUtils.metersToLonDegrees(cellSize, maxAbsLat + latStep);

    LongObjectHashMap<DoubleArrayList> building = Hppc.newLongObjectHashMap();
    for (int i = 0; i < points.size(); i++) {
      double lat = points.lat(i);
      double lon = points.lon(i);
      long row = (long) Math.floor((lat - envelope.getMinY()) / latStep);
      long col = (long) Math.floor((lon - envelope.getMinX()) / lonStep);
      long key = key(row, col);
      DoubleArrayList cell = building.get(key);
      if (cell == null) {
        cell = new DoubleArrayList(8);
        building.put(key, cell);
      }
      cell.add(lat, lon);
    }

    LongObjectHashMap<double[]> cells = Hppc.newLongObjectHashMap(building.size());
    for (LongObjectCursor<DoubleArrayList> cursor : building) {
      cells.put(cursor.key, cursor.value.toArray());
    }
    return new GridIndex(cellSize, envelope, points.size(), cells, latStep, lonStep);
  }

  private static long key(long row, long col) {
    return (row << 32) | (col & LOWER_32_BIT_MASK);
  }

  /** Returns true if any indexed point is within {@code radiusMeters} of {@code point}. */
  public boolean hasPointWithin(LatLon point, double radiusMeters) {
    return scan(point, radiusMeters, true) > 0;
  }

  /** Returns the number of indexed points within {@code radiusMeters} of {@code point}. */
  public int countWithin(LatLon point, double radiusMeters) {
    return scan(point, radiusMeters, false);
  }

  private int scan(LatLon point, double radius, boolean stopAtFirst) {
    if (!(radius >= 0)) {
      throw new IllegalArgumentException("radius must be >= 0, was " + radius);
    }
    if (size == 0) {
      return 0;
    }
    double lat = point.lat();
    double lon = point.lon();
    long kRow = (long) Math.ceil(radius / cellSize);
    // a point within radius of the query can be at most this far from the equator
    double farthestLat = Math.max(maxAbsLat, Math.abs(lat)) + GeoUtils.metersToLatDegrees(radius);
    double lonReach = GeoUtils.metersToLonDegrees(radius, farthestLat);
    // near a pole every longitude can be within reach
    boolean allColumns = farthestLat >= GeoUtils.MAX_LAT || lonReach >= 180;
    long kCol = (long) Math.ceil(lonReach / lonStep);

    double rowPosition = Math.floor((lat - originLat) / latStep);
    double colPosition = Math.floor((lon - originLon) / lonStep);
    if (rowPosition - kRow > maxRow || rowPosition + kRow < 0) {
      return 0;
    }
    if (!allColumns && (colPosition - kCol > maxCol || colPosition + kCol < 0)) {
      return 0;
    }
    long minRow = clamp(rowPosition - kRow, maxRow);
    long maxRowToScan = clamp(rowPosition + kRow, maxRow);
    long minCol = allColumns ? 0 : clamp(colPosition - kCol, maxCol);
    long maxColToScan = allColumns ? maxCol : clamp(colPosition + kCol, maxCol);

    int count = 0;
    for (long row = minRow; row <= maxRowToScan; row++) {
      for (long col = minCol; col <= maxColToScan; col++) {
        double[] cell = cells.get(key(row, col));
        if (cell != null) {
          for (int i = 0; i < cell.length; i += 2) {
            if (GeoUtils.haversineMeters(lat, lon, cell[i], cell[i + 1]) <= radius) {
              count++;
              if (stopAtFirst) {
                return count;
              }
            }
          }
        }
      }
    }
    return count;
  }

  private static long clamp(double value, long max) {
    return (long) Math.max(0, Math.min(max, value));
  }

  /** Returns the number of indexed points. */
  public int size() {
    return size;
  }

  /** Returns the number of non-empty cells. */
  public int cellCount() {
    return cells.size();
  }

  /** Returns the cell size actually used, after applying the minimum. */
  public double cellSizeMeters() {
    return cellSize;
  }

  @Override
  public String toString() {
    return "GridIndex{points=" + size + ", cells=" + cells.size() + ", cellSize=" + cellSize + "m}";
  }
}
