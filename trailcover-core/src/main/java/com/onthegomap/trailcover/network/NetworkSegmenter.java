package com.onthegomap.trailcover.network;

import com.carrotsearch.hppc.LongIntHashMap;
import com.onthegomap.trailcover.collection.Hppc;
import com.onthegomap.trailcover.geo.GeoUtils;
import com.onthegomap.trailcover.geo.GeometryException;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.stats.Stats;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits trail ways into segments at the nodes where trails meet.
 * <p>
 * Nodes are compared after snapping them to a grid of {@code tolerance} degrees so that two trails drawn through the
 * "same" node with slightly different coordinates still connect. A node is an intersection when it is used more than
 * once across all ways: by two different ways, or twice by the same way.
 */
public class NetworkSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(NetworkSegmenter.class);

  private final double tolerance;
  private final Stats stats;

  public NetworkSegmenter(double tolerance, Stats stats) {
    if (!(tolerance >= GeoUtils.MIN_QUANTIZATION_STEP)) {
      throw new IllegalArgumentException("tolerance must be >= " + GeoUtils.MIN_QUANTIZATION_STEP + ", was " + tolerance);
    }
    this.tolerance = tolerance;
    this.stats = stats;
  }

  /** Returns the segments of {@code ways} in input order, and along each way in walk order. */
  public SegmentedNetwork segment(List<Way> ways) {
    List<CleanWay> cleaned = new ArrayList<>(ways.size());
    int skipped = 0;
    for (Way way : ways) {
      try {
        cleaned.add(clean(way));
      } catch (GeometryException e) {
        e.log(stats, "segmenter", "Skipping way " + way.id());
        skipped++;
      }
    }

    LongIntHashMap uses = Hppc.newLongIntHashMap(cleaned.size() * 8);
    for (CleanWay way : cleaned) {
      for (long key : way.keys()) {
        uses.addTo(key, 1);
      }
    }

    List<Segment> segments = new ArrayList<>();
    for (CleanWay way : cleaned) {
      split(way, uses, segments);
    }
    LOGGER.debug("Split {} ways into {} segments ({} skipped)", cleaned.size(), segments.size(), skipped);
    return new SegmentedNetwork(segments, skipped);
  }

  private void split(CleanWay way, LongIntHashMap uses, List<Segment> output) {
    List<LatLon> points = way.points();
    int lastIndex = points.size() - 1;
    int ordinal = 0;
    List<LatLon> current = new ArrayList<>();
    current.add(points.get(0));
    for (int i = 1; i <= lastIndex; i++) {
      LatLon point = points.get(i);
      current.add(point);
      if (i < lastIndex && uses.get(way.keys()[i]) > 1) {
        output.add(new Segment(new SegmentId(way.source().id(), ordinal++), current, way.source().type()));
        current = new ArrayList<>();
        current.add(point);
      }
    }
    output.add(new Segment(new SegmentId(way.source().id(), ordinal), current, way.source().type()));
  }

  /** Drops consecutive points that snap to the same node. */
  private CleanWay clean(Way way) throws GeometryException {
    List<LatLon> input = way.points();
    List<LatLon> points = new ArrayList<>(input.size());
    long[] keys = new long[input.size()];
    int n = 0;
    for (LatLon point : input) {
      long key = GeoUtils.quantize(point, tolerance);
      if (n == 0 || keys[n - 1] != key) {
        keys[n++] = key;
        points.add(point);
      }
    }
    if (n < 2) {
      throw new GeometryException("too_few_points",
        "way has " + n + " distinct point" + (n == 1 ? "" : "s") + ", need at least 2", true);
    }
    return new CleanWay(way, points, Arrays.copyOf(keys, n));
  }

  private record CleanWay(Way source, List<LatLon> points, long[] keys) {}
}
