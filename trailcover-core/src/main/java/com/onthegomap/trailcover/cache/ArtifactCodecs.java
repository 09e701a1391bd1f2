package com.onthegomap.trailcover.cache;

import com.carrotsearch.hppc.DoubleArrayList;
import com.onthegomap.trailcover.coverage.Coverage;
import com.onthegomap.trailcover.coverage.CoverageResult;
import com.onthegomap.trailcover.coverage.SegmentCoverage;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.network.SegmentId;
import com.onthegomap.trailcover.network.SegmentedNetwork;
import com.onthegomap.trailcover.network.TrailType;
import com.onthegomap.trailcover.track.PointCloud;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

/**
 * The codecs for each kind of cached artifact.
 */
public class ArtifactCodecs {

  // cap on up-front allocation so a corrupt length header fails on read instead of exhausting memory
  private static final int MAX_INITIAL_CAPACITY = 1 << 16;

  private ArtifactCodecs() {}

  /** Segments of a trail network, with coordinates, IDs and trail types. */
  public static final ArtifactCodec<SegmentedNetwork> SEGMENTS = new ArtifactCodec<>() {
    @Override
    public String kind() {
      return "segments";
    }

    @Override
    public int version() {
      return 1;
    }

    @Override
    public void encode(SegmentedNetwork network, MessagePacker packer) throws IOException {
      packer.packInt(network.skippedWays());
      packer.packArrayHeader(network.size());
      for (Segment segment : network.segments()) {
        packer.packLong(segment.id().wayId());
        packer.packInt(segment.id().ordinal());
        packer.packString(segment.type().name());
        packer.packArrayHeader(segment.points().size() * 2);
        for (LatLon point : segment.points()) {
          packer.packDouble(point.lat());
          packer.packDouble(point.lon());
        }
      }
    }

    @Override
    public SegmentedNetwork decode(MessageUnpacker unpacker) throws IOException {
      int skipped = unpacker.unpackInt();
      int count = unpacker.unpackArrayHeader();
      List<Segment> segments = new ArrayList<>(Math.min(count, MAX_INITIAL_CAPACITY));
      for (int i = 0; i < count; i++) {
        long wayId = unpacker.unpackLong();
        int ordinal = unpacker.unpackInt();
        TrailType type = TrailType.valueOf(unpacker.unpackString());
        segments.add(new Segment(new SegmentId(wayId, ordinal), unpackPoints(unpacker), type));
      }
      return new SegmentedNetwork(segments, skipped);
    }
  };

  /** Samples along one GPS track. */
  public static final ArtifactCodec<PointCloud> POINT_CLOUD = new ArtifactCodec<>() {
    @Override
    public String kind() {
      return "track";
    }

    @Override
    public int version() {
      return 1;
    }

    @Override
    public void encode(PointCloud cloud, MessagePacker packer) throws IOException {
      packer.packArrayHeader(cloud.size() * 2);
      for (int i = 0; i < cloud.size(); i++) {
        packer.packDouble(cloud.lat(i));
        packer.packDouble(cloud.lon(i));
      }
    }

    @Override
    public PointCloud decode(MessageUnpacker unpacker) throws IOException {
      return PointCloud.wrap(unpackDoubles(unpacker));
    }
  };

  /** Classification of every segment. */
  public static final ArtifactCodec<CoverageResult> COVERAGE = new ArtifactCodec<>() {
    @Override
    public String kind() {
      return "coverage";
    }

    @Override
    public int version() {
      return 1;
    }

    @Override
    public void encode(CoverageResult result, MessagePacker packer) throws IOException {
      packer.packDouble(result.matchRadius());
      packer.packDouble(result.threshold());
      packer.packArrayHeader(result.size());
      for (SegmentCoverage segment : result.segments()) {
        packer.packLong(segment.id().wayId());
        packer.packInt(segment.id().ordinal());
        packer.packString(segment.coverage().name());
        packer.packDouble(segment.fraction());
        packer.packDouble(segment.lengthMeters());
        packer.packInt(segment.samples());
        packer.packInt(segment.matched());
      }
    }

    @Override
    public CoverageResult decode(MessageUnpacker unpacker) throws IOException {
      double matchRadius = unpacker.unpackDouble();
      double threshold = unpacker.unpackDouble();
      int count = unpacker.unpackArrayHeader();
      List<SegmentCoverage> segments = new ArrayList<>(Math.min(count, MAX_INITIAL_CAPACITY));
      for (int i = 0; i < count; i++) {
        SegmentId id = new SegmentId(unpacker.unpackLong(), unpacker.unpackInt());
        Coverage coverage = Coverage.valueOf(unpacker.unpackString());
        if (coverage == Coverage.UNCLASSIFIED) {
          throw new ArtifactCodec.CorruptArtifactException("segment " + id + " was never classified");
        }
        segments.add(new SegmentCoverage(id, coverage, unpacker.unpackDouble(), unpacker.unpackDouble(),
          unpacker.unpackInt(), unpacker.unpackInt()));
      }
      return new CoverageResult(segments, matchRadius, threshold);
    }
  };

  private static double[] unpackDoubles(MessageUnpacker unpacker) throws IOException {
    int length = unpacker.unpackArrayHeader();
    DoubleArrayList values = new DoubleArrayList(Math.min(length, MAX_INITIAL_CAPACITY));
    for (int i = 0; i < length; i++) {
      values.add(unpacker.unpackDouble());
    }
    return values.toArray();
  }

  private static List<LatLon> unpackPoints(MessageUnpacker unpacker) throws IOException {
    double[] coords = unpackDoubles(unpacker);
    if (coords.length % 2 != 0) {
      throw new ArtifactCodec.CorruptArtifactException("odd number of coordinates: " + coords.length);
    }
    List<LatLon> points = new ArrayList<>(coords.length / 2);
    for (int i = 0; i < coords.length; i += 2) {
      points.add(new LatLon(coords[i], coords[i + 1]));
    }
    return points;
  }
}
