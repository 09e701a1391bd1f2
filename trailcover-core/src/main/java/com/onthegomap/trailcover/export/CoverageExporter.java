package com.onthegomap.trailcover.export;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.onthegomap.trailcover.CoverageRun;
import com.onthegomap.trailcover.config.Bounds;
import com.onthegomap.trailcover.coverage.CoverageGrid;
import com.onthegomap.trailcover.coverage.SegmentCoverage;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.Segment;
import com.onthegomap.trailcover.util.FileUtils;
import com.onthegomap.trailcover.util.Format;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the segments of a coverage run and the cells of its {@link CoverageGrid} to a JSON document for the web
 * viewer.
 * <p>
 * The document holds the region {@code bbox}, the {@code grid} layout, and {@code segments} and {@code cells} as GeoJSON
 * feature collections. Segment {@code id}s are positions in the run's segment list, which is what cell
 * {@code segment_ids} refer to.
 */
public class CoverageExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoverageExporter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module())
    .setSerializationInclusion(NON_ABSENT);

  private final Bounds bounds;
  private final CoverageRun run;
  private final CoverageGrid grid;

  public CoverageExporter(Bounds bounds, CoverageRun run, CoverageGrid grid) {
    if (grid.segmentCells().size() != run.coverage().size()) {
      throw new IllegalArgumentException(
        "grid has " + grid.segmentCells().size() + " segments but run has " + run.coverage().size());
    }
    this.bounds = bounds;
    this.run = run;
    this.grid = grid;
  }

  /** Serializes the export and atomically replaces {@code output} with it. */
  public void export(Path output) throws IOException {
    byte[] bytes = MAPPER.writeValueAsBytes(document());
    FileUtils.writeAtomically(output, bytes);
    var format = Format.defaultInstance();
    LOGGER.info("Exported to {}: {} segments ({} of {} covered), {} cells with trails ({} visited), {}", output,
      format.integer(run.coverage().size()),
      format.kilometers(run.coverage().coveredLengthMeters()),
      format.kilometers(run.coverage().totalLengthMeters()),
      format.integer(grid.trailCells().size()),
      format.integer(grid.trailCells().stream().filter(CoverageGrid.Cell::visited).count()),
      format.storage(bytes.length));
  }

  Document document() {
    var config = grid.config();
    return new Document(
      List.of(bounds.west(), bounds.south(), bounds.east(), bounds.north()),
      new Grid(config.cellSizeMeters(), List.of(config.originLon(), config.originLat()), config.dlat(),
        config.dlon()),
      new FeatureCollection<>("FeatureCollection", segmentFeatures()),
      new FeatureCollection<>("FeatureCollection", cellFeatures())
    );
  }

  private List<Feature<SegmentProperties>> segmentFeatures() {
    List<Segment> segments = run.segments();
    List<Feature<SegmentProperties>> features = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      SegmentCoverage coverage = run.coverage().get(i);
      List<List<Double>> coordinates = segment.points().stream().map(CoverageExporter::lonLat).toList();
      features.add(new Feature<>("Feature", new Geometry("LineString", coordinates), new SegmentProperties(
        i,
        segment.id().wayId(),
        segment.id().ordinal(),
        segment.type().id(),
        round(coverage.lengthMeters(), 10),
        round(coverage.fraction(), 100),
        coverage.covered(),
        grid.segmentCells().get(i)
      )));
    }
    return features;
  }

  private List<Feature<CellProperties>> cellFeatures() {
    var config = grid.config();
    return grid.trailCells().stream().map(cell -> {
      List<List<Double>> ring = config.cellRing(cell.row(), cell.col()).stream()
        .map(corner -> List.of(corner[0], corner[1]))
        .toList();
      return new Feature<>("Feature", new Geometry("Polygon", List.of(ring)), new CellProperties(
        cell.id(),
        cell.hasTrail(),
        cell.visited(),
        true,
        round(cell.trailKm(), 1000),
        round(cell.coveredKm(), 1000),
        cell.segmentIds()
      ));
    }).toList();
  }

  private static List<Double> lonLat(LatLon point) {
    return List.of(point.lon(), point.lat());
  }

  private static double round(double value, double scale) {
    return Math.round(value * scale) / scale;
  }

  record Document(List<Double> bbox, Grid grid, FeatureCollection<SegmentProperties> segments,
    FeatureCollection<CellProperties> cells) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record Grid(double cellSizeM, List<Double> origin, double dlat, double dlon) {}

  record FeatureCollection<P>(String type, List<Feature<P>> features) {}

  record Feature<P>(String type, Geometry geometry, P properties) {}

  record Geometry(String type, Object coordinates) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record SegmentProperties(int id, long wayId, int ordinal, String trailType, double lengthM, double coveragePct,
    boolean covered, List<Integer> cells) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record CellProperties(int id, boolean hasTrail, boolean visited, boolean active, double trailKm, double coveredKm,
    List<Integer> segmentIds) {}
}
