package com.onthegomap.trailcover.export;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.trailcover.CoverageEngine;
import com.onthegomap.trailcover.CoverageRun;
import com.onthegomap.trailcover.cache.ArtifactCache;
import com.onthegomap.trailcover.config.Arguments;
import com.onthegomap.trailcover.config.Bounds;
import com.onthegomap.trailcover.config.CoverageConfig;
import com.onthegomap.trailcover.coverage.CoverageGrid;
import com.onthegomap.trailcover.coverage.CoverageResult;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.TrailType;
import com.onthegomap.trailcover.network.Way;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.track.Track;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoverageExporterTest {

  private static final double D = 0.001;
  private static final Bounds BOUNDS = Bounds.of(0, 0, 4 * D, 4 * D);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir
  Path tmpDir;

  private CoverageRun run;
  private CoverageGrid grid;

  @BeforeEach
  void computeRun() {
    var stats = Stats.inMemory();
    var config = CoverageConfig.from(Arguments.of("threads", "1"));
    run = new CoverageEngine(config, stats, ArtifactCache.inMemory(stats)).run(
      List.of(
        new Way(1, List.of(LatLon.of(0, 0), LatLon.of(0, D), LatLon.of(0, 2 * D)), TrailType.PATH),
        new Way(2, List.of(LatLon.of(0, D), LatLon.of(D, D)), TrailType.FOOTWAY)
      ),
      List.of(new Track("ride.gpx#0", List.of(LatLon.of(0, 0), LatLon.of(0, D))))
    );
    grid = CoverageGrid.compute(run.segments(), run.coverage(), BOUNDS, 200);
  }

  private JsonNode export() throws IOException {
    Path output = tmpDir.resolve("web").resolve("data.json");
    new CoverageExporter(BOUNDS, run, grid).export(output);
    return MAPPER.readTree(output.toFile());
  }

  @Test
  void testTopLevelLayout() throws IOException {
    JsonNode json = export();
    assertEquals(List.of("bbox", "grid", "segments", "cells"), fieldNames(json));
    assertEquals(List.of(0d, 0d, 4 * D, 4 * D), doubles(json.get("bbox")));

    JsonNode gridJson = json.get("grid");
    assertEquals(200, gridJson.get("cell_size_m").asDouble());
    assertEquals(List.of(0d, 0d), doubles(gridJson.get("origin")));
    assertEquals(grid.config().dlat(), gridJson.get("dlat").asDouble());
    assertEquals(grid.config().dlon(), gridJson.get("dlon").asDouble());

    assertEquals("FeatureCollection", json.get("segments").get("type").asText());
    assertEquals("FeatureCollection", json.get("cells").get("type").asText());
  }

  @Test
  void testSegmentFeatures() throws IOException {
    JsonNode features = export().get("segments").get("features");
    assertEquals(3, features.size());

    JsonNode first = features.get(0);
    assertEquals("Feature", first.get("type").asText());
    assertEquals("LineString", first.get("geometry").get("type").asText());
    JsonNode coordinates = first.get("geometry").get("coordinates");
    assertEquals(List.of(0d, 0d), doubles(coordinates.get(0)));
    // longitude first
    assertEquals(List.of(D, 0d), doubles(coordinates.get(1)));

    JsonNode properties = first.get("properties");
    assertEquals(0, properties.get("id").asInt());
    assertEquals(1, properties.get("way_id").asLong());
    assertEquals(0, properties.get("ordinal").asInt());
    assertEquals("path", properties.get("trail_type").asText());
    assertTrue(properties.get("covered").asBoolean());
    assertEquals(1, properties.get("coverage_pct").asDouble());
    assertEquals(Math.round(run.segments().get(0).lengthMeters() * 10) / 10d,
      properties.get("length_m").asDouble());

    JsonNode third = features.get(2).get("properties");
    assertEquals(2, third.get("id").asInt());
    assertEquals(2, third.get("way_id").asLong());
    assertEquals("footway", third.get("trail_type").asText());
    assertFalse(third.get("covered").asBoolean());
    double pct = third.get("coverage_pct").asDouble();
    assertEquals(pct, Math.round(pct * 100) / 100d);
  }

  @Test
  void testCellFeaturesAreConsistentWithSegments() throws IOException {
    JsonNode json = export();
    JsonNode segments = json.get("segments").get("features");
    JsonNode cells = json.get("cells").get("features");
    assertEquals(grid.trailCells().size(), cells.size());
    assertFalse(cells.isEmpty());

    Set<Integer> cellIds = new HashSet<>();
    boolean anyVisited = false;
    for (JsonNode cell : cells) {
      assertEquals("Polygon", cell.get("geometry").get("type").asText());
      JsonNode ring = cell.get("geometry").get("coordinates").get(0);
      assertEquals(5, ring.size());
      assertEquals(doubles(ring.get(0)), doubles(ring.get(4)));

      JsonNode properties = cell.get("properties");
      assertTrue(properties.get("has_trail").asBoolean());
      assertTrue(properties.get("active").asBoolean());
      assertTrue(properties.get("trail_km").asDouble() >= properties.get("covered_km").asDouble());
      anyVisited |= properties.get("visited").asBoolean();
      int id = properties.get("id").asInt();
      cellIds.add(id);
      for (JsonNode segmentId : properties.get("segment_ids")) {
        List<Integer> segmentCells = ints(segments.get(segmentId.asInt()).get("properties").get("cells"));
        assertTrue(segmentCells.contains(id), "segment " + segmentId + " should list cell " + id);
      }
    }
    assertTrue(anyVisited);
    for (JsonNode segment : segments) {
      for (JsonNode cell : segment.get("properties").get("cells")) {
        assertTrue(cellIds.contains(cell.asInt()), "missing cell " + cell);
      }
    }
  }

  @Test
  void testOverwritesPreviousExport() throws IOException {
    export();
    JsonNode again = export();
    assertEquals(3, again.get("segments").get("features").size());
  }

  @Test
  void testRejectsGridForOtherRun() {
    var otherGrid = CoverageGrid.compute(List.of(), new CoverageResult(List.of(), 10, 0.5), BOUNDS, 200);
    assertThrows(IllegalArgumentException.class, () -> new CoverageExporter(BOUNDS, run, otherGrid));
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> result = new ArrayList<>();
    node.fieldNames().forEachRemaining(result::add);
    return result;
  }

  private static List<Double> doubles(JsonNode array) {
    List<Double> result = new ArrayList<>();
    array.forEach(value -> result.add(value.asDouble()));
    return result;
  }

  private static List<Integer> ints(JsonNode array) {
    List<Integer> result = new ArrayList<>();
    array.forEach(value -> result.add(value.asInt()));
    return result;
  }
}
