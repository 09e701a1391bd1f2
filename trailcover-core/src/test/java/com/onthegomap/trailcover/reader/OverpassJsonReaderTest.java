package com.onthegomap.trailcover.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.TrailType;
import com.onthegomap.trailcover.network.Way;
import com.onthegomap.trailcover.stats.Stats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OverpassJsonReaderTest {

  private static final String JSON = """
    {
      "version": 0.6,
      "generator": "Overpass API",
      "elements": [
        {
          "type": "way", "id": 1,
          "bounds": {"minlat": 44.6, "minlon": 5.1, "maxlat": 44.61, "maxlon": 5.11},
          "nodes": [10, 11],
          "geometry": [{"lat": 44.6, "lon": 5.1}, {"lat": 44.61, "lon": 5.11}],
          "tags": {"highway": "path", "name": "Sentier des Crêtes"}
        },
        {
          "type": "way", "id": 2,
          "geometry": [{"lat": 44.6, "lon": 5.1}, {"lat": 44.62, "lon": 5.12}],
          "tags": {"highway": "residential"}
        },
        {
          "type": "way", "id": 3,
          "geometry": [{"lat": 44.6, "lon": 5.1}, null],
          "tags": {"highway": "track"}
        },
        {"type": "node", "id": 4, "lat": 44.6, "lon": 5.1},
        {
          "type": "way", "id": 5,
          "geometry": [{"lat": 44.6, "lon": 5.1}, {"lat": 44.62, "lon": 5.12}]
        },
        {
          "type": "way", "id": 6,
          "geometry": [{"lat": 44.63, "lon": 5.13}, null, {"lat": 44.64, "lon": 5.14}, {"lat": 44.65, "lon": 5.15}],
          "tags": {"highway": "FOOTWAY"}
        }
      ]
    }
    """;

  @TempDir
  Path tmpDir;
  private Path file;
  private final Stats stats = Stats.inMemory();

  @BeforeEach
  void writeFile() throws IOException {
    file = tmpDir.resolve("osm_trails.json");
    Files.writeString(file, JSON);
  }

  @Test
  void testReadsTrailWays() {
    var reader = new OverpassJsonReader(file, List.of("path", "track", "footway"), stats);
    List<Way> ways = reader.readWays();
    assertEquals(List.of(
      new Way(1, List.of(LatLon.of(44.6, 5.1), LatLon.of(44.61, 5.11)), TrailType.PATH, "Sentier des Crêtes"),
      new Way(6, List.of(LatLon.of(44.63, 5.13), LatLon.of(44.64, 5.14), LatLon.of(44.65, 5.15)), TrailType.FOOTWAY)
    ), ways);
    assertEquals(Map.of("overpass_way_too_few_points", 1L), stats.dataErrors());
    assertEquals("overpass:osm_trails.json", reader.id());
  }

  @Test
  void testAllTrailTypes() {
    var reader = new OverpassJsonReader(file, List.of(OverpassJsonReader.ALL_TRAIL_TYPES), stats);
    List<Way> ways = reader.readWays();
    assertEquals(List.of(1L, 2L, 6L), ways.stream().map(Way::id).toList());
    assertEquals(TrailType.OTHER, ways.get(1).type());
  }

  @Test
  void testFingerprintDependsOnTrailTypes() {
    var paths = new OverpassJsonReader(file, List.of("path"), stats);
    var pathsAgain = new OverpassJsonReader(file, List.of("PATH"), stats);
    var tracks = new OverpassJsonReader(file, List.of("track"), stats);
    assertEquals(paths.fingerprint(), pathsAgain.fingerprint());
    assertNotEquals(paths.fingerprint(), tracks.fingerprint());
  }

  @Test
  void testEmptyResponse() throws IOException {
    Path empty = tmpDir.resolve("empty.json");
    Files.writeString(empty, "{\"elements\": []}");
    assertEquals(List.of(), new OverpassJsonReader(empty, List.of("path"), stats).readWays());
    Files.writeString(empty, "{}");
    assertEquals(List.of(), new OverpassJsonReader(empty, List.of("path"), stats).readWays());
  }

  @Test
  void testMissingFile() {
    Path missing = tmpDir.resolve("missing.json");
    List<String> types = List.of("path");
    assertThrows(IllegalArgumentException.class, () -> new OverpassJsonReader(missing, types, stats));
  }

  @Test
  void testInvalidJson() throws IOException {
    Path invalid = tmpDir.resolve("invalid.json");
    Files.writeString(invalid, "{\"elements\": [");
    var reader = new OverpassJsonReader(invalid, List.of("path"), stats);
    assertThrows(UncheckedIOException.class, reader::readWays);
  }
}
