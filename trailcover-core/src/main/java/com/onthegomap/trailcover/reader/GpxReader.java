package com.onthegomap.trailcover.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.config.Bounds;
import com.onthegomap.trailcover.geo.GeometryException;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.stats.Stats;
import com.onthegomap.trailcover.track.Track;
import com.onthegomap.trailcover.util.FileUtils;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads GPS tracks from every {@code .gpx} file in a directory, in file name order.
 * <p>
 * Each {@code <trkseg>} becomes its own {@link Track}. Segments with no point inside the region of interest are
 * dropped, and files that cannot be parsed are skipped with a warning.
 */
public class GpxReader implements TrackSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(GpxReader.class);
  private static final ObjectMapper mapper = new XmlMapper();

  private final Path dir;
  private final Bounds bounds;
  private final Stats stats;

  /**
   * @param dir    directory containing {@code .gpx} files
   * @param bounds region of interest, a track segment needs at least one point inside it
   * @param stats  to count skipped files and segments
   * @throws IllegalArgumentException if {@code dir} is not a directory
   */
  public GpxReader(Path dir, Bounds bounds, Stats stats) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("Activities directory " + dir + " does not exist");
    }
    this.dir = dir;
    this.bounds = bounds;
    this.stats = stats;
  }

  private List<Path> files() {
    return FileUtils.listFiles(dir, "gpx");
  }

  @Override
  public String id() {
    return "gpx:" + dir;
  }

  @Override
  public Fingerprint fingerprint() {
    var builder = Fingerprint.builder()
      .add(dir.toAbsolutePath().normalize().toString())
      .add(bounds.west()).add(bounds.south()).add(bounds.east()).add(bounds.north());
    for (Path file : files()) {
      builder.add(file);
    }
    return builder.build();
  }

  @Override
  public List<Track> readTracks() {
    List<Track> tracks = new ArrayList<>();
    List<Path> files = files();
    int activities = 0;
    for (Path file : files) {
      try {
        List<Track> fromFile = read(file);
        if (fromFile.isEmpty()) {
          LOGGER.info("Skipping {}, no tracks in bounds", file.getFileName());
        } else {
          activities++;
          LOGGER.debug("Loaded {}: {} tracks, {} points", fromFile.get(0).name(), fromFile.size(),
            fromFile.stream().mapToInt(t -> t.points().size()).sum());
          tracks.addAll(fromFile);
        }
      } catch (IOException | RuntimeException e) {
        LOGGER.warn("Unable to parse {}: {}", file, e.toString());
        stats.dataError("gpx_unreadable");
      }
    }
    LOGGER.info("Loaded {} tracks from {} of {} activities in {}", tracks.size(), activities, files.size(), dir);
    return tracks;
  }

  /** Returns the track segments in {@code file} that have a point inside the region of interest. */
  List<Track> read(Path file) throws IOException {
    JsonNode root;
    try (InputStream input = Files.newInputStream(file)) {
      root = mapper.readTree(input);
    }
    if (root == null) {
      throw new IOException("empty document");
    }
    String fileName = file.getFileName().toString();
    String name = root.path("metadata").path("name").asText("");
    if (name.isBlank()) {
      name = fileName.replaceFirst("\\.[^.]+$", "");
    }
    List<Track> result = new ArrayList<>();
    int segmentIndex = 0;
    for (JsonNode trk : children(root, "trk")) {
      for (JsonNode trkseg : children(trk, "trkseg")) {
        String id = fileName + "#" + segmentIndex++;
        try {
          List<LatLon> points = points(trkseg);
          if (points.isEmpty()) {
            throw new GeometryException("empty_segment", "track segment has no points", true);
          }
          Track track = new Track(id, name, points);
          if (bounds.latLon().intersects(track.envelope()) && points.stream().anyMatch(bounds::contains)) {
            result.add(track);
          } else {
            stats.dataError("gpx_segment_out_of_bounds");
          }
        } catch (GeometryException e) {
          e.log(stats, "gpx", "Skipping " + id);
        }
      }
    }
    return result;
  }

  private static List<LatLon> points(JsonNode trkseg) throws GeometryException {
    List<LatLon> points = new ArrayList<>();
    for (JsonNode trkpt : children(trkseg, "trkpt")) {
      JsonNode lat = trkpt.get("lat");
      JsonNode lon = trkpt.get("lon");
      if (lat == null || lon == null) {
        throw new GeometryException("missing_coordinate", "trkpt is missing lat or lon", true);
      }
      try {
        points.add(new LatLon(Double.parseDouble(lat.asText()), Double.parseDouble(lon.asText())));
      } catch (IllegalArgumentException e) {
        throw new GeometryException("bad_coordinate", "invalid trkpt " + lat.asText() + "," + lon.asText(), true);
      }
    }
    return points;
  }

  /** Repeated XML elements become an array in the tree model but a lone element does not, so handle both. */
  private static List<JsonNode> children(JsonNode parent, String name) {
    JsonNode node = parent.get(name);
    List<JsonNode> result = new ArrayList<>();
    if (node == null) {
      return result;
    } else if (node.isArray()) {
      node.forEach(child -> result.add(element(child)));
    } else {
      result.add(element(node));
    }
    return result;
  }

  /** An element with no attributes or children reads as an empty string. */
  private static JsonNode element(JsonNode node) {
    return node.isObject() ? node : JsonNodeFactory.instance.objectNode();
  }
}
