package com.onthegomap.trailcover.reader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.geo.LatLon;
import com.onthegomap.trailcover.network.TrailType;
import com.onthegomap.trailcover.network.Way;
import com.onthegomap.trailcover.stats.Stats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads trail ways from the JSON output of an Overpass API query run with {@code out geom}, which inlines the node
 * coordinates of every way.
 * <p>
 * Only elements of type {@code way} whose {@code highway} tag is one of the configured trail types are kept, or ways
 * with any {@code highway} tag if the list of trail types contains {@code *}.
 */
public class OverpassJsonReader implements TrailNetworkSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverpassJsonReader.class);
  private static final ObjectMapper mapper = new ObjectMapper().registerModule(new Jdk8Module());
  public static final String ALL_TRAIL_TYPES = "*";

  private final Path path;
  private final Set<String> trailTypes;
  private final Stats stats;

  /**
   * @param path       the Overpass JSON file
   * @param trailTypes {@code highway} tag values to keep
   * @param stats      to count dropped elements
   * @throws IllegalArgumentException if {@code path} does not exist
   */
  public OverpassJsonReader(Path path, List<String> trailTypes, Stats stats) {
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Trail network file " + path + " does not exist");
    }
    this.path = path;
    this.trailTypes = trailTypes.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    this.stats = stats;
  }

  @Override
  public String id() {
    return "overpass:" + path.getFileName();
  }

  @Override
  public Fingerprint fingerprint() {
    return Fingerprint.builder()
      .add(path)
      .add(trailTypes.stream().sorted().collect(Collectors.joining(",")))
      .build();
  }

  @Override
  public List<Way> readWays() {
    OverpassResponse response;
    try (var reader = Files.newBufferedReader(path)) {
      response = mapper.readValue(reader, OverpassResponse.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read trail network " + path, e);
    }
    List<Way> ways = new ArrayList<>();
    int elements = response.elements() == null ? 0 : response.elements().size();
    for (Element element : Objects.requireNonNullElse(response.elements(), List.<Element>of())) {
      if (!"way".equals(element.type())) {
        continue;
      }
      Map<String, String> tags = Objects.requireNonNullElse(element.tags(), Map.of());
      String highway = tags.get("highway");
      if (!keep(highway)) {
        continue;
      }
      List<LatLon> points = new ArrayList<>();
      for (Point point : Objects.requireNonNullElse(element.geometry(), List.<Point>of())) {
        // overpass emits null for nodes outside of the query bbox
        if (point != null) {
          points.add(new LatLon(point.lat(), point.lon()));
        }
      }
      if (points.size() < 2) {
        stats.dataError("overpass_way_too_few_points");
        LOGGER.debug("Skipping way {} with {} points", element.id(), points.size());
        continue;
      }
      ways.add(new Way(element.id(), points, TrailType.fromHighway(highway), tags.get("name")));
    }
    LOGGER.info("Read {} trail ways from {} elements in {}", ways.size(), elements, path);
    return ways;
  }

  private boolean keep(String highway) {
    return highway != null && (trailTypes.contains(ALL_TRAIL_TYPES) ||
      trailTypes.contains(highway.toLowerCase(Locale.ROOT)));
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record OverpassResponse(List<Element> elements) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Element(String type, long id, Map<String, String> tags, List<Point> geometry) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Point(double lat, double lon) {}
}
