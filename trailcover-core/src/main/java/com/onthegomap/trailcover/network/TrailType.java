package com.onthegomap.trailcover.network;

import java.util.Locale;

/** The kind of trail a way represents, from its OpenStreetMap {@code highway} tag. */
public enum TrailType {
  PATH("path"),
  TRACK("track"),
  FOOTWAY("footway"),
  OTHER("other");

  private final String id;

  TrailType(String id) {
    this.id = id;
  }

  /** Returns the lowercase tag value for this type. */
  public String id() {
    return id;
  }

  /** Returns the type for a {@code highway} tag value, or {@link #OTHER} when it is missing or unrecognized. */
  public static TrailType fromHighway(String highway) {
    if (highway == null) {
      return OTHER;
    }
    return switch (highway.trim().toLowerCase(Locale.ROOT)) {
      case "path" -> PATH;
      case "track" -> TRACK;
      case "footway" -> FOOTWAY;
      default -> OTHER;
    };
  }
}
