package com.onthegomap.trailcover.reader;

import com.onthegomap.trailcover.cache.Fingerprint;
import com.onthegomap.trailcover.track.Track;
import java.util.List;

/**
 * Where recorded GPS tracks come from.
 */
public interface TrackSource {

  /** Returns a string ID for this source to use in logs. */
  String id();

  /** Returns a fingerprint that changes whenever {@link #readTracks()} would return something different. */
  Fingerprint fingerprint();

  /**
   * Returns every usable track from this source. Inputs that cannot be parsed are skipped.
   *
   * @throws java.io.UncheckedIOException if the source itself cannot be read
   */
  List<Track> readTracks();

  /** Returns a source that serves {@code tracks} from memory. */
  static TrackSource of(String id, List<Track> tracks) {
    List<Track> copy = List.copyOf(tracks);
    var builder = Fingerprint.builder().add(id).add((long) copy.size());
    for (Track track : copy) {
      builder.add(track.fingerprint());
    }
    Fingerprint fingerprint = builder.build();
    return new TrackSource() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public Fingerprint fingerprint() {
        return fingerprint;
      }

      @Override
      public List<Track> readTracks() {
        return copy;
      }
    };
  }
}
