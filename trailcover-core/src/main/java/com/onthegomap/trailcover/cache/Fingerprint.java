package com.onthegomap.trailcover.cache;

import com.onthegomap.trailcover.util.FileUtils;
import com.onthegomap.trailcover.util.Hashing;
import java.nio.file.Path;

/**
 * A 64-bit FNV-1a hash of everything that influences a cached artifact: where its input came from, the size and last
 * modified time of input files, and the parameters used to compute it.
 */
public record Fingerprint(long value) {

  /** Returns the fingerprint as 16 lowercase hex digits. */
  public String hex() {
    return String.format("%016x", value);
  }

  /** Returns the cache key for an artifact of {@code kind} with this fingerprint. */
  public String key(String kind) {
    return kind + "-" + hex();
  }

  /** Returns a fingerprint of a file's path, size and last modified time. */
  public static Fingerprint ofFile(Path path) {
    return builder().add(path).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return hex();
  }

  /** Accumulates values into a fingerprint, order matters. */
  public static class Builder {

    private long hash = Hashing.FNV1_64_INIT;

    private Builder() {}

    public Builder add(String value) {
      hash = Hashing.fnv1a64(hash, value);
      return this;
    }

    public Builder add(long value) {
      hash = Hashing.fnv1a64(hash, value);
      return this;
    }

    public Builder add(double value) {
      return add(Double.doubleToLongBits(value));
    }

    public Builder add(boolean value) {
      return add(value ? 1L : 0L);
    }

    public Builder add(Fingerprint other) {
      return add(other.value);
    }

    /** Adds the normalized absolute path, size and last modified time of {@code path}. */
    public Builder add(Path path) {
      return add(path.toAbsolutePath().normalize().toString())
        .add(FileUtils.fileSize(path))
        .add(FileUtils.lastModifiedMillis(path));
    }

    public Fingerprint build() {
      return new Fingerprint(hash);
    }
  }
}
