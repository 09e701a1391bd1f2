package com.onthegomap.trailcover.cache;

import com.onthegomap.trailcover.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link CacheStore} that keeps one {@code <key>.bin} file per entry in a directory.
 * <p>
 * Writes go to a temporary file that is then renamed into place.
 */
@ThreadSafe
public class FileCacheStore implements CacheStore {

  private static final String EXTENSION = "bin";
  private static final Pattern VALID_KEY = Pattern.compile("[a-z0-9_-]+");
  private final Path dir;

  public FileCacheStore(Path dir) {
    this.dir = dir;
  }

  public Path dir() {
    return dir;
  }

  Path path(String key) {
    if (!VALID_KEY.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid cache key: " + key);
    }
    return dir.resolve(key + "." + EXTENSION);
  }

  @Override
  public Optional<byte[]> read(String key) throws IOException {
    try {
      return Optional.of(Files.readAllBytes(path(key)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
  }

  @Override
  public void write(String key, byte[] bytes) throws IOException {
    FileUtils.writeAtomically(path(key), bytes);
  }

  @Override
  public void delete(String key) throws IOException {
    Files.deleteIfExists(path(key));
  }

  @Override
  public void clear() throws IOException {
    if (!Files.isDirectory(dir)) {
      return;
    }
    for (Path file : FileUtils.listFiles(dir, EXTENSION)) {
      Files.deleteIfExists(file);
    }
  }

  @Override
  public String toString() {
    return "FileCacheStore{" + dir + "}";
  }
}
