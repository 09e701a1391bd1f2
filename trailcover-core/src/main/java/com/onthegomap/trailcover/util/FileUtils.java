package com.onthegomap.trailcover.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;

/**
 * Convenience methods for working with files on disk.
 */
public class FileUtils {

  private FileUtils() {}

  /** Returns true if {@code path} ends with ".extension" (case-insensitive). */
  public static boolean hasExtension(Path path, String extension) {
    return path.toString().toLowerCase().endsWith("." + extension.toLowerCase());
  }

  /** Returns the size of {@code path} as a file, or 0 if missing/inaccessible. */
  public static long fileSize(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      return 0;
    }
  }

  /** Returns the last modified time of {@code path} in epoch millis, or 0 if missing/inaccessible. */
  public static long lastModifiedMillis(Path path) {
    try {
      return Files.getLastModifiedTime(path).toMillis();
    } catch (IOException e) {
      return 0;
    }
  }

  /**
   * Returns the regular files directly inside {@code dir} ending with {@code .extension}, sorted by file name.
   *
   * @throws UncheckedIOException if the directory cannot be listed
   */
  public static List<Path> listFiles(Path dir, String extension) {
    try (var list = Files.list(dir)) {
      return list
        .filter(Files::isRegularFile)
        .filter(path -> hasExtension(path, extension))
        .sorted(Comparator.comparing(path -> path.getFileName().toString()))
        .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to list " + dir, e);
    }
  }

  /**
   * Writes {@code bytes} to a temporary sibling of {@code path} then renames it over {@code path}, so readers never
   * observe a partially-written file.
   *
   * @throws IOException if the write or the rename fails, in which case the temporary file is removed
   */
  public static void writeAtomically(Path path, byte[] bytes) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    // one temp file per writer
    Path tmp = Files.createTempFile(parent, path.getFileName() + ".", ".tmp");
    try {
      Files.write(tmp, bytes);
      try {
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
