package com.onthegomap.trailcover.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

  @TempDir
  Path tmpDir;

  @Test
  void testHasExtension() {
    assertTrue(FileUtils.hasExtension(Path.of("a", "ride.gpx"), "gpx"));
    assertTrue(FileUtils.hasExtension(Path.of("RIDE.GPX"), "gpx"));
    assertFalse(FileUtils.hasExtension(Path.of("ride.gpx.bak"), "gpx"));
    assertFalse(FileUtils.hasExtension(Path.of("gpx"), "gpx"));
  }

  @Test
  void testSizeAndModifiedOfMissingFile() {
    Path missing = tmpDir.resolve("missing");
    assertEquals(0, FileUtils.fileSize(missing));
    assertEquals(0, FileUtils.lastModifiedMillis(missing));
  }

  @Test
  void testSizeAndModified() throws IOException {
    Path file = tmpDir.resolve("file");
    Files.write(file, new byte[]{1, 2, 3});
    assertEquals(3, FileUtils.fileSize(file));
    assertTrue(FileUtils.lastModifiedMillis(file) > 0);
  }

  @Test
  void testListFilesSortedByName() throws IOException {
    Files.writeString(tmpDir.resolve("b.gpx"), "");
    Files.writeString(tmpDir.resolve("a.GPX"), "");
    Files.writeString(tmpDir.resolve("c.txt"), "");
    Files.createDirectories(tmpDir.resolve("d.gpx"));
    assertEquals(
      List.of(tmpDir.resolve("a.GPX"), tmpDir.resolve("b.gpx")),
      FileUtils.listFiles(tmpDir, "gpx")
    );
  }

  @Test
  void testListMissingDirectoryThrows() {
    Path missing = tmpDir.resolve("missing");
    assertThrows(UncheckedIOException.class, () -> FileUtils.listFiles(missing, "gpx"));
  }

  @Test
  void testWriteAtomicallyCreatesParentsAndReplaces() throws IOException {
    Path file = tmpDir.resolve("nested").resolve("dir").resolve("out.json");
    FileUtils.writeAtomically(file, new byte[]{1, 2});
    assertArrayEquals(new byte[]{1, 2}, Files.readAllBytes(file));
    FileUtils.writeAtomically(file, new byte[]{3});
    assertArrayEquals(new byte[]{3}, Files.readAllBytes(file));
    try (var list = Files.list(file.getParent())) {
      assertEquals(List.of(file), list.toList());
    }
  }

  @Test
  void testConcurrentWritesToSamePath() throws Exception {
    Path file = tmpDir.resolve("cache").resolve("segments-0000000000000001.bin");
    byte[] first = new byte[100_000];
    byte[] second = new byte[100_000];
    Arrays.fill(first, (byte) 1);
    Arrays.fill(second, (byte) 2);
    var pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> writes = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        byte[] bytes = i % 2 == 0 ? first : second;
        writes.add(pool.submit(() -> {
          FileUtils.writeAtomically(file, bytes);
          return null;
        }));
      }
      for (Future<?> write : writes) {
        write.get();
      }
    } finally {
      pool.shutdownNow();
    }
    byte[] written = Files.readAllBytes(file);
    assertTrue(Arrays.equals(first, written) || Arrays.equals(second, written));
    try (var list = Files.list(file.getParent())) {
      assertEquals(List.of(file), list.toList());
    }
  }

  @Test
  void testWriteAtomicallyFailsWhenParentIsAFile() throws IOException {
    Path blocker = tmpDir.resolve("blocker");
    Files.writeString(blocker, "x");
    assertThrows(IOException.class, () -> FileUtils.writeAtomically(blocker.resolve("out.json"), new byte[]{1}));
  }
}
