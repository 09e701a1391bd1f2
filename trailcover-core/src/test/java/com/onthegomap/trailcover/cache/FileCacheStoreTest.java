package com.onthegomap.trailcover.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCacheStoreTest {

  @TempDir
  Path tmpDir;

  private List<String> fileNames(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(file -> file.getFileName().toString()).sorted().toList();
    }
  }

  @Test
  void testMissingEntry() throws IOException {
    var store = new FileCacheStore(tmpDir.resolve("cache"));
    assertEquals(Optional.empty(), store.read("segments-0000000000000001"));
  }

  @Test
  void testWriteCreatesDirectoryAndReadsBack() throws IOException {
    Path dir = tmpDir.resolve("nested").resolve("cache");
    var store = new FileCacheStore(dir);
    store.write("segments-00000000000000ab", new byte[]{1, 2, 3});
    assertArrayEquals(new byte[]{1, 2, 3}, store.read("segments-00000000000000ab").orElseThrow());
    assertEquals(List.of("segments-00000000000000ab.bin"), fileNames(dir));
  }

  @Test
  void testOverwriteLeavesNoTemporaryFiles() throws IOException {
    var store = new FileCacheStore(tmpDir);
    store.write("track-1", new byte[]{1});
    store.write("track-1", new byte[]{2, 2});
    assertArrayEquals(new byte[]{2, 2}, store.read("track-1").orElseThrow());
    assertEquals(List.of("track-1.bin"), fileNames(tmpDir));
  }

  @Test
  void testDelete() throws IOException {
    var store = new FileCacheStore(tmpDir);
    store.write("coverage-1", new byte[]{1});
    store.delete("coverage-1");
    store.delete("coverage-2");
    assertEquals(Optional.empty(), store.read("coverage-1"));
  }

  @Test
  void testClearOnlyRemovesEntries() throws IOException {
    var store = new FileCacheStore(tmpDir);
    store.write("coverage-1", new byte[]{1});
    store.write("track-2", new byte[]{2});
    Files.writeString(tmpDir.resolve("notes.txt"), "keep me");
    store.clear();
    assertEquals(List.of("notes.txt"), fileNames(tmpDir));
  }

  @Test
  void testClearMissingDirectory() throws IOException {
    var store = new FileCacheStore(tmpDir.resolve("missing"));
    store.clear();
    assertTrue(Files.notExists(tmpDir.resolve("missing")));
  }

  @Test
  void testRejectsKeysThatEscapeDirectory() {
    var store = new FileCacheStore(tmpDir);
    assertThrows(IllegalArgumentException.class, () -> store.read("../evil"));
    assertThrows(IllegalArgumentException.class, () -> store.write("Upper", new byte[0]));
    assertThrows(IllegalArgumentException.class, () -> store.delete(""));
  }
}
