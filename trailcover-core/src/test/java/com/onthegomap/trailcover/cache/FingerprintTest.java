package com.onthegomap.trailcover.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FingerprintTest {

  @Test
  void testHexAndKey() {
    var fingerprint = new Fingerprint(0xabL);
    assertEquals("00000000000000ab", fingerprint.hex());
    assertEquals("segments-00000000000000ab", fingerprint.key("segments"));
    assertEquals("ffffffffffffffff", new Fingerprint(-1).hex());
    assertTrue(Fingerprint.builder().add("x").build().hex().matches("[0-9a-f]{16}"));
  }

  @Test
  void testDeterministic() {
    assertEquals(
      Fingerprint.builder().add("network").add(10d).add(true).add(3L).build(),
      Fingerprint.builder().add("network").add(10d).add(true).add(3L).build()
    );
  }

  @Test
  void testSensitiveToEveryValueAndOrder() {
    var base = Fingerprint.builder().add("a").add(1d).build();
    assertNotEquals(base, Fingerprint.builder().add("a").add(2d).build());
    assertNotEquals(base, Fingerprint.builder().add("b").add(1d).build());
    assertNotEquals(base, Fingerprint.builder().add(1d).add("a").build());
    assertNotEquals(
      Fingerprint.builder().add("ab").add("c").build(),
      Fingerprint.builder().add("a").add("bc").build()
    );
    assertNotEquals(Fingerprint.builder().add(true).build(), Fingerprint.builder().add(false).build());
    assertNotEquals(base, Fingerprint.builder().add(base).build());
  }

  @Test
  void testFileFingerprintChangesWithContents(@TempDir Path tmpDir) throws IOException {
    Path file = tmpDir.resolve("network.json");
    Files.writeString(file, "{}");
    var before = Fingerprint.ofFile(file);
    assertEquals(before, Fingerprint.ofFile(file));
    Files.writeString(file, "{\"elements\":[]}");
    assertNotEquals(before, Fingerprint.ofFile(file));
    assertNotEquals(before, Fingerprint.ofFile(tmpDir.resolve("other.json")));
  }
}
