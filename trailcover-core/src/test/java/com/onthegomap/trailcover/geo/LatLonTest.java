package com.onthegomap.trailcover.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LatLonTest {

  @Test
  void testExactEquality() {
    assertEquals(LatLon.of(1, 2), new LatLon(1, 2));
    assertNotEquals(LatLon.of(1, 2), LatLon.of(1, 2 + 1e-12));
  }

  @Test
  void testRejectsNonFinite() {
    assertThrows(IllegalArgumentException.class, () -> LatLon.of(Double.NaN, 0));
    assertThrows(IllegalArgumentException.class, () -> LatLon.of(0, Double.POSITIVE_INFINITY));
  }

  @Test
  void testInterpolate() {
    LatLon a = LatLon.of(0, 0);
    LatLon b = LatLon.of(2, 4);
    assertEquals(a, a.interpolate(b, 0));
    assertEquals(b, a.interpolate(b, 1));
    assertEquals(LatLon.of(1, 2), a.interpolate(b, 0.5));
  }
}
