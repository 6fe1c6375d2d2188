package app.terrain.geometry;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class Polygon2DTest {
  private static final double EPS = 1e-9;

  @Test
  void openRingIsClosedForContainment() {
    Polygon2D square = new Polygon2D(List.of(
        new Point3(0, 0, 1), new Point3(10, 0, 2), new Point3(10, 10, 3), new Point3(0, 10, 2)));
    assertTrue(square.contains(5, 5));
    assertFalse(square.contains(11, 5));
    assertFalse(square.contains(0, 5));
    assertEquals(100.0, square.boundsArea(), EPS);
    assertEquals(2.0, square.meanZ(), EPS);
  }

  @Test
  void concaveRingExcludesNotch() {
    Polygon2D shape = new Polygon2D(List.of(
        new Point3(0, 0, 0), new Point3(10, 0, 0), new Point3(10, 10, 0),
        new Point3(5, 2, 0), new Point3(0, 10, 0)));
    assertTrue(shape.contains(2, 1));
    assertFalse(shape.contains(5, 8));
  }

  @Test
  void needsThreePoints() {
    assertThrows(IllegalArgumentException.class,
        () -> new Polygon2D(List.of(new Point3(0, 0, 0), new Point3(1, 1, 0))));
  }
}
