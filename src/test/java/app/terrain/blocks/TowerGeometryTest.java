package app.terrain.blocks;

import app.terrain.geometry.Point3;
import app.terrain.sink.BlockExtent;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TowerGeometryTest {
  private static final double EPS = 1e-9;

  @Test
  void rightAngleCornerCompletesRectangle() {
    Optional<Point3> fourth = TowerGeometry.completeRectangle(
        List.of(new Point3(0, 0, 0), new Point3(10, 0, 0), new Point3(10, 10, 1)), 0.05);
    assertTrue(fourth.isPresent());
    assertEquals(0.0, fourth.get().x(), EPS);
    assertEquals(10.0, fourth.get().y(), EPS);
    assertEquals(1.0 / 3.0, fourth.get().z(), EPS);
  }

  @Test
  void noRightAngleWithinTolerance() {
    Optional<Point3> fourth = TowerGeometry.completeRectangle(
        List.of(new Point3(0, 0, 0), new Point3(10, 0, 0), new Point3(13, 8, 0)), 0.05);
    assertTrue(fourth.isEmpty());
  }

  @Test
  void coincidentPointsAreRejected() {
    assertTrue(TowerGeometry.completeRectangle(
        List.of(new Point3(1, 1, 0), new Point3(1, 1, 0), new Point3(1, 1, 0)), 0.05).isEmpty());
    assertTrue(TowerGeometry.fit(
        List.of(new Point3(0, 0, 0), new Point3(0, 0, 0), new Point3(4, 0, 0), new Point3(4, 2, 0))).isEmpty());
  }

  @Test
  void footprintFollowsLongestEdge() {
    List<Point3> corners = List.of(
        new Point3(0, 0, 1), new Point3(0, 4, 1), new Point3(-2, 4, 1), new Point3(-2, 0, 1));
    TowerGeometry.Footprint footprint = TowerGeometry.fit(corners).orElseThrow();
    assertEquals(-1.0, footprint.center().x(), EPS);
    assertEquals(2.0, footprint.center().y(), EPS);
    assertEquals(1.0, footprint.center().z(), EPS);
    assertEquals(90.0, Math.abs(footprint.rotationDeg()), EPS);
    assertEquals(4.0, footprint.width(), EPS);
    assertEquals(2.0, footprint.height(), EPS);
  }

  @Test
  void scalesAreClampedToMinimum() {
    TowerGeometry.Footprint footprint = new TowerGeometry.Footprint(new Point3(0, 0, 0), 0, 4, 0.001);
    double[] scales = TowerGeometry.scales(footprint, new BlockExtent(2, 2), 0.01);
    assertEquals(2.0, scales[0], EPS);
    assertEquals(0.01, scales[1], EPS);
  }
}
