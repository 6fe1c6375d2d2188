package app.terrain.tin;

import app.terrain.config.TinConfig;
import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class MeshRefinerTest {
  private final TinBuilder builder = new TinBuilder(100.0);
  private final MeshRefiner refiner = new MeshRefiner(builder, TinConfig.defaultRefineDistances());

  @Test
  void listedScalesUseTheirDistance() {
    assertEquals(15.0, refiner.threshold(500));
    assertEquals(20.0, refiner.threshold(1000));
    assertEquals(35.0, refiner.threshold(2000));
    assertEquals(60.0, refiner.threshold(5000));
  }

  @Test
  void unlistedScaleUsesNearestKeyAndSmallerOnTie() {
    assertEquals(20.0, refiner.threshold(1200));
    assertEquals(60.0, refiner.threshold(10000));
    assertEquals(15.0, refiner.threshold(1));
    assertEquals(15.0, refiner.threshold(750));
  }

  @Test
  void emptyTableDisablesRefinement() {
    assertEquals(0.0, new MeshRefiner(builder, new TreeMap<>()).threshold(1000));
  }

  @Test
  void smallTrianglesLeaveMeshUnchanged() {
    List<Point3> points = grid(5, 5.0);
    Mesh base = builder.build(points, List.of());
    MeshRefiner.Refinement refinement = refiner.refine(base, points, List.of(), 1000, true);
    assertFalse(refinement.refined());
    assertSame(base, refinement.mesh());
  }

  @Test
  void disabledRefinementLeavesMeshUnchanged() {
    List<Point3> points = grid(4, 40.0);
    Mesh base = builder.build(points, List.of());
    MeshRefiner.Refinement refinement = refiner.refine(base, points, List.of(), 1000, false);
    assertSame(base, refinement.mesh());
    assertTrue(refinement.addedPoints().isEmpty());
  }

  @Test
  void largeTrianglesGetTheirCentroidsAdded() {
    List<Point3> points = grid(3, 40.0);
    Mesh base = builder.build(points, List.of());
    MeshRefiner.Refinement refinement = refiner.refine(base, points, List.of(), 1000, true);
    assertTrue(refinement.refined());
    assertEquals(base.triangleCount(), refinement.addedPoints().size());
    assertEquals(points.size() + refinement.addedPoints().size(), refinement.mesh().vertices().size());
    assertTrue(refinement.mesh().triangleCount() > base.triangleCount());
  }

  @Test
  void centroidsAreDeduplicated() {
    Mesh mesh = new Mesh(
        List.of(new Point3(0, 0, 0), new Point3(30, 0, 0), new Point3(0, 30, 0)),
        List.of(new int[] {0, 1, 2}, new int[] {0, 1, 2}),
        0);
    List<Point3> centroids = refiner.centroidsOfLargeTriangles(mesh, 20.0);
    assertEquals(List.of(new Point3(10, 10, 0)), centroids);
  }

  private static List<Point3> grid(int n, double step) {
    List<Point3> points = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        points.add(new Point3(i * step, j * step, (i + j) * 0.5));
      }
    }
    return points;
  }
}
