package app.terrain.graph;

import app.terrain.geometry.Point3;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ProximityGraphBuilderTest {
  private final ProximityGraphBuilder builder = new ProximityGraphBuilder();

  @Test
  void pointsExactlyAtThresholdAreConnected() {
    ProximityGraph graph = builder.build(List.of(new Point3(0, 0, 0), new Point3(3, 4, 0)), 5.0);
    assertEquals(5.0, graph.threshold());
    assertTrue(graph.adjacent(0, 1));
    assertEquals(1, graph.components().size());
  }

  @Test
  void pointsJustBeyondThresholdAreNot() {
    ProximityGraph graph = builder.build(List.of(new Point3(0, 0, 0), new Point3(5.0 + 1e-9, 0, 0)), 5.0);
    assertFalse(graph.adjacent(0, 1));
    assertEquals(List.of(List.of(0), List.of(1)), graph.components());
  }

  @Test
  void componentsAreTransitiveAndOrderedBySmallestMember() {
    List<Point3> points = List.of(
        new Point3(100, 0, 0),
        new Point3(0, 0, 0),
        new Point3(4, 0, 0),
        new Point3(104, 0, 0),
        new Point3(8, 0, 0));
    ProximityGraph graph = builder.build(points, 5.0);
    assertEquals(List.of(List.of(0, 3), List.of(1, 2, 4)), graph.components());
    assertFalse(graph.adjacent(1, 4));
    assertEquals(3, graph.edges().size());
  }
}
