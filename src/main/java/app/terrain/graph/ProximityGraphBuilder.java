package app.terrain.graph;

import app.terrain.geometry.GridIndex;
import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.List;

public final class ProximityGraphBuilder {
  /** Joins every pair of points whose XY distance is at most {@code threshold}, inclusive. */
  public ProximityGraph build(List<Point3> points, double threshold) {
    int n = points.size();
    if (n == 0) {
      return new ProximityGraph(0, threshold, List.of(), List.of());
    }
    GridIndex index = new GridIndex(threshold);
    for (int i = 0; i < n; i++) {
      index.add(i, points.get(i).x(), points.get(i).y());
    }
    List<List<Integer>> adjacency = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      adjacency.add(new ArrayList<>());
    }
    List<ProximityGraph.E> edges = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Point3 point = points.get(i);
      for (int j : index.near(point.x(), point.y())) {
        if (j == i) {
          continue;
        }
        if (point.distance2d(points.get(j)) <= threshold) {
          adjacency.get(i).add(j);
          if (i < j) {
            edges.add(new ProximityGraph.E(i, j));
          }
        }
      }
    }
    return new ProximityGraph(n, threshold, adjacency, edges);
  }
}
