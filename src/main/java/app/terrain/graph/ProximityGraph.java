package app.terrain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Undirected graph over point indices where an edge joins two points no further apart than
 * {@link #threshold()} in XY.
 */
public final class ProximityGraph {
  public static final class E {
    private final int u;
    private final int v;

    public E(int u, int v) {
      this.u = Math.min(u, v);
      this.v = Math.max(u, v);
    }

    public int u() {
      return u;
    }

    public int v() {
      return v;
    }
  }

  private final int size;
  private final double threshold;
  private final List<List<Integer>> adjacency;
  private final List<E> edges;

  ProximityGraph(int size, double threshold, List<List<Integer>> adjacency, List<E> edges) {
    this.size = size;
    this.threshold = threshold;
    List<List<Integer>> copy = new ArrayList<>(adjacency.size());
    for (List<Integer> neighbors : adjacency) {
      copy.add(List.copyOf(neighbors));
    }
    this.adjacency = Collections.unmodifiableList(copy);
    this.edges = List.copyOf(edges);
  }

  public int size() {
    return size;
  }

  public double threshold() {
    return threshold;
  }

  public List<E> edges() {
    return edges;
  }

  public boolean adjacent(int u, int v) {
    return adjacency.get(u).contains(v);
  }

  /**
   * Connected components in breadth-first order. Components are listed by their smallest
   * member and each component is sorted ascending.
   */
  public List<List<Integer>> components() {
    boolean[] visited = new boolean[size];
    List<List<Integer>> components = new ArrayList<>();
    for (int start = 0; start < size; start++) {
      if (visited[start]) {
        continue;
      }
      List<Integer> component = new ArrayList<>();
      Deque<Integer> queue = new ArrayDeque<>();
      queue.add(start);
      visited[start] = true;
      while (!queue.isEmpty()) {
        int current = queue.poll();
        component.add(current);
        for (int next : adjacency.get(current)) {
          if (!visited[next]) {
            visited[next] = true;
            queue.add(next);
          }
        }
      }
      Collections.sort(component);
      components.add(component);
    }
    return components;
  }
}
