package app.terrain.tin;

import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.List;

/**
 * Triangulated surface. Triangles index into {@link #vertices()}, are wound counter-clockwise in XY
 * and are listed in canonical order (smallest vertex index first, then lexicographic).
 */
public final class Mesh {
  private static final Mesh EMPTY = new Mesh(List.of(), List.of(), 0);

  private final List<Point3> vertices;
  private final List<int[]> triangles;
  private final int rejectedTriangles;

  public Mesh(List<Point3> vertices, List<int[]> triangles, int rejectedTriangles) {
    this.vertices = List.copyOf(vertices);
    List<int[]> copy = new ArrayList<>(triangles.size());
    for (int[] triangle : triangles) {
      copy.add(triangle.clone());
    }
    this.triangles = List.copyOf(copy);
    this.rejectedTriangles = rejectedTriangles;
  }

  public static Mesh empty() {
    return EMPTY;
  }

  public List<Point3> vertices() {
    return vertices;
  }

  public List<int[]> triangles() {
    return triangles;
  }

  /** Triangles the post-filter dropped as degenerate or oversized. */
  public int rejectedTriangles() {
    return rejectedTriangles;
  }

  public boolean isEmpty() {
    return triangles.isEmpty();
  }

  public int triangleCount() {
    return triangles.size();
  }

  public Point3[] corners(int triangle) {
    int[] t = triangles.get(triangle);
    return new Point3[] {vertices.get(t[0]), vertices.get(t[1]), vertices.get(t[2])};
  }

  public double minZ() {
    double min = Double.POSITIVE_INFINITY;
    for (int[] triangle : triangles) {
      for (int index : triangle) {
        min = Math.min(min, vertices.get(index).z());
      }
    }
    return min;
  }

  public double maxZ() {
    double max = Double.NEGATIVE_INFINITY;
    for (int[] triangle : triangles) {
      for (int index : triangle) {
        max = Math.max(max, vertices.get(index).z());
      }
    }
    return max;
  }
}
