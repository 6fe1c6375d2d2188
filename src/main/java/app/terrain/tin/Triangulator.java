package app.terrain.tin;

import app.terrain.geometry.Point3;
import java.util.List;

public interface Triangulator {
  /**
   * Triangulates the XY projection of {@code sites}. Each returned triple indexes into
   * {@code sites}; winding and order are unspecified.
   *
   * @throws TriangulationException when the input cannot be triangulated
   */
  List<int[]> triangulate(List<Point3> sites);
}
