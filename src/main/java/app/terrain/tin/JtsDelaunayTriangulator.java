package app.terrain.tin;

import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.locationtech.jts.triangulate.quadedge.LocateFailureException;
import org.locationtech.jts.triangulate.quadedge.QuadEdgeSubdivision;
import org.locationtech.jts.triangulate.quadedge.Vertex;

/** Unconstrained 2D Delaunay triangulation backed by JTS. Exact XY duplicates map to the first site. */
public final class JtsDelaunayTriangulator implements Triangulator {
  @Override
  public List<int[]> triangulate(List<Point3> sites) {
    Map<Coordinate, Integer> indexByXY = new HashMap<>();
    List<Coordinate> coordinates = new ArrayList<>(sites.size());
    for (int i = 0; i < sites.size(); i++) {
      Coordinate coordinate = new Coordinate(sites.get(i).x(), sites.get(i).y());
      if (indexByXY.putIfAbsent(coordinate, i) == null) {
        coordinates.add(coordinate);
      }
    }
    if (coordinates.size() < 3) {
      return List.of();
    }
    List<Vertex[]> triangles;
    try {
      DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
      builder.setSites(coordinates);
      builder.setTolerance(0d);
      QuadEdgeSubdivision subdivision = builder.getSubdivision();
      triangles = triangleVertices(subdivision);
    } catch (LocateFailureException | TopologyException e) {
      throw new TriangulationException("Delaunay triangulation failed for " + coordinates.size() + " sites", e);
    }
    List<int[]> result = new ArrayList<>(triangles.size());
    for (Vertex[] triangle : triangles) {
      int[] indices = new int[3];
      boolean resolved = true;
      for (int k = 0; k < 3; k++) {
        Integer index = indexByXY.get(triangle[k].getCoordinate());
        if (index == null) {
          resolved = false;
          break;
        }
        indices[k] = index;
      }
      if (resolved) {
        result.add(indices);
      }
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private List<Vertex[]> triangleVertices(QuadEdgeSubdivision subdivision) {
    return (List<Vertex[]>) subdivision.getTriangleVertices(false);
  }
}
