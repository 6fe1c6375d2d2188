package app.terrain.tin;

import app.terrain.geometry.GridIndex;
import app.terrain.geometry.Point3;
import app.terrain.geometry.SurveyPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TinBuilder {
  private static final Logger log = LoggerFactory.getLogger(TinBuilder.class);

  public static final double MERGE_TOLERANCE = 0.01;
  public static final double AREA_EPSILON = 1e-9;

  private static final Comparator<int[]> CANONICAL = (a, b) -> {
    for (int i = 0; i < 3; i++) {
      int cmp = Integer.compare(a[i], b[i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  };

  private final Triangulator triangulator;
  private final double maxEdgeLength;

  public TinBuilder(double maxEdgeLength) {
    this(new JtsDelaunayTriangulator(), maxEdgeLength);
  }

  public TinBuilder(Triangulator triangulator, double maxEdgeLength) {
    this.triangulator = triangulator;
    this.maxEdgeLength = maxEdgeLength;
  }

  /** Points whose code is in {@code codes}; an empty set selects every point. */
  public static List<Point3> surfacePoints(List<SurveyPoint> points, Set<String> codes) {
    List<Point3> selected = new ArrayList<>(points.size());
    for (SurveyPoint point : points) {
      if (codes.isEmpty() || codes.contains(point.normalizedCode())) {
        selected.add(point.position());
      }
    }
    return selected;
  }

  public Mesh build(List<Point3> points, List<List<Point3>> breaklines) {
    List<Point3> sites = merge(points, breaklines);
    if (sites.size() < 3) {
      log.warn("TIN needs at least 3 points, got {}", sites.size());
      return Mesh.empty();
    }
    List<int[]> raw;
    try {
      raw = triangulator.triangulate(sites);
    } catch (TriangulationException e) {
      log.warn("TIN triangulation failed: {}", e.getMessage());
      return Mesh.empty();
    }
    List<int[]> accepted = new ArrayList<>(raw.size());
    int rejected = 0;
    for (int[] triangle : raw) {
      Point3 a = sites.get(triangle[0]);
      Point3 b = sites.get(triangle[1]);
      Point3 c = sites.get(triangle[2]);
      double cross = cross(a, b, c);
      if (Math.abs(cross) * 0.5 <= AREA_EPSILON) {
        rejected++;
        continue;
      }
      if (a.distance2d(b) > maxEdgeLength || b.distance2d(c) > maxEdgeLength || c.distance2d(a) > maxEdgeLength) {
        rejected++;
        continue;
      }
      int[] oriented = cross > 0
          ? new int[] {triangle[0], triangle[1], triangle[2]}
          : new int[] {triangle[0], triangle[2], triangle[1]};
      accepted.add(rotateToSmallest(oriented));
    }
    if (accepted.isEmpty()) {
      log.warn("TIN produced no usable triangles from {} points", sites.size());
    } else if (rejected > 0) {
      log.warn("TIN dropped {} degenerate or oversized triangles (max edge {})", rejected, maxEdgeLength);
    }
    accepted.sort(CANONICAL);
    return new Mesh(sites, accepted, rejected);
  }

  private List<Point3> merge(List<Point3> points, List<List<Point3>> breaklines) {
    List<Point3> sites = new ArrayList<>(points);
    if (breaklines == null || breaklines.isEmpty()) {
      return sites;
    }
    GridIndex index = new GridIndex(MERGE_TOLERANCE);
    for (int i = 0; i < sites.size(); i++) {
      index.add(i, sites.get(i).x(), sites.get(i).y());
    }
    int added = 0;
    for (List<Point3> line : breaklines) {
      for (Point3 vertex : line) {
        if (hasNeighbor(index, sites, vertex)) {
          continue;
        }
        index.add(sites.size(), vertex.x(), vertex.y());
        sites.add(vertex);
        added++;
      }
    }
    if (added > 0) {
      log.debug("Merged {} breakline vertices into the TIN", added);
    }
    return sites;
  }

  private boolean hasNeighbor(GridIndex index, List<Point3> sites, Point3 vertex) {
    for (int id : index.near(vertex.x(), vertex.y())) {
      if (sites.get(id).matches2d(vertex, MERGE_TOLERANCE)) {
        return true;
      }
    }
    return false;
  }

  private int[] rotateToSmallest(int[] t) {
    if (t[1] < t[0] && t[1] < t[2]) {
      return new int[] {t[1], t[2], t[0]};
    }
    if (t[2] < t[0] && t[2] < t[1]) {
      return new int[] {t[2], t[0], t[1]};
    }
    return t;
  }

  static double cross(Point3 a, Point3 b, Point3 c) {
    return (b.x() - a.x()) * (c.y() - a.y()) - (b.y() - a.y()) * (c.x() - a.x());
  }
}
