package app.terrain.contour;

import app.terrain.geometry.GridIndex;
import app.terrain.geometry.Point3;
import app.terrain.tin.Mesh;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slices a mesh with horizontal planes. Segments are produced in the mesh's canonical triangle
 * order and chained greedily: the tail takes the lowest-numbered unused segment touching it, then
 * the head does, until neither can grow.
 */
public final class ContourExtractor {
  private static final Logger log = LoggerFactory.getLogger(ContourExtractor.class);

  public static final double TOLERANCE = 0.01;

  record Segment(Point3 a, Point3 b) {}

  public List<ContourPolyline> extract(Mesh mesh, double interval) {
    if (mesh.isEmpty()) {
      return List.of();
    }
    List<Double> levels = ContourLevels.levels(mesh.minZ(), mesh.maxZ(), interval);
    List<ContourPolyline> result = new ArrayList<>();
    for (double level : levels) {
      List<ContourPolyline> polylines = extractLevel(mesh, level);
      if (polylines.isEmpty()) {
        log.debug("Contour level {} produced no lines", level);
      }
      result.addAll(polylines);
    }
    return result;
  }

  public List<ContourPolyline> extractLevel(Mesh mesh, double level) {
    return chain(segments(mesh, level), level);
  }

  List<Segment> segments(Mesh mesh, double level) {
    List<Segment> segments = new ArrayList<>();
    GridIndex index = new GridIndex(TOLERANCE);
    for (int i = 0; i < mesh.triangleCount(); i++) {
      Point3[] corners = mesh.corners(i);
      double min = Math.min(corners[0].z(), Math.min(corners[1].z(), corners[2].z()));
      double max = Math.max(corners[0].z(), Math.max(corners[1].z(), corners[2].z()));
      if (min > level + TOLERANCE || max < level - TOLERANCE) {
        continue;
      }
      List<Point3> crossings = new ArrayList<>(3);
      for (int k = 0; k < 3; k++) {
        Point3 crossing = crossing(corners[k], corners[(k + 1) % 3], level);
        if (crossing != null && !containsNear(crossings, crossing)) {
          crossings.add(crossing);
        }
      }
      if (crossings.size() != 2) {
        continue;
      }
      Segment segment = new Segment(crossings.get(0), crossings.get(1));
      if (isDuplicate(segment, segments, index)) {
        continue;
      }
      index.add(segments.size(), segment.a().x(), segment.a().y());
      segments.add(segment);
    }
    return segments;
  }

  List<ContourPolyline> chain(List<Segment> segments, double level) {
    if (segments.isEmpty()) {
      return List.of();
    }
    GridIndex endpoints = new GridIndex(TOLERANCE);
    for (int i = 0; i < segments.size(); i++) {
      endpoints.add(i, segments.get(i).a().x(), segments.get(i).a().y());
      endpoints.add(i, segments.get(i).b().x(), segments.get(i).b().y());
    }
    boolean[] used = new boolean[segments.size()];
    List<ContourPolyline> polylines = new ArrayList<>();
    for (int start = 0; start < segments.size(); start++) {
      if (used[start]) {
        continue;
      }
      used[start] = true;
      Deque<Point3> line = new ArrayDeque<>();
      line.add(segments.get(start).a());
      line.add(segments.get(start).b());
      while (true) {
        Point3 next = extend(line.peekLast(), segments, endpoints, used);
        if (next != null) {
          line.addLast(next);
          continue;
        }
        Point3 previous = extend(line.peekFirst(), segments, endpoints, used);
        if (previous != null) {
          line.addFirst(previous);
          continue;
        }
        break;
      }
      List<Point3> points = new ArrayList<>(line);
      boolean closed = points.size() >= 4 && points.get(0).matches2d(points.get(points.size() - 1), TOLERANCE);
      if (closed) {
        points.remove(points.size() - 1);
      }
      if (points.size() >= 2) {
        polylines.add(new ContourPolyline(level, points, closed));
      }
    }
    return polylines;
  }

  private Point3 extend(Point3 end, List<Segment> segments, GridIndex endpoints, boolean[] used) {
    for (int candidate : endpoints.near(end.x(), end.y())) {
      if (used[candidate]) {
        continue;
      }
      Segment segment = segments.get(candidate);
      if (segment.a().matches2d(end, TOLERANCE)) {
        used[candidate] = true;
        return segment.b();
      }
      if (segment.b().matches2d(end, TOLERANCE)) {
        used[candidate] = true;
        return segment.a();
      }
    }
    return null;
  }

  private Point3 crossing(Point3 p, Point3 q, double level) {
    double dp = p.z() - level;
    double dq = q.z() - level;
    if (dp == dq || (dp > 0 && dq > 0) || (dp < 0 && dq < 0)) {
      return null;
    }
    double t = (level - p.z()) / (q.z() - p.z());
    return new Point3(p.x() + t * (q.x() - p.x()), p.y() + t * (q.y() - p.y()), level);
  }

  private boolean containsNear(List<Point3> points, Point3 candidate) {
    for (Point3 point : points) {
      if (point.matches2d(candidate, TOLERANCE)) {
        return true;
      }
    }
    return false;
  }

  private boolean isDuplicate(Segment segment, List<Segment> segments, GridIndex index) {
    for (int id : index.near(segment.a().x(), segment.a().y())) {
      Segment other = segments.get(id);
      if (other.a().matches2d(segment.a(), TOLERANCE) && other.b().matches2d(segment.b(), TOLERANCE)) {
        return true;
      }
    }
    for (int id : index.near(segment.b().x(), segment.b().y())) {
      Segment other = segments.get(id);
      if (other.a().matches2d(segment.b(), TOLERANCE) && other.b().matches2d(segment.a(), TOLERANCE)) {
        return true;
      }
    }
    return false;
  }
}
