package app.terrain.blocks;

import app.terrain.geometry.Point3;
import app.terrain.sink.BlockExtent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Corner completion and footprint fitting for tower point clusters. */
public final class TowerGeometry {
  private static final double EDGE_EPSILON = 1e-9;

  /** Centre, orientation and per-axis scale of a fitted tower footprint. */
  public record Footprint(Point3 center, double rotationDeg, double width, double height) {}

  private TowerGeometry() {}

  /**
   * Finds the corner of a right angle among three points and returns the fourth corner of the
   * rectangle. The corner {@code c} with opposite points {@code o1}, {@code o2} must satisfy
   * {@code |d1² + d2² - diag²| <= tolerance * diag²}. The inferred z is the mean of the three.
   */
  public static Optional<Point3> completeRectangle(List<Point3> three, double tolerance) {
    if (three.size() != 3) {
      return Optional.empty();
    }
    double meanZ = (three.get(0).z() + three.get(1).z() + three.get(2).z()) / 3d;
    for (int i = 0; i < 3; i++) {
      Point3 corner = three.get(i);
      Point3 o1 = three.get((i + 1) % 3);
      Point3 o2 = three.get((i + 2) % 3);
      double d1 = squared(corner, o1);
      double d2 = squared(corner, o2);
      double diagonal = squared(o1, o2);
      if (diagonal <= 0d) {
        continue;
      }
      if (Math.abs(d1 + d2 - diagonal) <= tolerance * diagonal) {
        return Optional.of(new Point3(o1.x() + o2.x() - corner.x(), o1.y() + o2.y() - corner.y(), meanZ));
      }
    }
    return Optional.empty();
  }

  /**
   * Orders the corners by polar angle around their centroid and aligns the footprint with the
   * longest edge. Returns empty when any edge has zero length.
   */
  public static Optional<Footprint> fit(List<Point3> corners) {
    int n = corners.size();
    if (n < 2) {
      return Optional.empty();
    }
    double cx = 0d;
    double cy = 0d;
    double cz = 0d;
    for (Point3 p : corners) {
      cx += p.x();
      cy += p.y();
      cz += p.z();
    }
    Point3 center = new Point3(cx / n, cy / n, cz / n);
    List<Point3> ordered = new ArrayList<>(corners);
    ordered.sort(Comparator.comparingDouble(p -> Math.atan2(p.y() - center.y(), p.x() - center.x())));

    int major = -1;
    double majorLength = -1d;
    for (int i = 0; i < n; i++) {
      double length = ordered.get(i).distance2d(ordered.get((i + 1) % n));
      if (length <= EDGE_EPSILON) {
        return Optional.empty();
      }
      if (length > majorLength) {
        major = i;
        majorLength = length;
      }
    }
    Point3 a = ordered.get(major);
    Point3 b = ordered.get((major + 1) % n);
    double angle = Math.atan2(b.y() - a.y(), b.x() - a.x());
    double ux = Math.cos(angle);
    double uy = Math.sin(angle);
    double minU = Double.POSITIVE_INFINITY;
    double maxU = Double.NEGATIVE_INFINITY;
    double minV = Double.POSITIVE_INFINITY;
    double maxV = Double.NEGATIVE_INFINITY;
    for (Point3 p : ordered) {
      double dx = p.x() - center.x();
      double dy = p.y() - center.y();
      double u = dx * ux + dy * uy;
      double v = -dx * uy + dy * ux;
      minU = Math.min(minU, u);
      maxU = Math.max(maxU, u);
      minV = Math.min(minV, v);
      maxV = Math.max(maxV, v);
    }
    return Optional.of(new Footprint(center, Math.toDegrees(angle), maxU - minU, maxV - minV));
  }

  /** Footprint size divided by the block extent, never below {@code minScale}. */
  static double[] scales(Footprint footprint, BlockExtent extent, double minScale) {
    double sx = footprint.width() / extent.width();
    double sy = footprint.height() / extent.height();
    return new double[] {Math.max(sx, minScale), Math.max(sy, minScale)};
  }

  private static double squared(Point3 a, Point3 b) {
    double dx = a.x() - b.x();
    double dy = a.y() - b.y();
    return dx * dx + dy * dy;
  }
}
