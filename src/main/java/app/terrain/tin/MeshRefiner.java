package app.terrain.tin;

import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One refinement pass: centroids of triangles with an over-long edge are added and the TIN rebuilt. */
public final class MeshRefiner {
  private static final Logger log = LoggerFactory.getLogger(MeshRefiner.class);

  public record Refinement(Mesh mesh, List<Point3> addedPoints) {
    public boolean refined() {
      return !addedPoints.isEmpty();
    }
  }

  private final TinBuilder builder;
  private final NavigableMap<Integer, Double> distances;

  public MeshRefiner(TinBuilder builder, NavigableMap<Integer, Double> distances) {
    this.builder = builder;
    this.distances = distances;
  }

  /** Refine distance for a nominal map scale; unlisted scales use the closest listed one. */
  public double threshold(int scale) {
    if (distances.isEmpty()) {
      return 0d;
    }
    Double exact = distances.get(scale);
    if (exact != null) {
      return exact;
    }
    Map.Entry<Integer, Double> best = null;
    long bestDiff = Long.MAX_VALUE;
    for (Map.Entry<Integer, Double> entry : distances.entrySet()) {
      long diff = Math.abs((long) entry.getKey() - scale);
      if (diff < bestDiff) {
        bestDiff = diff;
        best = entry;
      }
    }
    return best.getValue();
  }

  public Refinement refine(
      Mesh base, List<Point3> points, List<List<Point3>> breaklines, int scale, boolean enabled) {
    if (!enabled || base.isEmpty()) {
      return new Refinement(base, List.of());
    }
    double threshold = threshold(scale);
    if (threshold <= 0) {
      return new Refinement(base, List.of());
    }
    List<Point3> centroids = centroidsOfLargeTriangles(base, threshold);
    if (centroids.isEmpty()) {
      return new Refinement(base, List.of());
    }
    List<Point3> combined = new ArrayList<>(points.size() + centroids.size());
    combined.addAll(points);
    combined.addAll(centroids);
    Mesh refined = builder.build(combined, breaklines);
    log.info("TIN refinement at 1:{} (edge > {}): {} points added, {} triangles",
        scale, threshold, centroids.size(), refined.triangleCount());
    return new Refinement(refined, centroids);
  }

  List<Point3> centroidsOfLargeTriangles(Mesh mesh, double threshold) {
    List<Point3> result = new ArrayList<>();
    Set<List<Long>> seen = new HashSet<>();
    for (int i = 0; i < mesh.triangleCount(); i++) {
      Point3[] c = mesh.corners(i);
      if (c[0].distance2d(c[1]) <= threshold
          && c[1].distance2d(c[2]) <= threshold
          && c[2].distance2d(c[0]) <= threshold) {
        continue;
      }
      double cx = (c[0].x() + c[1].x() + c[2].x()) / 3d;
      double cy = (c[0].y() + c[1].y() + c[2].y()) / 3d;
      double cz = (c[0].z() + c[1].z() + c[2].z()) / 3d;
      List<Long> key = List.of(Math.round(cx * 1000), Math.round(cy * 1000), Math.round(cz * 1000));
      if (seen.add(key)) {
        result.add(new Point3(cx, cy, cz));
      }
    }
    return result;
  }
}
