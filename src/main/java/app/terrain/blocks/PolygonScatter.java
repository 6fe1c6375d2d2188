package app.terrain.blocks;

import app.terrain.geometry.Point3;
import app.terrain.geometry.Polygon2D;
import app.terrain.sink.PlacementError;
import app.terrain.sink.PlacementResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Rejection sampling of block positions inside a polygon. Candidates are drawn uniformly from the
 * bounding box and kept when they fall inside and at least {@code minSpacing} from every kept one.
 */
public final class PolygonScatter {
  /** Receives an accepted candidate; a failed result leaves the position free. */
  public interface Placer {
    PlacementResult place(Point3 position, double rotationDeg);
  }

  private final double minSpacing;
  private final int maxAttempts;

  public PolygonScatter(double minSpacing, int maxAttempts) {
    this.minSpacing = minSpacing;
    this.maxAttempts = maxAttempts;
  }

  public int targetCount(Polygon2D polygon) {
    double cell = 2d * minSpacing;
    return Math.max(1, (int) (polygon.boundsArea() / (cell * cell)));
  }

  /**
   * Returns the positions that were placed. Stops early when the placer reports an unknown block,
   * since every later attempt would fail the same way.
   */
  public List<Point3> scatter(Polygon2D polygon, Random random, Placer placer) {
    int target = targetCount(polygon);
    double z = polygon.meanZ();
    List<Point3> placed = new ArrayList<>();
    int attempts = 0;
    while (placed.size() < target && attempts < maxAttempts) {
      attempts++;
      double x = polygon.minX() + random.nextDouble() * (polygon.maxX() - polygon.minX());
      double y = polygon.minY() + random.nextDouble() * (polygon.maxY() - polygon.minY());
      if (!polygon.contains(x, y)) {
        continue;
      }
      Point3 candidate = new Point3(x, y, z);
      if (tooClose(candidate, placed)) {
        continue;
      }
      double rotation = random.nextDouble() * 360d;
      PlacementResult result = placer.place(candidate, rotation);
      if (result.isOk()) {
        placed.add(candidate);
        continue;
      }
      Optional<PlacementError> error = result.error();
      if (error.isPresent() && error.get().reason() == PlacementError.Reason.UNKNOWN_BLOCK) {
        break;
      }
    }
    return placed;
  }

  private boolean tooClose(Point3 candidate, List<Point3> placed) {
    for (Point3 other : placed) {
      if (candidate.distance2d(other) < minSpacing) {
        return true;
      }
    }
    return false;
  }
}
