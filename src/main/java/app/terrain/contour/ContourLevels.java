package app.terrain.contour;

import java.util.ArrayList;
import java.util.List;

/**
 * Height ladder for contours. Candidate levels are multiples of {@link #STEP} inside
 * {@code [minZ, maxZ]}; every N-th one is kept, N being {@code round(interval / STEP)}, starting with
 * the lowest. For {@code minZ=0.2, maxZ=3.1, interval=1} this gives 0.5, 1.5 and 2.5.
 */
public final class ContourLevels {
  public static final double STEP = 0.5;

  private ContourLevels() {}

  public static List<Double> levels(double minZ, double maxZ, double interval) {
    if (!Double.isFinite(minZ) || !Double.isFinite(maxZ) || minZ > maxZ || !(interval > 0)) {
      return List.of();
    }
    int every = Math.max(1, (int) Math.round(interval / STEP));
    double base = Math.floor(minZ / STEP) * STEP;
    List<Double> levels = new ArrayList<>();
    int candidate = 0;
    for (long k = 0; ; k++) {
      double level = base + k * STEP;
      if (level > maxZ) {
        break;
      }
      if (level < minZ) {
        continue;
      }
      if (candidate % every == 0) {
        levels.add(level);
      }
      candidate++;
    }
    return levels;
  }
}
