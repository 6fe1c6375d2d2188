package app.terrain.engine;

import app.terrain.report.SkipReport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Summary of one run: surface statistics, placed blocks per strategy and everything skipped. */
public record GenerationResult(
    int points, int codedPolylines, SurfaceStats surface, Map<String, Integer> blocks, SkipReport skips) {
  public GenerationResult {
    Objects.requireNonNull(surface, "surface");
    Objects.requireNonNull(skips, "skips");
    blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
  }

  public int blockCount(String strategy) {
    return blocks.getOrDefault(strategy, 0);
  }

  public int totalBlocks() {
    int total = 0;
    for (int count : blocks.values()) {
      total += count;
    }
    return total;
  }
}
