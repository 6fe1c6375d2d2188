package app.terrain.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets ids by square XY cells. {@link #near} returns every id in the 3x3 block of cells around a
 * location, so any id within {@code cellSize} of it is included.
 */
public final class GridIndex {
  private final double cellSize;
  private final Map<Long, List<Integer>> buckets = new HashMap<>();

  public GridIndex(double cellSize) {
    this.cellSize = cellSize > 0 ? cellSize : 1e-9;
  }

  public void add(int id, double x, double y) {
    buckets.computeIfAbsent(cellKey(cellOf(x), cellOf(y)), k -> new ArrayList<>()).add(id);
  }

  public List<Integer> near(double x, double y) {
    long cx = cellOf(x);
    long cy = cellOf(y);
    List<Integer> ids = new ArrayList<>();
    for (long dx = -1; dx <= 1; dx++) {
      for (long dy = -1; dy <= 1; dy++) {
        List<Integer> bucket = buckets.get(cellKey(cx + dx, cy + dy));
        if (bucket != null) {
          ids.addAll(bucket);
        }
      }
    }
    Collections.sort(ids);
    return ids;
  }

  private long cellOf(double value) {
    return (long) Math.floor(value / cellSize);
  }

  private long cellKey(long qx, long qy) {
    return (qx << 32) ^ (qy & 0xffffffffL);
  }
}
