package app.terrain.config;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

public record TinConfig(
    boolean enabled,
    Integer scaleValue,
    boolean refine,
    double maxEdgeLength,
    double contourInterval,
    Set<String> surfaceCodes,
    NavigableMap<Integer, Double> refineDistances,
    boolean contoursEnabled,
    String contourLayer,
    int contourColor) {
  public static final Set<Double> CONTOUR_INTERVALS = Set.of(0.5, 1.0, 2.0, 5.0);
  public static final double DEFAULT_MAX_EDGE_LENGTH = 100d;

  public TinConfig {
    if (!CONTOUR_INTERVALS.contains(contourInterval)) {
      throw new IllegalArgumentException(
          "contour interval must be one of 0.5, 1, 2 or 5, got " + contourInterval);
    }
    if (!(maxEdgeLength > 0)) {
      throw new IllegalArgumentException("max edge length must be > 0");
    }
    surfaceCodes = CodeSets.normalize(surfaceCodes);
    refineDistances = refineDistances == null
        ? defaultRefineDistances()
        : Collections.unmodifiableNavigableMap(new TreeMap<>(refineDistances));
    contourLayer = contourLayer == null || contourLayer.isBlank() ? "Contours" : contourLayer;
  }

  public static NavigableMap<Integer, Double> defaultRefineDistances() {
    TreeMap<Integer, Double> table = new TreeMap<>();
    table.put(500, 15.0);
    table.put(1000, 20.0);
    table.put(2000, 35.0);
    table.put(5000, 60.0);
    return Collections.unmodifiableNavigableMap(table);
  }

  public TinConfig withRefine(boolean value) {
    return new TinConfig(enabled, scaleValue, value, maxEdgeLength, contourInterval, surfaceCodes,
        refineDistances, contoursEnabled, contourLayer, contourColor);
  }
}
