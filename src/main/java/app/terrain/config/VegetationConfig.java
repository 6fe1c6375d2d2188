package app.terrain.config;

import java.util.Set;

public record VegetationConfig(
    Set<String> prefixes,
    Set<String> forestMarkers,
    Set<String> shrubMarkers,
    String defaultLayer,
    String forestBlock,
    double minSpacing,
    int maxAttempts,
    String shrubPattern,
    double patternScale,
    double closeTolerance,
    long seed) {
  public VegetationConfig {
    prefixes = CodeSets.normalize(prefixes);
    forestMarkers = CodeSets.normalize(forestMarkers);
    shrubMarkers = CodeSets.normalize(shrubMarkers);
    if (!(minSpacing > 0)) {
      throw new IllegalArgumentException("vegetation min spacing must be > 0");
    }
    maxAttempts = Math.max(0, maxAttempts);
  }

  public boolean isForest(String baseCode) {
    return containsAny(baseCode, forestMarkers);
  }

  public boolean isShrub(String baseCode) {
    return containsAny(baseCode, shrubMarkers);
  }

  private static boolean containsAny(String baseCode, Set<String> markers) {
    for (String marker : markers) {
      if (baseCode.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
