package app.terrain.config;

import java.util.Set;

public record TowerConfig(
    Set<String> codes,
    Set<String> prefixes,
    int groupSize,
    int minPoints,
    double rightAngleTolerance,
    double maxSpan,
    String blockName,
    String layer,
    Integer color,
    double baseWidth,
    double baseHeight,
    double zScale,
    double minScale) {
  public TowerConfig {
    codes = CodeSets.normalize(codes);
    prefixes = CodeSets.normalize(prefixes);
    groupSize = Math.max(2, groupSize);
    minPoints = Math.min(groupSize, minPoints);
    baseWidth = baseWidth > 0 ? baseWidth : 1d;
    baseHeight = baseHeight > 0 ? baseHeight : 1d;
    if (!(maxSpan >= 0)) {
      throw new IllegalArgumentException("tower max span must be >= 0");
    }
    if (!(rightAngleTolerance >= 0)) {
      throw new IllegalArgumentException("tower right angle tolerance must be >= 0");
    }
  }

  public boolean enabled() {
    return blockName != null && !blockName.isBlank() && !(codes.isEmpty() && prefixes.isEmpty());
  }
}
