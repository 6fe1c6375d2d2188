package app.terrain.config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for one generation run. Built once and passed to every component.
 */
public record EngineConfig(
    double scaleFactor,
    String pointLayer,
    int pointColor,
    TinConfig tin,
    BreaklineConfig breaklines,
    List<BlockMapping> blockMappings,
    LineSupportConfig lineSupport,
    TowerConfig tower,
    VegetationConfig vegetation) {
  public static final double MIN_SCALE_FACTOR = 0.05;

  public EngineConfig {
    Objects.requireNonNull(tin, "tin");
    Objects.requireNonNull(breaklines, "breaklines");
    Objects.requireNonNull(lineSupport, "lineSupport");
    Objects.requireNonNull(tower, "tower");
    Objects.requireNonNull(vegetation, "vegetation");
    scaleFactor = Math.max(scaleFactor, MIN_SCALE_FACTOR);
    pointLayer = pointLayer == null || pointLayer.isBlank() ? "Point" : pointLayer;
    blockMappings = blockMappings == null ? List.of() : List.copyOf(blockMappings);
  }

  /** Nominal map scale used to pick the refinement distance, e.g. 1000 for 1:1000. */
  public int tinScaleValue() {
    if (tin.scaleValue() != null && tin.scaleValue() > 0) {
      return tin.scaleValue();
    }
    return Math.max((int) Math.round(scaleFactor * 1000), 1);
  }

  public EngineConfig withScaleFactor(double value) {
    return new EngineConfig(value, pointLayer, pointColor, tin, breaklines, blockMappings, lineSupport, tower, vegetation);
  }

  public EngineConfig withTin(TinConfig value) {
    return new EngineConfig(scaleFactor, pointLayer, pointColor, value, breaklines, blockMappings, lineSupport, tower, vegetation);
  }

  public EngineConfig withBlockMappings(List<BlockMapping> value) {
    return new EngineConfig(scaleFactor, pointLayer, pointColor, tin, breaklines, value, lineSupport, tower, vegetation);
  }
}
