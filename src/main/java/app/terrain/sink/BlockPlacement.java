package app.terrain.sink;

import app.terrain.geometry.Point3;
import java.util.Objects;

public record BlockPlacement(
    String blockName,
    Point3 position,
    double xScale,
    double yScale,
    double zScale,
    double rotationDeg,
    String layer,
    int color) {
  public BlockPlacement {
    Objects.requireNonNull(blockName, "blockName");
    Objects.requireNonNull(position, "position");
    Objects.requireNonNull(layer, "layer");
  }

  public static BlockPlacement uniform(
      String blockName, Point3 position, double scale, double rotationDeg, String layer, int color) {
    return new BlockPlacement(blockName, position, scale, scale, scale, rotationDeg, layer, color);
  }
}
