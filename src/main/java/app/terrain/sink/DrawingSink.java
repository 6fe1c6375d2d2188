package app.terrain.sink;

import app.terrain.geometry.Point3;
import java.util.List;
import java.util.Optional;

/**
 * Write-only target for the generated geometry. Implementations own the primitives once they
 * are accepted. Block placement reports failures through {@link PlacementResult} instead of
 * throwing.
 */
public interface DrawingSink {
  void addPoint(Point3 position, String layer, int color);

  /** Three-vertex face; four-vertex formats repeat {@code v3}. */
  void addFace(Point3 v1, Point3 v2, Point3 v3, String layer, int color);

  void addPolyline(List<Point3> points, boolean closed, String layer, int color);

  void addHatch(List<Point3> boundary, HatchFill fill, String layer, int color);

  PlacementResult addBlockReference(BlockPlacement placement);

  Optional<BlockExtent> blockBoundingBox(String blockName);

  Optional<LayerAttributes> layer(String name);

  /** Default layer and colour carried by the block definition itself. */
  Optional<LayerAttributes> blockAttributes(String blockName);
}
