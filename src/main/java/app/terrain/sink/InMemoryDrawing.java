package app.terrain.sink;

import app.terrain.geometry.Point3;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recording sink backed by a {@link DrawingTemplate}. Block references to names the template
 * does not define are rejected.
 */
public final class InMemoryDrawing implements DrawingSink {
  private static final Logger log = LoggerFactory.getLogger(InMemoryDrawing.class);

  public record PointEntity(Point3 position, String layer, int color) {}

  public record FaceEntity(List<Point3> vertices, String layer, int color) {}

  public record PolylineEntity(List<Point3> points, boolean closed, String layer, int color) {}

  public record HatchEntity(List<Point3> boundary, HatchFill fill, String layer, int color) {}

  private final DrawingTemplate template;
  private final List<PointEntity> points = new ArrayList<>();
  private final List<FaceEntity> faces = new ArrayList<>();
  private final List<PolylineEntity> polylines = new ArrayList<>();
  private final List<HatchEntity> hatches = new ArrayList<>();
  private final List<BlockPlacement> blocks = new ArrayList<>();

  public InMemoryDrawing(DrawingTemplate template) {
    this.template = Objects.requireNonNull(template, "template");
  }

  @Override
  public void addPoint(Point3 position, String layer, int color) {
    points.add(new PointEntity(position, layer, color));
  }

  @Override
  public void addFace(Point3 v1, Point3 v2, Point3 v3, String layer, int color) {
    faces.add(new FaceEntity(List.of(v1, v2, v3, v3), layer, color));
  }

  @Override
  public void addPolyline(List<Point3> vertices, boolean closed, String layer, int color) {
    if (vertices.size() < 2) {
      log.debug("Ignoring polyline with {} vertices on layer {}", vertices.size(), layer);
      return;
    }
    polylines.add(new PolylineEntity(List.copyOf(vertices), closed, layer, color));
  }

  @Override
  public void addHatch(List<Point3> boundary, HatchFill fill, String layer, int color) {
    hatches.add(new HatchEntity(List.copyOf(boundary), fill, layer, color));
  }

  @Override
  public PlacementResult addBlockReference(BlockPlacement placement) {
    if (template.block(placement.blockName()).isEmpty()) {
      return PlacementResult.failed(new PlacementError(
          placement.blockName(),
          PlacementError.Reason.UNKNOWN_BLOCK,
          "block " + placement.blockName() + " is not defined in the template"));
    }
    if (!isFinite(placement.position()) || !Double.isFinite(placement.xScale())
        || !Double.isFinite(placement.yScale()) || !Double.isFinite(placement.rotationDeg())) {
      return PlacementResult.failed(new PlacementError(
          placement.blockName(),
          PlacementError.Reason.INVALID_GEOMETRY,
          "non-finite insert parameters for block " + placement.blockName()));
    }
    blocks.add(placement);
    return PlacementResult.ok();
  }

  @Override
  public Optional<BlockExtent> blockBoundingBox(String blockName) {
    return template.block(blockName)
        .map(block -> new BlockExtent(block.width(), block.height()))
        .filter(extent -> !extent.isDegenerate());
  }

  @Override
  public Optional<LayerAttributes> layer(String name) {
    return template.layer(name);
  }

  @Override
  public Optional<LayerAttributes> blockAttributes(String blockName) {
    return template.block(blockName)
        .filter(block -> block.layer() != null && !block.layer().isBlank())
        .map(block -> {
          Optional<LayerAttributes> layer = template.layer(block.layer());
          int color = block.color() != null
              ? block.color()
              : layer.map(LayerAttributes::color).orElse(LayerAttributes.DEFAULT_COLOR);
          String linetype = layer.map(LayerAttributes::linetype).orElse(LayerAttributes.CONTINUOUS);
          return new LayerAttributes(block.layer(), color, linetype);
        });
  }

  public List<PointEntity> points() {
    return Collections.unmodifiableList(points);
  }

  public List<FaceEntity> faces() {
    return Collections.unmodifiableList(faces);
  }

  public List<PolylineEntity> polylines() {
    return Collections.unmodifiableList(polylines);
  }

  public List<HatchEntity> hatches() {
    return Collections.unmodifiableList(hatches);
  }

  public List<BlockPlacement> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public List<PolylineEntity> polylinesOn(String layer) {
    List<PolylineEntity> result = new ArrayList<>();
    for (PolylineEntity polyline : polylines) {
      if (polyline.layer().equals(layer)) {
        result.add(polyline);
      }
    }
    return result;
  }

  private boolean isFinite(Point3 point) {
    return Double.isFinite(point.x()) && Double.isFinite(point.y()) && Double.isFinite(point.z());
  }
}
