package app.terrain.blocks;

import app.terrain.breakline.CodeGroups;
import app.terrain.config.EngineConfig;
import app.terrain.config.VegetationConfig;
import app.terrain.geometry.Point3;
import app.terrain.geometry.Polygon2D;
import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.HatchFill;
import app.terrain.sink.LayerAttributes;
import app.terrain.sink.PlacementResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vegetation outlines. Each coded contour is drawn as a closed polyline; forests are filled with
 * scattered tree blocks, everything else with a hatch.
 */
public final class VegetationFill implements BlockStrategy {
  private static final Logger log = LoggerFactory.getLogger(VegetationFill.class);
  private static final int MIN_POINTS = 3;

  private final EngineConfig config;
  private final CodeGroups groups = new CodeGroups(CodeGroups.LETTER_CODE);

  public VegetationFill(EngineConfig config) {
    this.config = config;
  }

  @Override
  public int place(List<SurveyPoint> points, DrawingSink sink, SkipReport report) {
    VegetationConfig vegetation = config.vegetation();
    if (vegetation.prefixes().isEmpty()) {
      return 0;
    }
    int blocks = 0;
    int outlines = 0;
    for (CodeGroups.Group group : groups.group(points, vegetation.prefixes())) {
      if (group.members().size() < MIN_POINTS) {
        log.warn("Vegetation contour '{}' has {} points, at least {} needed; skipped",
            group.key(), group.members().size(), MIN_POINTS);
        report.record(SkipCategory.GEOMETRY, "vegetation contour " + group.key() + " too short");
        continue;
      }
      List<Point3> ring = ring(groups.order(group.members()), vegetation.closeTolerance());
      String layer = config.breaklines().layerFor(group.prefix(), vegetation.defaultLayer());
      int color = sink.layer(layer).map(LayerAttributes::color).orElse(LayerAttributes.DEFAULT_COLOR);
      sink.addPolyline(ring, true, layer, color);
      outlines++;

      if (vegetation.isForest(group.prefix())) {
        blocks += scatterForest(group.key(), new Polygon2D(ring), sink, report);
      } else {
        HatchFill fill = vegetation.isShrub(group.prefix())
            ? new HatchFill(vegetation.shrubPattern(), vegetation.patternScale() * config.scaleFactor(), 0d)
            : HatchFill.solid();
        sink.addHatch(ring, fill, layer, color);
      }
    }
    log.debug("Drew {} vegetation outlines with {} tree blocks", outlines, blocks);
    return blocks;
  }

  /** Ordered contour points; a trailing point that repeats the first within tolerance is dropped. */
  static List<Point3> ring(List<SurveyPoint> ordered, double closeTolerance) {
    List<Point3> ring = new ArrayList<>(ordered.size());
    for (SurveyPoint point : ordered) {
      ring.add(point.position());
    }
    if (ring.size() > MIN_POINTS && ring.get(0).distance2d(ring.get(ring.size() - 1)) <= closeTolerance) {
      ring.remove(ring.size() - 1);
    }
    return ring;
  }

  private int scatterForest(String groupKey, Polygon2D polygon, DrawingSink sink, SkipReport report) {
    VegetationConfig vegetation = config.vegetation();
    String block = vegetation.forestBlock();
    LayerAttributes attributes = Placements.attributesFor(sink, block, vegetation.defaultLayer());
    Random random = new Random(vegetation.seed() ^ groupKey.hashCode());
    PolygonScatter scatter = new PolygonScatter(vegetation.minSpacing(), vegetation.maxAttempts());
    List<Point3> placed = scatter.scatter(polygon, random, (position, rotation) -> {
      BlockPlacement placement = BlockPlacement.uniform(
          block, position, config.scaleFactor(), rotation, attributes.name(), attributes.color());
      PlacementResult result = sink.addBlockReference(placement);
      result.error().ifPresent(error -> {
        log.warn("Tree block '{}' not placed in '{}': {}", block, groupKey, error.message());
        report.placementFailed(error);
      });
      return result;
    });
    int target = scatter.targetCount(polygon);
    if (placed.size() < target) {
      log.info("Forest '{}': placed {} of {} tree blocks", groupKey, placed.size(), target);
    }
    return placed.size();
  }
}
