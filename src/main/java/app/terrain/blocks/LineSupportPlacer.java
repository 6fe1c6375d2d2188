package app.terrain.blocks;

import app.terrain.config.EngineConfig;
import app.terrain.config.LineSupportConfig;
import app.terrain.geometry.GridIndex;
import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.LayerAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line supports turned towards their bracing points. With one bracing point the block points at
 * it; with two it takes the mean of both bearings. The variant block depends on how many bracing
 * points were found.
 */
public final class LineSupportPlacer implements BlockStrategy {
  private static final Logger log = LoggerFactory.getLogger(LineSupportPlacer.class);

  private final EngineConfig config;

  public LineSupportPlacer(EngineConfig config) {
    this.config = config;
  }

  @Override
  public int place(List<SurveyPoint> points, DrawingSink sink, SkipReport report) {
    LineSupportConfig support = config.lineSupport();
    if (support.codes().isEmpty()) {
      return 0;
    }
    List<SurveyPoint> bracing = new ArrayList<>();
    for (SurveyPoint point : points) {
      if (support.bracingCodes().contains(point.normalizedCode())) {
        bracing.add(point);
      }
    }
    GridIndex index = new GridIndex(support.distanceThreshold());
    for (int i = 0; i < bracing.size(); i++) {
      index.add(i, bracing.get(i).x(), bracing.get(i).y());
    }

    int placed = 0;
    for (SurveyPoint point : points) {
      if (!support.codes().contains(point.normalizedCode())) {
        continue;
      }
      List<SurveyPoint> nearest = nearestBracing(point, bracing, index, support);
      Optional<String> block = support.blockFor(nearest.size());
      if (block.isEmpty()) {
        log.warn("No line support block configured for {} bracing points (point {})", nearest.size(), point.id());
        report.record(SkipCategory.TEMPLATE, "no line support block for " + nearest.size() + " bracing points");
        continue;
      }
      double rotation = rotation(point, nearest);
      double scale = support.scale().resolve(point.z()) * config.scaleFactor();
      LayerAttributes attributes = Placements.attributesFor(sink, block.get(), Placements.DEFAULT_BLOCK_LAYER);
      BlockPlacement placement = BlockPlacement.uniform(
          block.get(), point.position(), scale, rotation, attributes.name(), attributes.color());
      if (Placements.submit(sink, placement, report, log)) {
        placed++;
      }
    }
    log.debug("Placed {} line supports", placed);
    return placed;
  }

  /** Bracing points within the threshold, nearest first, at most two. */
  static List<SurveyPoint> nearestBracing(
      SurveyPoint support, List<SurveyPoint> bracing, GridIndex index, LineSupportConfig config) {
    List<SurveyPoint> candidates = new ArrayList<>();
    for (int id : index.near(support.x(), support.y())) {
      SurveyPoint candidate = bracing.get(id);
      if (candidate.index() == support.index()) {
        continue;
      }
      if (support.distance2d(candidate) <= config.distanceThreshold()) {
        candidates.add(candidate);
      }
    }
    candidates.sort(Comparator.comparingDouble((SurveyPoint p) -> support.distance2d(p))
        .thenComparingInt(SurveyPoint::index));
    return candidates.size() > LineSupportConfig.MAX_BRACING
        ? new ArrayList<>(candidates.subList(0, LineSupportConfig.MAX_BRACING))
        : candidates;
  }

  /** Rotation in degrees: 0 without bracing, the bearing for one, the mean bearing for two. */
  static double rotation(SurveyPoint support, List<SurveyPoint> bracing) {
    if (bracing.isEmpty()) {
      return 0d;
    }
    double sum = 0d;
    for (SurveyPoint b : bracing) {
      sum += Placements.bearingDegrees(b.x() - support.x(), b.y() - support.y());
    }
    return sum / bracing.size();
  }
}
