package app.terrain.blocks;

import app.terrain.config.EngineConfig;
import app.terrain.config.TowerConfig;
import app.terrain.geometry.Point3;
import app.terrain.geometry.SurveyPoint;
import app.terrain.graph.ProximityGraph;
import app.terrain.graph.ProximityGraphBuilder;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.BlockExtent;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.LayerAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tower footprints. Points are grouped by code, split into clusters of mutually reachable points
 * and each complete cluster becomes one rotated, non-uniformly scaled block.
 */
public final class TowerPlacer implements BlockStrategy {
  private static final Logger log = LoggerFactory.getLogger(TowerPlacer.class);
  private static final String DEFAULT_LAYER = "Tower";

  private final EngineConfig config;
  private final ProximityGraphBuilder graphBuilder = new ProximityGraphBuilder();

  public TowerPlacer(EngineConfig config) {
    this.config = config;
  }

  @Override
  public int place(List<SurveyPoint> points, DrawingSink sink, SkipReport report) {
    TowerConfig tower = config.tower();
    if (!tower.enabled()) {
      return 0;
    }
    int placed = 0;
    for (Map.Entry<String, List<SurveyPoint>> group : group(points, tower).entrySet()) {
      for (List<Point3> cluster : clusters(group.getValue(), tower.maxSpan())) {
        Optional<List<Point3>> corners = corners(group.getKey(), cluster, tower, report);
        if (corners.isEmpty()) {
          continue;
        }
        Optional<TowerGeometry.Footprint> footprint = TowerGeometry.fit(corners.get());
        if (footprint.isEmpty()) {
          log.warn("Tower group '{}' has coincident corners; skipped", group.getKey());
          report.record(SkipCategory.GEOMETRY, "degenerate tower footprint in group " + group.getKey());
          continue;
        }
        if (Placements.submit(sink, placement(footprint.get(), tower, sink), report, log)) {
          placed++;
        }
      }
    }
    log.debug("Placed {} towers", placed);
    return placed;
  }

  /** Exact code match first, otherwise the longest configured prefix; first-appearance order. */
  static Map<String, List<SurveyPoint>> group(List<SurveyPoint> points, TowerConfig tower) {
    Map<String, List<SurveyPoint>> groups = new LinkedHashMap<>();
    for (SurveyPoint point : points) {
      String code = point.normalizedCode();
      if (code.isEmpty()) {
        continue;
      }
      String key = null;
      if (tower.codes().contains(code)) {
        key = code;
      } else {
        for (String prefix : tower.prefixes()) {
          if (code.startsWith(prefix) && (key == null || prefix.length() > key.length())) {
            key = prefix;
          }
        }
      }
      if (key != null) {
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(point);
      }
    }
    return groups;
  }

  private List<List<Point3>> clusters(List<SurveyPoint> members, double maxSpan) {
    List<Point3> positions = new ArrayList<>(members.size());
    for (SurveyPoint member : members) {
      positions.add(member.position());
    }
    ProximityGraph graph = graphBuilder.build(positions, maxSpan);
    List<List<Point3>> clusters = new ArrayList<>();
    for (List<Integer> component : graph.components()) {
      List<Point3> cluster = new ArrayList<>(component.size());
      for (int id : component) {
        cluster.add(positions.get(id));
      }
      clusters.add(cluster);
    }
    return clusters;
  }

  private Optional<List<Point3>> corners(String key, List<Point3> cluster, TowerConfig tower, SkipReport report) {
    int size = cluster.size();
    if (size < tower.minPoints() || size > tower.groupSize()) {
      log.warn("Tower group '{}' has a cluster of {} points, expected {} to {}; skipped",
          key, size, tower.minPoints(), tower.groupSize());
      report.record(SkipCategory.GEOMETRY, "tower cluster of " + size + " points in group " + key);
      return Optional.empty();
    }
    if (size == tower.groupSize()) {
      return Optional.of(cluster);
    }
    if (size == 3 && tower.groupSize() == 4) {
      Optional<Point3> fourth = TowerGeometry.completeRectangle(cluster, tower.rightAngleTolerance());
      if (fourth.isPresent()) {
        List<Point3> completed = new ArrayList<>(cluster);
        completed.add(fourth.get());
        return Optional.of(completed);
      }
      log.warn("Tower group '{}': three points without a right angle; skipped", key);
      report.record(SkipCategory.GEOMETRY, "no right angle in tower group " + key);
      return Optional.empty();
    }
    log.warn("Tower group '{}' has {} of {} points and cannot be completed; skipped", key, size, tower.groupSize());
    report.record(SkipCategory.GEOMETRY, "incomplete tower cluster in group " + key);
    return Optional.empty();
  }

  private BlockPlacement placement(TowerGeometry.Footprint footprint, TowerConfig tower, DrawingSink sink) {
    BlockExtent extent = sink.blockBoundingBox(tower.blockName())
        .filter(e -> !e.isDegenerate())
        .orElseGet(() -> new BlockExtent(tower.baseWidth(), tower.baseHeight()));
    double[] scales = TowerGeometry.scales(footprint, extent, tower.minScale());
    Optional<LayerAttributes> blockAttributes = sink.blockAttributes(tower.blockName());
    String layer = tower.layer() != null && !tower.layer().isBlank()
        ? tower.layer()
        : blockAttributes.map(LayerAttributes::name).orElse(DEFAULT_LAYER);
    int color = tower.color() != null
        ? tower.color()
        : blockAttributes.map(LayerAttributes::color).orElse(LayerAttributes.DEFAULT_COLOR);
    return new BlockPlacement(tower.blockName(), footprint.center(), scales[0], scales[1], tower.zScale(),
        footprint.rotationDeg(), layer, color);
  }
}
