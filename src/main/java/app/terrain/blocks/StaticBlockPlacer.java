package app.terrain.blocks;

import app.terrain.config.BlockMapping;
import app.terrain.config.EngineConfig;
import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipReport;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.LayerAttributes;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One unrotated block per point whose code belongs to a mapping. The first matching mapping in
 * configuration order wins. Line-support codes are left to {@link LineSupportPlacer}.
 */
public final class StaticBlockPlacer implements BlockStrategy {
  private static final Logger log = LoggerFactory.getLogger(StaticBlockPlacer.class);

  private final EngineConfig config;

  public StaticBlockPlacer(EngineConfig config) {
    this.config = config;
  }

  @Override
  public int place(List<SurveyPoint> points, DrawingSink sink, SkipReport report) {
    int placed = 0;
    for (SurveyPoint point : points) {
      String code = point.normalizedCode();
      if (code.isEmpty() || config.lineSupport().codes().contains(code)) {
        continue;
      }
      BlockMapping mapping = match(code);
      if (mapping == null) {
        continue;
      }
      double scale = mapping.scale().resolve(point.z()) * config.scaleFactor();
      LayerAttributes attributes =
          Placements.attributesFor(sink, mapping.blockName(), Placements.DEFAULT_BLOCK_LAYER);
      BlockPlacement placement = BlockPlacement.uniform(
          mapping.blockName(), point.position(), scale, 0d, attributes.name(), attributes.color());
      if (Placements.submit(sink, placement, report, log)) {
        placed++;
      }
    }
    log.debug("Placed {} mapped blocks", placed);
    return placed;
  }

  BlockMapping match(String code) {
    for (BlockMapping mapping : config.blockMappings()) {
      if (mapping.matches(code)) {
        return mapping;
      }
    }
    return null;
  }
}
