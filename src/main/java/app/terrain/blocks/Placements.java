package app.terrain.blocks;

import app.terrain.report.SkipReport;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.LayerAttributes;
import app.terrain.sink.PlacementError;
import app.terrain.sink.PlacementResult;
import java.util.Optional;
import org.slf4j.Logger;

final class Placements {
  static final String DEFAULT_BLOCK_LAYER = "Blocks";

  private Placements() {}

  static LayerAttributes attributesFor(DrawingSink sink, String blockName, String fallbackLayer) {
    return sink.blockAttributes(blockName)
        .orElseGet(() -> new LayerAttributes(fallbackLayer, LayerAttributes.DEFAULT_COLOR, null));
  }

  /** Submits one placement; failures are logged and recorded, never thrown. */
  static boolean submit(DrawingSink sink, BlockPlacement placement, SkipReport report, Logger log) {
    PlacementResult result = sink.addBlockReference(placement);
    Optional<PlacementError> error = result.error();
    if (error.isEmpty()) {
      return true;
    }
    log.warn("Block '{}' at ({}, {}) not placed: {}",
        placement.blockName(), placement.position().x(), placement.position().y(), error.get().message());
    report.placementFailed(error.get());
    return false;
  }

  static double bearingDegrees(double dx, double dy) {
    return Math.toDegrees(Math.atan2(dy, dx));
  }
}
