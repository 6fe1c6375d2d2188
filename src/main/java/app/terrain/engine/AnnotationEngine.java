package app.terrain.engine;

import app.terrain.blocks.BlockStrategy;
import app.terrain.blocks.LineSupportPlacer;
import app.terrain.blocks.StaticBlockPlacer;
import app.terrain.blocks.TowerPlacer;
import app.terrain.blocks.VegetationFill;
import app.terrain.breakline.Breakline;
import app.terrain.breakline.BreaklineExtractor;
import app.terrain.config.EngineConfig;
import app.terrain.geometry.SurveyPoint;
import app.terrain.io.SurveyTable;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.DrawingSink;
import app.terrain.sink.LayerAttributes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole annotation pipeline over one point table and writes the result into a drawing.
 *
 * <p>Order of output: survey points, coded polylines, vegetation, the terrain surface, mapped
 * blocks, line supports and towers. Nothing in here throws for bad input; every skipped item ends
 * up in the {@link SkipReport} of the result.
 */
public final class AnnotationEngine {
  private static final Logger log = LoggerFactory.getLogger(AnnotationEngine.class);

  public static final String VEGETATION = "vegetation";
  public static final String STATIC_BLOCKS = "static";
  public static final String LINE_SUPPORTS = "lineSupport";
  public static final String TOWERS = "tower";

  private final EngineConfig config;
  private final BreaklineExtractor breaklineExtractor = new BreaklineExtractor();
  private final SurfaceEmitter surfaceEmitter;
  private final BlockStrategy vegetation;
  private final Map<String, BlockStrategy> blockStrategies = new LinkedHashMap<>();

  public AnnotationEngine(EngineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.surfaceEmitter = new SurfaceEmitter(config);
    this.vegetation = new VegetationFill(config);
    blockStrategies.put(STATIC_BLOCKS, new StaticBlockPlacer(config));
    blockStrategies.put(LINE_SUPPORTS, new LineSupportPlacer(config));
    blockStrategies.put(TOWERS, new TowerPlacer(config));
  }

  public GenerationResult generate(SurveyTable table, DrawingSink sink) {
    SkipReport report = new SkipReport();
    report.record(SkipCategory.INPUT, table.skippedRows(), "unreadable point rows");
    return run(table.points(), sink, report);
  }

  public GenerationResult generate(List<SurveyPoint> points, DrawingSink sink) {
    return run(points, sink, new SkipReport());
  }

  private GenerationResult run(List<SurveyPoint> points, DrawingSink sink, SkipReport report) {
    for (SurveyPoint point : points) {
      sink.addPoint(point.position(), config.pointLayer(), config.pointColor());
    }

    List<Breakline> breaklines = breaklineExtractor.extract(points, config.breaklines());
    for (Breakline breakline : breaklines) {
      String layer = config.breaklines().layerFor(breakline.baseCode());
      int color = sink.layer(layer).map(LayerAttributes::color).orElse(LayerAttributes.DEFAULT_COLOR);
      sink.addPolyline(breakline.vertices(), false, layer, color);
    }

    Map<String, Integer> blocks = new LinkedHashMap<>();
    blocks.put(VEGETATION, vegetation.place(points, sink, report));

    SurfaceStats surface = SurfaceStats.none();
    if (config.tin().enabled()) {
      surface = surfaceEmitter.emit(points, breaklines, sink, report);
    }

    for (Map.Entry<String, BlockStrategy> strategy : blockStrategies.entrySet()) {
      blocks.put(strategy.getKey(), strategy.getValue().place(points, sink, report));
    }

    GenerationResult result = new GenerationResult(points.size(), breaklines.size(), surface, blocks, report);
    log.info("Annotated {} points: {} coded lines, {} blocks, {} skipped",
        points.size(), breaklines.size(), result.totalBlocks(), report.total());
    return result;
  }
}
