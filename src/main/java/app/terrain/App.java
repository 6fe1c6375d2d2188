package app.terrain;

import app.terrain.config.ConfigIO;
import app.terrain.config.EngineConfig;
import app.terrain.engine.AnnotationEngine;
import app.terrain.engine.GenerationResult;
import app.terrain.engine.SurfaceStats;
import app.terrain.io.DrawingWriter;
import app.terrain.io.SurveyIO;
import app.terrain.io.SurveyTable;
import app.terrain.io.TemplateIO;
import app.terrain.report.SkipCategory;
import app.terrain.sink.InMemoryDrawing;
import java.nio.file.Path;
import java.util.Map;

public final class App {
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      System.out.println("Usage: terrain-annotator <points.json> [output.json] [config.json]");
      return;
    }
    Path input = Path.of(args[0]);
    Path output = args.length > 1 ? Path.of(args[1]) : null;
    ConfigIO configIO = new ConfigIO();
    EngineConfig config = args.length > 2 ? configIO.load(Path.of(args[2])) : configIO.loadDefaults();

    SurveyTable table = new SurveyIO().load(input);
    InMemoryDrawing drawing = new InMemoryDrawing(new TemplateIO().loadDefaults());
    GenerationResult result = new AnnotationEngine(config).generate(table, drawing);

    System.out.println("Points: " + result.points());
    System.out.println("Coded polylines: " + result.codedPolylines());
    printSurface(result.surface());
    printBlocks(result.blocks());
    printSkips(result);
    if (output != null) {
      new DrawingWriter().save(output, drawing);
      System.out.println();
      System.out.println("Drawing written to " + output);
    }
  }

  private static void printSurface(SurfaceStats surface) {
    System.out.println();
    System.out.println("Surface:");
    System.out.printf("  base: %d points, %d triangles%n", surface.basePoints(), surface.baseTriangles());
    System.out.printf("  refined: %d added points, %d triangles%n",
        surface.refinedPoints(), surface.refinedTriangles());
    System.out.printf("  contours: %d polylines on %d levels%n",
        surface.contourPolylines(), surface.contourLevels());
  }

  private static void printBlocks(Map<String, Integer> blocks) {
    System.out.println();
    System.out.println("Blocks:");
    for (Map.Entry<String, Integer> entry : blocks.entrySet()) {
      System.out.printf("  %s: %d%n", entry.getKey(), entry.getValue());
    }
  }

  private static void printSkips(GenerationResult result) {
    System.out.println();
    System.out.println("Skipped:");
    for (SkipCategory category : SkipCategory.values()) {
      System.out.printf("  %s: %d%n", category, result.skips().count(category));
    }
    for (String message : result.skips().messages()) {
      System.out.println("  - " + message);
    }
  }
}
