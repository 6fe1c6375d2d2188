package app.terrain.engine;

import app.terrain.breakline.Breakline;
import app.terrain.breakline.BreaklineExtractor;
import app.terrain.config.EngineConfig;
import app.terrain.config.TinConfig;
import app.terrain.contour.ContourExtractor;
import app.terrain.contour.ContourLevels;
import app.terrain.contour.ContourPolyline;
import app.terrain.geometry.Point3;
import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.DrawingSink;
import app.terrain.tin.Mesh;
import app.terrain.tin.MeshRefiner;
import app.terrain.tin.TinBuilder;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the terrain surface and writes it to the drawing: base TIN, refinement and contours. */
final class SurfaceEmitter {
  private static final Logger log = LoggerFactory.getLogger(SurfaceEmitter.class);

  static final String BASE_POINT_LAYER = "1 Отметки и точки реального рельефа";
  static final String BASE_SURFACE_LAYER = "1 реальная поверхность";
  static final String ADDED_POINT_LAYER = "2 пикеты добавленные";
  static final String REFINED_SURFACE_LAYER = "2 отредактированная поверхность";
  static final int BASE_COLOR = 3;
  static final int REFINED_COLOR = 1;

  private final EngineConfig config;
  private final TinBuilder tinBuilder;
  private final MeshRefiner refiner;
  private final ContourExtractor contours = new ContourExtractor();

  SurfaceEmitter(EngineConfig config) {
    this.config = config;
    this.tinBuilder = new TinBuilder(config.tin().maxEdgeLength());
    this.refiner = new MeshRefiner(tinBuilder, config.tin().refineDistances());
  }

  SurfaceStats emit(List<SurveyPoint> points, List<Breakline> breaklines, DrawingSink sink, SkipReport report) {
    TinConfig tin = config.tin();
    List<Point3> surfacePoints = TinBuilder.surfacePoints(points, tin.surfaceCodes());
    List<List<Point3>> lines = BreaklineExtractor.vertices(breaklines);

    Mesh base = tinBuilder.build(surfacePoints, lines);
    report.record(SkipCategory.GEOMETRY, base.rejectedTriangles(), "degenerate or oversized TIN triangles");
    if (base.isEmpty()) {
      report.record(SkipCategory.GEOMETRY, "no TIN could be built from " + surfacePoints.size() + " points");
      return SurfaceStats.none();
    }
    for (Point3 point : surfacePoints) {
      sink.addPoint(point, BASE_POINT_LAYER, BASE_COLOR);
    }
    for (List<Point3> line : lines) {
      sink.addPolyline(line, false, BASE_SURFACE_LAYER, BASE_COLOR);
    }
    emitFaces(base, sink, BASE_SURFACE_LAYER, BASE_COLOR);

    MeshRefiner.Refinement refinement =
        refiner.refine(base, surfacePoints, lines, config.tinScaleValue(), tin.refine());
    Mesh surface = base;
    if (refinement.refined()) {
      surface = refinement.mesh();
      report.record(SkipCategory.GEOMETRY, surface.rejectedTriangles(), "degenerate or oversized refined triangles");
      for (Point3 point : refinement.addedPoints()) {
        sink.addPoint(point, ADDED_POINT_LAYER, REFINED_COLOR);
      }
      emitFaces(surface, sink, REFINED_SURFACE_LAYER, REFINED_COLOR);
    }

    int levels = 0;
    int polylines = 0;
    if (tin.contoursEnabled()) {
      levels = ContourLevels.levels(surface.minZ(), surface.maxZ(), tin.contourInterval()).size();
      for (ContourPolyline contour : contours.extract(surface, tin.contourInterval())) {
        sink.addPolyline(contour.points(), contour.closed(), tin.contourLayer(), tin.contourColor());
        polylines++;
      }
    }
    SurfaceStats stats = new SurfaceStats(surfacePoints.size(), base.triangleCount(),
        refinement.addedPoints().size(), refinement.refined() ? surface.triangleCount() : 0, levels, polylines);
    log.info("Surface: {} points, {} triangles, {} added points, {} contour lines on {} levels",
        stats.basePoints(), stats.baseTriangles(), stats.refinedPoints(), polylines, levels);
    return stats;
  }

  private static void emitFaces(Mesh mesh, DrawingSink sink, String layer, int color) {
    for (int i = 0; i < mesh.triangleCount(); i++) {
      Point3[] c = mesh.corners(i);
      sink.addFace(c[0], c[1], c[2], layer, color);
    }
  }
}
