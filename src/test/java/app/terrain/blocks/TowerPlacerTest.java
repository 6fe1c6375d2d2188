package app.terrain.blocks;

import app.terrain.Fixtures;
import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipCategory;
import app.terrain.report.SkipReport;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.InMemoryDrawing;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static app.terrain.Fixtures.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TowerPlacerTest {
  private static final double EPS = 1e-9;

  private final TowerPlacer placer = new TowerPlacer(Fixtures.engine());

  @Test
  void threePointsWithRightAngleArePlaced() {
    List<SurveyPoint> points = List.of(
        point(0, 0, 0, 0, "tower"),
        point(1, 10, 0, 0, "tower"),
        point(2, 10, 10, 1, "tower"));
    InMemoryDrawing drawing = new InMemoryDrawing(Fixtures.template());
    SkipReport report = new SkipReport();

    assertEquals(1, placer.place(points, drawing, report));
    assertTrue(report.isEmpty());
    BlockPlacement tower = drawing.blocks().get(0);
    assertEquals("Tower", tower.blockName());
    assertEquals(5.0, tower.position().x(), EPS);
    assertEquals(5.0, tower.position().y(), EPS);
    assertEquals((0 + 0 + 1 + 1.0 / 3.0) / 4.0, tower.position().z(), EPS);
    assertEquals(5.0, tower.xScale(), EPS);
    assertEquals(5.0, tower.yScale(), EPS);
    assertEquals(1.0, tower.zScale(), EPS);
    assertEquals("Tower", tower.layer());
    assertEquals(5, tower.color());
  }

  @Test
  void separateClustersGiveSeparateTowers() {
    List<SurveyPoint> points = List.of(
        point(0, 0, 0, 0, "tower1"),
        point(1, 4, 0, 0, "tower1"),
        point(2, 4, 2, 0, "tower1"),
        point(3, 0, 2, 0, "tower1"),
        point(4, 500, 0, 0, "tower1"),
        point(5, 504, 0, 0, "tower1"),
        point(6, 504, 2, 0, "tower1"),
        point(7, 500, 2, 0, "tower1"));
    InMemoryDrawing drawing = new InMemoryDrawing(Fixtures.template());
    assertEquals(2, placer.place(points, drawing, new SkipReport()));
    assertEquals(0.0, drawing.blocks().get(0).rotationDeg() % 180.0, EPS);
    assertEquals(2.0, drawing.blocks().get(0).xScale(), EPS);
    assertEquals(1.0, drawing.blocks().get(0).yScale(), EPS);
  }

  @Test
  void undersizedAndOversizedClustersAreSkipped() {
    List<SurveyPoint> points = List.of(
        point(0, 0, 0, 0, "tower"),
        point(1, 3, 0, 0, "tower"),
        point(2, 200, 0, 0, "tower"),
        point(3, 201, 0, 0, "tower"),
        point(4, 202, 0, 0, "tower"),
        point(5, 203, 0, 0, "tower"),
        point(6, 204, 0, 0, "tower"));
    InMemoryDrawing drawing = new InMemoryDrawing(Fixtures.template());
    SkipReport report = new SkipReport();
    assertEquals(0, placer.place(points, drawing, report));
    assertEquals(2, report.count(SkipCategory.GEOMETRY));
  }

  @Test
  void exactCodeWinsOverPrefixGrouping() {
    List<SurveyPoint> points = List.of(
        point(0, 0, 0, 0, "tower"),
        point(1, 1, 0, 0, "towerA"),
        point(2, 2, 0, 0, "TOWER"),
        point(3, 3, 0, 0, "road"));
    Map<String, List<SurveyPoint>> groups = TowerPlacer.group(points, Fixtures.tower());
    assertEquals(List.of("tower"), List.copyOf(groups.keySet()));
    assertEquals(3, groups.get("tower").size());
  }
}
