package app.terrain.report;

import app.terrain.sink.PlacementError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SkipReportTest {
  @Test
  void countsPerCategory() {
    SkipReport report = new SkipReport();
    report.record(SkipCategory.INPUT, 3, "bad rows");
    report.record(SkipCategory.GEOMETRY, "flat triangle");
    report.record(SkipCategory.GEOMETRY, 0, "nothing");
    report.placementFailed(new PlacementError("x", PlacementError.Reason.UNKNOWN_BLOCK, "no block x"));
    report.placementFailed(new PlacementError("y", PlacementError.Reason.INVALID_GEOMETRY, "NaN"));

    assertEquals(3, report.count(SkipCategory.INPUT));
    assertEquals(2, report.count(SkipCategory.GEOMETRY));
    assertEquals(1, report.count(SkipCategory.TEMPLATE));
    assertEquals(6, report.total());
    assertEquals(4, report.messages().size());
    assertEquals("TEMPLATE: no block x", report.messages().get(2));
  }

  @Test
  void keepsOnlyTheFirstMessages() {
    SkipReport report = new SkipReport();
    for (int i = 0; i < SkipReport.MAX_MESSAGES + 20; i++) {
      report.record(SkipCategory.GEOMETRY, "item " + i);
    }
    assertEquals(SkipReport.MAX_MESSAGES + 20, report.count(SkipCategory.GEOMETRY));
    assertEquals(SkipReport.MAX_MESSAGES, report.messages().size());
    assertTrue(new SkipReport().isEmpty());
  }
}
