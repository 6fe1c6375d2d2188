package app.terrain.contour;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ContourLevelsTest {
  @Test
  void unitIntervalKeepsEveryOtherHalfMetre() {
    assertEquals(List.of(0.5, 1.5, 2.5), ContourLevels.levels(0.2, 3.1, 1.0));
  }

  @Test
  void halfMetreIntervalKeepsEveryCandidate() {
    assertEquals(List.of(0.5, 1.0, 1.5, 2.0, 2.5, 3.0), ContourLevels.levels(0.2, 3.1, 0.5));
  }

  @Test
  void widerIntervalsStartFromTheLowestCandidate() {
    assertEquals(List.of(0.5, 2.5), ContourLevels.levels(0.2, 3.1, 2.0));
    assertEquals(List.of(-1.0, 4.0), ContourLevels.levels(-1.0, 4.2, 5.0));
  }

  @Test
  void boundsAreInclusive() {
    assertEquals(List.of(1.0, 2.0), ContourLevels.levels(1.0, 2.0, 1.0));
  }

  @Test
  void flatOrInvalidRangeHasNoLevelsBetweenSteps() {
    assertTrue(ContourLevels.levels(1.1, 1.4, 1.0).isEmpty());
    assertTrue(ContourLevels.levels(3.0, 1.0, 1.0).isEmpty());
  }
}
