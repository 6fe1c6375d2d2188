package app.terrain.io;

import app.terrain.geometry.SurveyPoint;
import java.util.List;

public record SurveyTable(List<SurveyPoint> points, int skippedRows) {
  public SurveyTable {
    points = List.copyOf(points);
  }
}
