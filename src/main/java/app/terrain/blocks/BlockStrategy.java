package app.terrain.blocks;

import app.terrain.geometry.SurveyPoint;
import app.terrain.report.SkipReport;
import app.terrain.sink.DrawingSink;
import java.util.List;

/** One way of turning coded survey points into block references. */
public interface BlockStrategy {
  /** Places blocks into the sink and returns how many were accepted. */
  int place(List<SurveyPoint> points, DrawingSink sink, SkipReport report);
}
