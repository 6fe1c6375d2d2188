package app.terrain.breakline;

import app.terrain.config.BreaklineConfig;
import app.terrain.geometry.Point3;
import app.terrain.geometry.SurveyPoint;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BreaklineExtractor {
  private static final Logger log = LoggerFactory.getLogger(BreaklineExtractor.class);

  private final CodeGroups groups = new CodeGroups(CodeGroups.LATIN_CODE);

  public List<Breakline> extract(List<SurveyPoint> points, BreaklineConfig config) {
    List<Breakline> breaklines = new ArrayList<>();
    for (CodeGroups.Group group : groups.group(points, config.prefixes())) {
      if (group.members().size() < 2) {
        log.debug("Coded line {} has a single point; skipped", group.key());
        continue;
      }
      breaklines.add(new Breakline(group.key(), group.prefix(), groups.order(group.members())));
    }
    return breaklines;
  }

  public static List<List<Point3>> vertices(List<Breakline> breaklines) {
    List<List<Point3>> result = new ArrayList<>(breaklines.size());
    for (Breakline breakline : breaklines) {
      result.add(breakline.vertices());
    }
    return result;
  }
}
