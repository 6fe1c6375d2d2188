package app.terrain.breakline;

import app.terrain.geometry.Point3;
import app.terrain.geometry.SurveyPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered chain of survey points sharing one code, e.g. {@code gaz1}. {@code baseCode} is the code
 * without its trailing number.
 */
public record Breakline(String groupKey, String baseCode, List<SurveyPoint> members) {
  public Breakline {
    Objects.requireNonNull(groupKey, "groupKey");
    Objects.requireNonNull(baseCode, "baseCode");
    members = List.copyOf(members);
  }

  public List<Point3> vertices() {
    List<Point3> vertices = new ArrayList<>(members.size());
    for (SurveyPoint member : members) {
      vertices.add(member.position());
    }
    return vertices;
  }

  public int size() {
    return members.size();
  }
}
