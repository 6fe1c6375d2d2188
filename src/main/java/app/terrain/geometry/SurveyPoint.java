package app.terrain.geometry;

import java.util.Locale;
import java.util.Objects;

/**
 * One cleaned row of the survey table. {@code index} is the position of the row in the input and drives
 * every order-sensitive grouping.
 */
public record SurveyPoint(int index, String id, double x, double y, double z, String code, String comment) {
  public SurveyPoint {
    Objects.requireNonNull(id, "id");
    code = code == null ? "" : code.trim();
    comment = comment == null ? "" : comment.trim();
  }

  public String normalizedCode() {
    return code.toLowerCase(Locale.ROOT);
  }

  public Point3 position() {
    return new Point3(x, y, z);
  }

  public double distance2d(SurveyPoint other) {
    return Math.hypot(other.x - x, other.y - y);
  }
}
