package app.terrain.contour;

import app.terrain.geometry.Point3;
import java.util.List;

public record ContourPolyline(double level, List<Point3> points, boolean closed) {
  public ContourPolyline {
    points = List.copyOf(points);
  }
}
