package app.terrain.geometry;

public record Point3(double x, double y, double z) {
  public double distance2d(Point3 other) {
    return Math.hypot(other.x - x, other.y - y);
  }

  public boolean matches2d(Point3 other, double tol) {
    return distance2d(other) <= tol;
  }
}
