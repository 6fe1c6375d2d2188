package app.terrain.engine;

public record SurfaceStats(
    int basePoints,
    int baseTriangles,
    int refinedPoints,
    int refinedTriangles,
    int contourLevels,
    int contourPolylines) {
  public static SurfaceStats none() {
    return new SurfaceStats(0, 0, 0, 0, 0, 0);
  }
}
