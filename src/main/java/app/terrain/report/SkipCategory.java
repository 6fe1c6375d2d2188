package app.terrain.report;

public enum SkipCategory {
  /** Unusable input rows. */
  INPUT,
  /** Degenerate triangles, towers or contour pieces. */
  GEOMETRY,
  /** Blocks or layers the drawing template does not define. */
  TEMPLATE
}
