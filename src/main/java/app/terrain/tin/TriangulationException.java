package app.terrain.tin;

public final class TriangulationException extends RuntimeException {
  public TriangulationException(String message, Throwable cause) {
    super(message, cause);
  }
}
