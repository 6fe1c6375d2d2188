package app.terrain.sink;

public record BlockExtent(double width, double height) {
  public boolean isDegenerate() {
    return !(width > 0) || !(height > 0);
  }
}
