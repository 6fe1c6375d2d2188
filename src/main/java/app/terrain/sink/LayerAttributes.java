package app.terrain.sink;

import java.util.Objects;

public record LayerAttributes(String name, int color, String linetype) {
  public static final int DEFAULT_COLOR = 7;
  public static final String CONTINUOUS = "CONTINUOUS";

  public LayerAttributes {
    Objects.requireNonNull(name, "name");
    linetype = linetype == null || linetype.isBlank() ? CONTINUOUS : linetype;
  }
}
