package app.terrain.sink;

import java.util.Objects;

public record HatchFill(String pattern, double scale, double angle) {
  public static final String SOLID_PATTERN = "SOLID";

  public HatchFill {
    Objects.requireNonNull(pattern, "pattern");
  }

  public static HatchFill solid() {
    return new HatchFill(SOLID_PATTERN, 1d, 0d);
  }

  public boolean isSolid() {
    return SOLID_PATTERN.equalsIgnoreCase(pattern);
  }
}
