package app.terrain.sink;

import java.util.Objects;

public record PlacementError(String blockName, Reason reason, String message) {
  public enum Reason {
    UNKNOWN_BLOCK,
    INVALID_GEOMETRY
  }

  public PlacementError {
    Objects.requireNonNull(blockName, "blockName");
    Objects.requireNonNull(reason, "reason");
    message = message == null ? "" : message;
  }
}
