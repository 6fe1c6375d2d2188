package app.terrain.sink;

import java.util.Objects;
import java.util.Optional;

public final class PlacementResult {
  private static final PlacementResult OK = new PlacementResult(null);

  private final PlacementError error;

  private PlacementResult(PlacementError error) {
    this.error = error;
  }

  public static PlacementResult ok() {
    return OK;
  }

  public static PlacementResult failed(PlacementError error) {
    return new PlacementResult(Objects.requireNonNull(error, "error"));
  }

  public boolean isOk() {
    return error == null;
  }

  public Optional<PlacementError> error() {
    return Optional.ofNullable(error);
  }

  @Override
  public String toString() {
    return isOk() ? "PlacementResult[ok]" : "PlacementResult[" + error.reason() + ": " + error.message() + "]";
  }
}
