package app.terrain.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Block scale as a function of the point height. */
public interface ScaleResolver {
  double resolve(double height);

  static ScaleResolver constant(double value) {
    return new Constant(value);
  }

  record Constant(double value) implements ScaleResolver {
    @Override
    public double resolve(double height) {
      return value;
    }
  }

  record Breakpoint(double minHeight, double scale) {}

  /**
   * Step function over height: the scale of the last breakpoint whose {@code minHeight} does not
   * exceed the height. Heights below the first breakpoint use the first scale.
   */
  record HeightPiecewise(List<Breakpoint> breakpoints) implements ScaleResolver {
    public HeightPiecewise {
      if (breakpoints == null || breakpoints.isEmpty()) {
        throw new IllegalArgumentException("height scale needs at least one breakpoint");
      }
      List<Breakpoint> sorted = new ArrayList<>(breakpoints);
      sorted.sort(Comparator.comparingDouble(Breakpoint::minHeight));
      breakpoints = List.copyOf(sorted);
    }

    @Override
    public double resolve(double height) {
      double scale = breakpoints.get(0).scale();
      for (Breakpoint breakpoint : breakpoints) {
        if (breakpoint.minHeight() > height) {
          break;
        }
        scale = breakpoint.scale();
      }
      return scale;
    }
  }
}
