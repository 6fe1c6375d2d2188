package app.terrain.config;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Line supports (poles) are rotated towards up to two bracing points. {@code blocks} maps the
 * number of bracing points used (0, 1 or 2) to the block variant.
 */
public record LineSupportConfig(
    Set<String> codes,
    Set<String> bracingCodes,
    Map<Integer, String> blocks,
    ScaleResolver scale,
    double distanceThreshold) {
  public static final int MAX_BRACING = 2;

  public LineSupportConfig {
    codes = CodeSets.normalize(codes);
    bracingCodes = CodeSets.normalize(bracingCodes);
    blocks = blocks == null ? Map.of() : Map.copyOf(new TreeMap<>(blocks));
    scale = scale == null ? ScaleResolver.constant(1d) : scale;
    if (!(distanceThreshold >= 0)) {
      throw new IllegalArgumentException("line support distance threshold must be >= 0");
    }
  }

  public Optional<String> blockFor(int bracingCount) {
    return Optional.ofNullable(blocks.get(bracingCount));
  }
}
