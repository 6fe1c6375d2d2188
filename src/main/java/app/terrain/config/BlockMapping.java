package app.terrain.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public record BlockMapping(String key, String blockName, Set<String> codes, ScaleResolver scale) {
  public BlockMapping {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(blockName, "blockName");
    codes = CodeSets.normalize(codes);
    scale = scale == null ? ScaleResolver.constant(1d) : scale;
  }

  public boolean matches(String code) {
    return code != null && codes.contains(code.trim().toLowerCase(Locale.ROOT));
  }
}
