package app.terrain.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

final class CodeSets {
  private CodeSets() {}

  static Set<String> normalize(Collection<String> codes) {
    if (codes == null) {
      return Set.of();
    }
    Set<String> result = new LinkedHashSet<>();
    for (String code : codes) {
      if (code == null) {
        continue;
      }
      String trimmed = code.trim().toLowerCase(Locale.ROOT);
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return Collections.unmodifiableSet(result);
  }
}
