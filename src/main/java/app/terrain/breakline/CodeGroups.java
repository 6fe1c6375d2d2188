package app.terrain.breakline;

import app.terrain.geometry.SurveyPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups points whose code is a known prefix followed by a number and orders each group into a
 * chain.
 */
public final class CodeGroups {
  public static final Pattern LATIN_CODE = Pattern.compile("^(?<prefix>[a-z]+)(?<number>\\d+)$");
  public static final Pattern LETTER_CODE = Pattern.compile("^(?<prefix>[a-zа-яё]+)(?<number>\\d+)$");

  public record Group(String key, String prefix, List<SurveyPoint> members) {}

  private final Pattern pattern;

  public CodeGroups(Pattern pattern) {
    this.pattern = pattern;
  }

  /** Groups keyed by the full lowercase code, in order of first appearance. */
  public List<Group> group(List<SurveyPoint> points, Set<String> prefixes) {
    Map<String, Group> groups = new LinkedHashMap<>();
    for (SurveyPoint point : points) {
      String code = point.normalizedCode();
      Matcher matcher = pattern.matcher(code);
      if (!matcher.matches()) {
        continue;
      }
      String prefix = matcher.group("prefix");
      if (!prefixes.contains(prefix)) {
        continue;
      }
      groups.computeIfAbsent(code, k -> new Group(k, prefix, new ArrayList<>())).members().add(point);
    }
    return new ArrayList<>(groups.values());
  }

  /**
   * Greedy nearest-neighbour walk from the member with the smallest row index. Equal distances go
   * to the candidate that comes first in row order.
   */
  public List<SurveyPoint> order(List<SurveyPoint> members) {
    if (members.isEmpty()) {
      return List.of();
    }
    List<SurveyPoint> remaining = new ArrayList<>(members);
    remaining.sort(Comparator.comparingInt(SurveyPoint::index));
    List<SurveyPoint> ordered = new ArrayList<>(members.size());
    SurveyPoint current = remaining.remove(0);
    ordered.add(current);
    while (!remaining.isEmpty()) {
      int best = 0;
      double bestDistance = current.distance2d(remaining.get(0));
      for (int i = 1; i < remaining.size(); i++) {
        double distance = current.distance2d(remaining.get(i));
        if (distance < bestDistance) {
          best = i;
          bestDistance = distance;
        }
      }
      current = remaining.remove(best);
      ordered.add(current);
    }
    return ordered;
  }
}
