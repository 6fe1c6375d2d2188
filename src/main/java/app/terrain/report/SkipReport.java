package app.terrain.report;

import app.terrain.sink.PlacementError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Counts of items skipped during one run, with the first messages kept for display. */
public final class SkipReport {
  public static final int MAX_MESSAGES = 100;

  private final Map<SkipCategory, Integer> counts = new EnumMap<>(SkipCategory.class);
  private final List<String> messages = new ArrayList<>();

  public void record(SkipCategory category, String message) {
    record(category, 1, message);
  }

  public void record(SkipCategory category, int count, String message) {
    if (count <= 0) {
      return;
    }
    counts.merge(category, count, Integer::sum);
    if (messages.size() < MAX_MESSAGES) {
      messages.add(category + ": " + message);
    }
  }

  public void placementFailed(PlacementError error) {
    SkipCategory category = error.reason() == PlacementError.Reason.UNKNOWN_BLOCK
        ? SkipCategory.TEMPLATE
        : SkipCategory.GEOMETRY;
    record(category, error.message());
  }

  public int count(SkipCategory category) {
    return counts.getOrDefault(category, 0);
  }

  public int total() {
    int total = 0;
    for (int count : counts.values()) {
      total += count;
    }
    return total;
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  public List<String> messages() {
    return Collections.unmodifiableList(messages);
  }

  @Override
  public String toString() {
    return "SkipReport" + counts;
  }
}
