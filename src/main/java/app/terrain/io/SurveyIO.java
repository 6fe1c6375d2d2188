package app.terrain.io;

import app.terrain.geometry.SurveyPoint;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the point table: {@code {"points": [{"id", "x", "y", "z", "code", "comment"}]}}. Rows with
 * missing or non-numeric coordinates are skipped and counted.
 */
public final class SurveyIO {
  private static final Logger log = LoggerFactory.getLogger(SurveyIO.class);

  private final ObjectMapper mapper;

  public SurveyIO() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public SurveyTable load(Path path) throws IOException {
    try (var reader = Files.newBufferedReader(path)) {
      return read(reader);
    }
  }

  public SurveyTable read(Reader reader) throws IOException {
    JsonNode root = mapper.readTree(reader);
    JsonNode rows = root == null ? null : (root.isArray() ? root : root.get("points"));
    if (rows == null || !rows.isArray()) {
      throw new IOException("expected a \"points\" array");
    }
    List<SurveyPoint> points = new ArrayList<>();
    int skipped = 0;
    int index = 0;
    for (JsonNode row : rows) {
      int rowIndex = index++;
      Double x = number(row, "x");
      Double y = number(row, "y");
      Double z = number(row, "z");
      if (x == null || y == null || z == null) {
        skipped++;
        log.warn("Skipping row {}: non-numeric coordinates", rowIndex);
        continue;
      }
      String id = text(row, "id");
      if (id.isEmpty()) {
        id = text(row, "point");
      }
      if (id.isEmpty()) {
        id = "p" + (rowIndex + 1);
      }
      points.add(new SurveyPoint(rowIndex, id, x, y, z, text(row, "code"), text(row, "comment")));
    }
    return new SurveyTable(points, skipped);
  }

  private Double number(JsonNode row, String field) {
    JsonNode node = row.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    double value;
    if (node.isNumber()) {
      value = node.doubleValue();
    } else {
      try {
        value = Double.parseDouble(node.asText().trim().replace(',', '.'));
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return Double.isFinite(value) ? value : null;
  }

  private String text(JsonNode row, String field) {
    JsonNode node = row.get(field);
    if (node == null || node.isNull()) {
      return "";
    }
    return node.asText().trim();
  }
}
