package app.terrain.io;

import app.terrain.geometry.Point3;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.DrawingTemplate;
import app.terrain.sink.HatchFill;
import app.terrain.sink.InMemoryDrawing;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class DrawingWriterTest {
  @TempDir
  Path tempDir;

  @Test
  void writesOneArrayPerEntityKind() throws Exception {
    DrawingTemplate template = new DrawingTemplate(
        List.of(new DrawingTemplate.BlockDefinition("368", 1, 1, "Trees", 3)), List.of());
    InMemoryDrawing drawing = new InMemoryDrawing(template);
    Point3 a = new Point3(0, 0, 1);
    Point3 b = new Point3(4, 0, 1);
    Point3 c = new Point3(0, 3, 1);
    drawing.addPoint(a, "Point", 10);
    drawing.addFace(a, b, c, "Surface", 3);
    drawing.addPolyline(List.of(a, b, c), true, "Contours", 7);
    drawing.addHatch(List.of(a, b, c), HatchFill.solid(), "Trees", 3);
    drawing.addBlockReference(new BlockPlacement("368", a, 1, 2, 3, 45, "Trees", 3));

    Path out = tempDir.resolve("drawing.json");
    new DrawingWriter().save(out, drawing);
    JsonNode root = new ObjectMapper().readTree(Files.readString(out));

    assertEquals(1, root.get("points").size());
    assertEquals(4, root.get("faces").get(0).get("vertices").size());
    assertEquals(true, root.get("polylines").get(0).get("closed").asBoolean());
    assertEquals("SOLID", root.get("hatches").get(0).get("pattern").asText());
    JsonNode block = root.get("blocks").get(0);
    assertEquals("368", block.get("name").asText());
    assertEquals(2.0, block.get("scale").get(1).asDouble());
    assertEquals(45.0, block.get("rotation").asDouble());
  }
}
