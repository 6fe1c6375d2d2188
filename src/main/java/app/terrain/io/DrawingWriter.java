package app.terrain.io;

import app.terrain.geometry.Point3;
import app.terrain.sink.BlockPlacement;
import app.terrain.sink.InMemoryDrawing;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Serialises a recorded drawing to JSON, one array per entity kind. */
public final class DrawingWriter {
  private final ObjectMapper mapper = new ObjectMapper();

  public void save(Path path, InMemoryDrawing drawing) throws IOException {
    try (var writer = Files.newBufferedWriter(path)) {
      mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toJson(drawing));
    }
  }

  public ObjectNode toJson(InMemoryDrawing drawing) {
    ObjectNode root = mapper.createObjectNode();
    ArrayNode points = root.putArray("points");
    for (InMemoryDrawing.PointEntity point : drawing.points()) {
      ObjectNode node = points.addObject();
      node.set("position", coords(point.position()));
      node.put("layer", point.layer());
      node.put("color", point.color());
    }
    ArrayNode faces = root.putArray("faces");
    for (InMemoryDrawing.FaceEntity face : drawing.faces()) {
      ObjectNode node = faces.addObject();
      node.set("vertices", coords(face.vertices()));
      node.put("layer", face.layer());
      node.put("color", face.color());
    }
    ArrayNode polylines = root.putArray("polylines");
    for (InMemoryDrawing.PolylineEntity polyline : drawing.polylines()) {
      ObjectNode node = polylines.addObject();
      node.set("points", coords(polyline.points()));
      node.put("closed", polyline.closed());
      node.put("layer", polyline.layer());
      node.put("color", polyline.color());
    }
    ArrayNode hatches = root.putArray("hatches");
    for (InMemoryDrawing.HatchEntity hatch : drawing.hatches()) {
      ObjectNode node = hatches.addObject();
      node.set("boundary", coords(hatch.boundary()));
      node.put("pattern", hatch.fill().pattern());
      node.put("patternScale", hatch.fill().scale());
      node.put("layer", hatch.layer());
      node.put("color", hatch.color());
    }
    ArrayNode blocks = root.putArray("blocks");
    for (BlockPlacement block : drawing.blocks()) {
      ObjectNode node = blocks.addObject();
      node.put("name", block.blockName());
      node.set("position", coords(block.position()));
      ArrayNode scale = node.putArray("scale");
      scale.add(block.xScale()).add(block.yScale()).add(block.zScale());
      node.put("rotation", block.rotationDeg());
      node.put("layer", block.layer());
      node.put("color", block.color());
    }
    return root;
  }

  private ArrayNode coords(Point3 point) {
    ArrayNode node = mapper.createArrayNode();
    node.add(point.x()).add(point.y()).add(point.z());
    return node;
  }

  private ArrayNode coords(List<Point3> points) {
    ArrayNode node = mapper.createArrayNode();
    for (Point3 point : points) {
      node.add(coords(point));
    }
    return node;
  }
}
