package app.terrain.sink;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Block and layer definitions available to a drawing before any geometry is added. */
public final class DrawingTemplate {
  public record BlockDefinition(String name, double width, double height, String layer, Integer color) {
    public BlockDefinition {
      Objects.requireNonNull(name, "name");
    }
  }

  private final Map<String, BlockDefinition> blocks;
  private final Map<String, LayerAttributes> layers;

  public DrawingTemplate(List<BlockDefinition> blocks, List<LayerAttributes> layers) {
    Map<String, BlockDefinition> blockMap = new LinkedHashMap<>();
    for (BlockDefinition block : blocks) {
      blockMap.put(block.name(), block);
    }
    Map<String, LayerAttributes> layerMap = new LinkedHashMap<>();
    for (LayerAttributes layer : layers) {
      layerMap.put(layer.name(), layer);
    }
    this.blocks = Map.copyOf(blockMap);
    this.layers = Map.copyOf(layerMap);
  }

  public static DrawingTemplate empty() {
    return new DrawingTemplate(List.of(), List.of());
  }

  public Optional<BlockDefinition> block(String name) {
    return Optional.ofNullable(blocks.get(name));
  }

  public Optional<LayerAttributes> layer(String name) {
    return Optional.ofNullable(layers.get(name));
  }
}
