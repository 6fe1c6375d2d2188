package app.terrain.io;

import app.terrain.sink.DrawingTemplate;
import app.terrain.sink.LayerAttributes;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TemplateIO {
  public static final String DEFAULT_RESOURCE = "/drawing-template.json";

  private final ObjectMapper mapper;

  public TemplateIO() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public DrawingTemplate load(Path path) throws IOException {
    try (var reader = Files.newBufferedReader(path)) {
      return toTemplate(mapper.readValue(reader, TemplateDto.class));
    }
  }

  public DrawingTemplate loadDefaults() {
    try (InputStream in = TemplateIO.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
      }
      return toTemplate(mapper.readValue(in, TemplateDto.class));
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  private DrawingTemplate toTemplate(TemplateDto dto) {
    List<DrawingTemplate.BlockDefinition> blocks = new ArrayList<>();
    if (dto.blocks != null) {
      for (BlockDto block : dto.blocks) {
        if (block.name == null || block.name.isBlank()) {
          throw new IllegalArgumentException("template block without a name");
        }
        blocks.add(new DrawingTemplate.BlockDefinition(block.name, block.width, block.height, block.layer, block.color));
      }
    }
    List<LayerAttributes> layers = new ArrayList<>();
    if (dto.layers != null) {
      for (LayerDto layer : dto.layers) {
        if (layer.name == null || layer.name.isBlank()) {
          throw new IllegalArgumentException("template layer without a name");
        }
        layers.add(new LayerAttributes(layer.name, layer.color, layer.linetype));
      }
    }
    return new DrawingTemplate(blocks, layers);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class TemplateDto {
    public List<BlockDto> blocks;
    public List<LayerDto> layers;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class BlockDto {
    public String name;
    public double width;
    public double height;
    public String layer;
    public Integer color;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class LayerDto {
    public String name;
    public int color = LayerAttributes.DEFAULT_COLOR;
    public String linetype;
  }
}
