package app.terrain.config;

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
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads {@link EngineConfig} from JSON. Sections missing from a file fall back to built-in
 * scalar defaults with empty code tables; {@link #loadDefaults()} reads the bundled tables.
 */
public final class ConfigIO {
  public static final String DEFAULT_RESOURCE = "/engine-config.json";

  private final ObjectMapper mapper;

  public ConfigIO() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public EngineConfig load(Path path) throws IOException {
    try (var reader = Files.newBufferedReader(path)) {
      return toConfig(mapper.readValue(reader, ConfigDto.class));
    }
  }

  public EngineConfig read(InputStream in) throws IOException {
    return toConfig(mapper.readValue(in, ConfigDto.class));
  }

  public EngineConfig loadDefaults() {
    try (InputStream in = ConfigIO.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
      }
      return read(in);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  private EngineConfig toConfig(ConfigDto dto) {
    TinDto tinDto = dto.tin != null ? dto.tin : new TinDto();
    BreaklineDto lineDto = dto.breaklines != null ? dto.breaklines : new BreaklineDto();
    LineSupportDto supportDto = dto.lineSupport != null ? dto.lineSupport : new LineSupportDto();
    TowerDto towerDto = dto.tower != null ? dto.tower : new TowerDto();
    VegetationDto vegetationDto = dto.vegetation != null ? dto.vegetation : new VegetationDto();

    TinConfig tin = new TinConfig(
        tinDto.enabled,
        tinDto.scaleValue,
        tinDto.refine,
        tinDto.maxEdgeLength,
        tinDto.contourInterval,
        set(tinDto.surfaceCodes),
        tinDto.refineDistances == null ? null : intKeys(tinDto.refineDistances, "tin.refineDistances"),
        tinDto.contours,
        tinDto.contourLayer,
        tinDto.contourColor);
    BreaklineConfig breaklines = new BreaklineConfig(
        set(lineDto.prefixes), lowerKeys(lineDto.layers), lineDto.defaultLayer);

    List<BlockMapping> mappings = new ArrayList<>();
    if (dto.blockMappings != null) {
      for (BlockMappingDto mapping : dto.blockMappings) {
        if (mapping.name == null || mapping.name.isBlank()) {
          throw new IllegalArgumentException("block mapping " + mapping.key + " has no block name");
        }
        String key = mapping.key != null ? mapping.key : mapping.name;
        mappings.add(new BlockMapping(key, mapping.name, set(mapping.codes), scale(mapping.scale)));
      }
    }

    Map<Integer, String> supportBlocks = supportDto.blocks == null
        ? Map.of()
        : intKeys(supportDto.blocks, "lineSupport.blocks");
    LineSupportConfig lineSupport = new LineSupportConfig(
        set(supportDto.codes),
        set(supportDto.bracingCodes),
        supportBlocks,
        scale(supportDto.scale),
        supportDto.distanceThreshold);

    TowerConfig tower = new TowerConfig(
        set(towerDto.codes),
        set(towerDto.prefixes),
        towerDto.groupSize,
        towerDto.minPoints != null ? towerDto.minPoints : towerDto.groupSize,
        towerDto.rightAngleTolerance,
        towerDto.maxSpan,
        towerDto.blockName,
        towerDto.layer,
        towerDto.color,
        towerDto.baseWidth,
        towerDto.baseHeight,
        towerDto.zScale,
        towerDto.minScale);

    VegetationConfig vegetation = new VegetationConfig(
        set(vegetationDto.prefixes),
        set(vegetationDto.forestMarkers),
        set(vegetationDto.shrubMarkers),
        vegetationDto.defaultLayer,
        vegetationDto.forestBlock,
        vegetationDto.minSpacing,
        vegetationDto.maxAttempts,
        vegetationDto.shrubPattern,
        vegetationDto.patternScale,
        vegetationDto.closeTolerance,
        vegetationDto.seed);

    return new EngineConfig(
        dto.scaleFactor, dto.pointLayer, dto.pointColor, tin, breaklines, mappings, lineSupport, tower, vegetation);
  }

  private ScaleResolver scale(ScaleDto dto) {
    if (dto == null || dto.type == null || dto.type.equalsIgnoreCase("constant")) {
      return ScaleResolver.constant(dto == null ? 1d : requireFinite(dto.value, "scale.value"));
    }
    if (dto.type.equalsIgnoreCase("height")) {
      List<ScaleResolver.Breakpoint> breakpoints = new ArrayList<>();
      if (dto.breakpoints != null) {
        for (BreakpointDto breakpoint : dto.breakpoints) {
          breakpoints.add(new ScaleResolver.Breakpoint(
              requireFinite(breakpoint.minHeight, "breakpoint.minHeight"),
              requireFinite(breakpoint.scale, "breakpoint.scale")));
        }
      }
      return new ScaleResolver.HeightPiecewise(breakpoints);
    }
    throw new IllegalArgumentException("unknown scale type " + dto.type);
  }

  private Set<String> set(List<String> values) {
    return values == null ? Set.of() : CodeSets.normalize(values);
  }

  private Map<String, String> lowerKeys(Map<String, String> values) {
    if (values == null) {
      return Map.of();
    }
    Map<String, String> result = new TreeMap<>();
    values.forEach((key, value) -> result.put(key.trim().toLowerCase(Locale.ROOT), value));
    return result;
  }

  private <V> TreeMap<Integer, V> intKeys(Map<String, V> values, String label) {
    TreeMap<Integer, V> result = new TreeMap<>();
    for (Map.Entry<String, V> entry : values.entrySet()) {
      try {
        result.put(Integer.parseInt(entry.getKey().trim()), entry.getValue());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(label + " key must be an integer: " + entry.getKey(), e);
      }
    }
    return result;
  }

  private double requireFinite(double value, String label) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(label + " must be finite");
    }
    return value;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class ConfigDto {
    public double scaleFactor = 1.0;
    public String pointLayer = "Point";
    public int pointColor = 10;
    public TinDto tin;
    public BreaklineDto breaklines;
    public List<BlockMappingDto> blockMappings;
    public LineSupportDto lineSupport;
    public TowerDto tower;
    public VegetationDto vegetation;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class TinDto {
    public boolean enabled = true;
    public Integer scaleValue;
    public boolean refine;
    public double maxEdgeLength = TinConfig.DEFAULT_MAX_EDGE_LENGTH;
    public double contourInterval = 1.0;
    public List<String> surfaceCodes;
    public Map<String, Double> refineDistances;
    public boolean contours = true;
    public String contourLayer = "Contours";
    public int contourColor = 7;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class BreaklineDto {
    public List<String> prefixes;
    public Map<String, String> layers;
    public String defaultLayer = "Polylines";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class ScaleDto {
    public String type = "constant";
    public double value = 1.0;
    public List<BreakpointDto> breakpoints;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class BreakpointDto {
    public double minHeight;
    public double scale = 1.0;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class BlockMappingDto {
    public String key;
    public String name;
    public List<String> codes;
    public ScaleDto scale;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class LineSupportDto {
    public List<String> codes;
    public List<String> bracingCodes;
    public Map<String, String> blocks;
    public ScaleDto scale;
    public double distanceThreshold = 5.0;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class TowerDto {
    public List<String> codes;
    public List<String> prefixes;
    public int groupSize = 4;
    public Integer minPoints;
    public double rightAngleTolerance;
    public double maxSpan = 30.0;
    public String blockName;
    public String layer;
    public Integer color;
    public double baseWidth = 1.0;
    public double baseHeight = 1.0;
    public double zScale = 1.0;
    public double minScale = 0.01;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class VegetationDto {
    public List<String> prefixes;
    public List<String> forestMarkers;
    public List<String> shrubMarkers;
    public String defaultLayer = "(026) Растительность";
    public String forestBlock = "368";
    public double minSpacing = 10.0;
    public int maxAttempts = 2000;
    public String shrubPattern = "ANSI37";
    public double patternScale = 0.5;
    public double closeTolerance = 0.1;
    public long seed = 368L;
  }
}
