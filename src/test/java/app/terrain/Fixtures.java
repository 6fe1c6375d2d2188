package app.terrain;

import app.terrain.config.BlockMapping;
import app.terrain.config.BreaklineConfig;
import app.terrain.config.EngineConfig;
import app.terrain.config.LineSupportConfig;
import app.terrain.config.TinConfig;
import app.terrain.config.TowerConfig;
import app.terrain.config.VegetationConfig;
import app.terrain.geometry.SurveyPoint;
import app.terrain.sink.DrawingTemplate;
import app.terrain.sink.LayerAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Small hand-built configurations and templates shared by the tests. */
public final class Fixtures {
  public static final String SUPPORT_LAYER = "(012) Опоры ЛЭП";
  public static final String VEGETATION_LAYER = "(026) Растительность";

  private Fixtures() {}

  public static SurveyPoint point(int index, double x, double y, double z, String code) {
    return new SurveyPoint(index, "p" + (index + 1), x, y, z, code, "");
  }

  public static TinConfig tin() {
    return new TinConfig(true, null, false, TinConfig.DEFAULT_MAX_EDGE_LENGTH, 1.0, Set.of(), null, true,
        "Contours", 7);
  }

  public static BreaklineConfig breaklines() {
    return new BreaklineConfig(Set.of("gaz", "k", "voda"), Map.of("gaz", "(036) Газопроводы"), "Polylines");
  }

  public static LineSupportConfig lineSupport() {
    return new LineSupportConfig(
        Set.of("VL", "вл"), Set.of("op", "оп"), Map.of(0, "115-9", 1, "115-10", 2, "115-10-2"), null, 5.0);
  }

  public static TowerConfig tower() {
    return new TowerConfig(Set.of("tower"), Set.of("tower"), 4, 3, 0.05, 25.0, "Tower", null, null,
        1.0, 1.0, 1.0, 0.01);
  }

  public static VegetationConfig vegetation() {
    return new VegetationConfig(Set.of("les", "kust", "lug"), Set.of("les"), Set.of("kust"), VEGETATION_LAYER,
        "368", 10.0, 2000, "ANSI37", 0.5, 0.1, 368L);
  }

  public static List<BlockMapping> mappings() {
    return List.of(
        new BlockMapping("Moln", "109a", Set.of("moln", "МОЛН"), null),
        new BlockMapping("Fonar", "110", Set.of("fonar"), null));
  }

  public static EngineConfig engine() {
    return new EngineConfig(1.0, "Point", 10, tin(), breaklines(), mappings(), lineSupport(), tower(),
        vegetation());
  }

  public static DrawingTemplate template() {
    List<DrawingTemplate.BlockDefinition> blocks = new ArrayList<>();
    blocks.add(new DrawingTemplate.BlockDefinition("109a", 1, 1, "Blocks", null));
    blocks.add(new DrawingTemplate.BlockDefinition("110", 1, 1, "Blocks", null));
    blocks.add(new DrawingTemplate.BlockDefinition("115-9", 1, 1, SUPPORT_LAYER, null));
    blocks.add(new DrawingTemplate.BlockDefinition("115-10", 1, 1, SUPPORT_LAYER, null));
    blocks.add(new DrawingTemplate.BlockDefinition("115-10-2", 1, 1, SUPPORT_LAYER, null));
    blocks.add(new DrawingTemplate.BlockDefinition("Tower", 2, 2, "Tower", 5));
    blocks.add(new DrawingTemplate.BlockDefinition("368", 1, 1, VEGETATION_LAYER, 3));
    List<LayerAttributes> layers = List.of(
        new LayerAttributes("Point", 7, null),
        new LayerAttributes("Blocks", 7, null),
        new LayerAttributes(SUPPORT_LAYER, 1, null),
        new LayerAttributes("Tower", 5, null),
        new LayerAttributes(VEGETATION_LAYER, 3, null),
        new LayerAttributes("(036) Газопроводы", 30, "DASHED"),
        new LayerAttributes("Contours", 7, null));
    return new DrawingTemplate(blocks, layers);
  }
}
