package app.terrain.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ConfigIOTest {
  private final ConfigIO io = new ConfigIO();

  @Test
  void bundledDefaultsCarryTheStandardTables() {
    EngineConfig config = io.loadDefaults();
    assertEquals(32, config.blockMappings().size());
    assertEquals("109a", config.blockMappings().get(0).blockName());
    assertTrue(config.blockMappings().get(0).matches(" МОЛН "));
    assertTrue(config.breaklines().prefixes().contains("gaz"));
    assertEquals("(036) Газопроводы", config.breaklines().layerFor("GAZ"));
    assertEquals("Polylines", config.breaklines().layerFor("k"));
    assertTrue(config.lineSupport().codes().contains("vl"));
    assertEquals("115-10-2", config.lineSupport().blockFor(2).orElseThrow());
    assertEquals(5.0, config.lineSupport().distanceThreshold());
    assertTrue(config.tower().enabled());
    assertEquals(1.0, config.tin().contourInterval());
    assertEquals(20.0, config.tin().refineDistances().get(1000));
    assertEquals(1000, config.tinScaleValue());
    assertTrue(config.vegetation().isForest("лес"));
  }

  @Test
  void missingSectionsFallBackToScalarDefaults() throws IOException {
    EngineConfig config = io.read(json("{\"scaleFactor\": 0.01}"));
    assertEquals(EngineConfig.MIN_SCALE_FACTOR, config.scaleFactor());
    assertEquals(50, config.tinScaleValue());
    assertTrue(config.blockMappings().isEmpty());
    assertFalse(config.tower().enabled());
    assertTrue(config.tin().enabled());
  }

  @Test
  void heightScaleIsReadAsPiecewise() throws IOException {
    String text = "{\"blockMappings\": [{\"key\": \"Pole\", \"name\": \"119\", \"codes\": [\"stolb\"],"
        + " \"scale\": {\"type\": \"height\", \"breakpoints\": ["
        + "{\"minHeight\": 10, \"scale\": 2.0}, {\"minHeight\": 0, \"scale\": 1.0}]}}]}";
    ScaleResolver scale = io.read(json(text)).blockMappings().get(0).scale();
    assertEquals(1.0, scale.resolve(-5));
    assertEquals(1.0, scale.resolve(9.99));
    assertEquals(2.0, scale.resolve(10));
  }

  @Test
  void explicitTinScaleOverridesScaleFactor() throws IOException {
    EngineConfig config = io.read(json("{\"scaleFactor\": 2.0, \"tin\": {\"scaleValue\": 500}}"));
    assertEquals(500, config.tinScaleValue());
  }

  @Test
  void unsupportedContourIntervalIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> io.read(json("{\"tin\": {\"contourInterval\": 0.3}}")));
  }

  @Test
  void unknownScaleTypeIsRejected() {
    String text = "{\"blockMappings\": [{\"name\": \"119\", \"codes\": [\"x\"], \"scale\": {\"type\": \"wind\"}}]}";
    assertThrows(IllegalArgumentException.class, () -> io.read(json(text)));
  }

  @Test
  void malformedJsonIsAnIOException() {
    assertThrows(IOException.class, () -> io.read(json("{\"tin\": [")));
  }

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
