package app.terrain.io;

import app.terrain.config.BlockMapping;
import app.terrain.config.ConfigIO;
import app.terrain.config.EngineConfig;
import app.terrain.sink.DrawingTemplate;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TemplateIOTest {
  @TempDir
  Path tempDir;

  @Test
  void defaultTemplateDefinesEveryConfiguredBlock() {
    DrawingTemplate template = new TemplateIO().loadDefaults();
    EngineConfig config = new ConfigIO().loadDefaults();
    for (BlockMapping mapping : config.blockMappings()) {
      assertTrue(template.block(mapping.blockName()).isPresent(), mapping.blockName());
    }
    for (int count = 0; count <= 2; count++) {
      assertTrue(template.block(config.lineSupport().blockFor(count).orElseThrow()).isPresent());
    }
    assertTrue(template.block(config.tower().blockName()).isPresent());
    assertTrue(template.block(config.vegetation().forestBlock()).isPresent());
    assertTrue(template.layer(config.tin().contourLayer()).isPresent());
  }

  @Test
  void loadsTemplateFile() throws IOException {
    Path file = tempDir.resolve("template.json");
    Files.writeString(file, "{\"blocks\": [{\"name\": \"A\", \"width\": 2, \"height\": 3, \"layer\": \"L\"}],"
        + " \"layers\": [{\"name\": \"L\", \"color\": 4}]}");
    DrawingTemplate template = new TemplateIO().load(file);
    assertEquals(2.0, template.block("A").orElseThrow().width());
    assertEquals(4, template.layer("L").orElseThrow().color());
  }

  @Test
  void blocksNeedNames() throws IOException {
    Path file = tempDir.resolve("bad.json");
    Files.writeString(file, "{\"blocks\": [{\"width\": 2}]}");
    assertThrows(IllegalArgumentException.class, () -> new TemplateIO().load(file));
  }
}
