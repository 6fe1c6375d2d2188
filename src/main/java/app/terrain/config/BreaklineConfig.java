package app.terrain.config;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Coded polylines: allowed code prefixes and the layer each base code is drawn on. */
public record BreaklineConfig(Set<String> prefixes, Map<String, String> layers, String defaultLayer) {
  public BreaklineConfig {
    prefixes = CodeSets.normalize(prefixes);
    layers = layers == null ? Map.of() : Map.copyOf(layers);
    defaultLayer = defaultLayer == null || defaultLayer.isBlank() ? "Polylines" : defaultLayer;
  }

  public String layerFor(String baseCode) {
    return layerFor(baseCode, defaultLayer);
  }

  public String layerFor(String baseCode, String fallback) {
    String layer = layers.get(baseCode.toLowerCase(Locale.ROOT));
    return layer != null ? layer : fallback;
  }
}
