package regmap.config;

import java.util.Map;

/**
 * Configuration for a behavior kind registered by the user. The parameters are passed to its factory as loaded.
 */
public record CustomConfig(String tag, Map<String, Object> parameters) implements BehaviorConfig {
  public CustomConfig {
    if (tag == null || tag.isEmpty())
      throw new IllegalArgumentException("custom behavior needs a type tag");
    parameters = Map.copyOf(parameters);
  }

  public CustomConfig(String tag) { this(tag, Map.of()); }
}
