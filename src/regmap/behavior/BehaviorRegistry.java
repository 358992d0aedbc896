package regmap.behavior;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.config.BehaviorConfig;
import regmap.config.ConstantConfig;
import regmap.config.ControlConfig;
import regmap.config.ExternalConfig;
import regmap.config.StatusConfig;
import regmap.config.StrobeConfig;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Maps behavior tags to the factories that create them. A registry is an ordinary object owned by one compilation.
 */
public class BehaviorRegistry {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Map<String, BehaviorFactory> factories = new LinkedHashMap<>();

  /** An empty registry. */
  public BehaviorRegistry() {}

  /** A registry holding the built-in behaviors. */
  public static BehaviorRegistry standard() {
    BehaviorRegistry registry = new BehaviorRegistry();
    registry.register(ConstantConfig.TAG, (config, width) -> {
      long value = as(config, ConstantConfig.class).value();
      if (width < 64 && (value >>> width) != 0 && (value >> (width - 1)) != -1L)
        throw new RegmapException(DiagnosticCategory.CONFIGURATION, String.format("constant 0x%X does not fit into %d bits", value, width));
      return new ConstantBehavior(width >= 64 ? value : value & ((1L << width) - 1));
    });
    registry.register(ControlConfig.TAG, (config, width) -> new ControlBehavior(width, as(config, ControlConfig.class).reset()));
    registry.register(StatusConfig.TAG, (config, width) -> new StatusBehavior(width));
    registry.register(StrobeConfig.TAG, (config, width) -> new StrobeBehavior());
    registry.register(ExternalConfig.TAG, (config, width) -> {
      ExternalConfig external = as(config, ExternalConfig.class);
      return new ExternalBehavior(external.readable(), external.writable(), external.deferring());
    });
    return registry;
  }

  /** Registers a factory; a later registration for the same tag replaces the earlier one. */
  public BehaviorRegistry register(String tag, BehaviorFactory factory) {
    if (factories.put(tag, factory) != null)
      logger.debug("Replacing behavior factory for '{}'", tag);
    return this;
  }

  public boolean isRegistered(String tag) { return factories.containsKey(tag); }

  public Set<String> getTags() { return factories.keySet(); }

  public FieldBehavior create(BehaviorConfig config, int width) throws RegmapException {
    BehaviorFactory factory = factories.get(config.tag());
    if (factory == null)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "unknown behavior '" + config.tag() + "', expected one of " + factories.keySet());
    FieldBehavior behavior = factory.create(config, width);
    if (behavior == null)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "behavior factory for '" + config.tag() + "' returned nothing");
    return behavior;
  }

  private static <C extends BehaviorConfig> C as(BehaviorConfig config, Class<C> type) throws RegmapException {
    if (!type.isInstance(config))
      throw new RegmapException(DiagnosticCategory.CONFIGURATION,
                                "behavior '" + config.tag() + "' expects a " + type.getSimpleName() + ", got " + config.getClass().getSimpleName());
    return type.cast(config);
  }
}
