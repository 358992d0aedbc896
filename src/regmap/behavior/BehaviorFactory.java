package regmap.behavior;

import regmap.config.BehaviorConfig;
import regmap.drc.RegmapException;

/** Creates the behavior of one field instance from its configuration. */
@FunctionalInterface
public interface BehaviorFactory {
  /**
   * @param config the behavior configuration, of the kind the factory was registered for
   * @param width width of the field in bits
   */
  FieldBehavior create(BehaviorConfig config, int width) throws RegmapException;
}
