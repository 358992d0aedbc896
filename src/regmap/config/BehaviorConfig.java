package regmap.config;

/**
 * Configuration of a field behavior. Each behavior kind has its own record; the tag selects the factory in the behavior
 * registry.
 */
public interface BehaviorConfig {
  String tag();
}
