package regmap.config;

/** A read-only field with a fixed value. */
public record ConstantConfig(long value) implements BehaviorConfig {
  public static final String TAG = "constant";

  @Override
  public String tag() {
    return TAG;
  }
}
