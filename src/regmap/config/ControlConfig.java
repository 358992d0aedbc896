package regmap.config;

/** A read/write register with the given reset value. */
public record ControlConfig(long reset) implements BehaviorConfig {
  public static final String TAG = "control";

  public ControlConfig() { this(0); }

  @Override
  public String tag() {
    return TAG;
  }
}
