package regmap.config;

/** A read-only field driven by the hardware. */
public record StatusConfig() implements BehaviorConfig {
  public static final String TAG = "status";

  @Override
  public String tag() {
    return TAG;
  }
}
