package regmap.config;

/** A write-only field that pulses the written bits. */
public record StrobeConfig() implements BehaviorConfig {
  public static final String TAG = "strobe";

  @Override
  public String tag() {
    return TAG;
  }
}
