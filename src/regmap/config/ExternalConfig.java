package regmap.config;

/**
 * A field forwarded to outside logic.
 *
 * @param readable whether reads are forwarded
 * @param writable whether writes are forwarded
 * @param deferring whether multiple requests may be outstanding
 */
public record ExternalConfig(boolean readable, boolean writable, boolean deferring) implements BehaviorConfig {
  public static final String TAG = "external";

  public ExternalConfig {
    if (!readable && !writable)
      throw new IllegalArgumentException("external field must be readable, writable or both");
  }

  @Override
  public String tag() {
    return TAG;
  }
}
