package regmap.caps;

/**
 * The cheapest way to access the register a field lives in without affecting the field, ordered from cheapest to most
 * restrictive.
 */
public enum NoOpMethod {
  /** Any access is a no-op for this field. */
  ALWAYS,
  /** Writing zero is a no-op. */
  WRITE_ZERO,
  /** Writing the current value is a no-op. */
  WRITE_CURRENT,
  /** Writing the current value or masking the field with byte strobes is a no-op. */
  WRITE_CURRENT_OR_MASK,
  /** Masking the field with byte strobes is a no-op. */
  MASK,
  /** There is no way to access the register without affecting this field. */
  NEVER;

  /** Reads cannot be masked, so only {@link #ALWAYS} and {@link #NEVER} make sense for them. */
  public boolean isValidForRead() {
    return switch (this) {
      case ALWAYS, NEVER -> true;
      case WRITE_ZERO, WRITE_CURRENT, WRITE_CURRENT_OR_MASK, MASK -> false;
    };
  }
}
