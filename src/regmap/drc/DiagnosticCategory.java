package regmap.drc;

/**
 * Category of a compile-time diagnostic. The human-readable name is part of every rendered message.
 */
public enum DiagnosticCategory {
  DECODE_CONFLICT("decode conflict"),
  SIBLING_CAPABILITY_CONFLICT("sibling capability conflict"),
  ADDRESS_ARITHMETIC("address arithmetic overflow"),
  PERMISSION_CONFLICT("permission conflict"),
  MASKING_INFEASIBLE("masking infeasible"),
  CONFIGURATION("configuration error");

  private final String displayName;

  DiagnosticCategory(String displayName) { this.displayName = displayName; }

  public String getDisplayName() { return displayName; }

  @Override
  public String toString() {
    return displayName;
  }
}
