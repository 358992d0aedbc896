package regmap.caps;

import regmap.address.MaskedAddress;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Access permissions derived from the AXI {@code prot} bits. The permissions are a 3-bit pattern that a transaction's
 * {@code prot} value must match:
 * bit 2 is data (0) or instruction (1), bit 1 secure (0) or nonsecure (1), bit 0 user (0) or privileged (1).
 */
public final class Permissions {
  public static final Permissions ALL = new Permissions(MaskedAddress.dontCare(3));

  private final MaskedAddress pattern;

  private Permissions(MaskedAddress pattern) { this.pattern = pattern; }

  /**
   * Builds the prot pattern from six allow flags.
   * @throws RegmapException if both sides of an axis are denied
   */
  public static Permissions of(boolean user, boolean privileged, boolean secure, boolean nonsecure, boolean data, boolean instruction)
      throws RegmapException {
    String bits = axis(data, instruction, "data", "instruction") + axis(secure, nonsecure, "secure", "nonsecure") +
                  axis(user, privileged, "user", "privileged");
    return new Permissions(MaskedAddress.fromBitString(bits));
  }

  private static String axis(boolean zeroAllowed, boolean oneAllowed, String zeroName, String oneName) throws RegmapException {
    if (zeroAllowed && oneAllowed)
      return "-";
    if (zeroAllowed)
      return "0";
    if (oneAllowed)
      return "1";
    throw new RegmapException(DiagnosticCategory.PERMISSION_CONFLICT, "cannot deny both " + zeroName + " and " + oneName + " accesses");
  }

  public boolean matches(int prot) { return pattern.matches(prot & 7); }

  /** Whether any kind of access is denied. */
  public boolean isProtected() { return !pattern.matchesAll(); }

  public MaskedAddress getPattern() { return pattern; }

  /** The pattern as a three character string, MSB first. */
  public String getMask() { return pattern.toBitString(); }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Permissions && ((Permissions)obj).pattern.equals(pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return "prot=" + getMask();
  }
}
