package regmap.address;

import java.util.List;
import java.util.Optional;
import regmap.drc.Diagnostic;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * A fixed-width address pattern in which every bit is either 0, 1 or don't care.
 * Stored as a value and a care mask (mask bit 1 = cared about), with {@code value & ~mask == 0}.
 * Immutable.
 */
public final class MaskedAddress implements Comparable<MaskedAddress> {
  public static final int DEFAULT_WIDTH = 32;
  public static final int MAX_WIDTH = 63;

  private final long value;
  private final long mask;
  private final int width;

  private MaskedAddress(long value, long mask, int width) {
    this.value = value;
    this.mask = mask;
    this.width = width;
  }

  public static long fullMask(int width) {
    if (width < 1 || width > MAX_WIDTH)
      throw new IllegalArgumentException("address width must be between 1 and " + MAX_WIDTH + ", got " + width);
    return (1L << width) - 1;
  }

  /** Creates a pattern matching exactly one address. */
  public static MaskedAddress of(long address, int width) { return of(address, -1L, width); }

  /**
   * Creates a pattern from an address and a care mask. Mask bits beyond the width are dropped, value bits outside the mask
   * are cleared.
   * @throws IllegalArgumentException if the address does not fit into the width
   */
  public static MaskedAddress of(long address, long mask, int width) {
    long full = fullMask(width);
    if ((address & ~full) != 0)
      throw new IllegalArgumentException(String.format("address 0x%X is out of range for %d bits", address, width));
    mask &= full;
    return new MaskedAddress(address & mask, mask, width);
  }

  /** Pattern that matches every address of the given width. */
  public static MaskedAddress dontCare(int width) {
    fullMask(width);
    return new MaskedAddress(0, 0, width);
  }

  /**
   * Parses a MSB-first string of '0', '1' and '-' characters. The string length is the width.
   */
  public static MaskedAddress fromBitString(String bits) {
    int width = bits.length();
    fullMask(width);
    long value = 0;
    long mask = 0;
    for (char c : bits.toCharArray()) {
      value <<= 1;
      mask <<= 1;
      switch (c) {
      case '1':
        value |= 1;
        mask |= 1;
        break;
      case '0':
        mask |= 1;
        break;
      case '-':
        break;
      default:
        throw new IllegalArgumentException("illegal character '" + c + "' in address pattern " + bits);
      }
    }
    return new MaskedAddress(value, mask, width);
  }

  public long getValue() { return value; }
  public long getMask() { return mask; }
  public int getWidth() { return width; }

  /** Bits that are not cared about. */
  public long getIgnored() { return ~mask & fullMask(width); }

  public boolean isFullyMasked() { return mask == fullMask(width); }
  public boolean matchesAll() { return mask == 0; }

  public boolean matches(long address) { return ((address ^ value) & mask) == 0; }

  public boolean overlaps(MaskedAddress other) { return (mask & other.mask & (value ^ other.value)) == 0; }

  /**
   * Returns the pattern of addresses matched by both this and the other pattern, or empty if there are none.
   */
  public Optional<MaskedAddress> common(MaskedAddress other) {
    if (!overlaps(other))
      return Optional.empty();
    return Optional.of(new MaskedAddress(value | other.value, mask | other.mask, Math.max(width, other.width)));
  }

  /**
   * Shifts left, shifting in don't cares.
   * @throws RegmapException if a cared-about bit is shifted out of the address width
   */
  public MaskedAddress shiftLeft(int amount) throws RegmapException {
    long full = fullMask(width);
    if (mask != 0 && (amount >= width || ((mask << amount) & ~full) != 0))
      throw arithmeticError("overflow during address shift");
    if (amount >= width)
      return new MaskedAddress(0, 0, width);
    return new MaskedAddress(value << amount, mask << amount, width);
  }

  /** Shifts right, shifting in don't cares. Cared bits shifted below bit 0 are dropped. */
  public MaskedAddress shiftRight(int amount) {
    if (amount >= 64)
      return new MaskedAddress(0, 0, width);
    return new MaskedAddress(value >>> amount, mask >>> amount, width);
  }

  /** Removes the match conditions for all bits not set in the given mask. */
  public MaskedAddress and(long keep) { return new MaskedAddress(value & keep, mask & keep, width); }

  /**
   * Combines two patterns that care about disjoint bits into one that matches iff both match.
   */
  public MaskedAddress combine(MaskedAddress other) {
    if ((mask & other.mask) != 0)
      throw new IllegalArgumentException("cannot combine address patterns with overlapping care masks: " + this + " and " + other);
    return new MaskedAddress(value | other.value, mask | other.mask, Math.max(width, other.width));
  }

  /**
   * Adds a (possibly negative) number to the cared-about bits of this pattern. Carries skip over don't-care bits.
   * @throws RegmapException on overflow, underflow, or when the summand needs more bits than the pattern cares about
   */
  public MaskedAddress add(long summand) throws RegmapException {
    long address = value;
    long remaining = summand;
    int carry = 0;
    for (int bit = 0; bit < width; ++bit) {
      long bitm = 1L << bit;
      if ((mask & bitm) == 0)
        continue;
      int inBit = (int)(remaining & 1);
      remaining >>= 1;
      int current = (address & bitm) != 0 ? 1 : 0;
      int sum = inBit + carry + current;
      if (((sum & 1) ^ current) != 0)
        address ^= bitm;
      carry = sum >> 1;
    }
    if (remaining == 0) {
      if (carry != 0)
        throw arithmeticError("overflow during address addition");
    } else if (remaining == -1) {
      if (carry == 0)
        throw arithmeticError("underflow during address addition");
    } else {
      throw arithmeticError("address summand out of range");
    }
    return new MaskedAddress(address, mask, width);
  }

  private RegmapException arithmeticError(String message) {
    return new RegmapException(new Diagnostic(DiagnosticCategory.ADDRESS_ARITHMETIC, message, List.of(), List.of(this), null));
  }

  /** MSB-first string of '0', '1' and '-'. */
  public String toBitString() {
    StringBuilder sb = new StringBuilder(width);
    for (int bit = width - 1; bit >= 0; --bit) {
      long bitm = 1L << bit;
      if ((mask & bitm) == 0)
        sb.append('-');
      else
        sb.append((value & bitm) != 0 ? '1' : '0');
    }
    return sb.toString();
  }

  /** Renders as {@code 0x<value>/0x<mask>}, zero padded to the width. */
  public String toHexMask() {
    int digits = (width + 3) / 4;
    return String.format("0x%0" + digits + "X/0x%0" + digits + "X", value, mask);
  }

  /**
   * Renders the most readable form: '-' if nothing is cared about, the plain hex value if everything is,
   * {@code 0x.../N} if only the N LSBs are ignored, or a binary string with dashes otherwise.
   */
  public String toDocString() {
    if (mask == 0)
      return "-";
    String hex = width <= 1 ? Long.toString(value) : String.format("0x%0" + ((width + 3) / 4) + "X", value);
    if (isFullyMasked())
      return hex;
    long inv = getIgnored();
    int lsbsIgnored = 64 - Long.numberOfLeadingZeros(inv);
    if (inv == (1L << lsbsIgnored) - 1)
      return hex + "/" + lsbsIgnored;
    return "0b" + toBitString();
  }

  @Override
  public int compareTo(MaskedAddress o) {
    int cmp = Long.compareUnsigned(value, o.value);
    if (cmp != 0)
      return cmp;
    cmp = Long.compareUnsigned(o.mask, mask);
    if (cmp != 0)
      return cmp;
    return Integer.compare(width, o.width);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof MaskedAddress))
      return false;
    MaskedAddress other = (MaskedAddress)obj;
    return value == other.value && mask == other.mask && width == other.width;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value) * 31 * 31 + Long.hashCode(mask) * 31 + width;
  }

  @Override
  public String toString() {
    return toDocString();
  }
}
