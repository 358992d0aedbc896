package regmap.address;

import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Parses the textual address forms used in register file descriptions into {@link MaskedAddress}es.
 *
 * <ul>
 * <li>integers (and booleans, for one-bit conditions);</li>
 * <li>{@code addr/size}: ignore the {@code size} LSBs;</li>
 * <li>{@code addr|ignore}: ignore the bits set in {@code ignore};</li>
 * <li>{@code addr&care}: only care about the bits set in {@code care};</li>
 * <li>{@code addr} itself can be decimal, {@code 0x} hex with {@code -} wildcard nibbles and {@code [bbbb]} nibble
 * subpatterns, or {@code 0b} binary with {@code -} wildcard bits. {@code _} separates digits.</li>
 * </ul>
 */
public class AddressParser {
  private final int ignoreLsbs;
  private final int width;

  /**
   * @param ignoreLsbs number of LSBs ignored by default, when the address carries no mask
   * @param width address width in bits
   */
  public AddressParser(int ignoreLsbs, int width) {
    MaskedAddress.fullMask(width);
    if (ignoreLsbs < 0 || ignoreLsbs >= width)
      throw new IllegalArgumentException("ignoreLsbs out of range: " + ignoreLsbs);
    this.ignoreLsbs = ignoreLsbs;
    this.width = width;
  }

  public AddressParser() { this(0, MaskedAddress.DEFAULT_WIDTH); }

  public int getIgnoreLsbs() { return ignoreLsbs; }
  public int getWidth() { return width; }

  /**
   * Parses a value as loaded from a description file: a String, a Number or a Boolean.
   */
  public MaskedAddress parse(Object raw) throws RegmapException {
    long fullMask = MaskedAddress.fullMask(width);
    long defaultMask = fullMask & (-1L << ignoreLsbs);
    long value;
    long mask;
    if (raw instanceof Boolean) {
      return MaskedAddress.of((Boolean)raw ? 1 : 0, fullMask, width);
    } else if (raw instanceof Number) {
      value = ((Number)raw).longValue();
      mask = defaultMask;
    } else if (raw instanceof String) {
      long[] parsed = parseString(((String)raw).trim(), fullMask, defaultMask);
      value = parsed[0];
      mask = parsed[1];
    } else {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "cannot interpret " + raw + " as an address");
    }
    if ((value & ~fullMask) != 0)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION,
                                String.format("address 0x%X is out of range for %d bits", value, width));
    mask &= fullMask;
    return MaskedAddress.of(value & mask, mask, width);
  }

  private long[] parseString(String raw, long fullMask, long defaultMask) throws RegmapException {
    String valueText = raw;
    long mask = defaultMask;
    try {
      int sep;
      if ((sep = raw.indexOf('/')) >= 0) {
        valueText = raw.substring(0, sep);
        int size = Integer.parseInt(raw.substring(sep + 1).trim());
        mask = size >= 64 ? 0 : (-1L << size);
      } else if ((sep = raw.indexOf('|')) >= 0) {
        valueText = raw.substring(0, sep);
        mask = ~parseInteger(raw.substring(sep + 1).trim());
      } else if ((sep = raw.indexOf('&')) >= 0) {
        valueText = raw.substring(0, sep);
        mask = parseInteger(raw.substring(sep + 1).trim());
      }
      valueText = valueText.trim();
      if (valueText.isEmpty())
        valueText = "0";
      if (valueText.startsWith("0x"))
        return parseHex(raw, valueText.substring(2), fullMask, mask);
      if (valueText.startsWith("0b"))
        return parseBinary(raw, valueText.substring(2), fullMask, mask);
      return new long[] {Long.parseLong(valueText.replace("_", "")), mask};
    } catch (NumberFormatException | IndexOutOfBoundsException e) {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "invalid address specification '" + raw + "'");
    }
  }

  private long[] parseHex(String raw, String digits, long fullMask, long mask) throws RegmapException {
    long parsedValue = 0;
    long parsedMask = fullMask;
    int i = 0;
    while (i < digits.length()) {
      char c = digits.charAt(i);
      if (c == '_') {
        ++i;
        continue;
      }
      checkRoom(raw, parsedValue, 4);
      if (c == '-') {
        parsedValue <<= 4;
        parsedMask <<= 4;
        ++i;
      } else if (c == '[') {
        if (i + 5 >= digits.length() || digits.charAt(i + 5) != ']')
          throw new RegmapException(DiagnosticCategory.CONFIGURATION, "nibble pattern must be of the form [bbbb] in address '" + raw + "'");
        for (int idx = 1; idx <= 4; ++idx) {
          parsedValue <<= 1;
          parsedMask <<= 1;
          char b = digits.charAt(i + idx);
          if (b == '1') {
            parsedValue |= 1;
            parsedMask |= 1;
          } else if (b == '0') {
            parsedMask |= 1;
          } else if (b != '-') {
            throw new RegmapException(DiagnosticCategory.CONFIGURATION, "illegal bit '" + b + "' in address '" + raw + "'");
          }
        }
        i += 6;
      } else {
        int nibble = Character.digit(c, 16);
        if (nibble < 0)
          throw new RegmapException(DiagnosticCategory.CONFIGURATION, "illegal hex digit '" + c + "' in address '" + raw + "'");
        parsedValue = (parsedValue << 4) | nibble;
        parsedMask = (parsedMask << 4) | 15;
        ++i;
      }
    }
    return new long[] {parsedValue, mask & parsedMask};
  }

  private long[] parseBinary(String raw, String digits, long fullMask, long mask) throws RegmapException {
    long parsedValue = 0;
    long parsedMask = fullMask;
    for (char c : digits.toCharArray()) {
      if (c == '_')
        continue;
      checkRoom(raw, parsedValue, 1);
      parsedValue <<= 1;
      parsedMask <<= 1;
      if (c == '1') {
        parsedValue |= 1;
        parsedMask |= 1;
      } else if (c == '0') {
        parsedMask |= 1;
      } else if (c != '-') {
        throw new RegmapException(DiagnosticCategory.CONFIGURATION, "illegal bit '" + c + "' in address '" + raw + "'");
      }
    }
    return new long[] {parsedValue, mask & parsedMask};
  }

  private void checkRoom(String raw, long parsedValue, int bits) throws RegmapException {
    if ((parsedValue >>> (63 - bits)) != 0)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "address '" + raw + "' is out of range for " + width + " bits");
  }

  /** Parses an integer with an optional 0x, 0b or 0o prefix. */
  static long parseInteger(String text) {
    String t = text.replace("_", "");
    boolean negative = t.startsWith("-");
    if (negative)
      t = t.substring(1);
    long result;
    if (t.startsWith("0x") || t.startsWith("0X"))
      result = Long.parseUnsignedLong(t.substring(2), 16);
    else if (t.startsWith("0b") || t.startsWith("0B"))
      result = Long.parseUnsignedLong(t.substring(2), 2);
    else if (t.startsWith("0o") || t.startsWith("0O"))
      result = Long.parseUnsignedLong(t.substring(2), 8);
    else
      result = Long.parseLong(t);
    return negative ? -result : result;
  }
}
