package regmap.config;

import java.util.ArrayList;
import java.util.List;
import regmap.model.Endianness;

/**
 * A complete register file description.
 *
 * @param name name of the register file, used for output file names
 * @param busWidth data width of the bus in bits, 32 or 64
 * @param endianness default word order of multi-word registers
 * @param fields the field entries in declaration order
 */
public record RegisterFileConfig(String name, int busWidth, Endianness endianness, List<FieldConfig> fields) {
  public RegisterFileConfig {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("register file name must not be empty");
    if (busWidth != 32 && busWidth != 64)
      throw new IllegalArgumentException("bus width must be 32 or 64, got " + busWidth);
    if (endianness == null)
      endianness = Endianness.LITTLE;
    fields = List.copyOf(fields);
  }

  public static Builder builder(String name) { return new Builder(name); }

  public static class Builder {
    private final String name;
    private int busWidth = 32;
    private Endianness endianness = Endianness.LITTLE;
    private final List<FieldConfig> fields = new ArrayList<>();

    private Builder(String name) { this.name = name; }

    public Builder setBusWidth(int busWidth) {
      this.busWidth = busWidth;
      return this;
    }
    public Builder setEndianness(Endianness endianness) {
      this.endianness = endianness;
      return this;
    }
    public Builder addField(FieldConfig field) {
      fields.add(field);
      return this;
    }

    public RegisterFileConfig build() { return new RegisterFileConfig(name, busWidth, endianness, fields); }
  }
}
