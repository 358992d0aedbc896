package regmap.config;

import regmap.model.Endianness;

/**
 * One field entry of a register file description, before repetition is expanded.
 *
 * @param name field name, also the base name of repeated fields
 * @param registerName name of the register the field belongs to, or null to use the name of its first field
 * @param address address as accepted by {@link regmap.address.AddressParser}
 * @param highBit highest bit of the field within the register, or null for a full bus word
 * @param lowBit lowest bit of the field within the register, or null for a full bus word
 * @param behavior the behavior configuration
 * @param endianness word order of the register, or null for the register file default
 * @param repeat number of copies of the field
 * @param fieldRepeat number of copies per register, or null for all of them
 * @param stride byte distance between registers of a repetition, or null for the register size
 * @param fieldStride bit distance between fields within a register, or null for the field width
 * @param permissions allowed access kinds
 */
public record FieldConfig(String name, String registerName, Object address, Integer highBit, Integer lowBit, BehaviorConfig behavior,
                          Endianness endianness, int repeat, Integer fieldRepeat, Long stride, Integer fieldStride,
                          PermissionConfig permissions) {
  public FieldConfig {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("field name must not be empty");
    if (address == null)
      throw new IllegalArgumentException("field `" + name + "` has no address");
    if (behavior == null)
      throw new IllegalArgumentException("field `" + name + "` has no behavior");
    if ((highBit == null) != (lowBit == null))
      throw new IllegalArgumentException("field `" + name + "` must specify both or neither end of its bitrange");
    if (highBit != null && (lowBit < 0 || highBit < lowBit))
      throw new IllegalArgumentException("field `" + name + "` has invalid bitrange " + highBit + ".." + lowBit);
    if (repeat < 1)
      throw new IllegalArgumentException("field `" + name + "` must be repeated at least once");
    if (fieldRepeat != null && (fieldRepeat < 1 || fieldRepeat > repeat))
      throw new IllegalArgumentException("field `" + name + "` has field-repeat " + fieldRepeat + " outside 1.." + repeat);
    if (permissions == null)
      permissions = PermissionConfig.ALLOW_ALL;
  }

  public boolean hasBitrange() { return highBit != null; }

  public static Builder builder(String name, Object address, BehaviorConfig behavior) { return new Builder(name, address, behavior); }

  public static class Builder {
    private final String name;
    private final Object address;
    private final BehaviorConfig behavior;
    private String registerName;
    private Integer highBit;
    private Integer lowBit;
    private Endianness endianness;
    private int repeat = 1;
    private Integer fieldRepeat;
    private Long stride;
    private Integer fieldStride;
    private PermissionConfig permissions = PermissionConfig.ALLOW_ALL;

    private Builder(String name, Object address, BehaviorConfig behavior) {
      this.name = name;
      this.address = address;
      this.behavior = behavior;
    }

    public Builder setRegisterName(String registerName) {
      this.registerName = registerName;
      return this;
    }
    public Builder setBitrange(int highBit, int lowBit) {
      this.highBit = highBit;
      this.lowBit = lowBit;
      return this;
    }
    public Builder setBit(int bit) { return setBitrange(bit, bit); }
    public Builder setEndianness(Endianness endianness) {
      this.endianness = endianness;
      return this;
    }
    public Builder setRepeat(int repeat) {
      this.repeat = repeat;
      return this;
    }
    public Builder setFieldRepeat(Integer fieldRepeat) {
      this.fieldRepeat = fieldRepeat;
      return this;
    }
    public Builder setStride(Long stride) {
      this.stride = stride;
      return this;
    }
    public Builder setFieldStride(Integer fieldStride) {
      this.fieldStride = fieldStride;
      return this;
    }
    public Builder setPermissions(PermissionConfig permissions) {
      this.permissions = permissions;
      return this;
    }

    public FieldConfig build() {
      return new FieldConfig(name, registerName, address, highBit, lowBit, behavior, endianness, repeat, fieldRepeat, stride, fieldStride,
                             permissions);
    }
  }
}
