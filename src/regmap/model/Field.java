package regmap.model;

import regmap.address.Direction;
import regmap.address.MaskedAddress;
import regmap.behavior.FieldBehavior;
import regmap.caps.AccessCapabilities;
import regmap.caps.FieldAccess;
import regmap.caps.Permissions;

/**
 * One field instance: a bit range within a register, with its behavior. Bits are numbered across the whole register, so
 * in a multi-word register they may exceed the bus width.
 */
public class Field {
  private final String name;
  private final String descriptorName;
  private final int index;
  private final MaskedAddress address;
  private final int lowBit;
  private final int width;
  private final FieldBehavior behavior;
  private final FieldAccess access;
  private final Permissions permissions;
  private final Endianness endianness;
  Register register;

  /**
   * @param name unique name of this instance
   * @param descriptorName name of the field entry this instance was expanded from
   * @param index repetition index, 0 if not repeated
   * @param endianness word order requested by the field, or null if it has no preference
   */
  public Field(String name, String descriptorName, int index, MaskedAddress address, int lowBit, int width, FieldBehavior behavior,
               FieldAccess access, Permissions permissions, Endianness endianness) {
    this.name = name;
    this.descriptorName = descriptorName;
    this.index = index;
    this.address = address;
    this.lowBit = lowBit;
    this.width = width;
    this.behavior = behavior;
    this.access = access;
    this.permissions = permissions;
    this.endianness = endianness;
  }

  public String getName() { return name; }
  public String getDescriptorName() { return descriptorName; }
  public int getIndex() { return index; }
  public MaskedAddress getAddress() { return address; }
  public int getLowBit() { return lowBit; }
  public int getHighBit() { return lowBit + width - 1; }
  public int getWidth() { return width; }
  public FieldBehavior getBehavior() { return behavior; }
  public FieldAccess getAccess() { return access; }
  public Permissions getPermissions() { return permissions; }
  /** Word order requested by this field, or null. */
  public Endianness getEndianness() { return endianness; }
  public Register getRegister() { return register; }

  /** Capabilities for the given direction, or null if the field does not support it. */
  public AccessCapabilities getCapabilities(Direction direction) { return access.get(direction); }

  public boolean supports(Direction direction) { return access.get(direction) != null; }

  /** Whether an access with the given AXI prot value can see this field. */
  public boolean isVisibleTo(int prot) { return permissions.matches(prot); }

  /** Mask of the field's bits, LSB aligned. */
  public long getValueMask() { return width >= 64 ? -1L : (1L << width) - 1; }

  @Override
  public String toString() {
    return "field `" + name + "` (" + address.toDocString() + ":" + getHighBit() + ".." + lowBit + ")";
  }
}
