package regmap.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import regmap.address.AddressSpace;
import regmap.address.Direction;

/**
 * A compiled register file: registers with their fields and blocks, the frozen address spaces of both directions and
 * the defer tags.
 */
public class RegisterFile {
  private final String name;
  private final int busWidth;
  private final List<Register> registers;
  private final Map<String, Field> fieldsByName = new LinkedHashMap<>();
  private final Map<Direction, AddressSpace<Block>> addressSpaces = new EnumMap<>(Direction.class);
  private final Map<Direction, DeferTagAllocator> deferTags = new EnumMap<>(Direction.class);

  RegisterFile(String name, int busWidth, List<Register> registers, AddressSpace<Block> readSpace, AddressSpace<Block> writeSpace,
               DeferTagAllocator readTags, DeferTagAllocator writeTags) {
    this.name = name;
    this.busWidth = busWidth;
    this.registers = List.copyOf(registers);
    for (Register register : this.registers)
      for (Field field : register.getFields())
        fieldsByName.putIfAbsent(field.getName(), field);
    addressSpaces.put(Direction.READ, readSpace);
    addressSpaces.put(Direction.WRITE, writeSpace);
    deferTags.put(Direction.READ, readTags);
    deferTags.put(Direction.WRITE, writeTags);
  }

  public String getName() { return name; }
  public int getBusWidth() { return busWidth; }
  /** Bus word size in bytes. */
  public int getWordBytes() { return busWidth / 8; }
  public List<Register> getRegisters() { return registers; }

  public List<Field> getFields() {
    List<Field> ret = new ArrayList<>();
    for (Register register : registers)
      ret.addAll(register.getFields());
    return ret;
  }

  /** The field with the given name, or null. */
  public Field getField(String fieldName) { return fieldsByName.get(fieldName); }

  public Register getRegister(String registerName) {
    for (Register register : registers)
      if (register.getName().equals(registerName))
        return register;
    return null;
  }

  public AddressSpace<Block> getAddressSpace(Direction direction) { return addressSpaces.get(direction); }

  public DeferTagAllocator getDeferTags(Direction direction) { return deferTags.get(direction); }
}
