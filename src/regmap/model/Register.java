package regmap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import regmap.address.Direction;
import regmap.address.MaskedAddress;
import regmap.caps.AccessCapabilities;

/**
 * Fields sharing one base address. A register spans one or more bus words, each of which is a block; multi-word
 * registers are accessed atomically through a holding buffer.
 */
public class Register {
  private final String name;
  private final MaskedAddress address;
  private final Endianness endianness;
  private final int busWidth;
  private final int wordCount;
  private final List<Field> fields;
  private final Map<Direction, AccessCapabilities> capabilities = new EnumMap<>(Direction.class);
  private final Map<Direction, List<Block>> blocks = new EnumMap<>(Direction.class);

  Register(String name, MaskedAddress address, Endianness endianness, int busWidth, int wordCount, List<Field> fields) {
    this.name = name;
    this.address = address;
    this.endianness = endianness;
    this.busWidth = busWidth;
    this.wordCount = wordCount;
    this.fields = List.copyOf(fields);
    for (Field field : this.fields)
      field.register = this;
  }

  public String getName() { return name; }
  public MaskedAddress getAddress() { return address; }
  public Endianness getEndianness() { return endianness; }
  public int getBusWidth() { return busWidth; }
  public int getWordCount() { return wordCount; }
  public List<Field> getFields() { return fields; }

  /** Fields supporting the given direction, in declaration order. */
  public List<Field> getFields(Direction direction) {
    List<Field> ret = new ArrayList<>();
    for (Field field : fields)
      if (field.supports(direction))
        ret.add(field);
    return ret;
  }

  /** Combined capabilities of the fields for the given direction, or null if none of them supports it. */
  public AccessCapabilities getCapabilities(Direction direction) { return capabilities.get(direction); }

  public boolean supports(Direction direction) { return capabilities.containsKey(direction); }

  /** Blocks in ascending address order; empty if the register does not support the direction. */
  public List<Block> getBlocks(Direction direction) { return Collections.unmodifiableList(blocks.getOrDefault(direction, List.of())); }

  /** Whether the register's hooks may defer accesses in the given direction. */
  public boolean isDeferring(Direction direction) {
    AccessCapabilities caps = capabilities.get(direction);
    return caps != null && caps.canDefer();
  }

  /** Lowest register bit held by the block with the given index. */
  public int getWordBitOffset(int blockIndex) {
    if (endianness == Endianness.BIG)
      return (wordCount - 1 - blockIndex) * busWidth;
    return blockIndex * busWidth;
  }

  void setCapabilities(Direction direction, AccessCapabilities caps) { capabilities.put(direction, caps); }

  void setBlocks(Direction direction, List<Block> list) { blocks.put(direction, List.copyOf(list)); }

  @Override
  public String toString() {
    return "register `" + name + "` at " + address.toDocString();
  }
}
