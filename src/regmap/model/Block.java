package regmap.model;

import java.util.List;
import regmap.address.Direction;
import regmap.address.MaskedAddress;
import regmap.caps.AccessCapabilities;

/**
 * One bus word of a register in one direction. Fields hook into the first block for reads and into the last block for
 * writes; the other blocks only access the register's holding buffer.
 */
public class Block {
  private final Register register;
  private final Direction direction;
  private final int index;
  private final MaskedAddress address;
  private final String name;
  private final String owner;
  DeferTag deferTag;

  Block(Register register, Direction direction, int index, MaskedAddress address, String name, String owner) {
    this.register = register;
    this.direction = direction;
    this.index = index;
    this.address = address;
    this.name = name;
    this.owner = owner;
  }

  public Register getRegister() { return register; }
  public Direction getDirection() { return direction; }
  /** Index of the block within its register, in ascending address order. */
  public int getIndex() { return index; }
  public MaskedAddress getAddress() { return address; }
  public String getName() { return name; }
  /** Description used in diagnostics, like {@code block "ctrl_high"}. */
  public String getOwner() { return owner; }
  /** The defer tag of this block, or null if it does not defer. */
  public DeferTag getDeferTag() { return deferTag; }

  public boolean isFirst() { return index == 0; }
  public boolean isLast() { return index == register.getWordCount() - 1; }

  /** Whether accessing this block calls the field hooks. */
  public boolean isHookBlock() { return direction == Direction.READ ? isFirst() : isLast(); }

  /** Fields whose hooks this block calls. */
  public List<Field> getHookFields() { return isHookBlock() ? register.getFields(direction) : List.of(); }

  /** Bit offset of this block's word within the register. */
  public int getBitOffset() { return register.getWordBitOffset(index); }

  public AccessCapabilities getCapabilities() { return register.getCapabilities(direction); }

  @Override
  public String toString() {
    return owner + " at " + address.toDocString() + " (" + direction + ")";
  }
}
