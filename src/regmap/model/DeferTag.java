package regmap.model;

import regmap.address.Direction;

/**
 * Hardware tag identifying which block a deferred request belongs to, so the response logic can route the completion.
 *
 * @param direction the direction the tag is used for
 * @param index the tag value
 * @param owner name of the block that issues it
 */
public record DeferTag(Direction direction, int index, String owner) {
  /** VHDL literal of the tag for the given tag width. */
  public String toLiteral(int width) {
    StringBuilder sb = new StringBuilder(Integer.toBinaryString(index));
    while (sb.length() < width)
      sb.insert(0, '0');
    return "\"" + sb + "\"";
  }
}
