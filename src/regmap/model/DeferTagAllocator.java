package regmap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import regmap.address.Direction;

/**
 * Hands out defer tags for one direction, numbered from zero in allocation order.
 */
public class DeferTagAllocator {
  private final Direction direction;
  private final List<DeferTag> tags = new ArrayList<>();

  public DeferTagAllocator(Direction direction) { this.direction = direction; }

  public DeferTag allocate(String owner) {
    DeferTag tag = new DeferTag(direction, tags.size(), owner);
    tags.add(tag);
    return tag;
  }

  public int getCount() { return tags.size(); }

  /** Width of the tag signal: enough bits for the highest tag, and at least one. */
  public int getWidth() {
    int count = tags.size();
    if (count <= 1)
      return 1;
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(count - 1));
  }

  public List<DeferTag> getTags() { return Collections.unmodifiableList(tags); }

  public Direction getDirection() { return direction; }
}
