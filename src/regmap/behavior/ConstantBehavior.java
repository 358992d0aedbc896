package regmap.behavior;

import regmap.bus.ReadContext;
import regmap.caps.AccessCapabilities;

/** A read-only field with a fixed value. */
public class ConstantBehavior implements FieldBehavior {
  private static final AccessCapabilities READ_CAPS = AccessCapabilities.builder().build();

  private final long value;

  public ConstantBehavior(long value) { this.value = value; }

  @Override
  public AccessCapabilities getReadCapabilities() {
    return READ_CAPS;
  }

  @Override
  public AccessCapabilities getWriteCapabilities() {
    return null;
  }

  @Override
  public void readNormal(ReadContext ctx) {
    ctx.ack(value);
  }

  public long getValue() { return value; }
}
