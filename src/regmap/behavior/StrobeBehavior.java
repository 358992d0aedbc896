package regmap.behavior;

import regmap.bus.WriteContext;
import regmap.caps.AccessCapabilities;
import regmap.caps.NoOpMethod;

/**
 * A write-only field that pulses the written bits for one cycle. Writing zero does nothing.
 */
public class StrobeBehavior implements FieldBehavior {
  private static final AccessCapabilities WRITE_CAPS =
      AccessCapabilities.builder().setVolatile(true).setNoOpMethod(NoOpMethod.WRITE_ZERO).build();

  private long pulse = 0;
  private long accumulated = 0;

  @Override
  public AccessCapabilities getReadCapabilities() {
    return null;
  }

  @Override
  public AccessCapabilities getWriteCapabilities() {
    return WRITE_CAPS;
  }

  @Override
  public void onCycle() {
    pulse = 0;
  }

  @Override
  public void writeNormal(WriteContext ctx) {
    pulse = ctx.getData() & ctx.getStrobe();
    accumulated |= pulse;
    ctx.ack();
  }

  /** Bits pulsed in the current cycle. */
  public long getPulse() { return pulse; }

  /** Returns all bits pulsed since the last call, and clears them. */
  public long takeAccumulated() {
    long ret = accumulated;
    accumulated = 0;
    return ret;
  }
}
