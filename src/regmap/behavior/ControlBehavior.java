package regmap.behavior;

import regmap.bus.ReadContext;
import regmap.bus.WriteContext;
import regmap.caps.AccessCapabilities;
import regmap.caps.NoOpMethod;

/**
 * A plain read/write register. Byte strobes select which bits are written.
 */
public class ControlBehavior implements FieldBehavior {
  private static final AccessCapabilities READ_CAPS = AccessCapabilities.builder().build();
  private static final AccessCapabilities WRITE_CAPS = AccessCapabilities.builder().setNoOpMethod(NoOpMethod.WRITE_CURRENT_OR_MASK).build();

  private final long fieldMask;
  private long value;
  private int writeCount = 0;

  public ControlBehavior(int width, long reset) {
    this.fieldMask = width >= 64 ? -1L : (1L << width) - 1;
    this.value = reset & fieldMask;
  }

  @Override
  public AccessCapabilities getReadCapabilities() {
    return READ_CAPS;
  }

  @Override
  public AccessCapabilities getWriteCapabilities() {
    return WRITE_CAPS;
  }

  @Override
  public void readNormal(ReadContext ctx) {
    ctx.ack(value);
  }

  @Override
  public void writeNormal(WriteContext ctx) {
    value = ctx.apply(value) & fieldMask;
    ++writeCount;
    ctx.ack();
  }

  /** The register value as seen by the hardware. */
  public long getValue() { return value; }

  /** Number of writes that reached this register, including fully masked ones. */
  public int getWriteCount() { return writeCount; }
}
