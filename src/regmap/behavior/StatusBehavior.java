package regmap.behavior;

import regmap.bus.ReadContext;
import regmap.caps.AccessCapabilities;

/** A read-only field reflecting a value driven by the hardware. */
public class StatusBehavior implements FieldBehavior {
  private static final AccessCapabilities READ_CAPS = AccessCapabilities.builder().build();

  private final long fieldMask;
  private long value = 0;

  public StatusBehavior(int width) { this.fieldMask = width >= 64 ? -1L : (1L << width) - 1; }

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

  /** Drives the status value. */
  public void setValue(long value) { this.value = value & fieldMask; }

  public long getValue() { return value; }
}
