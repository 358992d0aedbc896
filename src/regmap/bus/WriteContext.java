package regmap.bus;

import regmap.caps.AccessCapabilities;

/**
 * Context of a write hook. Data and strobe are already sliced to the field: bit 0 is the field's LSB, and a strobe bit is
 * set for every field bit covered by an active byte strobe.
 */
public class WriteContext extends HookContext {
  private final long data;
  private final long strobe;

  public WriteContext(HookMode mode, AccessCapabilities caps, long address, int prot, int tag, long data, long strobe) {
    super(mode, caps, address, prot, tag);
    this.data = data;
    this.strobe = strobe;
  }

  public long getData() { return data; }
  public long getStrobe() { return strobe; }

  /** Whether no bit of the field is written. */
  public boolean isMasked() { return strobe == 0; }

  /** Merges the written bits into the given value. */
  public long apply(long current) { return (current & ~strobe) | (data & strobe); }

  /** Completes the write. */
  public void ack() { signal(Outcome.ACK); }
}
