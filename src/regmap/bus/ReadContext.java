package regmap.bus;

import regmap.caps.AccessCapabilities;

/** Context of a read hook. */
public class ReadContext extends HookContext {
  private long data;

  public ReadContext(HookMode mode, AccessCapabilities caps, long address, int prot, int tag) { super(mode, caps, address, prot, tag); }

  /** Completes the read with the given field value. */
  public void ack(long data) {
    signal(Outcome.ACK);
    this.data = data;
  }

  public long getData() { return data; }
}
