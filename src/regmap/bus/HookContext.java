package regmap.bus;

import regmap.caps.AccessCapabilities;

/**
 * What a field hook sees of the current bus access, and how it answers. A hook signals at most one of ack, nack, block
 * and defer; signalling nothing means the field does not respond to the access.
 */
public abstract class HookContext {

  /** The outcome a hook signalled. */
  public enum Outcome { NONE, ACK, NACK, BLOCK, DEFER }

  private final HookMode mode;
  private final AccessCapabilities caps;
  private final long address;
  private final int prot;
  private final int tag;
  private Outcome outcome = Outcome.NONE;

  protected HookContext(HookMode mode, AccessCapabilities caps, long address, int prot, int tag) {
    this.mode = mode;
    this.caps = caps;
    this.address = address;
    this.prot = prot;
    this.tag = tag;
  }

  public HookMode getMode() { return mode; }
  public long getAddress() { return address; }
  /** The 3-bit AXI protection value of the access. */
  public int getProt() { return prot; }
  /** The defer tag of the block, or -1 if it has none. */
  public int getTag() { return tag; }
  public Outcome getOutcome() { return outcome; }

  protected void signal(Outcome newOutcome) {
    if (outcome != Outcome.NONE)
      throw new IllegalStateException("hook signalled " + newOutcome + " after already signalling " + outcome);
    if (mode == HookMode.LOOKAHEAD && newOutcome != Outcome.DEFER)
      throw new IllegalStateException("lookahead hooks may only defer, got " + newOutcome);
    outcome = newOutcome;
  }

  /** Responds with a slave error. */
  public void nack() { signal(Outcome.NACK); }

  /** Stalls the bus; the same access is presented again next cycle. */
  public void block() {
    if (!caps.canBlock())
      throw new IllegalStateException("field blocked the bus without declaring that it can block");
    signal(Outcome.BLOCK);
  }

  /** Accepts the request now; the response is produced by the deferred hook later. */
  public void defer() {
    if (!caps.canDefer())
      throw new IllegalStateException("field deferred an access without declaring that it can defer");
    if (mode == HookMode.DEFERRED)
      throw new IllegalStateException("a deferred access cannot be deferred again");
    signal(Outcome.DEFER);
  }
}
