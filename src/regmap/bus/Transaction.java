package regmap.bus;

import regmap.address.Direction;

/**
 * One bus transaction submitted to a {@link BusSimulator}. The simulator fills in the response once the master has
 * accepted it.
 */
public final class Transaction {
  private final Direction direction;
  private final long address;
  private final int prot;
  private final long data;
  private final int strobe;
  private final long submitCycle;
  private BusResponse response;
  private long readData;
  private long completeCycle = -1;

  Transaction(Direction direction, long address, int prot, long data, int strobe, long submitCycle) {
    this.direction = direction;
    this.address = address;
    this.prot = prot;
    this.data = data;
    this.strobe = strobe;
    this.submitCycle = submitCycle;
  }

  public Direction getDirection() { return direction; }
  public long getAddress() { return address; }
  public int getProt() { return prot; }
  /** Write data; unused for reads. */
  public long getWriteData() { return data; }
  /** Byte strobes of a write, bit {@code i} for byte lane {@code i}. */
  public int getStrobe() { return strobe; }
  public long getSubmitCycle() { return submitCycle; }

  public boolean isDone() { return response != null; }
  /** The response, or null while the transaction is in flight. */
  public BusResponse getResponse() { return response; }
  /** Read data; zero unless the read completed with OKAY. */
  public long getReadData() { return readData; }
  public long getCompleteCycle() { return completeCycle; }

  void complete(BusResponse response, long readData, long cycle) {
    this.response = response;
    this.readData = readData;
    this.completeCycle = cycle;
  }

  @Override
  public String toString() {
    String ret = direction + String.format(" 0x%08X prot=%d", address, prot);
    if (direction == Direction.WRITE)
      ret += String.format(" data=0x%X strobe=0x%X", data, strobe);
    if (response != null)
      ret += " -> " + response;
    return ret;
  }
}
