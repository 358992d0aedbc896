package regmap.bus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.address.Direction;
import regmap.behavior.FieldBehavior;
import regmap.decoder.DecoderNode;
import regmap.decoder.DecoderSynthesizer;
import regmap.drc.RegmapException;
import regmap.model.Block;
import regmap.model.Field;
import regmap.model.Register;
import regmap.model.RegisterFile;

/**
 * Cycle model of the bus side of a compiled register file. Each direction handles at most one request per cycle:
 * <ul>
 * <li>if the response slot is free and no deferred requests are outstanding, the addressed fields' normal hooks run
 * and may acknowledge, refuse, block or defer;</li>
 * <li>otherwise the lookahead hooks run, which may only defer;</li>
 * <li>deferred requests are completed in issue order through the deferred hooks whenever the response slot is free.</li>
 * </ul>
 * Responses wait in a one-entry slot until the master accepts them, see {@link #setResponseReady}.
 */
public class BusSimulator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_MAX_CYCLES = 1000;

  /** Result of a blocking read. */
  public record ReadResult(BusResponse response, long data) {
    public boolean isOkay() { return response == BusResponse.OKAY; }
  }

  /** An accepted request waiting for its completion; writes keep the field's data and strobe. */
  private record Deferred(Transaction transaction, Block block, Field field, long data, long strobe) {}

  private record Response(Transaction transaction, BusResponse response, long data) {}

  private class Channel {
    final Direction direction;
    final DecoderNode<Block> decoder;
    final ArrayDeque<Transaction> requests = new ArrayDeque<>();
    final ArrayDeque<Deferred> deferred = new ArrayDeque<>();
    Response slot = null;
    boolean masterReady = true;

    Channel(Direction direction, DecoderNode<Block> decoder) {
      this.direction = direction;
      this.decoder = decoder;
    }

    boolean isIdle() { return requests.isEmpty() && deferred.isEmpty() && slot == null; }
  }

  private final RegisterFile registerFile;
  private final Map<Direction, Channel> channels = new EnumMap<>(Direction.class);
  private final Map<Register, RegisterBuffers> buffers = new HashMap<>();
  private long cycle = 0;
  private int maxCycles = DEFAULT_MAX_CYCLES;

  public BusSimulator(RegisterFile registerFile) throws RegmapException {
    this.registerFile = registerFile;
    for (Direction direction : Direction.values()) {
      // the unoptimized decoder checks every cared bit, so unmapped addresses decode to nothing
      DecoderSynthesizer<Block> synthesizer = new DecoderSynthesizer<>(registerFile.getAddressSpace(direction).getWidth(), false);
      synthesizer.addAll(registerFile.getAddressSpace(direction));
      channels.put(direction, new Channel(direction, synthesizer.synthesize()));
    }
    for (Register register : registerFile.getRegisters())
      buffers.put(register, new RegisterBuffers(register.getWordCount() * registerFile.getBusWidth()));
  }

  public RegisterFile getRegisterFile() { return registerFile; }
  public long getCycle() { return cycle; }

  /** Limit for the blocking helpers, after which they give up with an exception. */
  public void setMaxCycles(int maxCycles) { this.maxCycles = maxCycles; }

  /** Models master backpressure: while not ready, responses stay in the slot. */
  public void setResponseReady(Direction direction, boolean ready) { channels.get(direction).masterReady = ready; }

  /** Number of accepted requests still waiting for their deferred completion. */
  public int getDeferredCount(Direction direction) { return channels.get(direction).deferred.size(); }

  public boolean isIdle() {
    for (Channel channel : channels.values())
      if (!channel.isIdle())
        return false;
    return true;
  }

  public Transaction submitRead(long address, int prot) {
    Transaction txn = new Transaction(Direction.READ, address, prot, 0, 0, cycle);
    channels.get(Direction.READ).requests.add(txn);
    return txn;
  }

  /** Submits a write; {@code strobe} has one bit per byte lane. */
  public Transaction submitWrite(long address, long data, int strobe, int prot) {
    Transaction txn = new Transaction(Direction.WRITE, address, prot, data, strobe, cycle);
    channels.get(Direction.WRITE).requests.add(txn);
    return txn;
  }

  /** Submits a write with all byte strobes set. */
  public Transaction submitWrite(long address, long data, int prot) { return submitWrite(address, data, fullStrobe(), prot); }

  public ReadResult read(long address, int prot) {
    Transaction txn = submitRead(address, prot);
    runUntilDone(txn);
    return new ReadResult(txn.getResponse(), txn.getReadData());
  }

  public ReadResult read(long address) { return read(address, 0); }

  public BusResponse write(long address, long data, int strobe, int prot) {
    Transaction txn = submitWrite(address, data, strobe, prot);
    runUntilDone(txn);
    return txn.getResponse();
  }

  public BusResponse write(long address, long data) { return write(address, data, fullStrobe(), 0); }

  /** Runs cycles until the transaction completes. */
  public void runUntilDone(Transaction txn) {
    long start = cycle;
    while (!txn.isDone()) {
      if (cycle - start >= maxCycles)
        throw new IllegalStateException("transaction " + txn + " did not complete within " + maxCycles + " cycles");
      cycle();
    }
  }

  /** Advances the model by one clock cycle. */
  public void cycle() {
    ++cycle;
    for (Field field : registerFile.getFields())
      field.getBehavior().onCycle();
    for (Channel channel : channels.values())
      step(channel);
  }

  private void step(Channel channel) {
    if (channel.slot != null && channel.masterReady) {
      Response r = channel.slot;
      r.transaction().complete(r.response(), r.data(), cycle);
      channel.slot = null;
      logger.trace("cycle {}: {}", cycle, r.transaction());
    }

    if (channel.slot == null && !channel.deferred.isEmpty())
      completeDeferred(channel);

    Transaction txn = channel.requests.peek();
    if (txn == null)
      return;
    boolean consumerReady = channel.slot == null && channel.deferred.isEmpty();
    List<Block> blocks = channel.decoder.evaluate(txn.getAddress());
    if (blocks.isEmpty()) {
      if (consumerReady)
        respond(channel, BusResponse.DECODE_ERROR, 0);
      return;
    }
    Block block = blocks.get(0);
    if (channel.direction == Direction.READ)
      dispatchRead(channel, txn, block, consumerReady);
    else
      dispatchWrite(channel, txn, block, consumerReady);
  }

  private void dispatchRead(Channel channel, Transaction txn, Block block, boolean consumerReady) {
    RegisterBuffers buf = buffers.get(block.getRegister());
    int busWidth = registerFile.getBusWidth();
    if (!block.isHookBlock()) {
      if (!consumerReady)
        return;
      if (!buf.readValid) {
        respond(channel, BusResponse.SLAVE_ERROR, 0);
        return;
      }
      long data = RegisterBuffers.getBits(buf.readData, block.getBitOffset(), busWidth);
      if (block.isLast())
        buf.readValid = false;
      respond(channel, BusResponse.OKAY, data);
      return;
    }

    HookMode mode = consumerReady ? HookMode.NORMAL : HookMode.LOOKAHEAD;
    List<Field> fields = visibleFields(block, txn.getProt());
    List<ReadContext> contexts = new ArrayList<>();
    for (Field field : fields) {
      ReadContext ctx = new ReadContext(mode, field.getCapabilities(Direction.READ), txn.getAddress(), txn.getProt(), tagOf(block));
      FieldBehavior behavior = field.getBehavior();
      if (mode == HookMode.NORMAL)
        behavior.readNormal(ctx);
      else
        behavior.readLookahead(ctx);
      contexts.add(ctx);
    }
    HookContext.Outcome outcome = combine(contexts);
    // the snapshot of an earlier read must not be served after a first word that did not acknowledge
    if (outcome != HookContext.Outcome.ACK)
      buf.readValid = false;
    switch (outcome) {
    case BLOCK:
      return;
    case DEFER:
      channel.requests.poll();
      channel.deferred.add(new Deferred(txn, block, fields.get(0), 0, 0));
      logger.trace("cycle {}: deferred {}", cycle, txn);
      return;
    case NACK:
      respond(channel, BusResponse.SLAVE_ERROR, 0);
      return;
    case ACK:
      respond(channel, BusResponse.OKAY, snapshot(block, fields, contexts));
      return;
    default:
      if (mode == HookMode.NORMAL)
        respond(channel, BusResponse.DECODE_ERROR, 0);
    }
  }

  private void dispatchWrite(Channel channel, Transaction txn, Block block, boolean consumerReady) {
    RegisterBuffers buf = buffers.get(block.getRegister());
    int busWidth = registerFile.getBusWidth();
    if (!consumerReady && !block.isHookBlock())
      return;
    long strobe = RegisterBuffers.expandStrobe(txn.getStrobe(), busWidth);
    long oldData = RegisterBuffers.getBits(buf.writeData, block.getBitOffset(), busWidth);
    long oldStrobe = RegisterBuffers.getBits(buf.writeStrobe, block.getBitOffset(), busWidth);
    RegisterBuffers.setBits(buf.writeData, block.getBitOffset(), busWidth, (oldData & ~strobe) | (txn.getWriteData() & strobe));
    RegisterBuffers.setBits(buf.writeStrobe, block.getBitOffset(), busWidth, oldStrobe | strobe);
    if (!block.isHookBlock()) {
      respond(channel, BusResponse.OKAY, 0);
      return;
    }

    HookMode mode = consumerReady ? HookMode.NORMAL : HookMode.LOOKAHEAD;
    List<Field> fields = visibleFields(block, txn.getProt());
    List<WriteContext> contexts = new ArrayList<>();
    for (Field field : fields) {
      WriteContext ctx = writeContext(mode, field, block, txn, buf);
      FieldBehavior behavior = field.getBehavior();
      if (mode == HookMode.NORMAL)
        behavior.writeNormal(ctx);
      else
        behavior.writeLookahead(ctx);
      contexts.add(ctx);
    }
    HookContext.Outcome outcome = combine(contexts);
    switch (outcome) {
    case BLOCK:
      return;
    case DEFER:
      channel.requests.poll();
      WriteContext deferredCtx = contexts.get(0);
      channel.deferred.add(new Deferred(txn, block, fields.get(0), deferredCtx.getData(), deferredCtx.getStrobe()));
      logger.trace("cycle {}: deferred {}", cycle, txn);
      break;
    case NACK:
      respond(channel, BusResponse.SLAVE_ERROR, 0);
      break;
    case ACK:
      respond(channel, BusResponse.OKAY, 0);
      break;
    default:
      if (mode == HookMode.LOOKAHEAD)
        return;
      respond(channel, BusResponse.DECODE_ERROR, 0);
    }
    buf.clearWrite();
  }

  private void completeDeferred(Channel channel) {
    Deferred head = channel.deferred.peek();
    Transaction txn = head.transaction();
    Field field = head.field();
    HookContext ctx;
    if (channel.direction == Direction.READ) {
      ReadContext readCtx = new ReadContext(HookMode.DEFERRED, field.getCapabilities(Direction.READ), txn.getAddress(), txn.getProt(),
                                            tagOf(head.block()));
      field.getBehavior().readDeferred(readCtx);
      ctx = readCtx;
    } else {
      WriteContext writeCtx = new WriteContext(HookMode.DEFERRED, field.getCapabilities(Direction.WRITE), txn.getAddress(), txn.getProt(),
                                               tagOf(head.block()), head.data(), head.strobe());
      field.getBehavior().writeDeferred(writeCtx);
      ctx = writeCtx;
    }
    if (ctx.getOutcome() == HookContext.Outcome.BLOCK)
      return;
    channel.deferred.poll();
    Response response;
    switch (ctx.getOutcome()) {
    case ACK:
      long data = 0;
      if (ctx instanceof ReadContext)
        data = snapshot(head.block(), List.of(field), List.of((ReadContext)ctx));
      response = new Response(txn, BusResponse.OKAY, data);
      break;
    case NACK:
      response = new Response(txn, BusResponse.SLAVE_ERROR, 0);
      break;
    default:
      response = new Response(txn, BusResponse.DECODE_ERROR, 0);
    }
    channel.slot = response;
  }

  /** Builds the write context of a field from the staged register data. */
  private WriteContext writeContext(HookMode mode, Field field, Block block, Transaction txn, RegisterBuffers buf) {
    long data = RegisterBuffers.getBits(buf.writeData, field.getLowBit(), field.getWidth());
    long strobe = RegisterBuffers.getBits(buf.writeStrobe, field.getLowBit(), field.getWidth());
    return new WriteContext(mode, field.getCapabilities(Direction.WRITE), txn.getAddress(), txn.getProt(), tagOf(block), data, strobe);
  }

  /** Assembles the register value from the acknowledging fields and returns the word of the given block. */
  private long snapshot(Block block, List<Field> fields, List<ReadContext> contexts) {
    Register register = block.getRegister();
    RegisterBuffers buf = buffers.get(register);
    Arrays.fill(buf.readData, 0);
    for (int i = 0; i < fields.size(); ++i) {
      Field field = fields.get(i);
      if (contexts.get(i).getOutcome() == HookContext.Outcome.ACK)
        RegisterBuffers.setBits(buf.readData, field.getLowBit(), field.getWidth(), contexts.get(i).getData() & field.getValueMask());
    }
    buf.readValid = register.getWordCount() > 1;
    return RegisterBuffers.getBits(buf.readData, block.getBitOffset(), registerFile.getBusWidth());
  }

  private void respond(Channel channel, BusResponse response, long data) {
    Transaction txn = channel.requests.poll();
    channel.slot = new Response(txn, response, data);
  }

  private static List<Field> visibleFields(Block block, int prot) {
    List<Field> ret = new ArrayList<>();
    for (Field field : block.getHookFields())
      if (field.isVisibleTo(prot))
        ret.add(field);
    return ret;
  }

  /** Block beats defer beats nack beats ack; a hook that did nothing does not count. */
  private static HookContext.Outcome combine(List<? extends HookContext> contexts) {
    HookContext.Outcome ret = HookContext.Outcome.NONE;
    for (HookContext ctx : contexts)
      if (rank(ctx.getOutcome()) > rank(ret))
        ret = ctx.getOutcome();
    return ret;
  }

  private static int rank(HookContext.Outcome outcome) {
    switch (outcome) {
    case BLOCK:
      return 4;
    case DEFER:
      return 3;
    case NACK:
      return 2;
    case ACK:
      return 1;
    default:
      return 0;
    }
  }

  private static int tagOf(Block block) { return block.getDeferTag() != null ? block.getDeferTag().index() : -1; }

  private int fullStrobe() { return (1 << (registerFile.getBusWidth() / 8)) - 1; }
}
