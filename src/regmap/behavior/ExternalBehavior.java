package regmap.behavior;

import java.util.ArrayDeque;
import regmap.address.Direction;
import regmap.bus.HookContext;
import regmap.bus.ReadContext;
import regmap.bus.WriteContext;
import regmap.caps.AccessCapabilities;
import regmap.caps.NoOpMethod;

/**
 * Forwards accesses to logic outside the register file through a request/response handshake. The field blocks the bus
 * until the outside logic responds. If deferring is enabled, requests are accepted right away instead and several may be
 * outstanding; responses are matched to requests in order.
 */
public class ExternalBehavior implements FieldBehavior {

  /** A request as seen by the outside logic. */
  public record Request(Direction direction, long address, int prot, long data, long strobe) {}

  private record Response(boolean ok, long data) {}

  private final AccessCapabilities readCaps;
  private final AccessCapabilities writeCaps;
  private final boolean deferring;
  private final ArrayDeque<Request> requests = new ArrayDeque<>();
  private final ArrayDeque<Response> readResponses = new ArrayDeque<>();
  private final ArrayDeque<Response> writeResponses = new ArrayDeque<>();
  private boolean readIssued = false;
  private boolean writeIssued = false;

  public ExternalBehavior(boolean readable, boolean writable, boolean deferring) {
    if (!readable && !writable)
      throw new IllegalArgumentException("external field must be readable, writable or both");
    this.deferring = deferring;
    AccessCapabilities caps = AccessCapabilities.builder()
                                  .setVolatile(true)
                                  .setCanBlock(true)
                                  .setCanDefer(deferring)
                                  .setNoOpMethod(NoOpMethod.NEVER)
                                  .setCanReadForRmw(false)
                                  .build();
    this.readCaps = readable ? caps : null;
    this.writeCaps = writable ? caps : null;
  }

  @Override
  public AccessCapabilities getReadCapabilities() {
    return readCaps;
  }

  @Override
  public AccessCapabilities getWriteCapabilities() {
    return writeCaps;
  }

  @Override
  public void readNormal(ReadContext ctx) {
    if (deferring) {
      readLookahead(ctx);
      return;
    }
    if (!readIssued) {
      requests.add(new Request(Direction.READ, ctx.getAddress(), ctx.getProt(), 0, 0));
      readIssued = true;
    }
    readDeferred(ctx);
    if (ctx.getOutcome() != HookContext.Outcome.BLOCK)
      readIssued = false;
  }

  @Override
  public void readLookahead(ReadContext ctx) {
    if (!deferring)
      return;
    requests.add(new Request(Direction.READ, ctx.getAddress(), ctx.getProt(), 0, 0));
    ctx.defer();
  }

  @Override
  public void readDeferred(ReadContext ctx) {
    Response response = readResponses.poll();
    if (response == null)
      ctx.block();
    else if (response.ok())
      ctx.ack(response.data());
    else
      ctx.nack();
  }

  @Override
  public void writeNormal(WriteContext ctx) {
    if (deferring) {
      writeLookahead(ctx);
      return;
    }
    if (!writeIssued) {
      requests.add(new Request(Direction.WRITE, ctx.getAddress(), ctx.getProt(), ctx.getData(), ctx.getStrobe()));
      writeIssued = true;
    }
    writeDeferred(ctx);
    if (ctx.getOutcome() != HookContext.Outcome.BLOCK)
      writeIssued = false;
  }

  @Override
  public void writeLookahead(WriteContext ctx) {
    if (!deferring)
      return;
    requests.add(new Request(Direction.WRITE, ctx.getAddress(), ctx.getProt(), ctx.getData(), ctx.getStrobe()));
    ctx.defer();
  }

  @Override
  public void writeDeferred(WriteContext ctx) {
    Response response = writeResponses.poll();
    if (response == null)
      ctx.block();
    else if (response.ok())
      ctx.ack();
    else
      ctx.nack();
  }

  /** Takes the oldest request not yet taken by the outside logic, or null. */
  public Request takeRequest() { return requests.poll(); }

  public int getPendingRequestCount() { return requests.size(); }

  /** Queues a successful read response. */
  public void respondRead(long data) { readResponses.add(new Response(true, data)); }

  /** Queues a successful write response. */
  public void respondWrite() { writeResponses.add(new Response(true, 0)); }

  /** Queues an error response for the given direction. */
  public void respondError(Direction direction) {
    (direction == Direction.READ ? readResponses : writeResponses).add(new Response(false, 0));
  }
}
