package regmap.behavior;

import regmap.bus.ReadContext;
import regmap.bus.WriteContext;
import regmap.caps.AccessCapabilities;

/**
 * The behavior of one field: its capabilities per direction and the hooks the bus logic calls.
 *
 * Hooks are only called for directions with capabilities. The normal and lookahead hooks fall back to the corresponding
 * "both" hook, so a behavior that does not care whether the response logic is ready only overrides that one. The value
 * passed to and from hooks is the field's own value, LSB aligned.
 */
public interface FieldBehavior {

  /** Capabilities for reads, or null if the field is write-only. */
  AccessCapabilities getReadCapabilities();

  /** Capabilities for writes, or null if the field is read-only. */
  AccessCapabilities getWriteCapabilities();

  /** Called when the field is read and the response logic can accept the result. */
  default void readNormal(ReadContext ctx) { readBoth(ctx); }

  /** Called when the field is read but the response logic is busy. May only defer. */
  default void readLookahead(ReadContext ctx) { readBoth(ctx); }

  /** Called in both of the above situations, unless the specific hook is overridden. */
  default void readBoth(ReadContext ctx) {}

  /** Called to complete the oldest read this field deferred. */
  default void readDeferred(ReadContext ctx) {}

  default void writeNormal(WriteContext ctx) { writeBoth(ctx); }

  default void writeLookahead(WriteContext ctx) { writeBoth(ctx); }

  default void writeBoth(WriteContext ctx) {}

  default void writeDeferred(WriteContext ctx) {}

  /** Called once at the start of every clock cycle, before any hook. */
  default void onCycle() {}
}
