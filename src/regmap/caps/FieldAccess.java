package regmap.caps;

import regmap.address.Direction;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Read and write capabilities of one field. Either may be null if the field does not support that direction, but not
 * both.
 */
public record FieldAccess(AccessCapabilities read, AccessCapabilities write) {

  /** How a partial write leaves a field untouched. */
  public enum MaskingStrategy {
    /** The field does not need masking. */
    NONE,
    /** Clear the byte strobes covering the field. */
    STROBE,
    /** Write zeros to the field. */
    ZERO,
    /** Read the current value and write it back. */
    RMW
  }

  public FieldAccess {
    if (read == null && write == null)
      throw new IllegalArgumentException("a field must support reads, writes or both");
    if (read != null && !read.getNoOpMethod().isValidForRead())
      throw new IllegalArgumentException("no-op method " + read.getNoOpMethod() + " is not valid for reads");
  }

  public boolean isReadable() { return read != null; }
  public boolean isWritable() { return write != null; }

  public AccessCapabilities get(Direction direction) { return direction == Direction.READ ? read : write; }

  public boolean maskingNeeded() { return write != null && write.getNoOpMethod() != NoOpMethod.ALWAYS; }

  public boolean canMaskWithStrobe() {
    if (!maskingNeeded())
      return true;
    return switch (write.getNoOpMethod()) {
      case WRITE_CURRENT, NEVER -> false;
      case ALWAYS, WRITE_ZERO, WRITE_CURRENT_OR_MASK, MASK -> true;
    };
  }

  public boolean canMaskWithZero() {
    if (!maskingNeeded())
      return true;
    return switch (write.getNoOpMethod()) {
      case WRITE_ZERO, ALWAYS -> true;
      case WRITE_CURRENT, WRITE_CURRENT_OR_MASK, MASK, NEVER -> false;
    };
  }

  public boolean canMaskWithRmw() {
    boolean methodOk = !maskingNeeded() || switch (write.getNoOpMethod()) {
      case WRITE_CURRENT_OR_MASK, WRITE_CURRENT, ALWAYS -> true;
      case WRITE_ZERO, MASK, NEVER -> false;
    };
    return methodOk && read != null && read.getNoOpMethod() == NoOpMethod.ALWAYS && read.canReadForRmw();
  }

  /**
   * Picks the cheapest way to leave this field untouched: byte strobes, then writing zero, then read-modify-write.
   * Returns null if none works.
   */
  public MaskingStrategy chooseMasking() {
    if (!maskingNeeded())
      return MaskingStrategy.NONE;
    if (canMaskWithStrobe())
      return MaskingStrategy.STROBE;
    if (canMaskWithZero())
      return MaskingStrategy.ZERO;
    if (canMaskWithRmw())
      return MaskingStrategy.RMW;
    return null;
  }

  /**
   * Checks that a write-capable field can be left untouched by writes to its siblings.
   * @throws RegmapException with category {@link DiagnosticCategory#MASKING_INFEASIBLE} otherwise
   */
  public void checkMaskable(String fieldName) throws RegmapException {
    if (write == null || chooseMasking() != null)
      return;
    String reason;
    if (read == null)
      reason = "the field is not readable";
    else if (read.getNoOpMethod() != NoOpMethod.ALWAYS)
      reason = "reading it is not a no-op";
    else if (!read.canReadForRmw())
      reason = "it cannot be read for read-modify-write";
    else
      reason = "writing the current value back is not a no-op";
    throw new RegmapException(DiagnosticCategory.MASKING_INFEASIBLE, "field `" + fieldName + "` with write no-op method " +
                                                                         write.getNoOpMethod() + " cannot be left untouched by writes: " + reason);
  }
}
