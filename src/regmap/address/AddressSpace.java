package regmap.address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.drc.Diagnostic;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * All address claims for one bus direction. Every claim is checked against all previous ones, so that no two accepted
 * patterns can match the same address.
 *
 * @param <T> payload attached to each claim, usually the block that decodes it
 */
public class AddressSpace<T> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * An accepted claim.
   * @param pattern the claimed addresses
   * @param owner description of the claimer, used in messages
   * @param payload the object that handles accesses to these addresses
   */
  public record Claim<T>(MaskedAddress pattern, String owner, T payload) {}

  private final Direction direction;
  private final int width;
  private final List<Claim<T>> claims = new ArrayList<>();
  private boolean frozen = false;

  public AddressSpace(Direction direction, int width) {
    MaskedAddress.fullMask(width);
    this.direction = direction;
    this.width = width;
  }

  public Direction getDirection() { return direction; }
  public int getWidth() { return width; }

  /**
   * Claims a pattern. Exact duplicates are rejected as well.
   * @throws RegmapException with category {@link DiagnosticCategory#DECODE_CONFLICT} if the pattern overlaps an existing claim
   */
  public void claim(MaskedAddress pattern, String owner, T payload) throws RegmapException { claim(pattern, owner, payload, false); }

  /**
   * Claims a pattern.
   * @param allowDuplicate accept a pattern that is exactly equal to an existing claim; partial overlap is still a conflict
   * @throws RegmapException with category {@link DiagnosticCategory#DECODE_CONFLICT} on conflict
   */
  public void claim(MaskedAddress pattern, String owner, T payload, boolean allowDuplicate) throws RegmapException {
    if (frozen)
      throw new IllegalStateException("address space for " + direction + " accesses is frozen, cannot claim " + pattern + " for " + owner);
    if (pattern.getWidth() != width)
      throw new IllegalArgumentException("pattern " + pattern + " is " + pattern.getWidth() + " bits wide, expected " + width);
    for (Claim<T> existing : claims) {
      if (!existing.pattern().overlaps(pattern))
        continue;
      if (allowDuplicate && existing.pattern().equals(pattern))
        continue;
      MaskedAddress common = pattern.common(existing.pattern()).get();
      String message = String.format("address conflict between %s (%s) and %s (%s) at %s in %s mode", owner, pattern.toDocString(),
                                     existing.owner(), existing.pattern().toDocString(), common.toDocString(), direction.getModeName());
      logger.debug("Rejected claim of {} by {}: {}", pattern, owner, message);
      throw new RegmapException(
          new Diagnostic(DiagnosticCategory.DECODE_CONFLICT, message, List.of(owner, existing.owner()), List.of(pattern, existing.pattern()), direction));
    }
    logger.trace("{} claims {} for {}", owner, pattern, direction);
    claims.add(new Claim<T>(pattern, owner, payload));
  }

  public void freeze() { frozen = true; }
  public boolean isFrozen() { return frozen; }

  /** Returns the claims in insertion order. */
  public List<Claim<T>> getClaims() { return Collections.unmodifiableList(claims); }

  /** Returns all claims matching the given address. */
  public List<Claim<T>> lookup(long address) {
    List<Claim<T>> ret = new ArrayList<>();
    for (Claim<T> claim : claims) {
      if (claim.pattern().matches(address))
        ret.add(claim);
    }
    return ret;
  }

  public boolean isEmpty() { return claims.isEmpty(); }
}
