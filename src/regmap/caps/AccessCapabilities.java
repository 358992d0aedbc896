package regmap.caps;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import regmap.drc.Diagnostic;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * What a field can do for one bus direction. Immutable; build with {@link #builder()}.
 */
public final class AccessCapabilities {

  /** A field's capabilities together with its name, for sibling checks. */
  public record Sibling(String name, AccessCapabilities caps) {}

  private final boolean isVolatile;
  private final boolean canBlock;
  private final boolean canDefer;
  private final NoOpMethod noOpMethod;
  private final boolean canReadForRmw;
  private final Permissions permissions;

  private AccessCapabilities(Builder builder) {
    this.isVolatile = builder.isVolatile;
    this.canBlock = builder.canBlock;
    this.canDefer = builder.canDefer;
    this.noOpMethod = Objects.requireNonNull(builder.noOpMethod, "noOpMethod");
    this.canReadForRmw = builder.canReadForRmw;
    this.permissions = Objects.requireNonNull(builder.permissions, "permissions");
  }

  /**
   * Whether doing the same access once or twice makes a functional difference.
   */
  public boolean isVolatile() { return isVolatile; }
  /**
   * Whether the field may stall the bus, having the same request retried next cycle.
   */
  public boolean canBlock() { return canBlock; }
  /**
   * Whether the field may accept a request and respond in a later cycle, possibly after accepting further requests.
   */
  public boolean canDefer() { return canDefer; }
  public NoOpMethod getNoOpMethod() { return noOpMethod; }
  /** Whether reading the field has no side effects, so that a read-modify-write can be used to leave it untouched. */
  public boolean canReadForRmw() { return canReadForRmw; }
  public Permissions getPermissions() { return permissions; }

  public static Builder builder() { return new Builder(); }

  public Builder toBuilder() {
    return new Builder()
        .setVolatile(isVolatile)
        .setCanBlock(canBlock)
        .setCanDefer(canDefer)
        .setNoOpMethod(noOpMethod)
        .setCanReadForRmw(canReadForRmw)
        .setPermissions(permissions);
  }

  public AccessCapabilities withPermissions(Permissions permissions) { return toBuilder().setPermissions(permissions).build(); }

  /**
   * Checks whether fields may share one register block in one direction, and combines their capabilities.
   * The verdict, the message and the result do not depend on the order of the siblings.
   * <p>
   * The combined capabilities are volatile, blocking or deferring if any sibling is. The combined no-op method is the
   * most restrictive one of the siblings, and read-modify-write is possible only if it is for all siblings. Permissions
   * are not combined; they stay per field.
   *
   * @throws RegmapException with category {@link DiagnosticCategory#SIBLING_CAPABILITY_CONFLICT} if the combination is illegal
   */
  public static AccessCapabilities checkSiblings(List<Sibling> siblings) throws RegmapException {
    if (siblings.isEmpty())
      throw new IllegalArgumentException("checkSiblings needs at least one field");
    TreeSet<String> deferring = new TreeSet<>();
    TreeSet<String> blocking = new TreeSet<>();
    TreeSet<String> volatileNonBlocking = new TreeSet<>();
    TreeSet<String> all = new TreeSet<>();
    for (Sibling sibling : siblings) {
      all.add(sibling.name());
      if (sibling.caps().canDefer())
        deferring.add(sibling.name());
      if (sibling.caps().canBlock())
        blocking.add(sibling.name());
      else if (sibling.caps().isVolatile())
        volatileNonBlocking.add(sibling.name());
    }
    if (siblings.size() >= 2 && !deferring.isEmpty())
      throw siblingError("fields that can defer cannot be combined with other fields (" + quote(deferring) + " with " +
                         quote(without(all, deferring)) + ")", all);
    if (blocking.size() >= 2)
      throw siblingError("cannot have more than one blocking field in a single register (" + quote(blocking) + ")", blocking);
    if (!blocking.isEmpty() && !volatileNonBlocking.isEmpty())
      throw siblingError("cannot have both volatile fields (" + quote(volatileNonBlocking) + ") and blocking fields (" + quote(blocking) +
                             ") in a single register",
                         all);

    Builder combined = builder().setCanReadForRmw(true);
    NoOpMethod noOp = NoOpMethod.ALWAYS;
    for (Sibling sibling : siblings) {
      AccessCapabilities caps = sibling.caps();
      combined.isVolatile |= caps.isVolatile;
      combined.canBlock |= caps.canBlock;
      combined.canDefer |= caps.canDefer;
      combined.canReadForRmw &= caps.canReadForRmw;
      if (caps.noOpMethod.compareTo(noOp) > 0)
        noOp = caps.noOpMethod;
    }
    return combined.setNoOpMethod(noOp).build();
  }

  private static List<String> without(TreeSet<String> all, TreeSet<String> remove) {
    List<String> ret = new ArrayList<>(all);
    ret.removeAll(remove);
    return ret;
  }

  private static String quote(Iterable<String> names) {
    List<String> quoted = new ArrayList<>();
    for (String name : names)
      quoted.add("`" + name + "`");
    if (quoted.size() <= 1)
      return String.join("", quoted);
    return String.join(", ", quoted.subList(0, quoted.size() - 1)) + " and " + quoted.get(quoted.size() - 1);
  }

  private static RegmapException siblingError(String message, Iterable<String> owners) {
    List<String> ownerList = new ArrayList<>();
    owners.forEach(ownerList::add);
    return new RegmapException(new Diagnostic(DiagnosticCategory.SIBLING_CAPABILITY_CONFLICT, message, ownerList, List.of(), null));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof AccessCapabilities))
      return false;
    AccessCapabilities o = (AccessCapabilities)obj;
    return isVolatile == o.isVolatile && canBlock == o.canBlock && canDefer == o.canDefer && noOpMethod == o.noOpMethod &&
        canReadForRmw == o.canReadForRmw && permissions.equals(o.permissions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isVolatile, canBlock, canDefer, noOpMethod, canReadForRmw, permissions);
  }

  @Override
  public String toString() {
    return "AccessCapabilities[volatile=" + isVolatile + ", canBlock=" + canBlock + ", canDefer=" + canDefer + ", noOp=" + noOpMethod +
        ", canReadForRmw=" + canReadForRmw + ", " + permissions + "]";
  }

  public static class Builder {
    private boolean isVolatile = false;
    private boolean canBlock = false;
    private boolean canDefer = false;
    private NoOpMethod noOpMethod = NoOpMethod.ALWAYS;
    private boolean canReadForRmw = true;
    private Permissions permissions = Permissions.ALL;

    public Builder setVolatile(boolean isVolatile) {
      this.isVolatile = isVolatile;
      return this;
    }
    public Builder setCanBlock(boolean canBlock) {
      this.canBlock = canBlock;
      return this;
    }
    public Builder setCanDefer(boolean canDefer) {
      this.canDefer = canDefer;
      return this;
    }
    public Builder setNoOpMethod(NoOpMethod noOpMethod) {
      this.noOpMethod = noOpMethod;
      return this;
    }
    public Builder setCanReadForRmw(boolean canReadForRmw) {
      this.canReadForRmw = canReadForRmw;
      return this;
    }
    public Builder setPermissions(Permissions permissions) {
      this.permissions = permissions;
      return this;
    }
    public AccessCapabilities build() { return new AccessCapabilities(this); }
  }
}
