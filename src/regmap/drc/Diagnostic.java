package regmap.drc;

import java.util.ArrayList;
import java.util.List;
import regmap.address.Direction;
import regmap.address.MaskedAddress;

/**
 * Structured description of a configuration error.
 *
 * @param category the error category
 * @param message the human-readable message, without the category prefix
 * @param owners names of the offending fields, registers or blocks (may be empty)
 * @param patterns the address patterns involved (may be empty)
 * @param direction the bus direction, or null if the error is not tied to one
 */
public record Diagnostic(DiagnosticCategory category, String message, List<String> owners, List<MaskedAddress> patterns,
                         Direction direction) {
  public Diagnostic {
    owners = List.copyOf(owners);
    patterns = List.copyOf(patterns);
  }

  public static Diagnostic of(DiagnosticCategory category, String message) {
    return new Diagnostic(category, message, List.of(), List.of(), null);
  }

  public static Diagnostic of(DiagnosticCategory category, String message, String owner) {
    return new Diagnostic(category, message, List.of(owner), List.of(), null);
  }

  /** Returns a copy with the given owner prepended, used when an error is passed up to the field that caused it. */
  public Diagnostic withOwner(String owner, String context) {
    var newOwners = new ArrayList<String>();
    newOwners.add(owner);
    newOwners.addAll(owners);
    return new Diagnostic(category, context + ": " + message, newOwners, patterns, direction);
  }

  /**
   * Renders the diagnostic as a single line, followed by one line per pattern in both the
   * value/mask form and the don't-care bit string form.
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append(category.getDisplayName()).append(": ").append(message);
    for (MaskedAddress pattern : patterns) {
      sb.append("\n  ").append(pattern.toHexMask()).append(" = ").append(pattern.toBitString());
    }
    return sb.toString();
  }
}
