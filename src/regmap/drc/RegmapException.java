package regmap.drc;

/**
 * Thrown when a register file description cannot be compiled. Compilation never continues after one of these.
 */
public class RegmapException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  public RegmapException(Diagnostic diagnostic) {
    super(diagnostic.category().getDisplayName() + ": " + diagnostic.message());
    this.diagnostic = diagnostic;
  }

  public RegmapException(DiagnosticCategory category, String message) { this(Diagnostic.of(category, message)); }

  public Diagnostic getDiagnostic() { return diagnostic; }

  public DiagnosticCategory getCategory() { return diagnostic.category(); }
}
