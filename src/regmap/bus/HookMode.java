package regmap.bus;

/** The situation in which a field hook is called. */
public enum HookMode {
  /** The field is addressed and the response logic can take a response. */
  NORMAL,
  /** The field is addressed, but the response logic is busy. Only deferring is allowed. */
  LOOKAHEAD,
  /** The response logic asks for the result of a request the field deferred earlier. */
  DEFERRED
}
