package regmap.model;

/** Order in which the words of a multi-word register map to bus addresses. */
public enum Endianness {
  /** The lowest address holds the least significant word. */
  LITTLE,
  /** The lowest address holds the most significant word. */
  BIG;

  public static Endianness fromName(String name) {
    switch (name.toLowerCase()) {
    case "little":
    case "le":
      return LITTLE;
    case "big":
    case "be":
      return BIG;
    default:
      throw new IllegalArgumentException("unknown endianness '" + name + "', expected little or big");
    }
  }
}
