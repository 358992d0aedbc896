package regmap.address;

/** Bus direction. Read and write requests are decoded independently. */
public enum Direction {
  READ("read"),
  WRITE("write");

  private final String modeName;

  Direction(String modeName) { this.modeName = modeName; }

  public String getModeName() { return modeName; }

  @Override
  public String toString() {
    return modeName;
  }
}
