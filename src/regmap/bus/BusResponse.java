package regmap.bus;

/** The 2-bit response code of a bus transfer. */
public enum BusResponse {
  OKAY(0b00),
  /** Exclusive access okay. Not used by register files. */
  EXOKAY(0b01),
  SLAVE_ERROR(0b10),
  DECODE_ERROR(0b11);

  private final int code;

  BusResponse(int code) { this.code = code; }

  public int getCode() { return code; }

  public static BusResponse fromCode(int code) {
    for (BusResponse response : values()) {
      if (response.code == code)
        return response;
    }
    throw new IllegalArgumentException("invalid response code " + code);
  }
}
