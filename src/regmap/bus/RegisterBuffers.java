package regmap.bus;

import java.util.Arrays;

/**
 * Holding buffers of one register: the read snapshot taken at the first word of a multi-word read, and the write data
 * staged until the last word of a multi-word write. Bit {@code i} of the register is bit {@code i % 64} of element
 * {@code i / 64}.
 */
class RegisterBuffers {
  final long[] readData;
  boolean readValid = false;
  final long[] writeData;
  final long[] writeStrobe;

  RegisterBuffers(int bits) {
    int chunks = (bits + 63) / 64;
    readData = new long[chunks];
    writeData = new long[chunks];
    writeStrobe = new long[chunks];
  }

  void clearWrite() {
    Arrays.fill(writeData, 0);
    Arrays.fill(writeStrobe, 0);
  }

  static long getBits(long[] bits, int low, int width) {
    long ret = 0;
    for (int i = 0; i < width; ++i) {
      int bit = low + i;
      if (((bits[bit / 64] >>> (bit % 64)) & 1) != 0)
        ret |= 1L << i;
    }
    return ret;
  }

  static void setBits(long[] bits, int low, int width, long value) {
    for (int i = 0; i < width; ++i) {
      int bit = low + i;
      long bitm = 1L << (bit % 64);
      if (((value >>> i) & 1) != 0)
        bits[bit / 64] |= bitm;
      else
        bits[bit / 64] &= ~bitm;
    }
  }

  /** Expands byte strobes to a bit mask of a bus word. */
  static long expandStrobe(int strobe, int busWidth) {
    long ret = 0;
    for (int lane = 0; lane < busWidth / 8; ++lane)
      if (((strobe >>> lane) & 1) != 0)
        ret |= 0xFFL << (lane * 8);
    return ret;
  }
}
