package regmap.decoder;

import java.util.ArrayList;
import java.util.List;
import regmap.address.MaskedAddress;

/**
 * Node of a synthesized address decoder tree.
 *
 * @param <T> the action type attached to the leaves
 */
public interface DecoderNode<T> {

  /** Adds the actions of all leaves reached by the given address to {@code out}, in tree order. */
  void collect(long address, List<T> out);

  /** Number of conditional nodes (guards and branches) in this subtree. */
  int countBranches();

  default List<T> evaluate(long address) {
    List<T> ret = new ArrayList<>();
    collect(address, ret);
    return ret;
  }

  /** Extracts bits {@code high} down to {@code low} of an address as an MSB-first string. */
  static String bits(long address, int high, int low) {
    StringBuilder sb = new StringBuilder(high - low + 1);
    for (int bit = high; bit >= low; --bit)
      sb.append(((address >>> bit) & 1) != 0 ? '1' : '0');
    return sb.toString();
  }

  /**
   * All bits have been discriminated; runs the actions of one address pattern.
   * @param pattern the full address pattern of this leaf
   * @param actions the actions registered for that pattern, in registration order
   */
  record Leaf<T>(MaskedAddress pattern, List<T> actions) implements DecoderNode<T> {
    public Leaf {
      actions = List.copyOf(actions);
    }
    @Override
    public void collect(long address, List<T> out) {
      out.addAll(actions);
    }
    @Override
    public int countBranches() {
      return 0;
    }
  }

  /**
   * Runs {@code then} only if bits {@code high} down to {@code low} equal {@code literal}.
   */
  record Guard<T>(int high, int low, String literal, DecoderNode<T> then) implements DecoderNode<T> {
    @Override
    public void collect(long address, List<T> out) {
      if (DecoderNode.bits(address, high, low).equals(literal))
        then.collect(address, out);
    }
    @Override
    public int countBranches() {
      return 1 + then.countBranches();
    }
  }

  /**
   * One arm of a {@link Branch}.
   * @param literal the bit value of the arm
   * @param others if set, the arm also catches all values not matched by an earlier arm
   * @param body the subtree for this arm
   */
  record Arm<T>(String literal, boolean others, DecoderNode<T> body) {}

  /**
   * Selects an arm by the value of bits {@code high} down to {@code low}. Arms are sorted by ascending literal.
   * A single-bit branch is rendered as an if statement, a wider one as a case statement.
   * @param trailingNull whether a no-op {@code others} arm follows the explicit ones
   */
  record Branch<T>(int high, int low, List<Arm<T>> arms, boolean trailingNull) implements DecoderNode<T> {
    public Branch {
      arms = List.copyOf(arms);
    }
    @Override
    public void collect(long address, List<T> out) {
      String value = DecoderNode.bits(address, high, low);
      for (Arm<T> arm : arms) {
        if (arm.others() || arm.literal().equals(value)) {
          arm.body().collect(address, out);
          return;
        }
      }
    }
    @Override
    public int countBranches() {
      int ret = 1;
      for (Arm<T> arm : arms)
        ret += arm.body().countBranches();
      return ret;
    }
    public int width() { return high - low + 1; }
  }

  /**
   * Subtrees for overlapping patterns. All parts are evaluated, so more than one leaf may fire.
   */
  record Sequence<T>(List<DecoderNode<T>> parts) implements DecoderNode<T> {
    public Sequence {
      parts = List.copyOf(parts);
    }
    @Override
    public void collect(long address, List<T> out) {
      for (DecoderNode<T> part : parts)
        part.collect(address, out);
    }
    @Override
    public int countBranches() {
      int ret = 0;
      for (DecoderNode<T> part : parts)
        ret += part.countBranches();
      return ret;
    }
  }
}
