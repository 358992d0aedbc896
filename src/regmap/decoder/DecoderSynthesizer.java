package regmap.decoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.address.AddressSpace;
import regmap.address.MaskedAddress;
import regmap.drc.Diagnostic;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Compiles a set of address patterns with don't cares into a decision tree.
 *
 * The tree is built by looking for bit runs shared by all remaining patterns on the MSB and LSB side first (these do
 * not discriminate between patterns, so at most a guard is needed), and only then splitting on the widest MSB run on
 * which no pattern has a don't care. Single-bit splits become if statements, wider ones case statements. When every MSB
 * has a don't care in some pattern but the patterns are still disjoint, the tree splits on the MSB and decodes those
 * patterns in both arms.
 *
 * With overlap allowed, overlapping patterns end up in a {@link DecoderNode.Sequence} whose parts are all evaluated.
 * The subtrees below a sequence keep their guards even when optimizing, so an optimized decoder still fires exactly
 * the patterns matching any listed address.
 *
 * @param <T> action type
 */
public class DecoderSynthesizer<T> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final int width;
  private final boolean optimize;
  private final boolean allowOverlap;
  private final boolean allowDuplicate;
  /** key: MSB-first pattern string */
  private final LinkedHashMap<String, List<T>> actions = new LinkedHashMap<>();

  /**
   * @param width address width
   * @param optimize treat unlisted addresses as unreachable; drops guards that do not discriminate
   * @param allowOverlap accept overlapping patterns; the generated tree may then fire more than one leaf
   * @param allowDuplicate accept multiple actions for the exact same pattern
   */
  public DecoderSynthesizer(int width, boolean optimize, boolean allowOverlap, boolean allowDuplicate) {
    MaskedAddress.fullMask(width);
    this.width = width;
    this.optimize = optimize;
    this.allowOverlap = allowOverlap;
    this.allowDuplicate = allowDuplicate;
  }

  public DecoderSynthesizer(int width, boolean optimize) { this(width, optimize, false, false); }

  public int getWidth() { return width; }
  public boolean isOptimize() { return optimize; }

  /**
   * Registers an action for a pattern.
   * @throws RegmapException if the pattern was already added and duplicates are not allowed
   */
  public void add(MaskedAddress pattern, T action) throws RegmapException {
    if (pattern.getWidth() != width)
      throw new IllegalArgumentException("pattern " + pattern + " is " + pattern.getWidth() + " bits wide, expected " + width);
    String key = pattern.toBitString();
    List<T> existing = actions.get(key);
    if (existing != null) {
      if (!allowDuplicate)
        throw new RegmapException(
            new Diagnostic(DiagnosticCategory.DECODE_CONFLICT, "duplicate address 0b" + key, List.of(), List.of(pattern), null));
      existing.add(action);
      return;
    }
    List<T> list = new ArrayList<>();
    list.add(action);
    actions.put(key, list);
  }

  /** Registers all claims of an address space, with the claim payload as the action. */
  public void addAll(AddressSpace<T> space) throws RegmapException {
    for (AddressSpace.Claim<T> claim : space.getClaims())
      add(claim.pattern(), claim.payload());
  }

  public int size() { return actions.size(); }

  /**
   * Builds the decoder tree. An empty decoder yields an empty {@link DecoderNode.Sequence}.
   * @throws RegmapException if two patterns overlap and overlap is not allowed
   */
  public DecoderNode<T> synthesize() throws RegmapException {
    if (actions.isEmpty())
      return new DecoderNode.Sequence<T>(List.of());
    List<Candidate> candidates = new ArrayList<>();
    for (String key : actions.keySet())
      candidates.add(new Candidate(key, key));
    DecoderNode<T> root = generate(width - 1, 0, "", "", candidates, false);
    logger.debug("Synthesized {}-bit decoder for {} patterns with {} branch nodes (optimize={})", width, actions.size(),
                 root.countBranches(), optimize);
    return root;
  }

  private static String commonPrefix(List<String> items) {
    String common = items.get(0);
    for (String item : items) {
      while (!common.isEmpty() && !item.startsWith(common))
        common = common.substring(0, common.length() - 1);
    }
    return common;
  }

  private static String commonSuffix(List<String> items) {
    String common = items.get(0);
    for (String item : items) {
      while (!common.isEmpty() && !item.endsWith(common))
        common = common.substring(1);
    }
    return common;
  }

  /** Number of leading characters not matching the predicate. */
  private static int countUpTo(String s, Predicate<Character> condition) {
    int count = 0;
    while (count < s.length() && !condition.test(s.charAt(count)))
      ++count;
    return count;
  }

  /** A pattern during synthesis: the bits not yet decoded, and the full pattern it was registered under. */
  private record Candidate(String remaining, String key) {
    Candidate strip(int front, int back) { return new Candidate(remaining.substring(front, remaining.length() - back), key); }
  }

  private static List<String> remainders(List<Candidate> candidates) {
    List<String> ret = new ArrayList<>(candidates.size());
    for (Candidate c : candidates)
      ret.add(c.remaining());
    return ret;
  }

  private static List<Candidate> strip(List<Candidate> candidates, int front, int back) {
    List<Candidate> ret = new ArrayList<>(candidates.size());
    for (Candidate c : candidates)
      ret.add(c.strip(front, back));
    return ret;
  }

  /** Whether some address matches both bit strings. */
  private static boolean overlaps(String a, String b) {
    for (int i = 0; i < a.length(); ++i) {
      char x = a.charAt(i);
      char y = b.charAt(i);
      if (x != '-' && y != '-' && x != y)
        return false;
    }
    return true;
  }

  /** The first pair of candidates that overlap on their remaining bits, or null. */
  private static Candidate[] findOverlap(List<Candidate> candidates) {
    for (int i = 0; i < candidates.size(); ++i) {
      for (int j = i + 1; j < candidates.size(); ++j) {
        if (overlaps(candidates.get(i).remaining(), candidates.get(j).remaining()))
          return new Candidate[] {candidates.get(i), candidates.get(j)};
      }
    }
    return null;
  }

  /**
   * @param high address bit of the first character of each remaining pattern
   * @param low address bit of the last character of each remaining pattern
   * @param prefix already matched MSB side
   * @param suffix already matched LSB side
   * @param candidates remaining patterns, all {@code high - low + 1} characters long
   * @param exact keep all guards and others-free case statements even when optimizing; set below overlap sequences,
   *     where every part is evaluated and must not fire for addresses it does not match
   */
  private DecoderNode<T> generate(int high, int low, String prefix, String suffix, List<Candidate> candidates, boolean exact)
      throws RegmapException {
    if (high < low) {
      assert candidates.size() == 1 && candidates.get(0).remaining().isEmpty();
      String key = candidates.get(0).key();
      return new DecoderNode.Leaf<T>(MaskedAddress.fromBitString(key), actions.get(key));
    }
    boolean dropGuards = optimize && !exact;
    List<String> addresses = remainders(candidates);

    // Bits shared by all patterns on the MSB side.
    String common = commonPrefix(addresses);
    if (!common.isEmpty()) {
      int dontCares = countUpTo(common, bit -> bit != '-');
      if (dontCares > 0)
        return generate(high - dontCares, low, prefix + common.substring(0, dontCares), suffix, strip(candidates, dontCares, 0), exact);
      int fixed = countUpTo(common, bit -> bit == '-');
      String literal = common.substring(0, fixed);
      DecoderNode<T> inner = generate(high - fixed, low, prefix + literal, suffix, strip(candidates, fixed, 0), exact);
      if (dropGuards)
        return inner;
      return new DecoderNode.Guard<T>(high, high - fixed + 1, literal, inner);
    }

    // Same for the LSB side.
    common = commonSuffix(addresses);
    if (!common.isEmpty()) {
      String reversed = new StringBuilder(common).reverse().toString();
      int dontCares = countUpTo(reversed, bit -> bit != '-');
      if (dontCares > 0)
        return generate(high, low + dontCares, prefix, common.substring(common.length() - dontCares) + suffix,
                        strip(candidates, 0, dontCares), exact);
      int fixed = countUpTo(reversed, bit -> bit == '-');
      String literal = common.substring(common.length() - fixed);
      DecoderNode<T> inner = generate(high, low + fixed, prefix, literal + suffix, strip(candidates, 0, fixed), exact);
      if (dropGuards)
        return inner;
      return new DecoderNode.Guard<T>(low + fixed - 1, low, literal, inner);
    }

    // Longest MSB run on which no pattern has a don't care.
    List<String> careOnly = new ArrayList<>(addresses.size());
    for (String a : addresses)
      careOnly.add(a.replace('1', '0'));
    common = commonPrefix(careOnly);
    int fixed = countUpTo(common, bit -> bit == '-');
    if (fixed > 0) {
      TreeSet<String> options = new TreeSet<>();
      for (String a : addresses)
        options.add(a.substring(0, fixed));
      List<DecoderNode.Arm<T>> arms = new ArrayList<>();
      int index = 0;
      for (String option : options) {
        List<Candidate> sub = new ArrayList<>();
        for (Candidate c : candidates) {
          if (c.remaining().startsWith(option))
            sub.add(c.strip(fixed, 0));
        }
        boolean last = ++index == options.size();
        arms.add(new DecoderNode.Arm<T>(option, fixed > 1 && dropGuards && last,
                                        generate(high - fixed, low, prefix + option, suffix, sub, exact)));
      }
      return new DecoderNode.Branch<T>(high, high - fixed + 1, arms, fixed > 1 && !dropGuards);
    }

    // Some pattern has a don't care on the MSB. If the patterns are still disjoint on a lower bit, split on the MSB
    // anyway and decode the don't care patterns in both arms.
    Candidate[] overlap = findOverlap(candidates);
    if (overlap == null) {
      List<DecoderNode.Arm<T>> arms = new ArrayList<>();
      for (char option : new char[] {'0', '1'}) {
        List<Candidate> sub = new ArrayList<>();
        for (Candidate c : candidates) {
          char bit = c.remaining().charAt(0);
          if (bit == option || bit == '-')
            sub.add(c.strip(1, 0));
        }
        arms.add(new DecoderNode.Arm<T>(String.valueOf(option), false,
                                        generate(high - 1, low, prefix + option, suffix, sub, exact)));
      }
      return new DecoderNode.Branch<T>(high, high, arms, false);
    }

    // The patterns overlap.
    String hashes = "#".repeat(high - low);
    if (!allowOverlap) {
      List<MaskedAddress> shapes = List.of(MaskedAddress.fromBitString(overlap[0].key()), MaskedAddress.fromBitString(overlap[1].key()));
      String message = String.format("addresses overlap at bit %d: found both %s-%s%s and %s0%s%s and/or %s1%s%s", high, prefix, hashes,
                                     suffix, prefix, hashes, suffix, prefix, hashes, suffix);
      throw new RegmapException(new Diagnostic(DiagnosticCategory.DECODE_CONFLICT, message, List.of(), shapes, null));
    }
    List<Candidate> literals = new ArrayList<>();
    List<Candidate> wildcards = new ArrayList<>();
    for (Candidate c : candidates)
      (c.remaining().charAt(0) == '-' ? wildcards : literals).add(c);
    return new DecoderNode.Sequence<T>(
        List.of(generate(high, low, prefix, suffix, literals, true), generate(high, low, prefix, suffix, wildcards, true)));
  }
}
