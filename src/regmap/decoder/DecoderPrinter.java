package regmap.decoder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import regmap.util.VHDL;

/**
 * Renders a decoder tree as VHDL statements.
 *
 * @param <T> action type; each action is rendered into a block of lines by the action renderer
 */
public class DecoderPrinter<T> {
  private final String address;
  private final Function<T, List<String>> actionRenderer;
  private final VHDL vhdl;

  /**
   * @param address name of the address signal or variable the decoder matches on
   * @param actionRenderer renders the statements for one action
   */
  public DecoderPrinter(String address, Function<T, List<String>> actionRenderer, VHDL vhdl) {
    this.address = address;
    this.actionRenderer = actionRenderer;
    this.vhdl = vhdl;
  }

  public DecoderPrinter(String address, Function<T, List<String>> actionRenderer) { this(address, actionRenderer, new VHDL()); }

  /** Renders the tree as text. An empty tree renders as an empty string. */
  public String print(DecoderNode<T> node) { return vhdl.Join(render(node)); }

  public List<String> render(DecoderNode<T> node) {
    List<String> ret = new ArrayList<>();
    if (node instanceof DecoderNode.Leaf) {
      DecoderNode.Leaf<T> leaf = (DecoderNode.Leaf<T>)node;
      ret.add(vhdl.CreateComment(address + " = " + leaf.pattern().toBitString()));
      for (T action : leaf.actions()) {
        ret.add("");
        ret.addAll(actionRenderer.apply(action));
      }
      ret.add("");
    } else if (node instanceof DecoderNode.Guard) {
      DecoderNode.Guard<T> guard = (DecoderNode.Guard<T>)node;
      ret.add(vhdl.CreateIfVector(address, guard.high(), guard.low(), guard.literal()));
      ret.addAll(vhdl.Indent(render(guard.then()), 1));
      ret.add("end if;");
    } else if (node instanceof DecoderNode.Branch) {
      DecoderNode.Branch<T> branch = (DecoderNode.Branch<T>)node;
      if (branch.width() == 1)
        renderIf(branch, ret);
      else
        renderCase(branch, ret);
    } else if (node instanceof DecoderNode.Sequence) {
      DecoderNode.Sequence<T> sequence = (DecoderNode.Sequence<T>)node;
      boolean first = true;
      for (DecoderNode<T> part : sequence.parts()) {
        if (!first)
          ret.add("");
        first = false;
        ret.addAll(render(part));
      }
    } else {
      throw new IllegalArgumentException("unknown decoder node " + node);
    }
    return ret;
  }

  /** Whether the rendering of a node starts with an if statement that can be chained with elsif. */
  private static boolean startsWithIf(DecoderNode<?> node) {
    if (node instanceof DecoderNode.Guard)
      return true;
    return node instanceof DecoderNode.Branch && ((DecoderNode.Branch<?>)node).width() == 1;
  }

  private void renderIf(DecoderNode.Branch<T> branch, List<String> ret) {
    DecoderNode<T> zero = null;
    DecoderNode<T> one = null;
    for (DecoderNode.Arm<T> arm : branch.arms()) {
      if (arm.literal().equals("0"))
        zero = arm.body();
      else
        one = arm.body();
    }
    int bit = branch.high();
    if (zero == null || one == null) {
      // Only reachable for hand-built trees; synthesized single-bit branches always have both arms.
      DecoderNode<T> only = zero != null ? zero : one;
      ret.add(vhdl.CreateIfBit(address, bit, zero != null ? '0' : '1'));
      ret.addAll(vhdl.Indent(render(only), 1));
      ret.add("end if;");
      return;
    }
    if (startsWithIf(one)) {
      List<String> chained = render(one);
      ret.add(vhdl.CreateIfBit(address, bit, '0'));
      ret.addAll(vhdl.Indent(render(zero), 1));
      ret.add("els" + chained.get(0));
      ret.addAll(chained.subList(1, chained.size()));
      return;
    }
    if (startsWithIf(zero)) {
      List<String> chained = render(zero);
      ret.add(vhdl.CreateIfBit(address, bit, '1'));
      ret.addAll(vhdl.Indent(render(one), 1));
      ret.add("els" + chained.get(0));
      ret.addAll(chained.subList(1, chained.size()));
      return;
    }
    ret.add(vhdl.CreateIfBit(address, bit, '0'));
    ret.addAll(vhdl.Indent(render(zero), 1));
    ret.add("else");
    ret.addAll(vhdl.Indent(render(one), 1));
    ret.add("end if;");
  }

  private void renderCase(DecoderNode.Branch<T> branch, List<String> ret) {
    ret.add(vhdl.CreateCase(address, branch.high(), branch.low()));
    for (DecoderNode.Arm<T> arm : branch.arms()) {
      ret.add(vhdl.tab + (arm.others() ? vhdl.CreateWhenOthers(arm.literal()) : vhdl.CreateWhen(arm.literal())));
      ret.addAll(vhdl.Indent(render(arm.body()), 2));
    }
    if (branch.trailingNull()) {
      ret.add(vhdl.tab + vhdl.CreateWhenOthers(null));
      ret.add(vhdl.tab.repeat(2) + "null;");
    }
    ret.add("end case;");
  }
}
