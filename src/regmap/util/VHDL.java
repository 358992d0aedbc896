package regmap.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Small VHDL text generator used for decoders and the processes around them.
 */
public class VHDL {
  public String tab = "  ";

  public VHDL() {}

  public VHDL(String tab) { this.tab = tab; }

  public String CreateSlice(String signal, int high, int low) { return signal + "(" + high + " downto " + low + ")"; }

  public String CreateBit(String signal, int index) { return signal + "(" + index + ")"; }

  public String CreateVectorLiteral(String bits) { return "\"" + bits + "\""; }

  public String CreateBitLiteral(char bit) { return "'" + bit + "'"; }

  /** {@code if signal(high downto low) = "literal" then} */
  public String CreateIfVector(String signal, int high, int low, String literal) {
    return "if " + CreateSlice(signal, high, low) + " = " + CreateVectorLiteral(literal) + " then";
  }

  /** {@code if signal(index) = 'bit' then} */
  public String CreateIfBit(String signal, int index, char bit) {
    return "if " + CreateBit(signal, index) + " = " + CreateBitLiteral(bit) + " then";
  }

  public String CreateCase(String signal, int high, int low) { return "case " + CreateSlice(signal, high, low) + " is"; }

  public String CreateWhen(String literal) { return "when " + CreateVectorLiteral(literal) + " =>"; }

  /** {@code when others =>}, with the value it stands for as a comment if given. */
  public String CreateWhenOthers(String literal) {
    if (literal == null)
      return "when others =>";
    return "when others => -- " + CreateVectorLiteral(literal);
  }

  public String CreateComment(String text) { return "-- " + text; }

  /** Prefixes every line with {@code levels} tabs. */
  public List<String> Indent(List<String> lines, int levels) {
    List<String> ret = new ArrayList<>(lines.size());
    String prefix = tab.repeat(levels);
    for (String line : lines)
      ret.add(prefix + line);
    return ret;
  }

  /** Joins lines, strips trailing whitespace from each and drops trailing empty lines. */
  public String Join(List<String> lines) {
    List<String> stripped = new ArrayList<>(lines.size());
    for (String line : lines)
      stripped.add(line.stripTrailing());
    while (!stripped.isEmpty() && stripped.get(stripped.size() - 1).isEmpty())
      stripped.remove(stripped.size() - 1);
    return String.join("\n", stripped);
  }

  /**
   * Wraps a block of statements into a process. With {@code clk}, the statements run on the rising clock edge.
   */
  public String CreateInProc(boolean clk, String label, String text) {
    int i = 1;
    String sensitivity = "all";
    String clockEdge = "";
    String endclockEdge = "";
    if (clk) {
      sensitivity = "clk";
      clockEdge = tab + "if rising_edge(clk) then\n";
      i++;
      endclockEdge = tab + "end if;\n";
    }
    return label + ": process(" + sensitivity + ") is\nbegin\n" + clockEdge + AlignText(tab.repeat(i), text) + "\n" + endclockEdge +
        "end process;\n";
  }

  /** Indents every non-empty line of a multi-line text. */
  public String AlignText(String alignment, String text) {
    List<String> ret = new ArrayList<>();
    for (String line : text.split("\n", -1))
      ret.add(line.isEmpty() ? line : alignment + line);
    return String.join("\n", ret);
  }
}
