//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

/**
 * The unary and binary operators of structured text.
 */
public enum Operator {

  OR("OR"), OR_ELSE("OR_ELSE"), XOR("XOR"), AND("AND"), AND_THEN("AND_THEN"),
  EQ("="), NE("<>"), LT("<"), GT(">"), LE("<="), GE(">="),
  ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("MOD"), POW("**"),

  NEG("-"), PLUS("+"), NOT("NOT");

  /** The canonical spelling of this operator. */
  public final String symbol;

  /** Returns the binary operator spelled {@code text}, in any case. {@code &} is {@link #AND}. */
  public static Operator binary (String text) {
    if ("&".equals(text)) return AND;
    for (Operator op : values()) {
      if (op.ordinal() < NEG.ordinal() && op.symbol.equalsIgnoreCase(text)) return op;
    }
    throw new IllegalArgumentException("Unknown binary operator: " + text);
  }

  /** Returns the unary operator spelled {@code text}, in any case. */
  public static Operator unary (String text) {
    for (Operator op : values()) {
      if (op.ordinal() >= NEG.ordinal() && op.symbol.equalsIgnoreCase(text)) return op;
    }
    throw new IllegalArgumentException("Unknown unary operator: " + text);
  }

  /** Returns true if this operator is spelled as a word and needs surrounding spaces. */
  public boolean isWord () {
    return Character.isLetter(symbol.charAt(0));
  }

  Operator (String symbol) {
    this.symbol = symbol;
  }
}
