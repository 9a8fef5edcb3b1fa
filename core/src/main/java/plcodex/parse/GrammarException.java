//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Reports text which does not match the grammar from the requested start symbol.
 */
public class GrammarException extends ParseException {

  /** The offset of the furthest position the parser reached. */
  public final int offset;

  /** The 1-based line of {@link #offset}. */
  public final int line;

  /** The 1-based column of {@link #offset}. */
  public final int column;

  /** The text found at {@link #offset}, or "" at end of input. */
  public final String found;

  /** The grammar symbols that would have been accepted at {@link #offset}. */
  public final Set<String> expected;

  public GrammarException (String message, int offset, int line, int column, String found,
                           Set<String> expected) {
    super(format(message, line, column, expected));
    this.offset = offset;
    this.line = line;
    this.column = column;
    this.found = found;
    this.expected = ImmutableSet.copyOf(expected);
  }

  private static String format (String message, int line, int column, Set<String> expected) {
    String msg = message + " [line=" + line + ", column=" + column + "]";
    return expected.isEmpty() ? msg :
      msg + ", expected one of {" + Joiner.on(", ").join(expected) + "}";
  }
}
