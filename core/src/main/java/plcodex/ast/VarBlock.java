//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A block of declarations in one section: {@code VAR_INPUT ... END_VAR}.
 */
public final class VarBlock extends Node {

  /** Qualifiers that may follow a section keyword. */
  public static enum Qualifier {
    CONSTANT, RETAIN, PERSISTENT, NON_RETAIN;

    public static Qualifier forKeyword (String keyword) {
      return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
  }

  public final Section section;
  public final List<Qualifier> qualifiers;
  public final List<Declaration> declarations;

  public VarBlock (Section section, List<Qualifier> qualifiers, List<Declaration> declarations) {
    this.section = section;
    this.qualifiers = ImmutableList.copyOf(qualifiers);
    this.declarations = ImmutableList.copyOf(declarations);
  }

  public boolean isConstant () {
    return qualifiers.contains(Qualifier.CONSTANT);
  }

  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(section, qualifiers, declarations); }
}
