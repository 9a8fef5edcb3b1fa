//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import java.util.Locale;

/**
 * The sections in which variables are declared, named by the keyword that opens them.
 */
public enum Section {

  VAR, VAR_INPUT, VAR_OUTPUT, VAR_IN_OUT, VAR_INST, VAR_TEMP, VAR_STAT, VAR_GLOBAL, VAR_EXTERNAL;

  /** Returns the keyword that opens this section. */
  public String keyword () {
    return name();
  }

  /** Returns the section opened by {@code keyword}, in any case. */
  public static Section forKeyword (String keyword) {
    return valueOf(keyword.toUpperCase(Locale.ROOT));
  }
}
