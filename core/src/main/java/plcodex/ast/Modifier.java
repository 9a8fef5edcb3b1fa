//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import java.util.Locale;

/**
 * Access specifiers and inheritance modifiers of function blocks, methods and properties.
 */
public enum Modifier {

  ABSTRACT, FINAL, PUBLIC, PRIVATE, PROTECTED, INTERNAL;

  /** Returns the modifier spelled {@code keyword}, in any case. */
  public static Modifier forKeyword (String keyword) {
    return valueOf(keyword.toUpperCase(Locale.ROOT));
  }
}
