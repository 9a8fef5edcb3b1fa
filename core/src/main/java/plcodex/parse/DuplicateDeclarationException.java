//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import plcodex.model.Span;

/**
 * Reports a name declared twice in the same section of a single scope.
 */
public class DuplicateDeclarationException extends ParseException {

  /** The name that was declared twice. */
  public final String name;

  /** The span of the first declaration of {@link #name}. */
  public final Span first;

  /** The span of the second declaration of {@link #name}. */
  public final Span second;

  public DuplicateDeclarationException (String name, Span first, Span second) {
    super("Duplicate declaration of '" + name + "' at " + first + " and " + second);
    this.name = name;
    this.first = first;
    this.second = second;
  }
}
