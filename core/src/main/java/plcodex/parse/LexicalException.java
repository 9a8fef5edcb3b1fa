//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import plcodex.model.Span;

/**
 * Reports a malformed comment or pragma, one which is never closed.
 */
public class LexicalException extends ParseException {

  /** The span from the opening delimiter to the end of the text. */
  public final Span span;

  public LexicalException (String message, Span span) {
    super(message + " at " + span);
    this.span = span;
  }
}
