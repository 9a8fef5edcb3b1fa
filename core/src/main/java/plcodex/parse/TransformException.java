//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

/**
 * Reports a syntax tree which the transformer cannot reduce. This indicates a mismatch between
 * the grammar and the transformer, not a problem with the parsed code.
 */
public class TransformException extends ParseException {

  public TransformException (String message) {
    super(message);
  }

  public TransformException (String message, Throwable cause) {
    super(message, cause);
  }
}
