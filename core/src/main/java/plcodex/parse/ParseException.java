//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import java.util.Optional;
import plcodex.model.Source;

/**
 * The root of the errors raised while turning source text into an AST. Every stage of the
 * pipeline raises a subclass; {@link SourceParser} attributes it to the unit being parsed.
 */
public class ParseException extends RuntimeException {

  public ParseException (String message) {
    super(message);
  }

  public ParseException (String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns the unit in which this error occurred, if it has been attributed. */
  public Optional<Source> source () {
    return Optional.ofNullable(_source);
  }

  /** Attributes this error to {@code source}, unless it was already attributed. */
  public ParseException attribute (Source source) {
    if (_source == null) _source = source;
    return this;
  }

  @Override public String getMessage () {
    String msg = super.getMessage();
    return (_source == null) ? msg : _source + ": " + msg;
  }

  private Source _source;
}
