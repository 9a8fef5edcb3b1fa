//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import java.util.NoSuchElementException;
import plcodex.model.Source;
import plcodex.parse.SourceUnit;

/**
 * The outcome of parsing one unit (or of failing to read one project) during a walk.
 */
public final class UnitResult {

  /** Identifies the unit, or the container that could not be read. */
  public final Source source;

  public static UnitResult success (Source source, SourceUnit unit) {
    return new UnitResult(source, unit, null);
  }

  public static UnitResult failure (Source source, Exception error) {
    return new UnitResult(source, null, error);
  }

  public boolean isSuccess () {
    return _unit != null;
  }

  /**
   * Returns the parsed unit.
   * @throws NoSuchElementException if this result is a failure.
   */
  public SourceUnit unit () {
    if (_unit == null) throw new NoSuchElementException("Failed to parse " + source, _error);
    return _unit;
  }

  /**
   * Returns the error which prevented parsing.
   * @throws NoSuchElementException if this result is a success.
   */
  public Exception error () {
    if (_error == null) throw new NoSuchElementException(source + " parsed successfully");
    return _error;
  }

  @Override public String toString () {
    return isSuccess() ? "ok " + source : "failed " + source + ": " + _error.getMessage();
  }

  private UnitResult (Source source, SourceUnit unit, Exception error) {
    this.source = source;
    _unit = unit;
    _error = error;
  }

  private final SourceUnit _unit;
  private final Exception _error;
}
