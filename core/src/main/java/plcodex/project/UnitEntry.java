//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import com.google.common.io.CharSource;
import java.io.IOException;
import java.util.Optional;
import plcodex.model.Source;

/**
 * A unit of source listed by a container: its identity and, if it has any, its text.
 */
public final class UnitEntry {

  /** The groups in which a target lists its units. Targets are walked in this order. */
  public static enum Kind {
    /** Data type units ({@code TYPE ... END_TYPE}). */
    DATA_TYPE,
    /** Global variable lists. */
    GLOBAL_VARIABLES,
    /** Program organization units: function blocks, programs and functions, along with their
      * methods, properties and actions. */
    POU
  }

  public final Source source;
  public final Kind kind;

  /** Creates an entry whose text is already in hand, or which has none if {@code text} is null. */
  public UnitEntry (Source source, Kind kind, String text) {
    this(source, kind, text == null ? null : CharSource.wrap(text));
  }

  /** Creates an entry whose text is read from {@code text} when it is parsed, or which has none
    * if {@code text} is null. */
  public UnitEntry (Source source, Kind kind, CharSource text) {
    this.source = source;
    this.kind = kind;
    _text = text;
  }

  /** Returns whether this unit has source text. Folders and items the container lists without
    * contents have none. */
  public boolean hasText () {
    return _text != null;
  }

  /**
   * Reads the source text of this unit, or returns empty if it has none.
   * @throws IOException if the text could not be read. Only this unit is affected.
   */
  public Optional<String> text () throws IOException {
    return _text == null ? Optional.empty() : Optional.of(_text.read());
  }

  @Override public String toString () {
    return kind + ":" + source;
  }

  private final CharSource _text;
}
