//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.model;

/**
 * A half-open range {@code [start, end)} of character offsets into a source text.
 */
public final class Span {

  /** The span of nodes that were not produced from source text. */
  public static final Span NONE = new Span(-1, -1);

  /** The offset of the first character in the span. */
  public final int start;

  /** The offset one past the last character in the span. */
  public final int end;

  /** Returns the span {@code [start, end)}. */
  public static Span of (int start, int end) {
    if (start < 0 || end < start) throw new IllegalArgumentException(
      "Invalid span [" + start + ", " + end + ")");
    return new Span(start, end);
  }

  /** Returns true if this span was not produced from source text. */
  public boolean isNone () {
    return this == NONE;
  }

  /** Returns the number of characters covered by this span. */
  public int length () {
    return end - start;
  }

  public boolean isEmpty () {
    return end == start;
  }

  /** Returns true if every character of {@code other} is also covered by this span. */
  public boolean contains (Span other) {
    if (other.isNone()) return true;
    if (isNone()) return false;
    return start <= other.start && other.end <= end;
  }

  /** Returns true if this span and {@code other} share at least one character. */
  public boolean overlaps (Span other) {
    if (isNone() || other.isNone()) return false;
    return start < other.end && other.start < end;
  }

  /** Returns the smallest span covering both this span and {@code other}. */
  public Span union (Span other) {
    if (other.isNone()) return this;
    if (isNone()) return other;
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }

  /** Returns the text covered by this span. */
  public String slice (CharSequence text) {
    return isNone() ? "" : text.subSequence(start, end).toString();
  }

  @Override public boolean equals (Object other) {
    return (other instanceof Span) && start == ((Span)other).start && end == ((Span)other).end;
  }

  @Override public int hashCode () {
    return start * 31 + end;
  }

  @Override public String toString () {
    return isNone() ? "[none]" : "[" + start + ", " + end + ")";
  }

  private Span (int start, int end) {
    this.start = start;
    this.end = end;
  }
}
