//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A comment or pragma removed from source text before parsing. Each one is claimed by exactly one
 * AST node during transformation.
 */
public final class Comment {

  /** Distinguishes comments from pragmas. */
  public static enum Kind {
    /** A {@code // line} or {@code (* block *)} comment. */
    COMMENT,
    /** A {@code { pragma }}, usually an attribute that applies to the following declaration. */
    PRAGMA;
  }

  /** The span of the comment in its source text, delimiters included. */
  public final Span span;

  /** Whether this is a comment or a pragma. */
  public final Kind kind;

  /** The text of the comment, delimiters included. */
  public final String text;

  public Comment (Span span, Kind kind, String text) {
    this.span = Objects.requireNonNull(span);
    this.kind = Objects.requireNonNull(kind);
    this.text = Objects.requireNonNull(text);
  }

  /** Returns true if this comment runs to the end of its line. */
  public boolean isLineComment () {
    return kind == Kind.COMMENT && text.startsWith("//");
  }

  /** Returns the text between the delimiters, trimmed. */
  public String body () {
    if (kind == Kind.PRAGMA) return text.substring(1, text.length()-1).trim();
    else if (isLineComment()) return text.substring(2).trim();
    else return text.substring(2, text.length()-2).trim();
  }

  /** Returns the name of the attribute set by this pragma, if it is an attribute pragma. */
  public Optional<String> attributeName () {
    Matcher m = attribute();
    return (m == null) ? Optional.empty() : Optional.of(m.group(1));
  }

  /** Returns the value of the attribute set by this pragma, if it is an attribute pragma which
    * assigns a value. */
  public Optional<String> attributeValue () {
    Matcher m = attribute();
    return (m == null) ? Optional.empty() : Optional.ofNullable(m.group(3));
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Comment)) return false;
    Comment oc = (Comment)other;
    return span.equals(oc.span) && kind == oc.kind && text.equals(oc.text);
  }

  @Override public int hashCode () {
    return span.hashCode() ^ text.hashCode();
  }

  @Override public String toString () {
    return kind + span.toString() + " " + text;
  }

  private Matcher attribute () {
    if (kind != Kind.PRAGMA) return null;
    Matcher m = ATTRIBUTE.matcher(body());
    return m.matches() ? m : null;
  }

  private static final Pattern ATTRIBUTE = Pattern.compile(
    "(?is)attribute\\s+'([^']*)'(\\s*:=\\s*'([^']*)')?\\s*");
}
