//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.collect.ImmutableList;
import java.util.List;
import plcodex.model.Comment;
import plcodex.model.Span;

/**
 * Removes comments and pragmas from structured text so that the grammar need not know about
 * them. Removed characters are replaced with spaces (line breaks are kept), so every offset in the
 * clean text refers to the same character as in the original.
 */
public class CommentExtractor {

  /** The result of extracting the comments from a text. */
  public static final class Extraction {

    /** The comments and pragmas, in source order. */
    public final List<Comment> comments;

    /** The text with every comment and pragma blanked out. */
    public final String cleanText;

    public Extraction (List<Comment> comments, String cleanText) {
      this.comments = ImmutableList.copyOf(comments);
      this.cleanText = cleanText;
    }
  }

  /**
   * Extracts all comments and pragmas from {@code text}.
   * @throws LexicalException if a block comment or pragma is never closed.
   */
  public Extraction extract (String text) {
    ImmutableList.Builder<Comment> comments = ImmutableList.builder();
    char[] clean = text.toCharArray();
    int pos = 0, len = text.length();

    while (pos < len) {
      char c = text.charAt(pos);
      int end;
      Comment.Kind kind = Comment.Kind.COMMENT;

      if (c == '\'' || c == '"') {
        pos = skipString(text, pos, c);
        continue;

      } else if (c == '/' && peek(text, pos+1) == '/') {
        end = pos;
        while (end < len && text.charAt(end) != '\n' && text.charAt(end) != '\r') end++;

      } else if (c == '(' && peek(text, pos+1) == '*') {
        end = skipBlock(text, pos);

      } else if (c == '{') {
        kind = Comment.Kind.PRAGMA;
        end = text.indexOf('}', pos+1);
        if (end == -1) throw new LexicalException("Unterminated pragma", Span.of(pos, len));
        end += 1;

      } else {
        pos++;
        continue;
      }

      comments.add(new Comment(Span.of(pos, end), kind, text.substring(pos, end)));
      blank(clean, pos, end);
      pos = end;
    }

    return new Extraction(comments.build(), new String(clean));
  }

  /** Returns the offset just past the (possibly nested) block comment that opens at {@code start}. */
  protected static int skipBlock (String text, int start) {
    int depth = 0, pos = start, len = text.length();
    while (pos < len-1) {
      char c = text.charAt(pos), n = text.charAt(pos+1);
      if (c == '(' && n == '*') {
        depth += 1;
        pos += 2;
      } else if (c == '*' && n == ')') {
        depth -= 1;
        pos += 2;
        if (depth == 0) return pos;
      } else pos++;
    }
    throw new LexicalException("Unterminated block comment", Span.of(start, len));
  }

  /** Returns the offset just past the string literal that opens at {@code start}. Strings do not
    * span lines, so an unterminated one ends at the line break and is left to the grammar. */
  protected static int skipString (String text, int start, char quote) {
    int pos = start+1, len = text.length();
    while (pos < len) {
      char c = text.charAt(pos);
      if (c == '$') pos += 2; // escape: $', $$, $N, ...
      else if (c == quote) return pos+1;
      else if (c == '\n' || c == '\r') return pos;
      else pos++;
    }
    return len;
  }

  private static char peek (String text, int pos) {
    return (pos < text.length()) ? text.charAt(pos) : '\0';
  }

  private static void blank (char[] text, int start, int end) {
    for (int ii = start; ii < end; ii++) {
      if (text[ii] != '\n' && text[ii] != '\r') text[ii] = ' ';
    }
  }
}
