//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.collect.ImmutableList;
import java.util.List;
import plcodex.ast.Node;
import plcodex.ast.SourceCode;
import plcodex.ast.SourcePrinter;
import plcodex.model.Comment;
import plcodex.model.Source;

/**
 * The result of parsing one unit of source: its AST along with the text it was parsed from.
 */
public final class SourceUnit {

  /** Identifies the unit. */
  public final Source source;

  /** The text as supplied, before preprocessing. */
  public final String text;

  /** The text after preprocessing. Node spans index into this text. */
  public final String processedText;

  /** The root of the AST. Its type depends on the start symbol used for parsing. */
  public final Node root;

  /** Every comment and pragma in {@link #processedText}, in source order. */
  public final List<Comment> comments;

  public SourceUnit (Source source, String text, String processedText, Node root,
                     List<Comment> comments) {
    this.source = source;
    this.text = text;
    this.processedText = processedText;
    this.root = root;
    this.comments = ImmutableList.copyOf(comments);
  }

  /** Returns the text from which {@code node} was parsed, exactly as it appears in
    * {@link #processedText}, comments included. */
  public String sourceText (Node node) {
    return node.span().slice(processedText);
  }

  /** Renders the AST back into structured text. */
  public String render () {
    return SourcePrinter.render(root);
  }

  /** Returns the root as a {@link SourceCode}.
    * @throws IllegalStateException if the unit was not parsed as a whole source file. */
  public SourceCode sourceCode () {
    if (!(root instanceof SourceCode)) throw new IllegalStateException(
      source + " was parsed as " + root.getClass().getSimpleName() + ", not SourceCode");
    return (SourceCode)root;
  }

  @Override public String toString () {
    return "SourceUnit(" + source + ", " + root.getClass().getSimpleName() + ")";
  }
}
