//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * The concrete syntax tree produced by an {@link Engine}. It exists only to be handed to the
 * transformer and should not be retained once the AST is built.
 */
public final class SyntaxTree {

  /** The symbol from which the text was parsed. */
  public final Engine.Start start;

  /** The root of the parse tree. Its shape is determined by the grammar. */
  public final ParserRuleContext root;

  /** Every token of the text (comments and whitespace excluded), ending with EOF. */
  public final List<Token> tokens;

  /** The clean text that was parsed. */
  public final String text;

  public SyntaxTree (Engine.Start start, ParserRuleContext root, List<Token> tokens, String text) {
    this.start = start;
    this.root = root;
    this.tokens = ImmutableList.copyOf(tokens);
    this.text = text;
  }
}
