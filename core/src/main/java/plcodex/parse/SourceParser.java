//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plcodex.ast.Node;
import plcodex.model.Source;
import plcodex.transform.GrammarTransformer;

/**
 * Runs the parsing pipeline over a single unit of source: preprocessing, comment extraction,
 * parsing and transformation into an AST.
 */
public class SourceParser {

  public SourceParser (Engine engine) {
    _engine = Preconditions.checkNotNull(engine);
  }

  /** Parses {@code text} as a whole source file. */
  public SourceUnit parse (Source source, String text) {
    return parse(source, text, ParseOptions.DEFAULT);
  }

  /**
   * Parses {@code text} according to {@code options}.
   * @throws ParseException if the text cannot be parsed. The exception is attributed to
   * {@code source}.
   */
  public SourceUnit parse (Source source, String text, ParseOptions options) {
    try {
      String processed = options.apply(text);
      CommentExtractor.Extraction extract = _extractor.extract(processed);
      SyntaxTree tree = _engine.parse(extract.cleanText, options.start);
      Node root = new GrammarTransformer(tree, extract.comments).transform();
      log.debug("Parsed {} ({} comments)", source, extract.comments.size());
      return new SourceUnit(source, text, processed, root, extract.comments);
    } catch (ParseException pe) {
      throw pe.attribute(source);
    }
  }

  private final Engine _engine;
  private final CommentExtractor _extractor = new CommentExtractor();

  private static final Logger log = LoggerFactory.getLogger(SourceParser.class);
}
