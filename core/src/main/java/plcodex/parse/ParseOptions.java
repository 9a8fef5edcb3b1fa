//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Configures a call to {@link SourceParser#parse}. Options are immutable; the modifier methods
  * return modified copies. */
public class ParseOptions {

  /** Parses whole source files, with no preprocessing. */
  public static final ParseOptions DEFAULT = new ParseOptions(
    Engine.Start.SOURCE, ImmutableList.of());

  /** The grammar symbol from which text is parsed. */
  public final Engine.Start start;

  /** Text transformations applied, in order, before comments are extracted. Spans in the
    * resulting AST index into the text produced by the last of them. */
  public final List<UnaryOperator<String>> preprocessors;

  /** Copies these options and sets {@link #start} to {@code start}. */
  public ParseOptions withStart (Engine.Start start) {
    return new ParseOptions(start, preprocessors);
  }

  /** Copies these options and appends {@code preprocessor} to {@link #preprocessors}. */
  public ParseOptions preprocess (UnaryOperator<String> preprocessor) {
    return new ParseOptions(start, ImmutableList.<UnaryOperator<String>>builder().
                            addAll(preprocessors).add(preprocessor).build());
  }

  /** Runs {@link #preprocessors} over {@code text}. */
  public String apply (String text) {
    String result = text;
    for (UnaryOperator<String> pp : preprocessors) result = pp.apply(result);
    return result;
  }

  @Override public String toString () {
    return "ParseOptions(" + start + ", preprocessors=" + preprocessors.size() + ")";
  }

  private ParseOptions (Engine.Start start, List<UnaryOperator<String>> preprocessors) {
    this.start = start;
    this.preprocessors = ImmutableList.copyOf(preprocessors);
  }
}
