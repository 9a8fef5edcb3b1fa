//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.collect.ImmutableSet;
import java.util.concurrent.locks.ReentrantLock;
import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.LexerATNSimulator;
import org.antlr.v4.runtime.atn.ParserATNSimulator;
import org.antlr.v4.runtime.atn.PredictionContextCache;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plcodex.grammar.IEC61131Lexer;
import plcodex.grammar.IEC61131Parser;

/**
 * Turns clean text (see {@link CommentExtractor}) into a concrete syntax tree. An engine owns the
 * prediction caches that the grammar builds up as it parses, which is where most of the cost of a
 * cold parse goes, so engines should be created once and reused. Calls on a single engine are
 * serialized; use one engine per thread for parallel parsing.
 */
public class Engine {

  /** The grammar symbols from which parsing can start. */
  public static enum Start {
    /** A whole source file: any number of program units, type declarations and global lists. */
    SOURCE {
      ParserRuleContext parse (IEC61131Parser parser) { return parser.iecSource(); }
    },
    /** A list of variable declaration blocks. */
    DECLARATIONS {
      ParserRuleContext parse (IEC61131Parser parser) { return parser.declarationList(); }
    },
    /** A list of statements. */
    STATEMENTS {
      ParserRuleContext parse (IEC61131Parser parser) { return parser.statementBlock(); }
    },
    /** A single expression. */
    EXPRESSION {
      ParserRuleContext parse (IEC61131Parser parser) { return parser.expressionInput(); }
    };

    abstract ParserRuleContext parse (IEC61131Parser parser);
  }

  public Engine () {
    _lexerDFA = newDFA(IEC61131Lexer._ATN);
    _parserDFA = newDFA(IEC61131Parser._ATN);
  }

  /**
   * Parses {@code text} starting from {@code start}.
   * @throws GrammarException if the text does not match the grammar.
   */
  public SyntaxTree parse (String text, Start start) {
    _lock.lock();
    try {
      IEC61131Lexer lexer = new IEC61131Lexer(CharStreams.fromString(text));
      lexer.setInterpreter(new LexerATNSimulator(
        lexer, IEC61131Lexer._ATN, _lexerDFA, _lexerContexts));
      lexer.removeErrorListeners();
      lexer.addErrorListener(LEXER_ERRORS);

      CommonTokenStream tokens = new CommonTokenStream(lexer);
      IEC61131Parser parser = new IEC61131Parser(tokens);
      parser.setInterpreter(new ParserATNSimulator(
        parser, IEC61131Parser._ATN, _parserDFA, _parserContexts));
      parser.removeErrorListeners();
      parser.setErrorHandler(new BailErrorStrategy());

      ParserRuleContext root;
      try {
        root = parse(parser, start, PredictionMode.SLL);
      } catch (ParseCancellationException sllFailure) {
        // SLL can reject valid input; only a full LL failure is a real syntax error
        log.debug("SLL parse failed, retrying with LL");
        parser.reset();
        try {
          root = parse(parser, start, PredictionMode.LL);
        } catch (ParseCancellationException llFailure) {
          throw toGrammarException(parser, text, llFailure);
        }
      }
      tokens.fill();
      return new SyntaxTree(start, root, tokens.getTokens(), text);

    } finally {
      _lock.unlock();
    }
  }

  private ParserRuleContext parse (IEC61131Parser parser, Start start, PredictionMode mode) {
    parser.getInterpreter().setPredictionMode(mode);
    return start.parse(parser);
  }

  private static GrammarException toGrammarException (Parser parser, String text,
                                                      ParseCancellationException pce) {
    if (!(pce.getCause() instanceof RecognitionException)) {
      return new GrammarException("Syntax error", text.length(), 0, 0, "", ImmutableSet.of());
    }
    RecognitionException re = (RecognitionException)pce.getCause();
    Token token = re.getOffendingToken();
    if (token == null) token = parser.getCurrentToken();

    ImmutableSet.Builder<String> expected = ImmutableSet.builder();
    IntervalSet types = re.getExpectedTokens();
    if (types != null) {
      Vocabulary vocab = parser.getVocabulary();
      for (int type : types.toList()) {
        expected.add(type == Token.EOF ? "<EOF>" : vocab.getDisplayName(type));
      }
    }

    boolean eof = token.getType() == Token.EOF;
    String found = eof ? "" : token.getText();
    int offset = eof ? text.length() : token.getStartIndex();
    String msg = eof ? "Unexpected end of input" : "Unexpected '" + found + "'";
    return new GrammarException(msg, offset, token.getLine(), token.getCharPositionInLine()+1,
                                found, expected.build());
  }

  private static DFA[] newDFA (ATN atn) {
    DFA[] dfa = new DFA[atn.getNumberOfDecisions()];
    for (int ii = 0; ii < dfa.length; ii++) dfa[ii] = new DFA(atn.getDecisionState(ii), ii);
    return dfa;
  }

  private final ReentrantLock _lock = new ReentrantLock();
  private final DFA[] _lexerDFA;
  private final DFA[] _parserDFA;
  private final PredictionContextCache _lexerContexts = new PredictionContextCache();
  private final PredictionContextCache _parserContexts = new PredictionContextCache();

  private static final ANTLRErrorListener LEXER_ERRORS = new BaseErrorListener() {
    @Override public void syntaxError (Recognizer<?,?> recognizer, Object offendingSymbol,
                                       int line, int charPositionInLine, String msg,
                                       RecognitionException e) {
      int offset = -1;
      String found = "";
      if (e instanceof LexerNoViableAltException) {
        LexerNoViableAltException lnvae = (LexerNoViableAltException)e;
        offset = lnvae.getStartIndex();
        CharStream input = lnvae.getInputStream();
        if (offset >= 0 && offset < input.size()) found = input.getText(Interval.of(offset, offset));
      }
      throw new GrammarException("Unrecognized input '" + found + "'", offset, line,
                                 charPositionInLine+1, found, ImmutableSet.<String>of());
    }
  };

  private static final Logger log = LoggerFactory.getLogger(Engine.class);
}
