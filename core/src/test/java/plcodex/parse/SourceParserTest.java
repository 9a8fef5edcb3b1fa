//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.base.Joiner;
import org.junit.*;
import static org.junit.Assert.*;

import plcodex.PlcCodex;
import plcodex.ast.*;
import plcodex.model.Source;

public class SourceParserTest {

  public final String PROGRAM = Joiner.on("\n").join(
    "PROGRAM Main",
    "VAR",
    "    count : INT;",
    "END_VAR",
    "count := 1; // one",
    "END_PROGRAM");

  public final SourceParser parser = new SourceParser(PlcCodex.defaultEngine());

  @Test public void testParse () {
    Source source = new Source.File("Main.st");
    SourceUnit unit = parser.parse(source, PROGRAM);
    assertEquals(source, unit.source);
    assertEquals(PROGRAM, unit.text);
    assertEquals(PROGRAM, unit.processedText);
    assertEquals(1, unit.comments.size());

    SourceCode code = unit.sourceCode();
    assertEquals(1, code.items.size());
    Program main = (Program)code.items.get(0);
    assertEquals("Main", main.name);
    Stmt stmt = main.body.statements.get(0);
    assertEquals("count := 1; // one", unit.sourceText(stmt));
    assertEquals("// one", stmt.trailingComments().get(0).text);
  }

  @Test public void testPreprocessorsRunInOrder () {
    ParseOptions opts = ParseOptions.DEFAULT.withStart(Engine.Start.DECLARATIONS).
      preprocess(text -> text.replace("$TYPE$", "INT")).
      preprocess(text -> text.replace("INT", "DINT"));
    String text = "VAR x : $TYPE$; END_VAR";
    SourceUnit unit = parser.parse(new Source.File("decls.st"), text, opts);
    assertEquals(text, unit.text);
    assertEquals("VAR x : DINT; END_VAR", unit.processedText);

    DeclarationList decls = (DeclarationList)unit.root;
    Declaration x = decls.varBlocks.get(0).declarations.get(0);
    assertEquals("DINT", ((TypeSpec.Named)x.type).name);
    assertEquals("DINT", unit.sourceText(x.type));
  }

  @Test public void testOptionsAreImmutable () {
    ParseOptions opts = ParseOptions.DEFAULT.preprocess(String::trim);
    assertEquals(Engine.Start.SOURCE, ParseOptions.DEFAULT.start);
    assertTrue(ParseOptions.DEFAULT.preprocessors.isEmpty());
    assertEquals(1, opts.preprocessors.size());
    assertEquals("x", opts.apply("  x  "));
  }

  @Test public void testErrorsAreAttributed () {
    Source source = new Source.File("Broken.st");
    try {
      parser.parse(source, "PROGRAM Broken\nx := ;\nEND_PROGRAM");
      fail("Expected GrammarException");
    } catch (GrammarException ge) {
      assertEquals(source, ge.source().get());
      assertTrue(ge.getMessage(), ge.getMessage().startsWith("Broken.st: "));
    }
  }

  @Test public void testLexicalErrorsAreAttributed () {
    Source source = new Source.File("Open.st");
    try {
      parser.parse(source, "PROGRAM Open\n(* oops\nEND_PROGRAM");
      fail("Expected LexicalException");
    } catch (LexicalException le) {
      assertEquals(source, le.source().get());
    }
  }

  @Test(expected=IllegalStateException.class)
  public void testSourceCodeOfExpression () {
    SourceUnit unit = parser.parse(new Source.File("expr"), "a + b",
                                   ParseOptions.DEFAULT.withStart(Engine.Start.EXPRESSION));
    assertTrue(unit.root instanceof Expr.Binary);
    unit.sourceCode();
  }

  @Test public void testRender () {
    SourceUnit unit = parser.parse(new Source.File("Main.st"), PROGRAM);
    SourceUnit again = parser.parse(new Source.File("Main.st"), unit.render());
    assertEquals(unit.root, again.root);
  }
}
