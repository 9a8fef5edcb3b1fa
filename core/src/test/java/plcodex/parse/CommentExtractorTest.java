//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.parse;

import com.google.common.base.Joiner;
import org.junit.*;
import static org.junit.Assert.*;

import plcodex.model.Comment;
import plcodex.model.Span;

public class CommentExtractorTest {

  public final String SOURCE = Joiner.on("\n").join(
    "x := 1; // set x",
    "(* block (* nested *) still block *)",
    "{attribute 'hide'}",
    "y := 2;");

  @Test public void testExtract () {
    CommentExtractor.Extraction ex = new CommentExtractor().extract(SOURCE);
    assertEquals(3, ex.comments.size());

    Comment line = ex.comments.get(0);
    assertEquals("// set x", line.text);
    assertEquals(Comment.Kind.COMMENT, line.kind);
    assertTrue(line.isLineComment());
    assertEquals("set x", line.body());
    assertEquals(line.text, line.span.slice(SOURCE));

    Comment block = ex.comments.get(1);
    assertEquals("(* block (* nested *) still block *)", block.text);
    assertFalse(block.isLineComment());

    Comment pragma = ex.comments.get(2);
    assertEquals(Comment.Kind.PRAGMA, pragma.kind);
    assertEquals("hide", pragma.attributeName().get());
    assertFalse(pragma.attributeValue().isPresent());
  }

  @Test public void testCleanTextKeepsOffsets () {
    CommentExtractor.Extraction ex = new CommentExtractor().extract(SOURCE);
    assertEquals(SOURCE.length(), ex.cleanText.length());
    assertEquals(SOURCE.split("\n").length, ex.cleanText.split("\n").length);
    assertFalse(ex.cleanText.contains("set x"));
    assertFalse(ex.cleanText.contains("nested"));
    assertFalse(ex.cleanText.contains("hide"));
    int yidx = SOURCE.indexOf("y := 2;");
    assertEquals(yidx, ex.cleanText.indexOf("y := 2;"));
    assertTrue(ex.cleanText.startsWith("x := 1;"));
  }

  @Test public void testStringsAreNotComments () {
    String text = Joiner.on("\n").join(
      "s := '// not a comment (* nor this *)';",
      "t := 'it$'s { still } a string';",
      "w := \"wide // string\";");
    CommentExtractor.Extraction ex = new CommentExtractor().extract(text);
    assertTrue(ex.comments.isEmpty());
    assertEquals(text, ex.cleanText);
  }

  @Test public void testAttributeValue () {
    CommentExtractor.Extraction ex = new CommentExtractor().extract(
      "{attribute 'pytmc' := 'pv: MOTOR:SPEED'}\nspeed : REAL;");
    Comment pragma = ex.comments.get(0);
    assertEquals("pytmc", pragma.attributeName().get());
    assertEquals("pv: MOTOR:SPEED", pragma.attributeValue().get());
  }

  @Test public void testNonAttributePragma () {
    CommentExtractor.Extraction ex = new CommentExtractor().extract("{warning 'check me'}");
    Comment pragma = ex.comments.get(0);
    assertEquals(Comment.Kind.PRAGMA, pragma.kind);
    assertFalse(pragma.attributeName().isPresent());
  }

  @Test public void testUnterminatedBlock () {
    String text = "x := 1;\n(* never (* closed *)\ny := 2;";
    try {
      new CommentExtractor().extract(text);
      fail("Expected LexicalException");
    } catch (LexicalException le) {
      assertEquals(Span.of(text.indexOf("(*"), text.length()), le.span);
    }
  }

  @Test public void testUnterminatedPragma () {
    String text = "{attribute 'hide'\nx : INT;";
    try {
      new CommentExtractor().extract(text);
      fail("Expected LexicalException");
    } catch (LexicalException le) {
      assertEquals(0, le.span.start);
      assertEquals(text.length(), le.span.end);
    }
  }
}
