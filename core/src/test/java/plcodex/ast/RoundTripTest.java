//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.junit.*;
import static org.junit.Assert.*;

import plcodex.PlcCodex;
import plcodex.model.Comment;
import plcodex.model.Source;
import plcodex.model.Span;
import plcodex.parse.SourceParser;
import plcodex.parse.SourceUnit;

public class RoundTripTest {

  public final String SOURCE = Joiner.on("\n").join(
    "// Motor control",
    "{attribute 'reflection'}",
    "FUNCTION_BLOCK FB_Motor EXTENDS FB_Base IMPLEMENTS I_Motor",
    "VAR_INPUT",
    "    bEnable : BOOL; // enable input",
    "    {attribute 'pytmc' := 'pv: SPEED'}",
    "    fSpeed : LREAL := 1.5;",
    "END_VAR",
    "VAR_OUTPUT",
    "    bRunning : BOOL;",
    "END_VAR",
    "VAR",
    "    aBuffer : ARRAY[1..10] OF INT := [1, 2, 8(0)];",
    "    stConfig : ST_Config := (nMode := 1, sName := 'motor');",
    "    pData : POINTER TO BYTE;",
    "    sText : STRING(80);",
    "    tDelay : TIME := T#5S;",
    "    fbTimer : TON;",
    "END_VAR",
    "(* main body *)",
    "IF bEnable AND NOT bRunning THEN",
    "    bRunning := TRUE; // start",
    "ELSIF fSpeed > 10.0 THEN",
    "    fSpeed := 10.0;",
    "ELSE",
    "    ;",
    "END_IF",
    "CASE nState OF",
    "    0, 1:",
    "        nState := nState + 1;",
    "    2..5:",
    "        nState := 0;",
    "ELSE",
    "    nState := -1;",
    "END_CASE",
    "FOR i := 1 TO 10 BY 2 DO",
    "    aBuffer[i] := i * (* doubled *) 2;",
    "END_FOR",
    "fbTimer(IN := bEnable, PT := tDelay, Q => bDone);",
    "WHILE nCount < 5 DO",
    "    nCount := nCount + 1;",
    "    IF nCount = 3 THEN",
    "        EXIT;",
    "    END_IF",
    "END_WHILE",
    "REPEAT",
    "    nCount := nCount - 1;",
    "UNTIL nCount <= 0",
    "END_REPEAT",
    "pData^ := 16#FF;",
    "stConfig.nMode := (nState + 1) MOD 4;",
    "// last words",
    "END_FUNCTION_BLOCK",
    "",
    "METHOD PUBLIC Start : BOOL",
    "VAR_INPUT",
    "    nSpeed : INT;",
    "END_VAR",
    "Start := TRUE;",
    "END_METHOD",
    "",
    "TYPE ST_Config :",
    "STRUCT",
    "    nMode : INT;",
    "    sName : STRING := 'default'; // fallback",
    "END_STRUCT",
    "END_TYPE",
    "",
    "VAR_GLOBAL CONSTANT",
    "    gMax : DINT := 100;",
    "END_VAR",
    "(* end of file *)",
    "");

  public final SourceParser parser = new SourceParser(PlcCodex.defaultEngine());

  @Test public void testRenderedTextReparses () {
    SourceUnit unit = parser.parse(new Source.File("FB_Motor.st"), SOURCE);
    String rendered = unit.render();
    SourceUnit again = parser.parse(new Source.File("FB_Motor.st"), rendered);
    assertEquals(unit.root, again.root);
    assertNotSame(unit.root, again.root);
  }

  @Test public void testRenderedTextKeepsComments () {
    SourceUnit unit = parser.parse(new Source.File("FB_Motor.st"), SOURCE);
    String rendered = unit.render();
    for (Comment comment : unit.comments) {
      assertTrue(comment.text, rendered.contains(comment.text));
    }
    SourceUnit again = parser.parse(new Source.File("FB_Motor.st"), rendered);
    assertEquals(unit.comments.size(), again.comments.size());
  }

  @Test public void testEachCommentClaimedOnce () {
    SourceUnit unit = parser.parse(new Source.File("FB_Motor.st"), SOURCE);
    Map<Comment, Node> owners = new IdentityHashMap<>();
    for (Node node : nodes(unit.root)) {
      for (Comment comment : node.comments()) {
        Node prev = owners.put(comment, node);
        assertNull("Claimed twice: " + comment, prev);
      }
    }
    assertEquals(unit.comments.size(), owners.size());
  }

  @Test public void testSpansNest () {
    SourceUnit unit = parser.parse(new Source.File("FB_Motor.st"), SOURCE);
    assertEquals(Span.of(0, SOURCE.length()), unit.root.span());
    for (Node node : nodes(unit.root)) {
      for (Comment comment : node.comments()) {
        assertTrue(node + " / " + comment, node.span().contains(comment.span));
      }
      Span prev = null;
      for (Node child : node.children()) {
        if (child.span().isNone()) continue;
        assertTrue(node.span() + " !> " + child.span(), node.span().contains(child.span()));
        if (prev != null) {
          assertTrue(prev + " overlaps " + child.span(), prev.end <= child.span().start);
        }
        prev = child.span();
      }
    }
  }

  @Test public void testSourceTextOfItems () {
    SourceUnit unit = parser.parse(new Source.File("FB_Motor.st"), SOURCE);
    List<Item> items = unit.sourceCode().items;
    assertEquals(4, items.size());
    String fb = unit.sourceText(items.get(0));
    assertTrue(fb, fb.startsWith("// Motor control\n{attribute 'reflection'}\nFUNCTION_BLOCK"));
    assertTrue(fb, fb.endsWith("END_FUNCTION_BLOCK"));
    assertEquals(Joiner.on("\n").join(
      "METHOD PUBLIC Start : BOOL",
      "VAR_INPUT",
      "    nSpeed : INT;",
      "END_VAR",
      "Start := TRUE;",
      "END_METHOD"), unit.sourceText(items.get(1)));
  }

  protected static List<Node> nodes (Node root) {
    List<Node> nodes = new ArrayList<>();
    collect(root, nodes);
    return nodes;
  }

  private static void collect (Node node, List<Node> into) {
    into.add(node);
    for (Node child : node.children()) collect(child, into);
  }
}
