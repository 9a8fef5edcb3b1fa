//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.transform;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import org.junit.*;
import static org.junit.Assert.*;

import plcodex.PlcCodex;
import plcodex.ast.*;
import plcodex.model.Comment;
import plcodex.model.Source;
import plcodex.parse.*;

public class GrammarTransformerTest {

  public final String MOTOR = Joiner.on("\n").join(
    "FUNCTION_BLOCK ABSTRACT FB_Motor EXTENDS FB_Base IMPLEMENTS I_Motor, I_Device",
    "VAR_INPUT",
    "    bEnable : BOOL; // enable input",
    "    {attribute 'pytmc' := 'pv: SPEED'}",
    "    fSpeed : LREAL := 1.5;",
    "END_VAR",
    "VAR RETAIN",
    "    aBuffer : ARRAY[1..10, *] OF INT := [1, 2, 8(0)];",
    "    stConfig : ST_Config := (nMode := 1, sName := 'motor');",
    "    pData : POINTER TO BYTE;",
    "    sText : STRING(80);",
    "    nLow, nHigh : int;",
    "    bOut AT %QX0.1 : BOOL;",
    "END_VAR",
    "IF bEnable THEN",
    "    fbTimer(IN := bEnable, PT := T#5S, Q => bDone, NOT ENO =>);",
    "END_IF",
    "END_FUNCTION_BLOCK");

  public final SourceParser parser = new SourceParser(PlcCodex.defaultEngine());

  protected Node parse (String text, Engine.Start start) {
    return parser.parse(new Source.File("test.st"), text,
                        ParseOptions.DEFAULT.withStart(start)).root;
  }

  protected Expr expr (String text) {
    return (Expr)parse(text, Engine.Start.EXPRESSION);
  }

  protected List<Stmt> statements (String text) {
    return ((StatementList)parse(text, Engine.Start.STATEMENTS)).statements;
  }

  @Test public void testFunctionBlock () {
    SourceCode code = (SourceCode)parse(MOTOR, Engine.Start.SOURCE);
    FunctionBlock fb = (FunctionBlock)code.items.get(0);
    assertEquals("FB_Motor", fb.name);
    assertEquals(ImmutableList.of(Modifier.ABSTRACT), fb.modifiers);
    assertEquals("FB_Base", fb.base);
    assertEquals(ImmutableList.of("I_Motor", "I_Device"), fb.interfaces);
    assertEquals(2, fb.varBlocks.size());

    VarBlock inputs = fb.varBlocks.get(0);
    assertEquals(Section.VAR_INPUT, inputs.section);
    Declaration speed = inputs.declarations.get(1);
    assertEquals(ImmutableList.of("fSpeed"), speed.names);
    assertEquals(new Expr.Literal(Expr.LiteralKind.REAL, "1.5"),
                 ((Initializer.Value)speed.init).value);
    assertEquals("pytmc", speed.pragmas().get(0).attributeName().get());
    assertEquals("// enable input", inputs.declarations.get(0).trailingComments().get(0).text);

    VarBlock locals = fb.varBlocks.get(1);
    assertEquals(Section.VAR, locals.section);
    assertEquals(ImmutableList.of(VarBlock.Qualifier.RETAIN), locals.qualifiers);

    TypeSpec.Array array = (TypeSpec.Array)locals.declarations.get(0).type;
    assertEquals(2, array.ranges.size());
    assertTrue(array.ranges.get(1).isOpen());
    assertEquals("INT", array.element.baseTypeName());
    Initializer.ArrayInit ainit = (Initializer.ArrayInit)locals.declarations.get(0).init;
    assertEquals(3, ainit.elements.size());
    assertNull(ainit.elements.get(0).count);
    assertEquals("8", ainit.elements.get(2).count);

    Initializer.StructInit sinit = (Initializer.StructInit)locals.declarations.get(1).init;
    assertEquals("sName", sinit.members.get(1).name);

    TypeSpec.Pointer ptr = (TypeSpec.Pointer)locals.declarations.get(2).type;
    assertEquals("BYTE", ptr.baseTypeName());
    TypeSpec.Str str = (TypeSpec.Str)locals.declarations.get(3).type;
    assertFalse(str.wide);
    assertEquals(new Expr.Literal(Expr.LiteralKind.INTEGER, "80"), str.length);

    Declaration pair = locals.declarations.get(4);
    assertEquals(ImmutableList.of("nLow", "nHigh"), pair.names);
    assertEquals("%QX0.1", locals.declarations.get(5).location);

    assertTrue(fb.declarations().find("NHIGH").isPresent());
    assertEquals(Section.VAR, fb.declarations().sections().keySet().toArray()[1]);
  }

  @Test public void testCallArguments () {
    SourceCode code = (SourceCode)parse(MOTOR, Engine.Start.SOURCE);
    Stmt.If ifs = (Stmt.If)((FunctionBlock)code.items.get(0)).body.statements.get(0);
    assertNull(ifs.otherwise);
    Stmt.Invoke invoke = (Stmt.Invoke)ifs.body.statements.get(0);
    List<Expr.Arg> args = invoke.call.args;
    assertEquals(4, args.size());
    assertEquals(Expr.Arg.Kind.INPUT, args.get(0).kind);
    assertEquals("IN", args.get(0).name);
    assertEquals(Expr.LiteralKind.TIME, ((Expr.Literal)args.get(1).value).kind);
    assertEquals(Expr.Arg.Kind.OUTPUT, args.get(2).kind);
    assertEquals(new Expr.Name("bDone"), args.get(2).value);
    assertTrue(args.get(3).inverted);
    assertNull(args.get(3).value);
  }

  @Test public void testTypeNamesAreCaseInsensitive () {
    DeclarationList upper = (DeclarationList)parse("VAR x : INT; END_VAR", Engine.Start.DECLARATIONS);
    DeclarationList lower = (DeclarationList)parse("var x : int; end_var", Engine.Start.DECLARATIONS);
    assertEquals(upper, lower);
    TypeSpec.Named type = (TypeSpec.Named)lower.varBlocks.get(0).declarations.get(0).type;
    assertEquals("int", type.name);
    assertEquals("INT", type.canonicalName());
  }

  @Test public void testAmpersandIsAnd () {
    Expr amp = expr("a & b");
    assertEquals(Operator.AND, ((Expr.Binary)amp).op);
    assertEquals(expr("a AND b"), amp);
  }

  @Test public void testPrecedence () {
    Expr.Binary sum = (Expr.Binary)expr("a + b * c");
    assertEquals(Operator.ADD, sum.op);
    assertEquals(Operator.MUL, ((Expr.Binary)sum.right).op);

    Expr.Binary or = (Expr.Binary)expr("NOT a AND b OR c");
    assertEquals(Operator.OR, or.op);
    Expr.Binary and = (Expr.Binary)or.left;
    assertEquals(Operator.NOT, ((Expr.Unary)and.left).op);

    Expr.Binary paren = (Expr.Binary)expr("(a + b) * c");
    assertTrue(paren.left instanceof Expr.Paren);
    assertEquals(expr("(a + b) * c"), paren);
    assertNotEquals(expr("a + b * c"), paren);
  }

  @Test public void testPostfix () {
    Expr.Member member = (Expr.Member)expr("fbs[i + 1]^.q");
    assertEquals("q", member.member);
    Expr.Deref deref = (Expr.Deref)member.target;
    Expr.Index index = (Expr.Index)deref.target;
    assertEquals(new Expr.Name("fbs"), index.target);
    assertEquals(1, index.indices.size());
  }

  @Test public void testBooleanLiteralsIgnoreCase () {
    assertEquals(expr("TRUE"), expr("true"));
    assertEquals(Expr.LiteralKind.BOOLEAN, ((Expr.Literal)expr("False")).kind);
    assertEquals(Expr.LiteralKind.INTEGER, ((Expr.Literal)expr("16#FF")).kind);
    assertEquals(Expr.LiteralKind.TYPED, ((Expr.Literal)expr("INT#5")).kind);
  }

  @Test public void testStatements () {
    List<Stmt> stmts = statements(Joiner.on("\n").join(
      "IF a THEN x := 1; ELSIF b THEN x := 2; ELSE END_IF",
      "CASE n OF 1, 2: x := 0; 3..5: ; ELSE x := -1; END_CASE",
      "FOR i := 0 TO 9 BY 3 DO EXIT; END_FOR",
      "WHILE run DO CONTINUE; END_WHILE",
      "REPEAT n := n - 1; UNTIL n = 0 END_REPEAT",
      "ref REF= target;",
      "RETURN;"));
    assertEquals(7, stmts.size());

    Stmt.If ifs = (Stmt.If)stmts.get(0);
    assertEquals(1, ifs.elsifs.size());
    assertNotNull(ifs.otherwise);
    assertTrue(ifs.otherwise.isEmpty());

    Stmt.Case cases = (Stmt.Case)stmts.get(1);
    assertEquals(2, cases.branches.size());
    assertEquals(2, cases.branches.get(0).labels.size());
    Stmt.Label range = cases.branches.get(1).labels.get(0);
    assertEquals(new Expr.Literal(Expr.LiteralKind.INTEGER, "5"), range.upper);
    assertTrue(cases.branches.get(1).body.statements.get(0) instanceof Stmt.Empty);
    Stmt.Assign neg = (Stmt.Assign)cases.otherwise.statements.get(0);
    assertEquals(Operator.NEG, ((Expr.Unary)neg.value).op);

    Stmt.For loop = (Stmt.For)stmts.get(2);
    assertEquals("i", loop.variable);
    assertNotNull(loop.by);
    assertTrue(loop.body.statements.get(0) instanceof Stmt.Exit);

    assertTrue(((Stmt.While)stmts.get(3)).body.statements.get(0) instanceof Stmt.Continue);
    assertTrue(((Stmt.Repeat)stmts.get(4)).condition instanceof Expr.Binary);
    assertTrue(((Stmt.Assign)stmts.get(5)).reference);
    assertTrue(stmts.get(6) instanceof Stmt.Return);
  }

  @Test public void testDataTypes () {
    SourceCode code = (SourceCode)parse(Joiner.on("\n").join(
      "TYPE",
      "    ST_Point EXTENDS ST_Base :",
      "    STRUCT",
      "        x, y : REAL;",
      "    END_STRUCT",
      "    E_Mode :",
      "    (",
      "        IDLE := 0,",
      "        RUN",
      "    ) INT;",
      "    T_Name : STRING(32) := 'none';",
      "END_TYPE"), Engine.Start.SOURCE);
    DataTypes types = (DataTypes)code.items.get(0);
    assertEquals(3, types.types.size());

    TypeDecl.Struct point = (TypeDecl.Struct)types.types.get(0);
    assertEquals("ST_Point", point.name);
    assertEquals("ST_Base", point.base);
    assertEquals(ImmutableList.of("x", "y"), point.members.get(0).names);

    TypeDecl.Enum mode = (TypeDecl.Enum)types.types.get(1);
    assertEquals(2, mode.values.size());
    assertEquals(new Expr.Literal(Expr.LiteralKind.INTEGER, "0"), mode.values.get(0).value);
    assertNull(mode.values.get(1).value);
    assertEquals("INT", mode.base.baseTypeName());

    TypeDecl.Alias name = (TypeDecl.Alias)types.types.get(2);
    assertEquals("STRING", name.type.baseTypeName());
    Expr.Literal init = (Expr.Literal)((Initializer.Value)name.init).value;
    assertEquals(Expr.LiteralKind.STRING, init.kind);
    assertEquals("'none'", init.text);
  }

  @Test(expected=DuplicateDeclarationException.class)
  public void testDuplicateDeclaration () {
    parse("VAR a : INT; a : BOOL; END_VAR", Engine.Start.DECLARATIONS);
  }

  @Test public void testDuplicateSpans () {
    String text = "VAR\n    nCount : INT;\n    NCOUNT : BOOL;\nEND_VAR";
    try {
      parse(text, Engine.Start.DECLARATIONS);
      fail("Expected DuplicateDeclarationException");
    } catch (DuplicateDeclarationException dde) {
      assertEquals("NCOUNT", dde.name);
      assertEquals("nCount : INT;", dde.first.slice(text));
      assertEquals("NCOUNT : BOOL;", dde.second.slice(text));
      assertTrue(dde.source().isPresent());
    }
  }

  @Test public void testDuplicateStructMember () {
    String text = "TYPE ST_Pair : STRUCT a : INT; A : BOOL; END_STRUCT END_TYPE";
    try {
      parse(text, Engine.Start.SOURCE);
      fail("Expected DuplicateDeclarationException");
    } catch (DuplicateDeclarationException dde) {
      assertEquals("A", dde.name);
      assertEquals("a : INT;", dde.first.slice(text));
      assertEquals("A : BOOL;", dde.second.slice(text));
    }
  }

  @Test public void testKeywordsAndNamesIgnoreDefaultLocale () {
    Locale saved = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      DeclarationList decls = (DeclarationList)parse(
        "var_input bInit : bool; END_VAR", Engine.Start.DECLARATIONS);
      assertEquals(Section.VAR_INPUT, decls.varBlocks.get(0).section);
      try {
        parse("VAR counti : INT; COUNTI : BOOL; END_VAR", Engine.Start.DECLARATIONS);
        fail("Expected DuplicateDeclarationException");
      } catch (DuplicateDeclarationException dde) {
        assertEquals("COUNTI", dde.name);
      }
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test public void testSameNameInDifferentSections () {
    DeclarationList decls = (DeclarationList)parse(
      "VAR_INPUT a : INT; END_VAR VAR_OUTPUT a : INT; END_VAR", Engine.Start.DECLARATIONS);
    assertEquals(2, decls.declarations().sections().size());
  }

  @Test public void testInvalidAssignmentTarget () {
    try {
      statements("x := 1;\n1 := x;");
      fail("Expected GrammarException");
    } catch (GrammarException ge) {
      assertEquals(2, ge.line);
      assertEquals(1, ge.column);
      assertEquals("1", ge.found);
      assertTrue(ge.expected.contains("IDENTIFIER"));
    }
  }

  @Test public void testExpressionIsNotStatement () {
    try {
      statements("x + 1;");
      fail("Expected GrammarException");
    } catch (GrammarException ge) {
      assertEquals(";", ge.found);
      assertTrue(ge.expected.contains("':='"));
    }
  }

  @Test public void testCommentsClaimedOnce () {
    String text = Joiner.on("\n").join(
      "// header",
      "PROGRAM Main",
      "(* before body *)",
      "x := a + (* inline *) b; // trailing",
      "// dangling",
      "END_PROGRAM",
      "// footer");
    SourceUnit unit = parser.parse(new Source.File("Main.st"), text);
    Program main = (Program)unit.sourceCode().items.get(0);
    assertEquals("// header", main.leadingComments().get(0).text);

    Stmt.Assign assign = (Stmt.Assign)main.body.statements.get(0);
    assertEquals("(* before body *)", assign.leadingComments().get(0).text);
    assertEquals("// trailing", assign.trailingComments().get(0).text);
    assertEquals("(* inline *)", assign.value.comments().get(0).text);
    assertTrue(main.comments().contains(unit.comments.get(4)));
    assertEquals("// footer", unit.root.comments().get(0).text);
  }

  @Test public void testPragmaAnnotatesFollowingDeclaration () {
    DeclarationList decls = (DeclarationList)parse(
      "VAR a : INT; {attribute 'hide'} b : INT; // note on b\nEND_VAR", Engine.Start.DECLARATIONS);
    Declaration a = decls.declarations().find("a").get();
    Declaration b = decls.declarations().find("b").get();
    assertTrue(a.pragmas().isEmpty());
    assertEquals("hide", b.pragmas().get(0).attributeName().get());
    assertEquals("// note on b", b.trailingComments().get(0).text);
  }
}
