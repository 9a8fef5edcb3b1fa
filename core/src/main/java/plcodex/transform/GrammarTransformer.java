//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.transform;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import plcodex.ast.*;
import plcodex.grammar.IEC61131BaseVisitor;
import plcodex.grammar.IEC61131Parser;
import plcodex.grammar.IEC61131Parser.*;
import plcodex.model.Comment;
import plcodex.model.Span;
import plcodex.parse.GrammarException;
import plcodex.parse.SyntaxTree;
import plcodex.parse.TransformException;

/**
 * Turns a {@link SyntaxTree} into an AST. The tree is walked bottom up: each node is built from
 * its already built children and then located, which sets its span and attaches comments to it.
 *
 * <p>A node claims the unclaimed comments that lie between its first and last token, so a comment
 * goes to the innermost node surrounding it. Line oriented nodes (items, var blocks, declarations,
 * type declarations, statements and the clauses of {@code IF} and {@code CASE}) additionally claim
 * the comments between the previous token and their first token (as leading comments) and those
 * following their last token on the same line (as trailing comments). Whatever remains goes to the
 * root. A node's span covers its tokens, its children and its comments.</p>
 *
 * <p>A transformer is good for a single call to {@link #transform}.</p>
 */
public class GrammarTransformer extends IEC61131BaseVisitor<Node> {

  public GrammarTransformer (SyntaxTree tree, List<Comment> comments) {
    _tree = tree;
    _comments = new CommentTable(comments);
  }

  /**
   * Builds the AST. The root is a {@link SourceCode}, {@link DeclarationList},
   * {@link StatementList} or {@link Expr} depending on the symbol from which the tree was parsed.
   * @throws GrammarException if the tree contains a construct the grammar accepts but the
   * language does not, such as an assignment to a literal.
   * @throws TransformException if the tree has a shape this transformer does not understand.
   */
  public Node transform () {
    Preconditions.checkState(!_used, "GrammarTransformer can only be used once");
    _used = true;
    Node root = visit(_tree.root);
    if (root == null) throw new TransformException(
      "No AST produced for " + _tree.root.getClass().getSimpleName());
    _comments.claimRest(root);
    root.setSpan(Span.of(0, _tree.text.length()).union(root.span()));
    return root;
  }

  //
  // entry points

  @Override public Node visitIecSource (IecSourceContext ctx) {
    return new SourceCode(all(Item.class, ctx.sourceElement()));
  }

  @Override public Node visitDeclarationList (DeclarationListContext ctx) {
    return new DeclarationList(all(VarBlock.class, ctx.varBlock()));
  }

  @Override public Node visitStatementBlock (StatementBlockContext ctx) {
    return visit(ctx.statementList());
  }

  @Override public Node visitExpressionInput (ExpressionInputContext ctx) {
    return visit(ctx.expression());
  }

  //
  // program organization units

  @Override public Node visitSourceElement (SourceElementContext ctx) {
    if (ctx.varBlock() != null) {
      return item(new GlobalVariables(as(VarBlock.class, ctx.varBlock())), ctx);
    }
    return visit(ctx.getChild(0));
  }

  @Override public Node visitFunctionBlockDecl (FunctionBlockDeclContext ctx) {
    String base = ctx.extendsClause() == null ? null :
      ctx.extendsClause().qualifiedName().getText();
    List<String> interfaces = new ArrayList<>();
    if (ctx.implementsClause() != null) {
      for (QualifiedNameContext name : ctx.implementsClause().qualifiedName()) {
        interfaces.add(name.getText());
      }
    }
    return item(new FunctionBlock(modifiers(ctx.modifier()), ctx.IDENTIFIER().getText(), base,
                                  interfaces, all(VarBlock.class, ctx.varBlock()),
                                  statements(ctx.statementList())), ctx);
  }

  @Override public Node visitProgramDecl (ProgramDeclContext ctx) {
    return item(new Program(ctx.IDENTIFIER().getText(), all(VarBlock.class, ctx.varBlock()),
                            statements(ctx.statementList())), ctx);
  }

  @Override public Node visitFunctionDecl (FunctionDeclContext ctx) {
    return item(new Function(ctx.IDENTIFIER().getText(), opt(TypeSpec.class, ctx.typeSpec()),
                             all(VarBlock.class, ctx.varBlock()),
                             statements(ctx.statementList())), ctx);
  }

  @Override public Node visitMethodDecl (MethodDeclContext ctx) {
    return item(new Method(modifiers(ctx.modifier()), ctx.IDENTIFIER().getText(),
                           opt(TypeSpec.class, ctx.typeSpec()), all(VarBlock.class, ctx.varBlock()),
                           statements(ctx.statementList())), ctx);
  }

  @Override public Node visitPropertyDecl (PropertyDeclContext ctx) {
    return item(new Property(modifiers(ctx.modifier()), ctx.IDENTIFIER().getText(),
                             as(TypeSpec.class, ctx.typeSpec()), all(VarBlock.class, ctx.varBlock()),
                             statements(ctx.statementList())), ctx);
  }

  @Override public Node visitActionDecl (ActionDeclContext ctx) {
    return item(new Action(ctx.IDENTIFIER().getText(), statements(ctx.statementList())), ctx);
  }

  //
  // data types

  @Override public Node visitDataTypeDecl (DataTypeDeclContext ctx) {
    return item(new DataTypes(all(TypeDecl.class, ctx.typeDecl())), ctx);
  }

  @Override public Node visitStructDecl (StructDeclContext ctx) {
    String base = ctx.qualifiedName() == null ? null : ctx.qualifiedName().getText();
    return item(new TypeDecl.Struct(ctx.IDENTIFIER().getText(), base,
                                    all(Declaration.class, ctx.declaration())), ctx);
  }

  @Override public Node visitEnumDecl (EnumDeclContext ctx) {
    return item(new TypeDecl.Enum(ctx.IDENTIFIER().getText(),
                                  all(TypeDecl.Value.class, ctx.enumValue()),
                                  opt(TypeSpec.class, ctx.typeSpec())), ctx);
  }

  @Override public Node visitEnumValue (EnumValueContext ctx) {
    return inline(new TypeDecl.Value(ctx.IDENTIFIER().getText(),
                                     opt(Expr.class, ctx.expression())), ctx);
  }

  @Override public Node visitAliasDecl (AliasDeclContext ctx) {
    return item(new TypeDecl.Alias(ctx.IDENTIFIER().getText(), as(TypeSpec.class, ctx.typeSpec()),
                                   opt(Initializer.class, ctx.initializer())), ctx);
  }

  //
  // variable declarations

  @Override public Node visitVarBlock (VarBlockContext ctx) {
    List<VarBlock.Qualifier> quals = new ArrayList<>();
    for (VarQualifierContext qual : ctx.varQualifier()) {
      quals.add(VarBlock.Qualifier.forKeyword(qual.getText()));
    }
    return item(new VarBlock(Section.forKeyword(ctx.varSection().getText()), quals,
                             all(Declaration.class, ctx.declaration())), ctx);
  }

  @Override public Node visitDeclaration (DeclarationContext ctx) {
    List<String> names = new ArrayList<>();
    for (TerminalNode name : ctx.IDENTIFIER()) names.add(name.getText());
    String location = ctx.DIRECT_ADDRESS() == null ? null : ctx.DIRECT_ADDRESS().getText();
    return item(new Declaration(names, location, as(TypeSpec.class, ctx.typeSpec()),
                                opt(Initializer.class, ctx.initializer())), ctx);
  }

  @Override public Node visitArrayType (ArrayTypeContext ctx) {
    return inline(new TypeSpec.Array(all(TypeSpec.Range.class, ctx.subrange()),
                                     as(TypeSpec.class, ctx.typeSpec())), ctx);
  }

  @Override public Node visitPointerType (PointerTypeContext ctx) {
    return inline(new TypeSpec.Pointer(as(TypeSpec.class, ctx.typeSpec())), ctx);
  }

  @Override public Node visitReferenceType (ReferenceTypeContext ctx) {
    return inline(new TypeSpec.Reference(as(TypeSpec.class, ctx.typeSpec())), ctx);
  }

  @Override public Node visitStringType (StringTypeContext ctx) {
    boolean wide = ctx.kind.getType() == IEC61131Parser.WSTRING;
    return inline(new TypeSpec.Str(wide, opt(Expr.class, ctx.expression())), ctx);
  }

  @Override public Node visitNamedType (NamedTypeContext ctx) {
    return inline(new TypeSpec.Named(ctx.qualifiedName().getText(),
                                     opt(TypeSpec.Range.class, ctx.subrange())), ctx);
  }

  @Override public Node visitSubrange (SubrangeContext ctx) {
    TypeSpec.Range range = (ctx.lower == null) ? TypeSpec.Range.open() :
      new TypeSpec.Range(expr(ctx.lower), expr(ctx.upper));
    return inline(range, ctx);
  }

  @Override public Node visitArrayInit (ArrayInitContext ctx) {
    return inline(new Initializer.ArrayInit(all(Initializer.Element.class, ctx.arrayElement())),
                  ctx);
  }

  @Override public Node visitRepeatedElement (RepeatedElementContext ctx) {
    return inline(new Initializer.Element(ctx.INTEGER().getText(),
                                          opt(Initializer.class, ctx.initializer())), ctx);
  }

  @Override public Node visitSingleElement (SingleElementContext ctx) {
    return inline(new Initializer.Element(null, as(Initializer.class, ctx.initializer())), ctx);
  }

  @Override public Node visitStructInit (StructInitContext ctx) {
    return inline(new Initializer.StructInit(all(Initializer.Field.class, ctx.fieldInit())), ctx);
  }

  @Override public Node visitFieldInit (FieldInitContext ctx) {
    return inline(new Initializer.Field(ctx.IDENTIFIER().getText(),
                                        as(Initializer.class, ctx.initializer())), ctx);
  }

  @Override public Node visitValueInit (ValueInitContext ctx) {
    return inline(new Initializer.Value(expr(ctx.expression())), ctx);
  }

  //
  // statements

  @Override public Node visitStatementList (StatementListContext ctx) {
    return inline(new StatementList(all(Stmt.class, ctx.statement())), ctx);
  }

  @Override public Node visitIfStatement (IfStatementContext ctx) {
    return item(new Stmt.If(expr(ctx.expression()), statements(ctx.statementList()),
                            all(Stmt.ElsIf.class, ctx.elsifClause()),
                            otherwise(ctx.elseClause())), ctx);
  }

  @Override public Node visitElsifClause (ElsifClauseContext ctx) {
    return item(new Stmt.ElsIf(expr(ctx.expression()), statements(ctx.statementList())), ctx);
  }

  @Override public Node visitCaseStatement (CaseStatementContext ctx) {
    return item(new Stmt.Case(expr(ctx.expression()), all(Stmt.Branch.class, ctx.caseBranch()),
                              otherwise(ctx.elseClause())), ctx);
  }

  @Override public Node visitCaseBranch (CaseBranchContext ctx) {
    return item(new Stmt.Branch(all(Stmt.Label.class, ctx.caseLabel()),
                                statements(ctx.statementList())), ctx);
  }

  @Override public Node visitCaseLabel (CaseLabelContext ctx) {
    return inline(new Stmt.Label(expr(ctx.lower), opt(Expr.class, ctx.upper)), ctx);
  }

  @Override public Node visitForStatement (ForStatementContext ctx) {
    return item(new Stmt.For(ctx.IDENTIFIER().getText(), expr(ctx.from), expr(ctx.to),
                             opt(Expr.class, ctx.by), statements(ctx.statementList())), ctx);
  }

  @Override public Node visitWhileStatement (WhileStatementContext ctx) {
    return item(new Stmt.While(expr(ctx.expression()), statements(ctx.statementList())), ctx);
  }

  @Override public Node visitRepeatStatement (RepeatStatementContext ctx) {
    return item(new Stmt.Repeat(statements(ctx.statementList()), expr(ctx.expression())), ctx);
  }

  @Override public Node visitExitStatement (ExitStatementContext ctx) {
    return item(new Stmt.Exit(), ctx);
  }

  @Override public Node visitContinueStatement (ContinueStatementContext ctx) {
    return item(new Stmt.Continue(), ctx);
  }

  @Override public Node visitReturnStatement (ReturnStatementContext ctx) {
    return item(new Stmt.Return(), ctx);
  }

  @Override public Node visitAssignStatement (AssignStatementContext ctx) {
    Expr target = expr(ctx.target);
    if (!(target instanceof Expr.Name || target instanceof Expr.Member ||
          target instanceof Expr.Index || target instanceof Expr.Deref)) {
      throw error("Cannot assign to '" + ctx.target.getText() + "'", ctx.target.getStart(),
                  ImmutableSet.of("IDENTIFIER"));
    }
    boolean reference = ctx.op.getType() == IEC61131Parser.REF_ASSIGN;
    return item(new Stmt.Assign(target, reference, expr(ctx.value)), ctx);
  }

  @Override public Node visitInvokeStatement (InvokeStatementContext ctx) {
    Expr expr = expr(ctx.expression());
    if (!(expr instanceof Expr.Call)) {
      throw error("Expression '" + ctx.expression().getText() + "' is not a statement",
                  ctx.getStop(), ImmutableSet.of("'('", "':='"));
    }
    return item(new Stmt.Invoke((Expr.Call)expr), ctx);
  }

  @Override public Node visitEmptyStatement (EmptyStatementContext ctx) {
    return item(new Stmt.Empty(), ctx);
  }

  //
  // expressions

  @Override public Node visitMemberExpr (MemberExprContext ctx) {
    return inline(new Expr.Member(expr(ctx.expression()), ctx.member.getText()), ctx);
  }

  @Override public Node visitIndexExpr (IndexExprContext ctx) {
    List<ExpressionContext> exprs = ctx.expression();
    return inline(new Expr.Index(expr(exprs.get(0)),
                                 all(Expr.class, exprs.subList(1, exprs.size()))), ctx);
  }

  @Override public Node visitDerefExpr (DerefExprContext ctx) {
    return inline(new Expr.Deref(expr(ctx.expression())), ctx);
  }

  @Override public Node visitCallExpr (CallExprContext ctx) {
    return inline(new Expr.Call(expr(ctx.expression()), all(Expr.Arg.class, ctx.argument())), ctx);
  }

  @Override public Node visitInputArgument (InputArgumentContext ctx) {
    return inline(Expr.Arg.input(ctx.IDENTIFIER().getText(), expr(ctx.expression())), ctx);
  }

  @Override public Node visitOutputArgument (OutputArgumentContext ctx) {
    return inline(Expr.Arg.output(ctx.IDENTIFIER().getText(), ctx.NOT() != null,
                                  opt(Expr.class, ctx.expression())), ctx);
  }

  @Override public Node visitPositionalArgument (PositionalArgumentContext ctx) {
    return inline(Expr.Arg.positional(expr(ctx.expression())), ctx);
  }

  @Override public Node visitBinaryExpr (BinaryExprContext ctx) {
    return inline(new Expr.Binary(expr(ctx.left), Operator.binary(ctx.op.getText()),
                                  expr(ctx.right)), ctx);
  }

  @Override public Node visitUnaryExpr (UnaryExprContext ctx) {
    return inline(new Expr.Unary(Operator.unary(ctx.op.getText()), expr(ctx.expression())), ctx);
  }

  @Override public Node visitLiteralExpr (LiteralExprContext ctx) {
    Token token = ctx.literal().getStart();
    return inline(new Expr.Literal(literalKind(token), token.getText()), ctx);
  }

  @Override public Node visitNameExpr (NameExprContext ctx) {
    return inline(new Expr.Name(ctx.IDENTIFIER().getText()), ctx);
  }

  @Override public Node visitParenExpr (ParenExprContext ctx) {
    return inline(new Expr.Paren(expr(ctx.expression())), ctx);
  }

  //
  // helpers

  private Expr expr (ParserRuleContext ctx) {
    return as(Expr.class, ctx);
  }

  private StatementList statements (StatementListContext ctx) {
    return as(StatementList.class, ctx);
  }

  private StatementList otherwise (ElseClauseContext ctx) {
    return ctx == null ? null : statements(ctx.statementList());
  }

  private List<Modifier> modifiers (List<ModifierContext> ctxs) {
    List<Modifier> mods = new ArrayList<>();
    for (ModifierContext ctx : ctxs) mods.add(Modifier.forKeyword(ctx.getText()));
    return mods;
  }

  private <T extends Node> T as (Class<T> type, ParserRuleContext ctx) {
    Node node = visit(ctx);
    if (!type.isInstance(node)) throw new TransformException(
      "Expected " + type.getSimpleName() + " from " + ctx.getClass().getSimpleName() + " at " +
      ctx.getStart().getLine() + ":" + ctx.getStart().getCharPositionInLine() + ", got " +
      (node == null ? "nothing" : node.getClass().getSimpleName()));
    return type.cast(node);
  }

  private <T extends Node> T opt (Class<T> type, ParserRuleContext ctx) {
    return ctx == null ? null : as(type, ctx);
  }

  private <T extends Node> List<T> all (Class<T> type, List<? extends ParserRuleContext> ctxs) {
    List<T> nodes = new ArrayList<>(ctxs.size());
    for (ParserRuleContext ctx : ctxs) nodes.add(as(type, ctx));
    return nodes;
  }

  private static Expr.LiteralKind literalKind (Token token) {
    switch (token.getType()) {
    case IEC61131Parser.INTEGER:
    case IEC61131Parser.BASED_INTEGER: return Expr.LiteralKind.INTEGER;
    case IEC61131Parser.REAL_LITERAL: return Expr.LiteralKind.REAL;
    case IEC61131Parser.TRUE:
    case IEC61131Parser.FALSE: return Expr.LiteralKind.BOOLEAN;
    case IEC61131Parser.STRING_LITERAL: return Expr.LiteralKind.STRING;
    case IEC61131Parser.WSTRING_LITERAL: return Expr.LiteralKind.WSTRING;
    case IEC61131Parser.TIME_LITERAL: return Expr.LiteralKind.TIME;
    case IEC61131Parser.DATE_LITERAL: return Expr.LiteralKind.DATE;
    case IEC61131Parser.TIME_OF_DAY_LITERAL: return Expr.LiteralKind.TIME_OF_DAY;
    case IEC61131Parser.DATE_AND_TIME_LITERAL: return Expr.LiteralKind.DATE_AND_TIME;
    case IEC61131Parser.TYPED_LITERAL: return Expr.LiteralKind.TYPED;
    default: throw new TransformException("Unknown literal token: " + token);
    }
  }

  private GrammarException error (String message, Token at, Set<String> expected) {
    return new GrammarException(message, at.getStartIndex(), at.getLine(),
                                at.getCharPositionInLine()+1, at.getText(), expected);
  }

  private <N extends Node> N inline (N node, ParserRuleContext ctx) {
    return locate(node, ctx, false);
  }

  private <N extends Node> N item (N node, ParserRuleContext ctx) {
    return locate(node, ctx, true);
  }

  private <N extends Node> N locate (N node, ParserRuleContext ctx, boolean item) {
    Token first = ctx.getStart(), last = ctx.getStop();
    Span span = Span.NONE;
    // a rule that matched no tokens has its stop token before its start token
    if (first != null && last != null && first.getType() != Token.EOF &&
        last.getTokenIndex() >= first.getTokenIndex()) {
      span = Span.of(first.getStartIndex(), last.getStopIndex()+1);
      if (item) _comments.claim(node, gapStart(first), span.start, false);
      _comments.claim(node, span.start, span.end, false);
      if (item) _comments.claim(node, span.end, lineEnd(last, span.end), true);
    }
    for (Node child : node.children()) span = span.union(child.span());
    for (Comment comment : node.comments()) span = span.union(comment.span);
    node.setSpan(span);
    return node;
  }

  /** Returns the offset just past the token preceding {@code first}, or zero. */
  private int gapStart (Token first) {
    int idx = first.getTokenIndex();
    return idx == 0 ? 0 : _tree.tokens.get(idx-1).getStopIndex()+1;
  }

  /** Returns the end of the line on which {@code last} ends, or the start of the next token if
    * that comes first. */
  private int lineEnd (Token last, int from) {
    int next = last.getTokenIndex()+1;
    int limit = next < _tree.tokens.size() ? _tree.tokens.get(next).getStartIndex() :
      _tree.text.length();
    int eol = _tree.text.indexOf('\n', from);
    return Math.min(limit, eol < 0 ? _tree.text.length() : eol);
  }

  private final SyntaxTree _tree;
  private final CommentTable _comments;
  private boolean _used;
}
