//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import java.util.List;
import plcodex.model.Comment;

/**
 * Renders an AST as structured text. Keywords are emitted in upper case, identifiers and literals
 * as they were written. Comments attached to statements, declarations and other line oriented
 * nodes are emitted on their own lines before the node (leading) or after it on its last line
 * (trailing). Comments attached to expressions and other inline nodes are emitted just before
 * the node. Parsing the rendered text yields an AST equal to the one rendered.
 */
public class SourcePrinter implements Node.Visitor<Void>, Item.Visitor<Void>,
                                      TypeDecl.Visitor<Void>, TypeSpec.Visitor<Void>,
                                      Initializer.Visitor<Void>, Stmt.Visitor<Void>,
                                      Expr.Visitor<Void> {

  /** The text used for one level of indentation. */
  public static final String INDENT = "    ";

  /** Renders {@code node} to a string. Roots end with a newline, other nodes do not. */
  public static String render (Node node) {
    return render(node, true);
  }

  /** Renders {@code node} to a string, omitting all comments. */
  public static String renderCode (Node node) {
    return render(node, false);
  }

  /** Creates a printer which includes comments in its output iff {@code comments} is true. */
  public SourcePrinter (boolean comments) {
    _comments = comments;
  }

  private static String render (Node node, boolean comments) {
    SourcePrinter printer = new SourcePrinter(comments);
    printer.print(node);
    String text = printer.toString();
    boolean root = (node instanceof SourceCode || node instanceof DeclarationList);
    return (!root && text.endsWith("\n")) ? text.substring(0, text.length()-1) : text;
  }

  /** Appends the rendering of {@code node} to this printer's output. */
  public void print (Node node) {
    node.accept((Node.Visitor<Void>)this);
  }

  @Override public String toString () {
    return _out.toString();
  }

  //
  // structural nodes

  @Override public Void visit (SourceCode node) {
    ownLines(node.leadingComments());
    for (int ii = 0, ll = node.items.size(); ii < ll; ii++) {
      if (ii > 0) newline();
      print(node.items.get(ii));
    }
    ownLines(node.trailingComments());
    return null;
  }

  @Override public Void visit (DeclarationList node) {
    ownLines(node.leadingComments());
    for (VarBlock block : node.varBlocks) print(block);
    ownLines(node.trailingComments());
    return null;
  }

  @Override public Void visit (Item node) {
    return node.accept((Item.Visitor<Void>)this);
  }

  @Override public Void visit (VarBlock node) {
    ownLines(node.leadingComments());
    text(node.section.keyword());
    for (VarBlock.Qualifier qual : node.qualifiers) text(" ").text(qual.name());
    newline();
    _indent++;
    for (Declaration decl : node.declarations) print(decl);
    _indent--;
    text("END_VAR");
    endLine(node);
    return null;
  }

  @Override public Void visit (Declaration node) {
    ownLines(node.leadingComments());
    text(String.join(", ", node.names));
    if (node.location != null) text(" AT ").text(node.location);
    text(" : ");
    print(node.type);
    if (node.init != null) {
      text(" := ");
      print(node.init);
    }
    text(";");
    endLine(node);
    return null;
  }

  @Override public Void visit (TypeDecl node) {
    return node.accept((TypeDecl.Visitor<Void>)this);
  }

  @Override public Void visit (TypeDecl.Value node) {
    inline(node);
    text(node.name);
    if (node.value != null) {
      text(" := ");
      print(node.value);
    }
    return null;
  }

  @Override public Void visit (TypeSpec node) {
    inline(node);
    return node.accept((TypeSpec.Visitor<Void>)this);
  }

  @Override public Void visit (TypeSpec.Range node) {
    inline(node);
    if (node.isOpen()) text("*");
    else {
      print(node.lower);
      text("..");
      print(node.upper);
    }
    return null;
  }

  @Override public Void visit (Initializer node) {
    inline(node);
    return node.accept((Initializer.Visitor<Void>)this);
  }

  @Override public Void visit (Initializer.Element node) {
    inline(node);
    if (node.count == null) print(node.value);
    else {
      text(node.count).text("(");
      if (node.value != null) print(node.value);
      text(")");
    }
    return null;
  }

  @Override public Void visit (Initializer.Field node) {
    inline(node);
    text(node.name).text(" := ");
    print(node.value);
    return null;
  }

  @Override public Void visit (StatementList node) {
    ownLines(node.leadingComments());
    for (Stmt stmt : node.statements) print(stmt);
    ownLines(node.trailingComments());
    return null;
  }

  @Override public Void visit (Stmt node) {
    ownLines(node.leadingComments());
    return node.accept((Stmt.Visitor<Void>)this);
  }

  @Override public Void visit (Stmt.ElsIf node) {
    ownLines(node.leadingComments());
    text("ELSIF ");
    print(node.condition);
    text(" THEN");
    endLine(node);
    indented(node.body);
    return null;
  }

  @Override public Void visit (Stmt.Branch node) {
    ownLines(node.leadingComments());
    separated(node.labels);
    text(":");
    endLine(node);
    indented(node.body);
    return null;
  }

  @Override public Void visit (Stmt.Label node) {
    inline(node);
    print(node.lower);
    if (node.upper != null) {
      text("..");
      print(node.upper);
    }
    return null;
  }

  @Override public Void visit (Expr node) {
    inline(node);
    return node.accept((Expr.Visitor<Void>)this);
  }

  @Override public Void visit (Expr.Arg node) {
    inline(node);
    switch (node.kind) {
    case POSITIONAL:
      print(node.value);
      break;
    case INPUT:
      text(node.name).text(" := ");
      print(node.value);
      break;
    case OUTPUT:
      if (node.inverted) text("NOT ");
      text(node.name).text(" =>");
      if (node.value != null) {
        text(" ");
        print(node.value);
      }
      break;
    }
    return null;
  }

  //
  // items

  @Override public Void visit (FunctionBlock item) {
    ownLines(item.leadingComments());
    text("FUNCTION_BLOCK");
    modifiers(item.modifiers);
    text(" ").text(item.name);
    if (item.base != null) text(" EXTENDS ").text(item.base);
    if (!item.interfaces.isEmpty()) text(" IMPLEMENTS ").text(String.join(", ", item.interfaces));
    newline();
    pou(item.varBlocks, item.body, "END_FUNCTION_BLOCK", item);
    return null;
  }

  @Override public Void visit (Program item) {
    ownLines(item.leadingComments());
    text("PROGRAM ").text(item.name);
    newline();
    pou(item.varBlocks, item.body, "END_PROGRAM", item);
    return null;
  }

  @Override public Void visit (Function item) {
    ownLines(item.leadingComments());
    text("FUNCTION ").text(item.name);
    returnType(item.returnType);
    newline();
    pou(item.varBlocks, item.body, "END_FUNCTION", item);
    return null;
  }

  @Override public Void visit (Method item) {
    ownLines(item.leadingComments());
    text("METHOD");
    modifiers(item.modifiers);
    text(" ").text(item.name);
    returnType(item.returnType);
    newline();
    pou(item.varBlocks, item.body, "END_METHOD", item);
    return null;
  }

  @Override public Void visit (Property item) {
    ownLines(item.leadingComments());
    text("PROPERTY");
    modifiers(item.modifiers);
    text(" ").text(item.name);
    returnType(item.type);
    newline();
    pou(item.varBlocks, item.body, "END_PROPERTY", item);
    return null;
  }

  @Override public Void visit (Action item) {
    ownLines(item.leadingComments());
    text("ACTION ").text(item.name).text(":");
    newline();
    print(item.body);
    text("END_ACTION");
    endLine(item);
    return null;
  }

  @Override public Void visit (DataTypes item) {
    ownLines(item.leadingComments());
    text("TYPE");
    newline();
    _indent++;
    for (TypeDecl decl : item.types) print(decl);
    _indent--;
    text("END_TYPE");
    endLine(item);
    return null;
  }

  @Override public Void visit (GlobalVariables item) {
    ownLines(item.leadingComments());
    print(item.block);
    ownLines(item.trailingComments());
    return null;
  }

  //
  // type declarations

  @Override public Void visit (TypeDecl.Struct decl) {
    ownLines(decl.leadingComments());
    text(decl.name);
    if (decl.base != null) text(" EXTENDS ").text(decl.base);
    text(" :");
    newline();
    text("STRUCT");
    newline();
    _indent++;
    for (Declaration member : decl.members) print(member);
    _indent--;
    text("END_STRUCT");
    endLine(decl);
    return null;
  }

  @Override public Void visit (TypeDecl.Enum decl) {
    ownLines(decl.leadingComments());
    text(decl.name).text(" :");
    newline();
    text("(");
    newline();
    _indent++;
    for (int ii = 0, ll = decl.values.size(); ii < ll; ii++) {
      print(decl.values.get(ii));
      if (ii < ll-1) text(",");
      newline();
    }
    _indent--;
    text(")");
    if (decl.base != null) {
      text(" ");
      print(decl.base);
    }
    endLine(decl);
    return null;
  }

  @Override public Void visit (TypeDecl.Alias decl) {
    ownLines(decl.leadingComments());
    text(decl.name).text(" : ");
    print(decl.type);
    if (decl.init != null) {
      text(" := ");
      print(decl.init);
    }
    text(";");
    endLine(decl);
    return null;
  }

  //
  // types

  @Override public Void visit (TypeSpec.Named type) {
    text(type.name);
    if (type.range != null) {
      text("(");
      print(type.range);
      text(")");
    }
    return null;
  }

  @Override public Void visit (TypeSpec.Str type) {
    text(type.keyword());
    if (type.length != null) {
      text("(");
      print(type.length);
      text(")");
    }
    return null;
  }

  @Override public Void visit (TypeSpec.Array type) {
    text("ARRAY[");
    separated(type.ranges);
    text("] OF ");
    print(type.element);
    return null;
  }

  @Override public Void visit (TypeSpec.Pointer type) {
    text("POINTER TO ");
    print(type.target);
    return null;
  }

  @Override public Void visit (TypeSpec.Reference type) {
    text("REFERENCE TO ");
    print(type.target);
    return null;
  }

  //
  // initializers

  @Override public Void visit (Initializer.Value init) {
    print(init.value);
    return null;
  }

  @Override public Void visit (Initializer.ArrayInit init) {
    text("[");
    separated(init.elements);
    text("]");
    return null;
  }

  @Override public Void visit (Initializer.StructInit init) {
    text("(");
    separated(init.members);
    text(")");
    return null;
  }

  //
  // statements

  @Override public Void visit (Stmt.Assign stmt) {
    print(stmt.target);
    text(stmt.reference ? " REF= " : " := ");
    print(stmt.value);
    text(";");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.Invoke stmt) {
    print(stmt.call);
    text(";");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.If stmt) {
    text("IF ");
    print(stmt.condition);
    text(" THEN");
    newline();
    indented(stmt.body);
    for (Stmt.ElsIf elsif : stmt.elsifs) print(elsif);
    otherwise(stmt.otherwise);
    text("END_IF;");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.Case stmt) {
    text("CASE ");
    print(stmt.selector);
    text(" OF");
    newline();
    _indent++;
    for (Stmt.Branch branch : stmt.branches) print(branch);
    _indent--;
    otherwise(stmt.otherwise);
    text("END_CASE;");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.For stmt) {
    text("FOR ").text(stmt.variable).text(" := ");
    print(stmt.from);
    text(" TO ");
    print(stmt.to);
    if (stmt.by != null) {
      text(" BY ");
      print(stmt.by);
    }
    text(" DO");
    newline();
    indented(stmt.body);
    text("END_FOR;");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.While stmt) {
    text("WHILE ");
    print(stmt.condition);
    text(" DO");
    newline();
    indented(stmt.body);
    text("END_WHILE;");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.Repeat stmt) {
    text("REPEAT");
    newline();
    indented(stmt.body);
    text("UNTIL ");
    print(stmt.condition);
    newline();
    text("END_REPEAT;");
    endLine(stmt);
    return null;
  }

  @Override public Void visit (Stmt.Exit stmt) {
    return keyword("EXIT;", stmt);
  }

  @Override public Void visit (Stmt.Continue stmt) {
    return keyword("CONTINUE;", stmt);
  }

  @Override public Void visit (Stmt.Return stmt) {
    return keyword("RETURN;", stmt);
  }

  @Override public Void visit (Stmt.Empty stmt) {
    return keyword(";", stmt);
  }

  //
  // expressions

  @Override public Void visit (Expr.Literal expr) {
    text(expr.text);
    return null;
  }

  @Override public Void visit (Expr.Name expr) {
    text(expr.name);
    return null;
  }

  @Override public Void visit (Expr.Member expr) {
    print(expr.target);
    text(".").text(expr.member);
    return null;
  }

  @Override public Void visit (Expr.Index expr) {
    print(expr.target);
    text("[");
    separated(expr.indices);
    text("]");
    return null;
  }

  @Override public Void visit (Expr.Deref expr) {
    print(expr.target);
    text("^");
    return null;
  }

  @Override public Void visit (Expr.Call expr) {
    print(expr.target);
    text("(");
    separated(expr.args);
    text(")");
    return null;
  }

  @Override public Void visit (Expr.Unary expr) {
    text(expr.op.symbol);
    if (expr.op.isWord()) text(" ");
    print(expr.operand);
    return null;
  }

  @Override public Void visit (Expr.Binary expr) {
    print(expr.left);
    text(" ").text(expr.op.symbol).text(" ");
    print(expr.right);
    return null;
  }

  @Override public Void visit (Expr.Paren expr) {
    text("(");
    print(expr.inner);
    text(")");
    return null;
  }

  //
  // helpers

  private void pou (List<VarBlock> varBlocks, StatementList body, String end, Item item) {
    for (VarBlock block : varBlocks) print(block);
    print(body);
    text(end);
    endLine(item);
  }

  private void modifiers (List<Modifier> modifiers) {
    for (Modifier mod : modifiers) text(" ").text(mod.name());
  }

  private void returnType (TypeSpec type) {
    if (type != null) {
      text(" : ");
      print(type);
    }
  }

  private void otherwise (StatementList stmts) {
    if (stmts != null) {
      text("ELSE");
      newline();
      indented(stmts);
    }
  }

  private void indented (StatementList stmts) {
    _indent++;
    print(stmts);
    _indent--;
  }

  private Void keyword (String text, Stmt stmt) {
    text(text);
    endLine(stmt);
    return null;
  }

  private void separated (List<? extends Node> nodes) {
    for (int ii = 0, ll = nodes.size(); ii < ll; ii++) {
      if (ii > 0) text(", ");
      print(nodes.get(ii));
    }
  }

  /** Emits the comments attached to an inline node, just before it. */
  private void inline (Node node) {
    if (!_comments) return;
    for (Comment comment : node.comments()) {
      text(comment.text);
      if (comment.isLineComment()) newline();
      else text(" ");
    }
  }

  /** Emits each comment on a line of its own. */
  private void ownLines (List<Comment> comments) {
    if (!_comments) return;
    for (Comment comment : comments) {
      text(comment.text);
      newline();
    }
  }

  /** Emits the trailing comments of {@code node} and ends the current line. */
  private void endLine (Node node) {
    if (_comments) {
      for (Comment comment : node.trailingComments()) text(" ").text(comment.text);
    }
    newline();
  }

  private SourcePrinter text (String text) {
    if (_lineStart) {
      for (int ii = 0; ii < _indent; ii++) _out.append(INDENT);
      _lineStart = false;
    }
    _out.append(text);
    return this;
  }

  private void newline () {
    _out.append('\n');
    _lineStart = true;
  }

  private final boolean _comments;
  private final StringBuilder _out = new StringBuilder();
  private int _indent = 0;
  private boolean _lineStart = true;
}
