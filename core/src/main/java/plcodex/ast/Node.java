//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import plcodex.model.Comment;
import plcodex.model.Span;

/**
 * The base of all AST nodes. A node has semantic fields, which define its equality, and
 * positional metadata (its span and the comments attached to it), which does not.
 */
public abstract class Node {

  /**
   * Dispatches over the families of nodes. Each family with variants ({@link Expr}, {@link Stmt},
   * {@link TypeSpec}, {@link Initializer}, {@link TypeDecl}, {@link Item}) has its own visitor for
   * dispatching over those variants.
   */
  public interface Visitor<R> {
    R visit (SourceCode node);
    R visit (DeclarationList node);
    R visit (Item node);
    R visit (VarBlock node);
    R visit (Declaration node);
    R visit (TypeDecl node);
    R visit (TypeDecl.Value node);
    R visit (TypeSpec node);
    R visit (TypeSpec.Range node);
    R visit (Initializer node);
    R visit (Initializer.Element node);
    R visit (Initializer.Field node);
    R visit (StatementList node);
    R visit (Stmt node);
    R visit (Stmt.ElsIf node);
    R visit (Stmt.Branch node);
    R visit (Stmt.Label node);
    R visit (Expr node);
    R visit (Expr.Arg node);
  }

  /** Dispatches this node to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  /** Returns the span of source text covered by this node, its children and its comments.
    * Returns {@link Span#NONE} for nodes that were not parsed from text. */
  public Span span () {
    return _span;
  }

  /** Returns every comment attached to this node, in source order. */
  public List<Comment> comments () {
    if (_trailing.isEmpty()) return _leading;
    return ImmutableList.<Comment>builder().addAll(_leading).addAll(_trailing).build();
  }

  /** Returns the comments which precede this node or fall inside it. */
  public List<Comment> leadingComments () {
    return _leading;
  }

  /** Returns the comments which follow this node on the line on which it ends. */
  public List<Comment> trailingComments () {
    return _trailing;
  }

  /** Returns the pragmas attached to this node, in source order. */
  public List<Comment> pragmas () {
    ImmutableList.Builder<Comment> pragmas = ImmutableList.builder();
    for (Comment c : comments()) if (c.kind == Comment.Kind.PRAGMA) pragmas.add(c);
    return pragmas.build();
  }

  /** Returns the nodes nested directly inside this node, in source order. */
  public List<Node> children () {
    List<Node> kids = new ArrayList<>();
    for (Object field : fields()) addNodes(field, kids);
    return kids;
  }

  /** Records the span of this node. Called by the transformer. */
  public void setSpan (Span span) {
    _span = span;
  }

  /** Attaches {@code comment} to this node. Called by the transformer, which ensures that each
    * comment is attached to exactly one node. */
  public void claim (Comment comment, boolean trailing) {
    List<Comment> list = trailing ? _trailing : _leading;
    if (list.isEmpty()) list = new ArrayList<>();
    list.add(comment);
    if (trailing) _trailing = list;
    else _leading = list;
  }

  /** Renders this node as structured text. */
  @Override public String toString () {
    return SourcePrinter.render(this);
  }

  @Override public boolean equals (Object other) {
    return (other != null && other.getClass() == getClass() &&
            fields().equals(((Node)other).fields()));
  }

  @Override public int hashCode () {
    return getClass().hashCode() ^ fields().hashCode();
  }

  /** Returns the semantic fields of this node, in source order. Two nodes of the same class are
    * equal if their fields are equal. Child nodes and lists of child nodes are also reported by
    * {@link #children}. */
  protected abstract List<?> fields ();

  private static void addNodes (Object field, List<Node> into) {
    if (field instanceof Node) into.add((Node)field);
    else if (field instanceof Iterable) {
      for (Object elem : (Iterable<?>)field) addNodes(elem, into);
    }
  }

  private Span _span = Span.NONE;
  private List<Comment> _leading = ImmutableList.of();
  private List<Comment> _trailing = ImmutableList.of();
}
