//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import plcodex.model.Kind;

/**
 * A top-level element of a source file: a program organization unit, a method, property or
 * action, a block of type declarations, or a global variable list.
 */
public abstract class Item extends Node {

  /** Dispatches over the variants of {@link Item}. */
  public interface Visitor<R> {
    R visit (FunctionBlock item);
    R visit (Program item);
    R visit (Function item);
    R visit (Method item);
    R visit (Property item);
    R visit (Action item);
    R visit (DataTypes item);
    R visit (GlobalVariables item);
  }

  /** Returns the kind of unit that this item declares. */
  public abstract Kind kind ();

  /** Dispatches this item to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  Item () {} // only subclassed in this package
}
