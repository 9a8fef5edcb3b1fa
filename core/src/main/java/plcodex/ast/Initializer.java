//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * The initial value of a declaration or alias.
 */
public abstract class Initializer extends Node {

  /** Dispatches over the variants of {@link Initializer}. */
  public interface Visitor<R> {
    R visit (Value init);
    R visit (ArrayInit init);
    R visit (StructInit init);
  }

  /** A single expression. */
  public static final class Value extends Initializer {
    public final Expr value;

    public Value (Expr value) {
      this.value = value;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(value); }
  }

  /** {@code [1, 2, 3(0)]}. */
  public static final class ArrayInit extends Initializer {
    public final List<Element> elements;

    public ArrayInit (List<Element> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(elements); }
  }

  /** An element of an {@link ArrayInit}: a value, or {@code count(value)} when repeated. */
  public static final class Element extends Node {
    /** The repeat count as written, or null. */
    public final String count;
    /** The value, or null for a repeated default ({@code 3()}). */
    public final Initializer value;

    public Element (String count, Initializer value) {
      this.count = count;
      this.value = value;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(count, value); }
  }

  /** {@code (x := 1, y := 2)}. */
  public static final class StructInit extends Initializer {
    public final List<Field> members;

    public StructInit (List<Field> members) {
      this.members = ImmutableList.copyOf(members);
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(members); }
  }

  /** A member of a {@link StructInit}. */
  public static final class Field extends Node {
    public final String name;
    public final Initializer value;

    public Field (String name, Initializer value) {
      this.name = name;
      this.value = value;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name, value); }
  }

  /** Dispatches this initializer to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  private Initializer () {} // seal it!
}
