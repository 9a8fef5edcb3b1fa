//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * An expression. Parentheses written in the source are kept as {@link Paren} nodes so that
 * rendering reproduces the source's grouping.
 */
public abstract class Expr extends Node {

  /** Dispatches over the variants of {@link Expr}. */
  public interface Visitor<R> {
    R visit (Literal expr);
    R visit (Name expr);
    R visit (Member expr);
    R visit (Index expr);
    R visit (Deref expr);
    R visit (Call expr);
    R visit (Unary expr);
    R visit (Binary expr);
    R visit (Paren expr);
  }

  /** The kinds of literal values. */
  public static enum LiteralKind {
    INTEGER, REAL, BOOLEAN, STRING, WSTRING, TIME, DATE, TIME_OF_DAY, DATE_AND_TIME, TYPED
  }

  /** A literal value, kept as written. */
  public static final class Literal extends Expr {
    public final LiteralKind kind;
    public final String text;

    public Literal (LiteralKind kind, String text) {
      this.kind = kind;
      this.text = text;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () {
      return Arrays.asList(kind, kind == LiteralKind.BOOLEAN ?
                           text.toUpperCase(Locale.ROOT) : text);
    }
  }

  /** A reference to a named variable, constant or POU. */
  public static final class Name extends Expr {
    public final String name;

    public Name (String name) {
      this.name = name;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name); }
  }

  /** A member access: {@code target.member}. Bit access ({@code word.3}) uses a numeric member. */
  public static final class Member extends Expr {
    public final Expr target;
    public final String member;

    public Member (Expr target, String member) {
      this.target = target;
      this.member = member;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target, member); }
  }

  /** An array subscript: {@code target[i, j]}. */
  public static final class Index extends Expr {
    public final Expr target;
    public final List<Expr> indices;

    public Index (Expr target, List<Expr> indices) {
      this.target = target;
      this.indices = ImmutableList.copyOf(indices);
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target, indices); }
  }

  /** A pointer dereference: {@code target^}. */
  public static final class Deref extends Expr {
    public final Expr target;

    public Deref (Expr target) {
      this.target = target;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target); }
  }

  /** A call of a function, function block instance or method. */
  public static final class Call extends Expr {
    public final Expr target;
    public final List<Arg> args;

    public Call (Expr target, List<Arg> args) {
      this.target = target;
      this.args = ImmutableList.copyOf(args);
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target, args); }
  }

  /** An argument to a {@link Call}. */
  public static final class Arg extends Node {

    /** The ways in which an argument can be supplied. */
    public static enum Kind {
      /** {@code value} */
      POSITIONAL,
      /** {@code name := value} */
      INPUT,
      /** {@code [NOT] name => [target]} */
      OUTPUT
    }

    public final Kind kind;
    /** The parameter name, or null for a positional argument. */
    public final String name;
    /** True for an inverted output connection ({@code NOT name => x}). */
    public final boolean inverted;
    /** The value or output target, or null for an unconnected output. */
    public final Expr value;

    public static Arg positional (Expr value) {
      return new Arg(Kind.POSITIONAL, null, false, value);
    }

    public static Arg input (String name, Expr value) {
      return new Arg(Kind.INPUT, name, false, value);
    }

    public static Arg output (String name, boolean inverted, Expr target) {
      return new Arg(Kind.OUTPUT, name, inverted, target);
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(kind, name, inverted, value); }

    private Arg (Kind kind, String name, boolean inverted, Expr value) {
      this.kind = kind;
      this.name = name;
      this.inverted = inverted;
      this.value = value;
    }
  }

  /** A unary operation: {@code -x}, {@code NOT x}. */
  public static final class Unary extends Expr {
    public final Operator op;
    public final Expr operand;

    public Unary (Operator op, Expr operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(op, operand); }
  }

  /** A binary operation. */
  public static final class Binary extends Expr {
    public final Expr left;
    public final Operator op;
    public final Expr right;

    public Binary (Expr left, Operator op, Expr right) {
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(left, op, right); }
  }

  /** A parenthesized expression. */
  public static final class Paren extends Expr {
    public final Expr inner;

    public Paren (Expr inner) {
      this.inner = inner;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(inner); }
  }

  /** Dispatches this expression to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  private Expr () {} // seal it!
}
