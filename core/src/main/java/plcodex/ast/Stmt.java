//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A statement. Optional parts which are absent are null; an {@code ELSE} with no statements is
 * an empty {@link StatementList}, which is distinct from no {@code ELSE} at all.
 */
public abstract class Stmt extends Node {

  /** Dispatches over the variants of {@link Stmt}. */
  public interface Visitor<R> {
    R visit (Assign stmt);
    R visit (Invoke stmt);
    R visit (If stmt);
    R visit (Case stmt);
    R visit (For stmt);
    R visit (While stmt);
    R visit (Repeat stmt);
    R visit (Exit stmt);
    R visit (Continue stmt);
    R visit (Return stmt);
    R visit (Empty stmt);
  }

  /** {@code target := value;} or, when {@code reference} is set, {@code target REF= value;}. */
  public static final class Assign extends Stmt {
    public final Expr target;
    public final boolean reference;
    public final Expr value;

    public Assign (Expr target, boolean reference, Expr value) {
      this.target = target;
      this.reference = reference;
      this.value = value;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target, reference, value); }
  }

  /** A call made for its effect: {@code fbTimer(IN := TRUE);}. */
  public static final class Invoke extends Stmt {
    public final Expr.Call call;

    public Invoke (Expr.Call call) {
      this.call = call;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(call); }
  }

  public static final class If extends Stmt {
    public final Expr condition;
    public final StatementList body;
    public final List<ElsIf> elsifs;
    /** The {@code ELSE} statements, or null. */
    public final StatementList otherwise;

    public If (Expr condition, StatementList body, List<ElsIf> elsifs, StatementList otherwise) {
      this.condition = condition;
      this.body = body;
      this.elsifs = ImmutableList.copyOf(elsifs);
      this.otherwise = otherwise;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () {
      return Arrays.asList(condition, body, elsifs, otherwise);
    }
  }

  /** An {@code ELSIF} clause of an {@link If}. */
  public static final class ElsIf extends Node {
    public final Expr condition;
    public final StatementList body;

    public ElsIf (Expr condition, StatementList body) {
      this.condition = condition;
      this.body = body;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(condition, body); }
  }

  public static final class Case extends Stmt {
    public final Expr selector;
    public final List<Branch> branches;
    /** The {@code ELSE} statements, or null. */
    public final StatementList otherwise;

    public Case (Expr selector, List<Branch> branches, StatementList otherwise) {
      this.selector = selector;
      this.branches = ImmutableList.copyOf(branches);
      this.otherwise = otherwise;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(selector, branches, otherwise); }
  }

  /** A labeled branch of a {@link Case}: {@code 1, 3..5: stmts}. */
  public static final class Branch extends Node {
    public final List<Label> labels;
    public final StatementList body;

    public Branch (List<Label> labels, StatementList body) {
      this.labels = ImmutableList.copyOf(labels);
      this.body = body;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(labels, body); }
  }

  /** A case label: a single value, or a range when {@code upper} is non-null. */
  public static final class Label extends Node {
    public final Expr lower;
    public final Expr upper;

    public Label (Expr lower, Expr upper) {
      this.lower = lower;
      this.upper = upper;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(lower, upper); }
  }

  public static final class For extends Stmt {
    public final String variable;
    public final Expr from;
    public final Expr to;
    /** The step, or null. */
    public final Expr by;
    public final StatementList body;

    public For (String variable, Expr from, Expr to, Expr by, StatementList body) {
      this.variable = variable;
      this.from = from;
      this.to = to;
      this.by = by;
      this.body = body;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(variable, from, to, by, body); }
  }

  public static final class While extends Stmt {
    public final Expr condition;
    public final StatementList body;

    public While (Expr condition, StatementList body) {
      this.condition = condition;
      this.body = body;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(condition, body); }
  }

  public static final class Repeat extends Stmt {
    public final StatementList body;
    public final Expr condition;

    public Repeat (StatementList body, Expr condition) {
      this.body = body;
      this.condition = condition;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(body, condition); }
  }

  public static final class Exit extends Stmt {
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Collections.emptyList(); }
  }

  public static final class Continue extends Stmt {
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Collections.emptyList(); }
  }

  public static final class Return extends Stmt {
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Collections.emptyList(); }
  }

  /** A lone {@code ;}. */
  public static final class Empty extends Stmt {
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Collections.emptyList(); }
  }

  /** Dispatches this statement to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  private Stmt () {} // seal it!
}
