//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * A sequence of statements: a POU body or the body of a control statement.
 */
public final class StatementList extends Node {

  public final List<Stmt> statements;

  public StatementList (List<Stmt> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  public boolean isEmpty () {
    return statements.isEmpty();
  }

  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(statements); }
}
