//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code ACTION name: ... END_ACTION}. Actions share the variables of their owning POU.
 */
public final class Action extends Item {

  public final String name;
  public final StatementList body;

  public Action (String name, StatementList body) {
    this.name = name;
    this.body = body;
  }

  @Override public Kind kind () { return Kind.ACTION; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(name, body); }
}
