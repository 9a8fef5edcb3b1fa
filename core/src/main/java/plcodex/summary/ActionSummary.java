//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import java.util.Arrays;
import java.util.List;
import plcodex.ast.Action;
import plcodex.model.Source;

/**
 * Summarizes an action of a function block or program.
 */
public final class ActionSummary extends Summary {

  /** The text of the action, exactly as it appears in the unit. */
  public final String sourceCode;

  public ActionSummary (Source source, String owner, Action action, String sourceCode) {
    super(action.name, qualify(owner, action.name), source, action);
    this.sourceCode = sourceCode;
  }

  @Override protected List<?> details () {
    return Arrays.asList(sourceCode);
  }
}
