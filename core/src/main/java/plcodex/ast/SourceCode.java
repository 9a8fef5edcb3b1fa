//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * The root of a parsed source file: its top-level items, in source order.
 */
public final class SourceCode extends Node {

  public final List<Item> items;

  public SourceCode (List<Item> items) {
    this.items = ImmutableList.copyOf(items);
  }

  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(items); }
}
