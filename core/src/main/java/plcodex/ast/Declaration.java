//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * A variable declaration: {@code a, b AT %IX0.0 : BOOL := TRUE;}.
 */
public final class Declaration extends Node {

  /** The declared names, in source order. Never empty. */
  public final List<String> names;
  /** The hardware address ({@code %IX0.0}), or null. */
  public final String location;
  public final TypeSpec type;
  /** The initial value, or null. */
  public final Initializer init;

  public Declaration (List<String> names, String location, TypeSpec type, Initializer init) {
    Preconditions.checkArgument(!names.isEmpty(), "Declaration requires at least one name");
    this.names = ImmutableList.copyOf(names);
    this.location = location;
    this.type = type;
    this.init = init;
  }

  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(names, location, type, init); }
}
