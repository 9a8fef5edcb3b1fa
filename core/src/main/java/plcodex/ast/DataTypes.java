//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code TYPE ... END_TYPE}: one or more type declarations.
 */
public final class DataTypes extends Item {

  public final List<TypeDecl> types;

  public DataTypes (List<TypeDecl> types) {
    this.types = ImmutableList.copyOf(types);
  }

  @Override public Kind kind () { return Kind.DATA_TYPE; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(types); }
}
