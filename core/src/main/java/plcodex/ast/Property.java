//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code PROPERTY [modifiers] name : type ... END_PROPERTY}.
 */
public final class Property extends Item implements Scoped {

  public final List<Modifier> modifiers;
  public final String name;
  public final TypeSpec type;
  public final List<VarBlock> varBlocks;
  public final StatementList body;

  public Property (List<Modifier> modifiers, String name, TypeSpec type,
                   List<VarBlock> varBlocks, StatementList body) {
    this.modifiers = ImmutableList.copyOf(modifiers);
    this.name = name;
    this.type = type;
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    this.body = body;
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.PROPERTY; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () {
    return Arrays.asList(modifiers, name, type, varBlocks, body);
  }

  private final DeclarationBlock _decls;
}
