//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code METHOD [modifiers] name [: returnType] ... END_METHOD}. Methods appear after the
 * function block that owns them.
 */
public final class Method extends Item implements Scoped {

  public final List<Modifier> modifiers;
  public final String name;
  /** The return type, or null. */
  public final TypeSpec returnType;
  public final List<VarBlock> varBlocks;
  public final StatementList body;

  public Method (List<Modifier> modifiers, String name, TypeSpec returnType,
                 List<VarBlock> varBlocks, StatementList body) {
    this.modifiers = ImmutableList.copyOf(modifiers);
    this.name = name;
    this.returnType = returnType;
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    this.body = body;
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.METHOD; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () {
    return Arrays.asList(modifiers, name, returnType, varBlocks, body);
  }

  private final DeclarationBlock _decls;
}
