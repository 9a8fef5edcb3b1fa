//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code FUNCTION_BLOCK [modifiers] name [EXTENDS base] [IMPLEMENTS interfaces] ...}.
 */
public final class FunctionBlock extends Item implements Scoped {

  public final List<Modifier> modifiers;
  public final String name;
  /** The extended function block, or null. */
  public final String base;
  public final List<String> interfaces;
  public final List<VarBlock> varBlocks;
  public final StatementList body;

  public FunctionBlock (List<Modifier> modifiers, String name, String base,
                        List<String> interfaces, List<VarBlock> varBlocks, StatementList body) {
    this.modifiers = ImmutableList.copyOf(modifiers);
    this.name = name;
    this.base = base;
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    this.body = body;
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.FUNCTION_BLOCK; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () {
    return Arrays.asList(modifiers, name, base, interfaces, varBlocks, body);
  }

  private final DeclarationBlock _decls;
}
