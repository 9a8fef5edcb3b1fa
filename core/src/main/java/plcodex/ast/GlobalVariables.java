//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * A {@code VAR_GLOBAL} block appearing at the top level of a source file.
 */
public final class GlobalVariables extends Item implements Scoped {

  public final VarBlock block;

  public GlobalVariables (VarBlock block) {
    this.block = block;
    _decls = DeclarationBlock.of(varBlocks());
  }

  @Override public List<VarBlock> varBlocks () { return ImmutableList.of(block); }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.GLOBAL_VARIABLES; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(block); }

  private final DeclarationBlock _decls;
}
