//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * The root of text parsed as a bare list of var blocks, such as the declaration part of a unit
 * stored apart from its implementation.
 */
public final class DeclarationList extends Node implements Scoped {

  public final List<VarBlock> varBlocks;

  public DeclarationList (List<VarBlock> varBlocks) {
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(varBlocks); }

  private final DeclarationBlock _decls;
}
