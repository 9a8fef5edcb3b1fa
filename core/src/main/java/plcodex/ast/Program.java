//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code PROGRAM name ... END_PROGRAM}.
 */
public final class Program extends Item implements Scoped {

  public final String name;
  public final List<VarBlock> varBlocks;
  public final StatementList body;

  public Program (String name, List<VarBlock> varBlocks, StatementList body) {
    this.name = name;
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    this.body = body;
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.PROGRAM; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(name, varBlocks, body); }

  private final DeclarationBlock _decls;
}
