//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.model.Kind;

/**
 * {@code FUNCTION name [: returnType] ... END_FUNCTION}.
 */
public final class Function extends Item implements Scoped {

  public final String name;
  /** The return type, or null. */
  public final TypeSpec returnType;
  public final List<VarBlock> varBlocks;
  public final StatementList body;

  public Function (String name, TypeSpec returnType, List<VarBlock> varBlocks,
                   StatementList body) {
    this.name = name;
    this.returnType = returnType;
    this.varBlocks = ImmutableList.copyOf(varBlocks);
    this.body = body;
    _decls = DeclarationBlock.of(varBlocks);
  }

  @Override public List<VarBlock> varBlocks () { return varBlocks; }
  @Override public DeclarationBlock declarations () { return _decls; }
  @Override public Kind kind () { return Kind.FUNCTION; }
  @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
  @Override protected List<?> fields () { return Arrays.asList(name, returnType, varBlocks, body); }

  private final DeclarationBlock _decls;
}
