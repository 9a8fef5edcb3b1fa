//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import java.util.List;

/**
 * A node which declares variables in var blocks.
 */
public interface Scoped {

  /** Returns the var blocks of this scope, in source order. */
  List<VarBlock> varBlocks ();

  /** Returns the declarations of this scope, indexed by section and name. */
  DeclarationBlock declarations ();
}
