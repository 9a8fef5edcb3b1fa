//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import java.io.IOException;
import java.util.List;

/**
 * A build target of a project (a PLC project of a TwinCAT system project, for example): a named
 * collection of source units.
 */
public interface Target {

  /** Returns the name of this target. */
  String name ();

  /** Returns the units of {@code kind} in this target, in the order the target lists them. */
  List<UnitEntry> entries (UnitEntry.Kind kind) throws IOException;
}
