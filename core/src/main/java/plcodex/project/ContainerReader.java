//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the on-disk containers of some PLC toolchain: solutions, which list projects, and
 * projects, which list targets, which in turn list source units.
 */
public interface ContainerReader {

  /** Returns true if {@code path} is a solution this reader understands. */
  boolean isSolution (Path path);

  /** Returns true if {@code path} is a project this reader understands. */
  boolean isProject (Path path);

  /** Returns the projects listed by {@code solution}, in the order listed. */
  List<Path> projects (Path solution) throws IOException;

  /** Returns the targets of {@code project}, in the order listed. */
  List<Target> targets (Path project) throws IOException;

  /** Reads a standalone source file. */
  UnitEntry file (Path path) throws IOException;
}
