//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import plcodex.model.Source;

/**
 * Reads plain structured text files. Knows of no solutions or projects; subclasses which do
 * can reuse {@link #read} and {@link #file}.
 */
public class SourceFileReader implements ContainerReader {

  /** Reads {@code path} as UTF-8, dropping any byte order mark. */
  public static String read (Path path) throws IOException {
    String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    return (!text.isEmpty() && text.charAt(0) == '\uFEFF') ? text.substring(1) : text;
  }

  @Override public boolean isSolution (Path path) {
    return false;
  }

  @Override public boolean isProject (Path path) {
    return false;
  }

  @Override public List<Path> projects (Path solution) throws IOException {
    return ImmutableList.of();
  }

  @Override public List<Target> targets (Path project) throws IOException {
    return ImmutableList.of();
  }

  @Override public UnitEntry file (Path path) throws IOException {
    return new UnitEntry(new Source.File(path.toString()), UnitEntry.Kind.POU, read(path));
  }
}
