//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import plcodex.model.Source;
import plcodex.parse.Engine;
import plcodex.parse.ParseOptions;
import plcodex.parse.SourceParser;
import plcodex.parse.SourceUnit;
import plcodex.project.ContainerReader;
import plcodex.project.ProjectWalker;
import plcodex.project.SourceFileReader;
import plcodex.project.UnitEntry;
import plcodex.project.UnitResult;
import plcodex.summary.CodeSummary;

/**
 * The main entry point for parsing PLC code. A codex combines an {@link Engine}, which does the
 * parsing, with a {@link ContainerReader}, which knows how to find source in a toolchain's
 * solutions and projects.
 */
public class PlcCodex {

  /**
   * Returns an engine shared by every codex created without an explicit engine. It is created on
   * first use. Calls on it are serialized, so parallel parsers should create their own engines.
   */
  public static Engine defaultEngine () {
    return DEFAULT_ENGINE.get();
  }

  /** Summarizes {@code units}. See {@link CodeSummary#of}. */
  public static CodeSummary summarize (Iterable<SourceUnit> units) {
    return CodeSummary.of(units);
  }

  /** Returns the successfully parsed units in {@code results}. */
  public static ImmutableList<SourceUnit> units (Iterable<UnitResult> results) {
    ImmutableList.Builder<SourceUnit> units = ImmutableList.builder();
    for (UnitResult result : results) if (result.isSuccess()) units.add(result.unit());
    return units.build();
  }

  /** Returns the failed results in {@code results}, for reporting once a walk completes. */
  public static ImmutableList<UnitResult> failures (Iterable<UnitResult> results) {
    ImmutableList.Builder<UnitResult> failures = ImmutableList.builder();
    for (UnitResult result : results) if (!result.isSuccess()) failures.add(result);
    return failures.build();
  }

  /** Creates a codex which reads plain source files using the default engine. */
  public PlcCodex () {
    this(new SourceFileReader());
  }

  /** Creates a codex which reads containers with {@code reader} using the default engine. */
  public PlcCodex (ContainerReader reader) {
    this(defaultEngine(), reader);
  }

  public PlcCodex (Engine engine, ContainerReader reader) {
    _reader = reader;
    _parser = new SourceParser(engine);
    _walker = new ProjectWalker(reader, _parser);
  }

  /** Parses {@code text} as a whole source file. */
  public SourceUnit parseText (String text, Source source) {
    return _parser.parse(source, text);
  }

  /** Parses {@code text} according to {@code options}. */
  public SourceUnit parseText (String text, Source source, ParseOptions options) {
    return _parser.parse(source, text, options);
  }

  /**
   * Reads and parses the source file at {@code path}.
   * @throws IOException if the file cannot be read.
   * @throws plcodex.parse.ParseException if the file cannot be parsed.
   */
  public SourceUnit parseFile (Path path) throws IOException {
    UnitEntry entry = _reader.file(path);
    return _parser.parse(entry.source, entry.text().orElse(""));
  }

  /** Parses every unit reachable from the solution, project or file at {@code path}. The
    * results are computed as they are iterated. */
  public Iterable<UnitResult> parseContainer (Path path) {
    return _walker.walk(path);
  }

  private final ContainerReader _reader;
  private final SourceParser _parser;
  private final ProjectWalker _walker;

  private static final Supplier<Engine> DEFAULT_ENGINE = Suppliers.memoize(Engine::new);
}
