//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plcodex.model.Source;
import plcodex.parse.ParseException;
import plcodex.parse.SourceParser;
import plcodex.parse.SourceUnit;

/**
 * Parses every unit reachable from a solution, project or source file. A failure to read a
 * project or to parse a unit is reported as a failed {@link UnitResult} and the walk moves on.
 */
public class ProjectWalker {

  public ProjectWalker (ContainerReader reader, SourceParser parser) {
    _reader = Preconditions.checkNotNull(reader);
    _parser = Preconditions.checkNotNull(parser);
  }

  /**
   * Returns the results of parsing every unit reachable from {@code path}. A solution is expanded
   * into its projects, each project into its targets and each target into its data types, then
   * its global variable lists, then its program organization units. The results are computed
   * lazily as they are iterated, and each iteration parses anew.
   */
  public Iterable<UnitResult> walk (Path path) {
    if (_reader.isSolution(path)) return walkSolution(path);
    else if (_reader.isProject(path)) return walkProject(path);
    else return walkFile(path);
  }

  protected Iterable<UnitResult> walkSolution (Path solution) {
    List<Path> projects;
    try {
      projects = _reader.projects(solution);
    } catch (IOException | RuntimeException e) {
      return ImmutableList.of(failed(solution, e));
    }
    log.debug("Walking {}: {} projects", solution, projects.size());
    return Iterables.concat(Iterables.transform(projects, this::walkProject));
  }

  protected Iterable<UnitResult> walkProject (Path project) {
    List<Target> targets;
    try {
      targets = _reader.targets(project);
    } catch (IOException | RuntimeException e) {
      return ImmutableList.of(failed(project, e));
    }
    log.debug("Walking {}: {} targets", project, targets.size());
    return Iterables.concat(Iterables.transform(targets, target -> walkTarget(project, target)));
  }

  protected Iterable<UnitResult> walkTarget (Path project, Target target) {
    return Iterables.concat(Iterables.transform(Arrays.asList(UnitEntry.Kind.values()),
                                                kind -> walkEntries(project, target, kind)));
  }

  protected Iterable<UnitResult> walkEntries (Path project, Target target, UnitEntry.Kind kind) {
    List<UnitEntry> entries;
    try {
      entries = target.entries(kind);
    } catch (IOException | RuntimeException e) {
      return ImmutableList.of(failed(project, e));
    }
    Iterable<UnitEntry> withText = Iterables.filter(entries, entry -> {
      if (entry.hasText()) return true;
      log.debug("Skipping {}: no source", entry.source);
      return false;
    });
    return Iterables.transform(withText, this::parse);
  }

  protected Iterable<UnitResult> walkFile (Path file) {
    UnitEntry entry;
    try {
      entry = _reader.file(file);
    } catch (IOException | RuntimeException e) {
      return ImmutableList.of(failed(file, e));
    }
    if (!entry.hasText()) {
      log.debug("Skipping {}: no source", entry.source);
      return ImmutableList.of();
    }
    return ImmutableList.of(parse(entry));
  }

  /** Reads and parses {@code entry}. Any failure is reported against the entry alone. */
  protected UnitResult parse (UnitEntry entry) {
    try {
      SourceUnit unit = _parser.parse(entry.source, entry.text().orElse(""));
      log.debug("Parsed {}", entry.source);
      return UnitResult.success(entry.source, unit);
    } catch (ParseException pe) {
      log.warn("Failed to parse {}: {}", entry.source, pe.getMessage());
      return UnitResult.failure(entry.source, pe);
    } catch (IOException ioe) {
      log.warn("Failed to read {}: {}", entry.source, ioe.getMessage());
      return UnitResult.failure(entry.source, ioe);
    } catch (RuntimeException re) {
      log.warn("Failed to parse {}", entry.source, re);
      return UnitResult.failure(entry.source, re);
    }
  }

  private UnitResult failed (Path container, Exception error) {
    log.warn("Failed to read {}: {}", container, error.getMessage());
    return UnitResult.failure(new Source.File(container.toString()), error);
  }

  protected final ContainerReader _reader;
  protected final SourceParser _parser;

  private static final Logger log = LoggerFactory.getLogger(ProjectWalker.class);
}
