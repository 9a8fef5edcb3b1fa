//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.project;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.CharSource;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.*;
import static org.junit.Assert.*;

import plcodex.PlcCodex;
import plcodex.model.Source;
import plcodex.parse.GrammarException;
import plcodex.parse.SourceParser;

public class ProjectWalkerTest {

  /** A reader over an in-memory solution, which records the projects it is asked to read. */
  public static class TestReader implements ContainerReader {
    public final List<Path> read = new ArrayList<>();
    public final Map<Path, List<Target>> projects;

    public TestReader (Map<Path, List<Target>> projects) {
      this.projects = projects;
    }

    @Override public boolean isSolution (Path path) {
      return path.toString().endsWith(".sln");
    }

    @Override public boolean isProject (Path path) {
      return path.toString().endsWith(".proj");
    }

    @Override public List<Path> projects (Path solution) throws IOException {
      return ImmutableList.copyOf(projects.keySet());
    }

    @Override public List<Target> targets (Path project) throws IOException {
      read.add(project);
      List<Target> targets = projects.get(project);
      if (targets == null) throw new FileNotFoundException(project.toString());
      return targets;
    }

    @Override public UnitEntry file (Path path) throws IOException {
      return entry(UnitEntry.Kind.POU, path.toString(), GOOD);
    }
  }

  /** A target whose units are listed up front. */
  public static class TestTarget implements Target {
    public final List<UnitEntry> entries;

    public TestTarget (UnitEntry... entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override public String name () {
      return "test";
    }

    @Override public List<UnitEntry> entries (UnitEntry.Kind kind) {
      List<UnitEntry> matches = new ArrayList<>();
      for (UnitEntry entry : entries) if (entry.kind == kind) matches.add(entry);
      return matches;
    }
  }

  public static final String GOOD = "PROGRAM Main\nx := 1;\nEND_PROGRAM";
  public static final String BAD = "PROGRAM Broken\nx := ;\nEND_PROGRAM";

  public static UnitEntry entry (UnitEntry.Kind kind, String name, String text) {
    return new UnitEntry(new Source.Item("plc.proj", name), kind, text);
  }

  /** Returns an entry whose text cannot be read: reading it throws {@code error}. */
  public static UnitEntry unreadable (String name, Exception error) {
    return new UnitEntry(new Source.Item("plc.proj", name), UnitEntry.Kind.POU, new CharSource() {
      @Override public Reader openStream () throws IOException {
        if (error instanceof IOException) throw (IOException)error;
        throw (RuntimeException)error;
      }
    });
  }

  public final SourceParser parser = new SourceParser(PlcCodex.defaultEngine());

  @Test public void testFailuresDoNotStopTheWalk () {
    Path proj = Paths.get("plc.proj");
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of(
      proj, ImmutableList.<Target>of(new TestTarget(
        entry(UnitEntry.Kind.POU, "One.TcPOU", GOOD),
        entry(UnitEntry.Kind.POU, "Two.TcPOU", BAD),
        entry(UnitEntry.Kind.POU, "Three.TcPOU", GOOD)))));
    List<UnitResult> results = ImmutableList.copyOf(new ProjectWalker(reader, parser).walk(proj));
    assertEquals(3, results.size());
    assertTrue(results.get(0).isSuccess());
    assertFalse(results.get(1).isSuccess());
    assertTrue(results.get(2).isSuccess());
    assertEquals(new Source.Item("plc.proj", "Two.TcPOU"), results.get(1).source);
    assertTrue(results.get(1).error() instanceof GrammarException);
    assertEquals(1, PlcCodex.failures(results).size());
    assertEquals(2, PlcCodex.units(results).size());
  }

  @Test public void testUnreadableUnit () {
    Path proj = Paths.get("plc.proj");
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of(
      proj, ImmutableList.<Target>of(new TestTarget(
        entry(UnitEntry.Kind.POU, "One.TcPOU", GOOD),
        unreadable("Two.TcPOU", new IOException("truncated")),
        entry(UnitEntry.Kind.POU, "Three.TcPOU", GOOD)))));
    List<UnitResult> results = ImmutableList.copyOf(new ProjectWalker(reader, parser).walk(proj));
    assertEquals(3, results.size());
    assertTrue(results.get(0).isSuccess());
    assertEquals(new Source.Item("plc.proj", "Two.TcPOU"), results.get(1).source);
    assertEquals("truncated", results.get(1).error().getMessage());
    assertTrue(results.get(2).isSuccess());
  }

  @Test public void testUnexpectedErrorsDoNotStopTheWalk () {
    Path proj = Paths.get("plc.proj");
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of(
      proj, ImmutableList.<Target>of(new TestTarget(
        entry(UnitEntry.Kind.POU, "One.TcPOU", GOOD),
        unreadable("Two.TcPOU", new IllegalStateException("reader bug")),
        entry(UnitEntry.Kind.POU, "Three.TcPOU", GOOD)))));
    List<UnitResult> results = ImmutableList.copyOf(new ProjectWalker(reader, parser).walk(proj));
    assertEquals(3, results.size());
    assertTrue(results.get(0).isSuccess());
    assertTrue(results.get(1).error() instanceof IllegalStateException);
    assertEquals(new Source.Item("plc.proj", "Two.TcPOU"), results.get(1).source);
    assertTrue(results.get(2).isSuccess());
  }

  @Test public void testFailedListingSkipsOnlyItsKind () {
    Path proj = Paths.get("plc.proj");
    Target target = new TestTarget(
      entry(UnitEntry.Kind.DATA_TYPE, "E_Mode.TcDUT", "TYPE E_Mode : (A, B); END_TYPE"),
      entry(UnitEntry.Kind.POU, "Main.TcPOU", GOOD)) {
      @Override public List<UnitEntry> entries (UnitEntry.Kind kind) {
        if (kind == UnitEntry.Kind.GLOBAL_VARIABLES) throw new IllegalStateException("no GVLs");
        return super.entries(kind);
      }
    };
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of(
      proj, ImmutableList.of(target)));
    List<UnitResult> results = ImmutableList.copyOf(new ProjectWalker(reader, parser).walk(proj));
    assertEquals(3, results.size());
    assertTrue(results.get(0).isSuccess());
    assertEquals(new Source.File("plc.proj"), results.get(1).source);
    assertTrue(results.get(1).error() instanceof IllegalStateException);
    assertTrue(results.get(2).isSuccess());
  }

  @Test public void testKindOrder () {
    Path proj = Paths.get("plc.proj");
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of(
      proj, ImmutableList.<Target>of(new TestTarget(
        entry(UnitEntry.Kind.POU, "Main.TcPOU", GOOD),
        entry(UnitEntry.Kind.GLOBAL_VARIABLES, "GVL.TcGVL", "VAR_GLOBAL g : INT; END_VAR"),
        entry(UnitEntry.Kind.POU, "Folder", null),
        entry(UnitEntry.Kind.DATA_TYPE, "E_Mode.TcDUT", "TYPE E_Mode : (A, B); END_TYPE")))));
    List<String> names = new ArrayList<>();
    for (UnitResult result : new ProjectWalker(reader, parser).walk(proj)) {
      assertTrue(result.toString(), result.isSuccess());
      names.add(result.source.fileName());
    }
    assertEquals(ImmutableList.of("E_Mode.TcDUT", "GVL.TcGVL", "Main.TcPOU"), names);
  }

  @Test public void testUnreadableProject () {
    Path missing = Paths.get("missing.proj"), good = Paths.get("good.proj");
    Map<Path, List<Target>> projects = new java.util.LinkedHashMap<>();
    projects.put(missing, null);
    projects.put(good, ImmutableList.<Target>of(
      new TestTarget(entry(UnitEntry.Kind.POU, "Main.TcPOU", GOOD))));
    TestReader reader = new TestReader(projects);

    List<UnitResult> results = ImmutableList.copyOf(
      new ProjectWalker(reader, parser).walk(Paths.get("app.sln")));
    assertEquals(2, results.size());
    assertFalse(results.get(0).isSuccess());
    assertEquals(new Source.File("missing.proj"), results.get(0).source);
    assertTrue(results.get(0).error() instanceof FileNotFoundException);
    assertTrue(results.get(1).isSuccess());
  }

  @Test public void testWalkIsLazy () {
    Path first = Paths.get("first.proj"), second = Paths.get("second.proj");
    Map<Path, List<Target>> projects = new java.util.LinkedHashMap<>();
    projects.put(first, ImmutableList.<Target>of(
      new TestTarget(entry(UnitEntry.Kind.POU, "A.TcPOU", GOOD))));
    projects.put(second, ImmutableList.<Target>of(
      new TestTarget(entry(UnitEntry.Kind.POU, "B.TcPOU", GOOD))));
    TestReader reader = new TestReader(projects);

    Iterator<UnitResult> iter = new ProjectWalker(reader, parser).walk(
      Paths.get("app.sln")).iterator();
    assertTrue(reader.read.isEmpty());
    assertEquals("A.TcPOU", iter.next().source.fileName());
    assertEquals(ImmutableList.of(first), reader.read);
    assertEquals("B.TcPOU", iter.next().source.fileName());
    assertEquals(ImmutableList.of(first, second), reader.read);
    assertFalse(iter.hasNext());
  }

  @Test public void testWalkFile () {
    TestReader reader = new TestReader(ImmutableMap.<Path, List<Target>>of());
    List<UnitResult> results = ImmutableList.copyOf(
      new ProjectWalker(reader, parser).walk(Paths.get("Main.st")));
    assertEquals(1, results.size());
    assertTrue(results.get(0).isSuccess());
    assertEquals("Main", ((plcodex.ast.Program)results.get(0).unit().sourceCode().items.get(0)).name);
  }

  @Test(expected=java.util.NoSuchElementException.class)
  public void testUnitOfFailure () {
    UnitResult.failure(new Source.File("x.st"), new IOException("boom")).unit();
  }
}
