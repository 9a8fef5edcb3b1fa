//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import plcodex.ast.FunctionBlock;
import plcodex.model.Source;
import plcodex.parse.SourceUnit;
import plcodex.project.UnitResult;
import plcodex.summary.CodeSummary;

public class PlcCodexTest {

  @Rule public TemporaryFolder temp = new TemporaryFolder();

  public final String VALVE = Joiner.on("\n").join(
    "FUNCTION_BLOCK FB_Valve",
    "VAR_INPUT",
    "    bOpen : BOOL;",
    "END_VAR",
    "END_FUNCTION_BLOCK",
    "",
    "METHOD Toggle",
    "bOpen := NOT bOpen;",
    "END_METHOD",
    "");

  protected Path write (String name, String text) throws IOException {
    Path path = temp.getRoot().toPath().resolve(name);
    Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  @Test public void testParseFile () throws IOException {
    Path path = write("FB_Valve.st", "\uFEFF" + VALVE);
    SourceUnit unit = new PlcCodex().parseFile(path);
    assertEquals(new Source.File(path.toString()), unit.source);
    assertEquals(VALVE, unit.text);
    FunctionBlock fb = (FunctionBlock)unit.sourceCode().items.get(0);
    assertEquals("FB_Valve", fb.name);
  }

  @Test public void testParseContainerOfFile () throws IOException {
    Path path = write("FB_Valve.st", VALVE);
    List<UnitResult> results = ImmutableList.copyOf(new PlcCodex().parseContainer(path));
    assertEquals(1, results.size());
    CodeSummary sum = PlcCodex.summarize(PlcCodex.units(results));
    assertEquals("FB_Valve.Toggle", sum.find("FB_Valve.Toggle").qualifiedName);
  }

  @Test public void testMissingFile () {
    Path path = temp.getRoot().toPath().resolve("Nope.st");
    List<UnitResult> results = ImmutableList.copyOf(new PlcCodex().parseContainer(path));
    assertEquals(1, results.size());
    assertTrue(results.get(0).error() instanceof IOException);
  }

  @Test public void testParseText () {
    SourceUnit unit = new PlcCodex().parseText(VALVE, new Source.File("FB_Valve.st"));
    assertEquals(2, unit.sourceCode().items.size());
    assertSame(PlcCodex.defaultEngine(), PlcCodex.defaultEngine());
  }
}
