//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.twincat;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import plcodex.model.Source;
import plcodex.project.SourceFileReader;
import plcodex.project.Target;
import plcodex.project.UnitEntry;

/**
 * Reads TwinCAT 3 containers: Visual Studio solutions ({@code .sln}), which list TwinCAT system
 * projects ({@code .tsproj}), whose PLC projects ({@code .plcproj}) are the targets, which list
 * TwinCAT source files ({@code .TcPOU}, {@code .TcGVL}, {@code .TcDUT}). A {@code .plcproj} may
 * also be walked directly, as a project with a single target.
 */
public class TwinCatReader extends SourceFileReader {

  @Override public boolean isSolution (Path path) {
    return hasExt(path, "sln");
  }

  @Override public boolean isProject (Path path) {
    return hasExt(path, "tsproj") || hasExt(path, "plcproj");
  }

  @Override public List<Path> projects (Path solution) throws IOException {
    List<Path> projects = new ArrayList<>();
    for (String line : Files.readAllLines(solution)) {
      Matcher m = SLN_PROJECT.matcher(line);
      if (!m.find()) continue;
      Path project = resolve(solution, m.group(2));
      if (isProject(project)) projects.add(project);
      else log.debug("Skipping non-TwinCAT project {} in {}", project, solution);
    }
    return projects;
  }

  @Override public List<Target> targets (Path project) throws IOException {
    if (hasExt(project, "plcproj")) return ImmutableList.of(new PlcTarget(project));

    List<Target> targets = new ArrayList<>();
    Element root = parseXml(project);
    NodeList plcs = root.getElementsByTagName("Plc");
    for (int ii = 0, ll = plcs.getLength(); ii < ll; ii++) {
      for (Element proj : children((Element)plcs.item(ii), "Project")) {
        Element plc = proj;
        // an independent project file holds the project element in _Config/PLC
        if (!plc.hasAttribute("PrjFilePath") && plc.hasAttribute("File")) {
          Path xti = project.resolveSibling("_Config").resolve("PLC").resolve(
            plc.getAttribute("File"));
          plc = parseXml(xti);
          if (!"Project".equals(plc.getTagName())) {
            List<Element> inner = children(plc, "Project");
            if (inner.isEmpty()) continue;
            plc = inner.get(0);
          }
        }
        if (plc.hasAttribute("PrjFilePath")) {
          targets.add(new PlcTarget(resolve(project, plc.getAttribute("PrjFilePath"))));
        }
      }
    }
    return targets;
  }

  @Override public UnitEntry file (Path path) throws IOException {
    UnitEntry.Kind kind = TcPlcObject.kindForExtension(ext(path));
    if (kind == null) return super.file(path);
    return new UnitEntry(new Source.File(path.toString()), kind,
                         TcPlcObject.sourceText(parseXml(path)));
  }

  /** A PLC project: lists its source files in {@code Compile} items. */
  protected class PlcTarget implements Target {

    public PlcTarget (Path plcproj) {
      _plcproj = plcproj;
    }

    @Override public String name () {
      String name = _plcproj.getFileName().toString();
      return name.substring(0, name.length() - ".plcproj".length());
    }

    /** Lists the files of {@code kind} named by this project. Each file is read and assembled
      * only when its entry is parsed, so a broken file fails on its own. */
    @Override public List<UnitEntry> entries (UnitEntry.Kind kind) throws IOException {
      List<UnitEntry> entries = new ArrayList<>();
      NodeList compiles = parseXml(_plcproj).getElementsByTagName("Compile");
      for (int ii = 0, ll = compiles.getLength(); ii < ll; ii++) {
        String include = ((Element)compiles.item(ii)).getAttribute("Include").replace('\\', '/');
        Path file = _plcproj.resolveSibling(include);
        if (TcPlcObject.kindForExtension(ext(file)) != kind) continue;
        entries.add(new UnitEntry(new Source.Item(_plcproj.toString(), include), kind,
                                  sourceText(file)));
      }
      return entries;
    }

    @Override public String toString () {
      return "PlcTarget(" + _plcproj + ")";
    }

    private final Path _plcproj;
  }

  /** Returns the structured text of the TwinCAT file at {@code path}, read and assembled each
    * time it is opened. A file holding no unit reads as empty text. */
  protected static CharSource sourceText (Path path) {
    return new CharSource() {
      @Override public Reader openStream () throws IOException {
        String text = TcPlcObject.sourceText(parseXml(path));
        if (text == null) log.debug("No unit in {}", path);
        return new StringReader(text == null ? "" : text);
      }
    };
  }

  protected static Element parseXml (Path path) throws IOException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      Document doc = builder.parse(path.toFile());
      return doc.getDocumentElement();
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Failed to parse " + path + ": " + e.getMessage(), e);
    }
  }

  private static List<Element> children (Element parent, String name) {
    List<Element> kids = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int ii = 0, ll = nodes.getLength(); ii < ll; ii++) {
      if (nodes.item(ii) instanceof Element && ((Element)nodes.item(ii)).getTagName().equals(name)) {
        kids.add((Element)nodes.item(ii));
      }
    }
    return kids;
  }

  /** Resolves a path written in {@code container} (with Windows separators) against the directory
    * containing {@code container}. */
  private static Path resolve (Path container, String path) {
    return container.resolveSibling(path.replace('\\', '/')).normalize();
  }

  private static boolean hasExt (Path path, String ext) {
    return ext(path).equals(ext);
  }

  private static String ext (Path path) {
    String name = path.getFileName().toString();
    int didx = name.lastIndexOf('.');
    return didx == -1 ? "" : name.substring(didx+1).toLowerCase(Locale.ROOT);
  }

  private static final Pattern SLN_PROJECT = Pattern.compile(
    "^Project\\(\"[^\"]*\"\\)\\s*=\\s*\"([^\"]*)\"\\s*,\\s*\"([^\"]*)\"");

  private static final Logger log = LoggerFactory.getLogger(TwinCatReader.class);
}
