//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.twincat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import plcodex.parse.CommentExtractor;
import plcodex.parse.LexicalException;
import plcodex.project.UnitEntry;

/**
 * Assembles structured text from a TwinCAT source file ({@code .TcPOU}, {@code .TcGVL},
 * {@code .TcDUT}). These are XML documents which store the declaration and implementation of a
 * unit, and of each of its methods, properties and actions, in separate elements.
 */
class TcPlcObject {

  /** Returns the kind of unit stored in files with extension {@code ext}, or null if files with
    * that extension do not hold structured text we can parse. */
  static UnitEntry.Kind kindForExtension (String ext) {
    switch (ext.toLowerCase(Locale.ROOT)) {
    case "tcpou": return UnitEntry.Kind.POU;
    case "tcgvl": return UnitEntry.Kind.GLOBAL_VARIABLES;
    case "tcdut": return UnitEntry.Kind.DATA_TYPE;
    default: return null;
    }
  }

  /**
   * Returns the structured text of the unit in {@code root} (a {@code TcPlcObject} element), or
   * null if it contains no unit. A POU is assembled as its declaration, its implementation and
   * the matching {@code END_} keyword, followed by its methods, properties (one block for each
   * accessor) and actions.
   */
  static String sourceText (Element root) {
    Element pou = child(root, "POU");
    if (pou != null) return pouText(pou);
    Element gvl = child(root, "GVL");
    if (gvl != null) return declaration(gvl);
    Element dut = child(root, "DUT");
    if (dut != null) return declaration(dut);
    return null;
  }

  private static String pouText (Element pou) {
    List<String> parts = new ArrayList<>();
    String decl = declaration(pou);
    parts.add(decl);
    parts.add(implementation(pou));
    parts.add("END_" + pouKeyword(decl));

    for (Element method : children(pou, "Method")) {
      parts.add(declaration(method));
      parts.add(implementation(method));
      parts.add("END_METHOD");
    }

    for (Element prop : children(pou, "Property")) {
      String propDecl = declaration(prop);
      List<Element> accessors = new ArrayList<>();
      accessors.addAll(children(prop, "Get"));
      accessors.addAll(children(prop, "Set"));
      if (accessors.isEmpty()) {
        parts.add(propDecl);
        parts.add("END_PROPERTY");
      }
      for (Element accessor : accessors) {
        parts.add(propDecl);
        parts.add(declaration(accessor));
        parts.add(implementation(accessor));
        parts.add("END_PROPERTY");
      }
    }

    for (Element action : children(pou, "Action")) {
      parts.add("ACTION " + action.getAttribute("Name") + ":");
      parts.add(implementation(action));
      parts.add("END_ACTION");
    }

    StringBuilder text = new StringBuilder();
    for (String part : parts) {
      if (part.isEmpty()) continue;
      if (text.length() > 0) text.append('\n');
      text.append(part);
    }
    return text.toString();
  }

  /** Returns the keyword which opens the POU declared by {@code decl}. Malformed comments are
    * left for the parser to report, so the keyword is then sought in the raw text. */
  static String pouKeyword (String decl) {
    String clean;
    try {
      clean = new CommentExtractor().extract(decl).cleanText;
    } catch (LexicalException le) {
      clean = decl;
    }
    Matcher m = POU_KEYWORD.matcher(clean);
    return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : "FUNCTION_BLOCK";
  }

  private static String declaration (Element elem) {
    Element decl = child(elem, "Declaration");
    return decl == null ? "" : decl.getTextContent().trim();
  }

  /** Returns the structured text implementation of {@code elem}. Graphical implementations
    * (SFC, FBD, LD) are not structured text and yield "". */
  private static String implementation (Element elem) {
    Element impl = child(elem, "Implementation");
    Element st = impl == null ? null : child(impl, "ST");
    return st == null ? "" : st.getTextContent().trim();
  }

  private static Element child (Element parent, String name) {
    List<Element> kids = children(parent, name);
    return kids.isEmpty() ? null : kids.get(0);
  }

  private static List<Element> children (Element parent, String name) {
    List<Element> kids = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int ii = 0, ll = nodes.getLength(); ii < ll; ii++) {
      Node node = nodes.item(ii);
      if (node instanceof Element && ((Element)node).getTagName().equals(name)) {
        kids.add((Element)node);
      }
    }
    return kids;
  }

  private static final Pattern POU_KEYWORD = Pattern.compile(
    "(?i)\\b(FUNCTION_BLOCK|PROGRAM|FUNCTION|INTERFACE)\\b");
}
