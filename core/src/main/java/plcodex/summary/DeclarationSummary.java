//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import java.util.Arrays;
import java.util.List;
import plcodex.ast.Declaration;
import plcodex.ast.Section;
import plcodex.ast.SourcePrinter;
import plcodex.model.Source;

/**
 * Summarizes a single declared variable. A declaration of several names yields one summary per
 * name.
 */
public final class DeclarationSummary extends Summary {

  /** The section in which the variable was declared, or null for a struct member. */
  public final Section section;

  /** The declared type, rendered without comments ({@code ARRAY[1..10] OF INT}). */
  public final String type;

  /** The type at the bottom of any array, pointer or reference layers ({@code INT}). */
  public final String baseType;

  /** The initial value, rendered without comments, or null. */
  public final String value;

  /** The hardware address ({@code %IX0.0}), or null. */
  public final String location;

  public DeclarationSummary (Source source, String owner, Section section, Declaration decl,
                             String name) {
    super(name, qualify(owner, name), source, decl);
    this.section = section;
    this.type = SourcePrinter.renderCode(decl.type);
    this.baseType = decl.type.baseTypeName();
    this.value = decl.init == null ? null : SourcePrinter.renderCode(decl.init);
    this.location = decl.location;
  }

  @Override protected List<?> details () {
    return Arrays.asList(section, type, baseType, value, location);
  }
}
