//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import plcodex.ast.Modifier;
import plcodex.ast.Property;
import plcodex.ast.Section;
import plcodex.ast.SourcePrinter;
import plcodex.model.Source;

/**
 * Summarizes a property of a function block or program. A property with both a getter and a
 * setter appears as two summaries of the same name.
 */
public final class PropertySummary extends Summary {

  public final List<Modifier> modifiers;

  /** The property type, rendered without comments. */
  public final String type;

  public final Map<Section, Map<String, DeclarationSummary>> declarations;

  /** The text of the property, exactly as it appears in the unit. */
  public final String sourceCode;

  public PropertySummary (Source source, String owner, Property property, String sourceCode) {
    super(property.name, qualify(owner, property.name), source, property);
    this.modifiers = ImmutableList.copyOf(property.modifiers);
    this.type = SourcePrinter.renderCode(property.type);
    this.declarations = Declarations.of(source, qualifiedName, property);
    this.sourceCode = sourceCode;
  }

  @Override protected List<?> details () {
    return Arrays.asList(modifiers, type, declarations, sourceCode);
  }
}
