//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import plcodex.ast.Method;
import plcodex.ast.Modifier;
import plcodex.ast.Section;
import plcodex.ast.SourcePrinter;
import plcodex.model.Source;

/**
 * Summarizes a method of a function block or program.
 */
public final class MethodSummary extends Summary {

  public final List<Modifier> modifiers;

  /** The return type, rendered without comments, or null. */
  public final String returnType;

  /** The method's own declarations, by section and name. */
  public final Map<Section, Map<String, DeclarationSummary>> declarations;

  /** The text of the method, exactly as it appears in the unit. */
  public final String sourceCode;

  public MethodSummary (Source source, String owner, Method method, String sourceCode) {
    super(method.name, qualify(owner, method.name), source, method);
    this.modifiers = ImmutableList.copyOf(method.modifiers);
    this.returnType = method.returnType == null ? null :
      SourcePrinter.renderCode(method.returnType);
    this.declarations = Declarations.of(source, qualifiedName, method);
    this.sourceCode = sourceCode;
  }

  /** Returns the declaration of {@code name} in this method, if any. */
  public Optional<DeclarationSummary> declaration (String name) {
    return Declarations.find(declarations, name);
  }

  @Override public Optional<Summary> child (String name) {
    return declaration(name).map(d -> d);
  }

  @Override protected List<?> details () {
    return Arrays.asList(modifiers, returnType, declarations, sourceCode);
  }
}
