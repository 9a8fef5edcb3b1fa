//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import plcodex.ast.Item;
import plcodex.ast.Section;
import plcodex.model.Kind;
import plcodex.model.Source;

/**
 * Summarizes a function block, program or function, along with the methods, properties and
 * actions declared after it.
 */
public final class FunctionBlockSummary extends Summary {

  /** {@link Kind#FUNCTION_BLOCK}, {@link Kind#PROGRAM} or {@link Kind#FUNCTION}. */
  public final Kind kind;

  /** The extended function block, or null. */
  public final String base;

  /** The implemented interfaces. */
  public final List<String> interfaces;

  /** The return type of a function, rendered without comments, or null. */
  public final String returnType;

  /** The declarations, by section and name, in source order. */
  public final Map<Section, Map<String, DeclarationSummary>> declarations;

  public final List<MethodSummary> methods;
  public final List<PropertySummary> properties;
  public final List<ActionSummary> actions;

  /** The text of the declaration, exactly as it appears in the unit. */
  public final String sourceCode;

  /** Returns the declaration of {@code name} in any section, if any. */
  public Optional<DeclarationSummary> declaration (String name) {
    return Declarations.find(declarations, name);
  }

  /** Returns the declarations in {@code section}, which may be empty. */
  public Map<String, DeclarationSummary> section (Section section) {
    Map<String, DeclarationSummary> decls = declarations.get(section);
    return decls == null ? Collections.emptyMap() : decls;
  }

  /**
   * Returns the first method named {@code name} (case-insensitively).
   * @throws NoSuchElementException if no such method exists.
   */
  public MethodSummary method (String name) {
    return first(methods, name).orElseThrow(() -> new NoSuchElementException(
      "No method '" + name + "' in " + qualifiedName));
  }

  /**
   * Returns the first action named {@code name} (case-insensitively).
   * @throws NoSuchElementException if no such action exists.
   */
  public ActionSummary action (String name) {
    return first(actions, name).orElseThrow(() -> new NoSuchElementException(
      "No action '" + name + "' in " + qualifiedName));
  }

  /**
   * Returns the first property named {@code name} (case-insensitively).
   * @throws NoSuchElementException if no such property exists.
   */
  public PropertySummary property (String name) {
    return first(properties, name).orElseThrow(() -> new NoSuchElementException(
      "No property '" + name + "' in " + qualifiedName));
  }

  /** Searches methods, then properties, then actions, then declarations. */
  @Override public Optional<Summary> child (String name) {
    Optional<? extends Summary> found = first(methods, name);
    if (!found.isPresent()) found = first(properties, name);
    if (!found.isPresent()) found = first(actions, name);
    if (!found.isPresent()) found = declaration(name);
    return found.map(s -> s);
  }

  @Override protected List<?> details () {
    return Arrays.asList(kind, base, interfaces, returnType, declarations, methods, properties,
                         actions, sourceCode);
  }

  FunctionBlockSummary (Kind kind, String name, Source source, Item item,
                        String base, List<String> interfaces, String returnType,
                        Map<Section, Map<String, DeclarationSummary>> declarations,
                        List<MethodSummary> methods, List<PropertySummary> properties,
                        List<ActionSummary> actions, String sourceCode) {
    super(name, name, source, item);
    this.kind = kind;
    this.base = base;
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.returnType = returnType;
    this.declarations = declarations;
    this.methods = ImmutableList.copyOf(methods);
    this.properties = ImmutableList.copyOf(properties);
    this.actions = ImmutableList.copyOf(actions);
    this.sourceCode = sourceCode;
  }

  private static <S extends Summary> Optional<S> first (List<S> summaries, String name) {
    for (S summary : summaries) if (summary.name.equalsIgnoreCase(name)) return Optional.of(summary);
    return Optional.empty();
  }
}
