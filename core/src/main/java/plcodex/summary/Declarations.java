//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import plcodex.ast.Declaration;
import plcodex.ast.Scoped;
import plcodex.ast.Section;
import plcodex.ast.VarBlock;
import plcodex.model.Source;

/** Helpers for summarizing the declarations of a scope. */
class Declarations {

  /** Summarizes the declarations of {@code scope}, by section and then by name, in source order. */
  static Map<Section, Map<String, DeclarationSummary>> of (Source source, String owner,
                                                          Scoped scope) {
    Map<Section, Map<String, DeclarationSummary>> sections = new LinkedHashMap<>();
    for (VarBlock block : scope.varBlocks()) {
      Map<String, DeclarationSummary> decls = sections.computeIfAbsent(
        block.section, s -> new LinkedHashMap<>());
      for (Declaration decl : block.declarations) {
        for (String name : decl.names) {
          decls.put(name, new DeclarationSummary(source, owner, block.section, decl, name));
        }
      }
    }
    ImmutableMap.Builder<Section, Map<String, DeclarationSummary>> builder = ImmutableMap.builder();
    for (Map.Entry<Section, Map<String, DeclarationSummary>> entry : sections.entrySet()) {
      builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return builder.build();
  }

  /** Finds {@code name} (case-insensitively) in any section of {@code sections}. */
  static Optional<DeclarationSummary> find (Map<Section, Map<String, DeclarationSummary>> sections,
                                            String name) {
    for (Map<String, DeclarationSummary> decls : sections.values()) {
      for (DeclarationSummary decl : decls.values()) {
        if (decl.name.equalsIgnoreCase(name)) return Optional.of(decl);
      }
    }
    return Optional.empty();
  }

  private Declarations () {}
}
