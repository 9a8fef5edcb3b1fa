//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import plcodex.parse.DuplicateDeclarationException;

/**
 * The variables declared by a scope, keyed by section and then by name. Both levels iterate in
 * declaration order. Several blocks of the same section are merged into one.
 */
public final class DeclarationBlock {

  public static final DeclarationBlock EMPTY = new DeclarationBlock(ImmutableMap.of());

  /**
   * Indexes the declarations in {@code blocks}.
   * @throws DuplicateDeclarationException if a name is declared twice in one section. Names are
   * compared case-insensitively.
   */
  public static DeclarationBlock of (Iterable<VarBlock> blocks) {
    Map<Section, Map<String, Declaration>> sections = new LinkedHashMap<>();
    Map<Section, Map<String, Declaration>> seen = new HashMap<>();
    for (VarBlock block : blocks) {
      Map<String, Declaration> byName = sections.computeIfAbsent(
        block.section, s -> new LinkedHashMap<>());
      Map<String, Declaration> byUpper = seen.computeIfAbsent(block.section, s -> new HashMap<>());
      for (Declaration decl : block.declarations) {
        for (String name : decl.names) {
          claim(byUpper, name, decl);
          byName.put(name, decl);
        }
      }
    }
    ImmutableMap.Builder<Section, Map<String, Declaration>> builder = ImmutableMap.builder();
    for (Map.Entry<Section, Map<String, Declaration>> entry : sections.entrySet()) {
      builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return new DeclarationBlock(builder.build());
  }

  /**
   * Checks that no name is declared twice in {@code decls}, a single scope with no sections (the
   * members of a struct, for example).
   * @throws DuplicateDeclarationException naming the first repeated name.
   */
  public static void checkUnique (Iterable<Declaration> decls) {
    Map<String, Declaration> byUpper = new HashMap<>();
    for (Declaration decl : decls) {
      for (String name : decl.names) claim(byUpper, name, decl);
    }
  }

  /** Returns all sections which declare at least one block, in the order first declared. */
  public Map<Section, Map<String, Declaration>> sections () {
    return _sections;
  }

  /** Returns the declarations in {@code section}, which may be empty. */
  public Map<String, Declaration> section (Section section) {
    Map<String, Declaration> decls = _sections.get(section);
    return decls == null ? ImmutableMap.of() : decls;
  }

  /** Finds the declaration of {@code name} (case-insensitively) in any section. */
  public Optional<Declaration> find (String name) {
    for (Map<String, Declaration> decls : _sections.values()) {
      for (Map.Entry<String, Declaration> entry : decls.entrySet()) {
        if (entry.getKey().equalsIgnoreCase(name)) return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  public boolean isEmpty () {
    return _sections.isEmpty();
  }

  @Override public String toString () {
    return _sections.toString();
  }

  private static void claim (Map<String, Declaration> byUpper, String name, Declaration decl) {
    Declaration prev = byUpper.put(name.toUpperCase(Locale.ROOT), decl);
    if (prev != null) throw new DuplicateDeclarationException(name, prev.span(), decl.span());
  }

  private DeclarationBlock (ImmutableMap<Section, Map<String, Declaration>> sections) {
    _sections = sections;
  }

  private final ImmutableMap<Section, Map<String, Declaration>> _sections;
}
