//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import plcodex.ast.Declaration;
import plcodex.ast.SourcePrinter;
import plcodex.ast.TypeDecl;
import plcodex.model.Source;

/**
 * Summarizes a user defined type.
 */
public final class DataTypeSummary extends Summary {

  /** The forms a user defined type can take. */
  public static enum Form { STRUCT, ENUM, ALIAS }

  public final Form form;

  /** The extended struct, the underlying type of an enum or the aliased type; null if none. */
  public final String base;

  /** The members of a struct, by name. Empty for other forms. */
  public final Map<String, DeclarationSummary> members;

  /** The values of an enum, by name, mapped to their rendered explicit value or null. Empty for
    * other forms. */
  public final Map<String, String> values;

  /** The text of the declaration, exactly as it appears in the unit. */
  public final String sourceCode;

  public DataTypeSummary (Source source, TypeDecl decl, String sourceCode) {
    super(decl.name, decl.name, source, decl);
    this.sourceCode = sourceCode;
    Map<String, DeclarationSummary> members = new LinkedHashMap<>();
    Map<String, String> values = new LinkedHashMap<>();
    if (decl instanceof TypeDecl.Struct) {
      TypeDecl.Struct struct = (TypeDecl.Struct)decl;
      this.form = Form.STRUCT;
      this.base = struct.base;
      for (Declaration member : struct.members) {
        for (String name : member.names) {
          members.put(name, new DeclarationSummary(source, decl.name, null, member, name));
        }
      }
    } else if (decl instanceof TypeDecl.Enum) {
      TypeDecl.Enum enm = (TypeDecl.Enum)decl;
      this.form = Form.ENUM;
      this.base = enm.base == null ? null : SourcePrinter.renderCode(enm.base);
      for (TypeDecl.Value value : enm.values) {
        values.put(value.name, value.value == null ? null : SourcePrinter.renderCode(value.value));
      }
    } else {
      this.form = Form.ALIAS;
      this.base = SourcePrinter.renderCode(((TypeDecl.Alias)decl).type);
    }
    this.members = Collections.unmodifiableMap(members);
    this.values = Collections.unmodifiableMap(values);
  }

  @Override public Optional<Summary> child (String name) {
    for (DeclarationSummary member : members.values()) {
      if (member.name.equalsIgnoreCase(name)) return Optional.of(member);
    }
    return Optional.empty();
  }

  @Override protected List<?> details () {
    return Arrays.asList(form, base, members, values, sourceCode);
  }
}
