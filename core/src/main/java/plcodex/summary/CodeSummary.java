//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plcodex.ast.*;
import plcodex.model.Kind;
import plcodex.parse.SourceUnit;

/**
 * A name addressable index of the units declared in a set of parsed sources. Records are kept in
 * the order in which they appear in the sources, and lookups return the first match, so when two
 * sources declare the same name the earlier one takes precedence.
 *
 * <p>Names are matched case-insensitively, against a record's name or its qualified name. A
 * dotted name ({@code FB_Motor.Start}) which matches no record directly is resolved by looking up
 * its first component and then the remainder among that record's members.</p>
 */
public final class CodeSummary {

  /**
   * Summarizes {@code units}, in order. Methods, properties and actions are attached to the
   * nearest preceding function block or program in the same unit; those with no such owner are
   * logged and dropped. Units not parsed as whole source files are skipped.
   */
  public static CodeSummary of (Iterable<SourceUnit> units) {
    List<Supplier<Summary>> entries = new ArrayList<>();
    for (SourceUnit unit : units) {
      if (!(unit.root instanceof SourceCode)) {
        log.debug("Not summarizing {}: root is {}", unit.source,
                  unit.root.getClass().getSimpleName());
        continue;
      }
      UnitSummarizer sum = new UnitSummarizer(unit, entries);
      for (Item item : unit.sourceCode().items) item.accept(sum);
    }

    ImmutableList.Builder<Summary> all = ImmutableList.builder();
    for (Supplier<Summary> entry : entries) all.add(entry.get());
    return new CodeSummary(all.build());
  }

  /** Every function block, program and function, in source order. */
  public final List<FunctionBlockSummary> functionBlocks;

  /** Every user defined type, in source order. */
  public final List<DataTypeSummary> dataTypes;

  /** Every global variable, in source order. */
  public final List<DeclarationSummary> globals;

  /** Returns every record, in source order. */
  public List<Summary> all () {
    return _all;
  }

  /**
   * Returns the record named {@code name}. A function block, program or function wins over other
   * records of the same name, otherwise the first match in source order wins. Use
   * {@link #functionBlock} for a lookup that only considers program units.
   * @throws NoSuchElementException if no record matches.
   */
  public Summary find (String name) {
    return lookup(name).orElseThrow(() -> new NoSuchElementException("No summary for '" + name + "'"));
  }

  /** Returns the record named {@code name}, if any, chosen as {@link #find} does. */
  public Optional<Summary> lookup (String name) {
    List<Summary> matches = findAll(name);
    for (Summary match : matches) {
      if (match instanceof FunctionBlockSummary) return Optional.of(match);
    }
    return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
  }

  /** Returns every record named {@code name}, in source order. */
  public List<Summary> findAll (String name) {
    List<Summary> matches = new ArrayList<>();
    for (Summary summary : _all) {
      if (summary.name.equalsIgnoreCase(name) || summary.qualifiedName.equalsIgnoreCase(name)) {
        matches.add(summary);
      }
    }
    int dot = name.indexOf('.');
    if (matches.isEmpty() && dot > 0) {
      String head = name.substring(0, dot), rest = name.substring(dot+1);
      for (Summary owner : findAll(head)) {
        Optional<Summary> child = resolve(owner, rest);
        if (child.isPresent()) matches.add(child.get());
      }
    }
    return matches;
  }

  /**
   * Returns the first function block, program or function named {@code name}.
   * @throws NoSuchElementException if there is no such unit.
   */
  public FunctionBlockSummary functionBlock (String name) {
    for (FunctionBlockSummary fb : functionBlocks) if (fb.name.equalsIgnoreCase(name)) return fb;
    throw new NoSuchElementException("No function block '" + name + "'");
  }

  /**
   * Returns the first user defined type named {@code name}.
   * @throws NoSuchElementException if there is no such type.
   */
  public DataTypeSummary dataType (String name) {
    for (DataTypeSummary type : dataTypes) if (type.name.equalsIgnoreCase(name)) return type;
    throw new NoSuchElementException("No data type '" + name + "'");
  }

  @Override public boolean equals (Object other) {
    return (other instanceof CodeSummary) && _all.equals(((CodeSummary)other)._all);
  }

  @Override public int hashCode () {
    return _all.hashCode();
  }

  @Override public String toString () {
    return "CodeSummary(fbs=" + functionBlocks.size() + ", types=" + dataTypes.size() +
      ", globals=" + globals.size() + ")";
  }

  private CodeSummary (List<Summary> all) {
    _all = all;
    List<FunctionBlockSummary> fbs = new ArrayList<>();
    List<DataTypeSummary> types = new ArrayList<>();
    List<DeclarationSummary> globals = new ArrayList<>();
    for (Summary summary : all) {
      if (summary instanceof FunctionBlockSummary) fbs.add((FunctionBlockSummary)summary);
      else if (summary instanceof DataTypeSummary) types.add((DataTypeSummary)summary);
      else if (summary instanceof DeclarationSummary) globals.add((DeclarationSummary)summary);
    }
    this.functionBlocks = Collections.unmodifiableList(fbs);
    this.dataTypes = Collections.unmodifiableList(types);
    this.globals = Collections.unmodifiableList(globals);
  }

  private static Optional<Summary> resolve (Summary owner, String path) {
    Summary current = owner;
    for (String part : path.split("\\.")) {
      Optional<Summary> child = current.child(part);
      if (!child.isPresent()) return Optional.empty();
      current = child.get();
    }
    return Optional.of(current);
  }

  /** Summarizes the items of one unit, tracking the owner of methods, properties and actions. */
  private static class UnitSummarizer implements Item.Visitor<Void> {

    public UnitSummarizer (SourceUnit unit, List<Supplier<Summary>> entries) {
      _unit = unit;
      _entries = entries;
    }

    @Override public Void visit (FunctionBlock item) {
      _owner = new OwnerBuilder(_unit, Kind.FUNCTION_BLOCK, item.name, item, item.base,
                                item.interfaces, null);
      _entries.add(Suppliers.memoize(_owner::build));
      return null;
    }

    @Override public Void visit (Program item) {
      _owner = new OwnerBuilder(_unit, Kind.PROGRAM, item.name, item, null,
                                ImmutableList.of(), null);
      _entries.add(Suppliers.memoize(_owner::build));
      return null;
    }

    @Override public Void visit (Function item) {
      String rtype = item.returnType == null ? null : SourcePrinter.renderCode(item.returnType);
      OwnerBuilder fn = new OwnerBuilder(_unit, Kind.FUNCTION, item.name, item, null,
                                         ImmutableList.of(), rtype);
      _entries.add(Suppliers.memoize(fn::build));
      return null;
    }

    @Override public Void visit (Method item) {
      if (owner(item, item.name)) _owner.methods.add(
        new MethodSummary(_unit.source, _owner.name, item, _unit.sourceText(item)));
      return null;
    }

    @Override public Void visit (Property item) {
      if (owner(item, item.name)) _owner.properties.add(
        new PropertySummary(_unit.source, _owner.name, item, _unit.sourceText(item)));
      return null;
    }

    @Override public Void visit (Action item) {
      if (owner(item, item.name)) _owner.actions.add(
        new ActionSummary(_unit.source, _owner.name, item, _unit.sourceText(item)));
      return null;
    }

    @Override public Void visit (DataTypes item) {
      for (TypeDecl decl : item.types) {
        DataTypeSummary type = new DataTypeSummary(_unit.source, decl, _unit.sourceText(decl));
        _entries.add(Suppliers.<Summary>ofInstance(type));
      }
      return null;
    }

    @Override public Void visit (GlobalVariables item) {
      String owner = unitName();
      for (Declaration decl : item.block.declarations) {
        for (String name : decl.names) {
          DeclarationSummary global = new DeclarationSummary(
            _unit.source, owner, item.block.section, decl, name);
          _entries.add(Suppliers.<Summary>ofInstance(global));
        }
      }
      return null;
    }

    private boolean owner (Item item, String name) {
      if (_owner != null) return true;
      log.warn("Dropping {} {} in {}: no preceding function block or program",
               item.kind(), name, _unit.source);
      return false;
    }

    /** Global variables are qualified by the name of their unit, minus its extension. */
    private String unitName () {
      String name = _unit.source.fileName();
      int didx = name.lastIndexOf('.');
      return didx > 0 ? name.substring(0, didx) : name;
    }

    private final SourceUnit _unit;
    private final List<Supplier<Summary>> _entries;
    private OwnerBuilder _owner;
  }

  /** Accumulates the members of a function block or program until the summary is built. */
  private static class OwnerBuilder {
    public final String name;
    public final List<MethodSummary> methods = new ArrayList<>();
    public final List<PropertySummary> properties = new ArrayList<>();
    public final List<ActionSummary> actions = new ArrayList<>();

    public OwnerBuilder (SourceUnit unit, Kind kind, String name, Item item, String base,
                         List<String> interfaces, String returnType) {
      this.name = name;
      _unit = unit;
      _kind = kind;
      _item = item;
      _base = base;
      _interfaces = interfaces;
      _returnType = returnType;
    }

    public Summary build () {
      return new FunctionBlockSummary(
        _kind, name, _unit.source, _item, _base, _interfaces, _returnType,
        Declarations.of(_unit.source, name, (Scoped)_item), methods, properties, actions,
        _unit.sourceText(_item));
    }

    private final SourceUnit _unit;
    private final Kind _kind;
    private final Item _item;
    private final String _base;
    private final List<String> _interfaces;
    private final String _returnType;
  }

  private final List<Summary> _all;

  private static final Logger log = LoggerFactory.getLogger(CodeSummary.class);
}
