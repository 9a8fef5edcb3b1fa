//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import plcodex.parse.DuplicateDeclarationException;

/**
 * A user defined type, declared inside {@code TYPE ... END_TYPE}.
 */
public abstract class TypeDecl extends Node {

  /** Dispatches over the variants of {@link TypeDecl}. */
  public interface Visitor<R> {
    R visit (Struct decl);
    R visit (Enum decl);
    R visit (Alias decl);
  }

  /** {@code name [EXTENDS base] : STRUCT members END_STRUCT}. */
  public static final class Struct extends TypeDecl {
    /** The extended struct, or null. */
    public final String base;
    public final List<Declaration> members;

    /** @throws DuplicateDeclarationException if two members share a name. */
    public Struct (String name, String base, List<Declaration> members) {
      super(name);
      this.base = base;
      DeclarationBlock.checkUnique(members);
      this.members = ImmutableList.copyOf(members);
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name, base, members); }
  }

  /** {@code name : (A, B := 5) [base]}. */
  public static final class Enum extends TypeDecl {
    public final List<Value> values;
    /** The underlying integer type, or null. */
    public final TypeSpec base;

    public Enum (String name, List<Value> values, TypeSpec base) {
      super(name);
      this.values = ImmutableList.copyOf(values);
      this.base = base;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name, values, base); }
  }

  /** A member of an {@link Enum}, with an optional explicit value. */
  public static final class Value extends Node {
    public final String name;
    public final Expr value;

    public Value (String name, Expr value) {
      this.name = name;
      this.value = value;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name, value); }
  }

  /** {@code name : type [:= init];}. */
  public static final class Alias extends TypeDecl {
    public final TypeSpec type;
    /** The initial value, or null. */
    public final Initializer init;

    public Alias (String name, TypeSpec type, Initializer init) {
      super(name);
      this.type = type;
      this.init = init;
    }

    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(name, type, init); }
  }

  /** The name of the declared type. */
  public final String name;

  /** Dispatches this declaration to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  private TypeDecl (String name) { // seal it!
    this.name = name;
  }
}
