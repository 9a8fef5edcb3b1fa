//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The type of a declaration, return value, property or alias.
 */
public abstract class TypeSpec extends Node {

  /** Dispatches over the variants of {@link TypeSpec}. */
  public interface Visitor<R> {
    R visit (Named type);
    R visit (Str type);
    R visit (Array type);
    R visit (Pointer type);
    R visit (Reference type);
  }

  /** A named type, elementary or user defined, optionally restricted to a subrange:
    * {@code INT}, {@code ST_Config}, {@code INT(0..100)}. Type names are compared
    * case-insensitively; the spelling used in the source is kept for rendering. */
  public static final class Named extends TypeSpec {
    public final String name;
    /** The subrange restriction, or null. */
    public final Range range;

    public Named (String name, Range range) {
      this.name = name;
      this.range = range;
    }

    /** Returns the case-insensitive form of this type's name. */
    public String canonicalName () {
      return name.toUpperCase(Locale.ROOT);
    }

    @Override public String baseTypeName () { return name; }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(canonicalName(), range); }
  }

  /** {@code STRING} or {@code WSTRING}, with an optional length. */
  public static final class Str extends TypeSpec {
    public final boolean wide;
    /** The maximum length, or null. */
    public final Expr length;

    public Str (boolean wide, Expr length) {
      this.wide = wide;
      this.length = length;
    }

    public String keyword () {
      return wide ? "WSTRING" : "STRING";
    }

    @Override public String baseTypeName () { return keyword(); }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(wide, length); }
  }

  /** {@code ARRAY [ranges] OF element}. */
  public static final class Array extends TypeSpec {
    public final List<Range> ranges;
    public final TypeSpec element;

    public Array (List<Range> ranges, TypeSpec element) {
      this.ranges = ImmutableList.copyOf(ranges);
      this.element = element;
    }

    @Override public String baseTypeName () { return element.baseTypeName(); }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(ranges, element); }
  }

  /** {@code POINTER TO target}. */
  public static final class Pointer extends TypeSpec {
    public final TypeSpec target;

    public Pointer (TypeSpec target) {
      this.target = target;
    }

    @Override public String baseTypeName () { return target.baseTypeName(); }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target); }
  }

  /** {@code REFERENCE TO target}. */
  public static final class Reference extends TypeSpec {
    public final TypeSpec target;

    public Reference (TypeSpec target) {
      this.target = target;
    }

    @Override public String baseTypeName () { return target.baseTypeName(); }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(target); }
  }

  /** A bounds pair {@code lower..upper}, or the open bound {@code *} when both are null. */
  public static final class Range extends Node {
    public final Expr lower;
    public final Expr upper;

    public static Range open () {
      return new Range(null, null);
    }

    public Range (Expr lower, Expr upper) {
      this.lower = lower;
      this.upper = upper;
    }

    public boolean isOpen () {
      return lower == null;
    }

    @Override public <R> R accept (Node.Visitor<R> visitor) { return visitor.visit(this); }
    @Override protected List<?> fields () { return Arrays.asList(lower, upper); }
  }

  /** Returns the name of the type at the bottom of any array, pointer or reference layers. */
  public abstract String baseTypeName ();

  /** Dispatches this type to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  @Override public <R> R accept (Node.Visitor<R> visitor) {
    return visitor.visit(this);
  }

  private TypeSpec () {} // seal it!
}
