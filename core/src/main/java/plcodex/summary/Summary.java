//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.summary;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import plcodex.ast.Node;
import plcodex.model.Comment;
import plcodex.model.Source;
import plcodex.model.Span;

/**
 * The parts common to every summary record: where it was declared and the comments attached to
 * its declaration. Summaries are values: two are equal if all of their fields are equal.
 */
public abstract class Summary {

  /** The declared name, as spelled in the source. */
  public final String name;

  /** The name qualified by the name of its owner ({@code FB_Motor.Start}), or just the name. */
  public final String qualifiedName;

  /** The unit in which this was declared. */
  public final Source source;

  /** The span of the declaration in the unit's processed text. */
  public final Span span;

  /** The comments attached to the declaration, pragmas excluded. */
  public final List<Comment> comments;

  /** The pragmas attached to the declaration. */
  public final List<Comment> pragmas;

  /** Returns the value of the attribute pragma {@code {attribute 'name' := 'value'}} attached to
    * this declaration, or "" for an attribute with no value. */
  public Optional<String> attribute (String name) {
    for (Comment pragma : pragmas) {
      if (pragma.attributeName().map(name::equalsIgnoreCase).orElse(false)) {
        return Optional.of(pragma.attributeValue().orElse(""));
      }
    }
    return Optional.empty();
  }

  /** Returns the member of this record named {@code name} (case-insensitively), if any. */
  public Optional<Summary> child (String name) {
    return Optional.empty();
  }

  @Override public boolean equals (Object other) {
    return (other != null && other.getClass() == getClass() &&
            fields().equals(((Summary)other).fields()));
  }

  @Override public int hashCode () {
    return fields().hashCode();
  }

  @Override public String toString () {
    return getClass().getSimpleName() + "(" + qualifiedName + " @ " + source + span + ")";
  }

  protected Summary (String name, String qualifiedName, Source source, Node decl) {
    this.name = name;
    this.qualifiedName = qualifiedName;
    this.source = source;
    this.span = decl.span();
    ImmutableList.Builder<Comment> comments = ImmutableList.builder();
    for (Comment c : decl.comments()) if (c.kind == Comment.Kind.COMMENT) comments.add(c);
    this.comments = comments.build();
    this.pragmas = decl.pragmas();
  }

  /** Returns the fields which define equality, in addition to those of this base class. */
  protected abstract List<?> details ();

  protected static String qualify (String owner, String name) {
    return owner == null ? name : owner + "." + name;
  }

  private List<?> fields () {
    return Arrays.asList(name, qualifiedName, source, span, comments, pragmas, details());
  }
}
