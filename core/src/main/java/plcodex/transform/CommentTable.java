//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.transform;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import plcodex.ast.Node;
import plcodex.model.Comment;

/**
 * Tracks the comments of a text which have not yet been attached to a node. Claiming a comment
 * removes it from the table, so each comment is attached at most once.
 */
class CommentTable {

  public CommentTable (List<Comment> comments) {
    for (Comment comment : comments) _unclaimed.put(comment.span.start, comment);
  }

  /** Attaches to {@code node} every unclaimed comment which starts in {@code [start, end)}.
    * Comments never overlap tokens, so a comment starting between two tokens also ends there.
    * A trailing claim stops at the first pragma: a pragma annotates what follows it. */
  public void claim (Node node, int start, int end, boolean trailing) {
    if (start >= end) return;
    Iterator<Map.Entry<Integer, Comment>> iter = _unclaimed.subMap(start, end).entrySet().iterator();
    while (iter.hasNext()) {
      Comment comment = iter.next().getValue();
      if (trailing && comment.kind == Comment.Kind.PRAGMA) break;
      node.claim(comment, trailing);
      iter.remove();
    }
  }

  /** Attaches every remaining comment to {@code node}. */
  public void claimRest (Node node) {
    for (Comment comment : _unclaimed.values()) node.claim(comment, false);
    _unclaimed.clear();
  }

  /** Returns the comments not yet claimed, in source order. */
  public List<Comment> unclaimed () {
    return ImmutableList.copyOf(_unclaimed.values());
  }

  private final TreeMap<Integer, Comment> _unclaimed = new TreeMap<>();
}
