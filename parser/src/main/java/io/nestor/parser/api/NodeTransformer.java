package io.nestor.parser.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Rewrites a parse tree from the innermost regions outwards.
 *
 * <p>Every node's inner text is rebuilt from its literal runs with each child replaced by that
 * child's already transformed value, and then passed to the function. The function's result for
 * the root is the overall result. For {@code f(g(x))} with parentheses as the only pair and an
 * upper-casing function the result is {@code FGX}.
 *
 * <p>Child delimiters are dropped before a parent's text reaches the function: for {@code a(b)c}
 * the root receives {@code abc}, never {@code a(b)c}. Delimiter characters produced by the
 * function itself are kept.
 *
 * <p>The function is called once per node in post-order: the children of a node left to right,
 * each with its own subtree first, then the node. Stateful functions such as counters observe that
 * order.
 *
 * <p>Ignored spans are part of the literal runs and reach the function verbatim, delimiters
 * included.
 */
public final class NodeTransformer {

  private NodeTransformer() {}

  /**
   * Applies the function to every node, children before parents.
   *
   * @param root the subtree to transform, usually a parse root
   * @param function applied once per node to its rebuilt inner text
   * @return the transformed text of {@code root}
   */
  public static String applyOutward(Node root, UnaryOperator<String> function) {
    Objects.requireNonNull(root, "root must not be null");
    Objects.requireNonNull(function, "function must not be null");

    Map<Node, String> results = new IdentityHashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.nextChild < frame.node.childCount()) {
        stack.push(new Frame(frame.node.child(frame.nextChild++)));
        continue;
      }
      stack.pop();
      results.put(frame.node, transform(frame.node, results, function));
    }
    return results.get(root);
  }

  private static String transform(
      Node node, Map<Node, String> results, UnaryOperator<String> function) {
    List<TextRun> pieces = new ArrayList<>(node.contentRuns());
    for (Node child : node.children()) {
      pieces.add(new TextRun(child.span().start(), results.remove(child)));
    }
    pieces.sort(Comparator.comparingInt(TextRun::offset));
    StringBuilder inner = new StringBuilder();
    for (TextRun piece : pieces) {
      inner.append(piece.text());
    }
    String result = function.apply(inner.toString());
    return Objects.requireNonNull(result, "function must not return null");
  }

  private static final class Frame {
    final Node node;
    int nextChild;

    Frame(Node node) {
      this.node = node;
    }
  }
}
