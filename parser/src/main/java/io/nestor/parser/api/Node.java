package io.nestor.parser.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One node of a parse tree: either the root, spanning the whole input, or a region delimited by a
 * matched {@link TokenPair}.
 *
 * <p>A node owns the literal text between its delimiters that belongs to none of its children
 * ({@link #contentRuns()}), and its children in document order. Children spans are disjoint,
 * ordered and lie inside the parent's delimiters. The parent reference is for navigation only.
 *
 * <p>Nodes are not modified after {@link NestedParser#parse} has returned them. The parent
 * back-reference is assigned when the enclosing node is created and is not a final field, so a
 * tree handed to another thread must be published safely (a volatile field, a concurrent
 * collection, a thread start or an executor submission) for {@link #parent()} and {@link #depth()}
 * to be reliable there. Traversals are iterative, so arbitrarily deep trees can be walked without exhausting the call
 * stack.
 */
public final class Node {
  private final NodeKind kind;
  private final Span span;
  private final List<TextRun> runs;
  private final List<Node> children;
  private Node parent;

  private Node(NodeKind kind, Span span, List<TextRun> runs, List<Node> children) {
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    this.span = Objects.requireNonNull(span, "span must not be null");
    this.runs = List.copyOf(runs);
    this.children = List.copyOf(children);
  }

  /**
   * Creates a node and adopts the given children.
   *
   * @param kind root or region kind
   * @param span the span covering the delimiters and all descendant text
   * @param runs the node's own literal runs, in document order
   * @param children completed child nodes, in document order, not yet adopted by another node
   * @return the new node
   */
  @Internal("Nodes are created by the tree builder; obtain trees through NestedParser.parse")
  public static Node create(NodeKind kind, Span span, List<TextRun> runs, List<Node> children) {
    Node node = new Node(kind, span, runs, children);
    for (Node child : node.children) {
      if (child.parent != null) {
        throw new IllegalStateException("Node " + child + " already has a parent");
      }
      if (!span.contains(child.span)) {
        throw new IllegalArgumentException("Child " + child + " escapes parent span " + span);
      }
      child.parent = node;
    }
    return node;
  }

  public NodeKind kind() {
    return kind;
  }

  public boolean isRoot() {
    return kind.isRoot();
  }

  /**
   * Returns the pair delimiting this node.
   *
   * @return the pair, or empty for the root
   */
  public Optional<TokenPair> pair() {
    return kind instanceof NodeKind.Region region ? Optional.of(region.pair()) : Optional.empty();
  }

  /**
   * Returns the range of input covered by this node, delimiters included.
   *
   * @return the span
   */
  public Span span() {
    return span;
  }

  /**
   * Returns the range between this node's delimiters. For the root this is the whole span.
   *
   * @return the inner span
   */
  public Span innerSpan() {
    if (kind instanceof NodeKind.Region region) {
      TokenPair pair = region.pair();
      return new Span(span.start() + pair.open().length(), span.end() - pair.close().length());
    }
    return span;
  }

  /**
   * Returns the node's own literal text: everything between its delimiters that belongs to no
   * child, concatenated in document order.
   *
   * @return the content, possibly empty
   */
  public String content() {
    if (runs.size() == 1) {
      return runs.get(0).text();
    }
    StringBuilder sb = new StringBuilder();
    for (TextRun run : runs) {
      sb.append(run.text());
    }
    return sb.toString();
  }

  /**
   * Returns the literal runs making up {@link #content()}, with their input offsets.
   *
   * @return unmodifiable list of runs in document order
   */
  public List<TextRun> contentRuns() {
    return runs;
  }

  /**
   * Returns the direct children.
   *
   * @return unmodifiable list in document order
   */
  public List<Node> children() {
    return children;
  }

  public Node child(int index) {
    return children.get(index);
  }

  public int childCount() {
    return children.size();
  }

  /**
   * Returns the enclosing node.
   *
   * @return the parent, or empty for the root
   */
  public Optional<Node> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Returns the number of ancestors.
   *
   * @return 0 for the root
   */
  public int depth() {
    int depth = 0;
    for (Node p = parent; p != null; p = p.parent) {
      depth++;
    }
    return depth;
  }

  /**
   * Returns this node and all its descendants in pre-order.
   *
   * <p>Each call to {@link Iterable#iterator()} starts a fresh lazy traversal.
   *
   * @return a restartable pre-order view of the subtree
   */
  public Iterable<Node> descendants() {
    return () -> new PreOrderIterator(this, node -> true);
  }

  /**
   * Returns the subtree in pre-order as a sequential stream.
   *
   * @return a stream starting with this node
   */
  public Stream<Node> stream() {
    return StreamSupport.stream(descendants().spliterator(), false);
  }

  /**
   * Lazily finds nodes in this subtree, this node included, that satisfy the predicate.
   *
   * @param predicate the filter, see {@link NodePredicates}
   * @return iterator over matching nodes in pre-order
   */
  public Iterator<Node> find(Predicate<? super Node> predicate) {
    Objects.requireNonNull(predicate, "predicate must not be null");
    return new PreOrderIterator(this, predicate);
  }

  /**
   * Returns the exact input text covered by this node, delimiters included.
   *
   * @param originalInput the input this tree was parsed from
   * @return the covered substring
   */
  public String text(String originalInput) {
    Objects.requireNonNull(originalInput, "originalInput must not be null");
    return span.substring(originalInput);
  }

  /**
   * Returns the input text between this node's delimiters.
   *
   * @param originalInput the input this tree was parsed from
   * @return the inner substring
   */
  public String innerText(String originalInput) {
    Objects.requireNonNull(originalInput, "originalInput must not be null");
    return innerSpan().substring(originalInput);
  }

  /**
   * Rebuilds the text covered by this node from the tree alone: delimiters, literal runs and
   * descendants, in offset order. Equals {@link #text(String)} for the parsed input.
   *
   * @return the reconstructed text
   */
  public String reconstruct() {
    List<TextRun> pieces = new ArrayList<>();
    for (Node node : descendants()) {
      if (node.kind instanceof NodeKind.Region region) {
        TokenPair pair = region.pair();
        pieces.add(new TextRun(node.span.start(), pair.open()));
        pieces.add(new TextRun(node.span.end() - pair.close().length(), pair.close()));
      }
      pieces.addAll(node.runs);
    }
    pieces.sort(Comparator.comparingInt(TextRun::offset));
    StringBuilder sb = new StringBuilder(span.length());
    for (TextRun piece : pieces) {
      sb.append(piece.text());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return kind + span.toString() + " children=" + children.size();
  }

  private static final class PreOrderIterator implements Iterator<Node> {
    private final Deque<Node> pending = new ArrayDeque<>();
    private final Predicate<? super Node> predicate;
    private Node next;

    PreOrderIterator(Node start, Predicate<? super Node> predicate) {
      this.predicate = predicate;
      pending.push(start);
      advance();
    }

    private void advance() {
      next = null;
      while (!pending.isEmpty()) {
        Node candidate = pending.pop();
        List<Node> kids = candidate.children;
        for (int i = kids.size() - 1; i >= 0; i--) {
          pending.push(kids.get(i));
        }
        if (predicate.test(candidate)) {
          next = candidate;
          return;
        }
      }
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public Node next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      Node result = next;
      advance();
      return result;
    }
  }
}
