package io.nestor.parser.impl;

import io.nestor.parser.api.Node;
import io.nestor.parser.api.NodeKind;
import io.nestor.parser.api.Span;
import io.nestor.parser.api.TextRun;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Materializes the {@link Node} tree from the events of one scan.
 *
 * <p>The construction stack follows the scanner's nesting stack event for event: a region is
 * turned into an immutable node as soon as its exit event arrives, so the finished tree is
 * assembled bottom-up without recursion. Ignored spans, delimiters included, become plain literal
 * content of the node they occur in.
 *
 * <p>A builder serves a single scan of the text it was created with.
 */
public final class TreeBuilder implements ScanEventSink {
  private final String text;
  private final Deque<PendingNode> stack = new ArrayDeque<>();
  private int ignoreStart = -1;
  private Node root;

  public TreeBuilder(String text) {
    this.text = Objects.requireNonNull(text, "text must not be null");
    stack.push(new PendingNode(NodeKind.root(), 0));
  }

  @Override
  public void accept(ScanEvent event) {
    if (root != null) {
      throw new IllegalStateException("Tree already completed, unexpected " + event);
    }
    if (event instanceof ScanEvent.Literal literal) {
      top().addRun(literal.offset(), text.substring(literal.offset(), literal.end()));
    } else if (event instanceof ScanEvent.EnterRegion enter) {
      stack.push(new PendingNode(NodeKind.region(enter.pair()), enter.offset()));
    } else if (event instanceof ScanEvent.ExitRegion exit) {
      PendingNode done = stack.pop();
      if (stack.isEmpty() || done.kind.isRoot()) {
        throw new IllegalStateException("Exit without matching enter: " + event);
      }
      if (!done.kind.equals(NodeKind.region(exit.pair()))) {
        throw new IllegalStateException("Exit of " + exit.pair() + " while " + done.kind + " open");
      }
      top().addChild(done.complete(exit.end()));
    } else if (event instanceof ScanEvent.EnterIgnore enter) {
      ignoreStart = enter.offset();
    } else if (event instanceof ScanEvent.ExitIgnore exit) {
      if (ignoreStart < 0) {
        throw new IllegalStateException("Ignore exit without matching enter: " + event);
      }
      top().addRun(ignoreStart, text.substring(ignoreStart, exit.end()));
      ignoreStart = -1;
    } else if (event instanceof ScanEvent.End end) {
      if (stack.size() != 1 || ignoreStart >= 0) {
        throw new IllegalStateException("End reached with " + (stack.size() - 1) + " open regions");
      }
      root = stack.pop().complete(end.offset());
    }
  }

  /**
   * Returns the completed tree.
   *
   * @return the root node
   * @throws IllegalStateException if the scan has not ended successfully
   */
  public Node root() {
    if (root == null) {
      throw new IllegalStateException("Scan has not completed");
    }
    return root;
  }

  private PendingNode top() {
    return stack.peek();
  }

  private static final class PendingNode {
    final NodeKind kind;
    final int start;
    final List<TextRun> runs = new ArrayList<>();
    final List<Node> children = new ArrayList<>();
    private final StringBuilder pending = new StringBuilder();
    private int pendingStart = -1;

    PendingNode(NodeKind kind, int start) {
      this.kind = kind;
      this.start = start;
    }

    /** Appends literal text, merging it with the previous run when contiguous. */
    void addRun(int offset, String value) {
      if (value.isEmpty()) {
        return;
      }
      if (pendingStart >= 0 && pendingStart + pending.length() != offset) {
        flushRun();
      }
      if (pendingStart < 0) {
        pendingStart = offset;
      }
      pending.append(value);
    }

    void addChild(Node child) {
      flushRun();
      children.add(child);
    }

    private void flushRun() {
      if (pendingStart >= 0) {
        runs.add(new TextRun(pendingStart, pending.toString()));
        pending.setLength(0);
        pendingStart = -1;
      }
    }

    Node complete(int end) {
      flushRun();
      return Node.create(kind, new Span(start, end), runs, children);
    }
  }
}
