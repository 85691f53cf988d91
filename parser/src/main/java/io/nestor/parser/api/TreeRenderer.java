package io.nestor.parser.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Renders a parse tree as a two column table of region text and depth, one row per node, each
 * row's key indented by two spaces per level.
 *
 * <pre>
 * KEY                                      DEPTH
 * --------------------------------------------------
 *   a(b(c))d                               1
 *     b(c)                                 2
 *       c                                  3
 * </pre>
 *
 * <p>Keys are the node's inner text, so region delimiters are not shown. The root is depth 1.
 */
public final class TreeRenderer {
  private static final String NEWLINE = System.lineSeparator();

  private final int width;

  public TreeRenderer() {
    this(ParserOptions.DEFAULT);
  }

  public TreeRenderer(ParserOptions options) {
    this.width = Objects.requireNonNull(options, "options must not be null").renderWidth();
  }

  /**
   * Renders the tree to a string.
   *
   * @param root the subtree to render
   * @param input the text the tree was parsed from
   * @return the rendered table
   */
  public String render(Node root, String input) {
    StringBuilder sb = new StringBuilder();
    render(root, input, sb);
    return sb.toString();
  }

  /**
   * Renders the tree into the given output.
   *
   * @param root the subtree to render
   * @param input the text the tree was parsed from
   * @param out destination of the table
   * @throws UncheckedIOException if writing to {@code out} fails
   */
  public void render(Node root, String input, Appendable out) {
    Objects.requireNonNull(root, "root must not be null");
    Objects.requireNonNull(input, "input must not be null");
    Objects.requireNonNull(out, "out must not be null");
    try {
      out.append(row("KEY", "DEPTH")).append(NEWLINE);
      out.append("-".repeat(width + 10)).append(NEWLINE);
      int baseDepth = root.depth();
      for (Node node : root.descendants()) {
        int level = node.depth() - baseDepth + 1;
        String key = "  ".repeat(level) + node.innerText(input);
        out.append(row(key, Integer.toString(level))).append(NEWLINE);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render parse tree", e);
    }
  }

  private String row(String key, String depth) {
    return String.format("%-" + width + "s %-15s", key, depth).stripTrailing();
  }
}
