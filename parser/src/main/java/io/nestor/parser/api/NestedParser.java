package io.nestor.parser.api;

import io.nestor.parser.impl.Scanner;
import io.nestor.parser.impl.TreeBuilder;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for parsing nested regions out of text.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * TokenRegistry registry = TokenRegistry.builder()
 *     .pair("paren", "(", ")")
 *     .ignore("\"", "\"")
 *     .build();
 *
 * String input = "f(a, g(\"x)\"), b)";
 * Node root = NestedParser.parse(input, registry);
 * for (Node node : root.descendants()) {
 *   System.out.println(node.depth() + " " + node.text(input));
 * }
 * }</pre>
 *
 * <p>Parsing is a single synchronous pass. A structural violation ends the parse with a {@link
 * NestorParseException}; no partial tree is produced.
 */
public final class NestedParser {
  private static final Logger log = LoggerFactory.getLogger(NestedParser.class);

  private NestedParser() {}

  /**
   * Parses the text with default options.
   *
   * @param text the input
   * @param registry the tokens to recognize
   * @return the root node, spanning the whole input
   * @throws NestorParseException if a close token is unmatched or the input ends inside a region
   *     or ignore span
   * @throws NullPointerException if text or registry is null
   */
  public static Node parse(String text, TokenRegistry registry) throws NestorParseException {
    return parse(text, registry, ParserOptions.DEFAULT);
  }

  /**
   * Parses the text with custom options.
   *
   * @param text the input
   * @param registry the tokens to recognize
   * @param options parser options
   * @return the root node, spanning the whole input
   * @throws NestorParseException if the input is structurally invalid or nests deeper than {@link
   *     ParserOptions#maxDepth()}
   * @throws NullPointerException if any argument is null
   */
  public static Node parse(String text, TokenRegistry registry, ParserOptions options)
      throws NestorParseException {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(registry, "registry must not be null");
    Objects.requireNonNull(options, "options must not be null");

    TreeBuilder builder = new TreeBuilder(text);
    new Scanner(registry, options).scan(text, builder);
    Node root = builder.root();
    log.debug("Parsed {} chars into {} top-level regions", text.length(), root.childCount());
    return root;
  }
}
