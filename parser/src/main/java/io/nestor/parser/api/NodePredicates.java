package io.nestor.parser.api;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Ready-made filters for {@link Node#find(Predicate)}. */
public final class NodePredicates {

  private NodePredicates() {}

  /** Matches every node except the root. */
  public static Predicate<Node> isRegion() {
    return node -> !node.isRoot();
  }

  /** Matches regions delimited by exactly this pair. */
  public static Predicate<Node> byPair(TokenPair pair) {
    Objects.requireNonNull(pair, "pair must not be null");
    return node -> node.pair().map(pair::equals).orElse(false);
  }

  /** Matches regions whose pair has the given name. */
  public static Predicate<Node> byPairName(String name) {
    Objects.requireNonNull(name, "name must not be null");
    return node -> node.pair().map(p -> name.equals(p.name())).orElse(false);
  }

  /** Matches nodes whose own content contains the text. */
  public static Predicate<Node> contentContains(String text) {
    Objects.requireNonNull(text, "text must not be null");
    return node -> node.content().contains(text);
  }

  /** Matches nodes whose own content contains a match of the pattern. */
  public static Predicate<Node> contentMatches(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern must not be null");
    return node -> pattern.matcher(node.content()).find();
  }

  /** Matches nodes at exactly the given depth below their tree's root. */
  public static Predicate<Node> atDepth(int depth) {
    return node -> node.depth() == depth;
  }
}
