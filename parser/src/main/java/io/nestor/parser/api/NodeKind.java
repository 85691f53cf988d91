package io.nestor.parser.api;

import java.util.Objects;

/** What delimits a {@link Node}: the whole input, or one matched {@link TokenPair}. */
public sealed interface NodeKind permits NodeKind.Root, NodeKind.Region {

  /**
   * Returns the root kind.
   *
   * @return the shared root kind
   */
  static NodeKind root() {
    return Root.INSTANCE;
  }

  /**
   * Returns the kind of a region delimited by the given pair.
   *
   * @param pair the delimiting pair
   * @return a region kind
   */
  static NodeKind region(TokenPair pair) {
    return new Region(pair);
  }

  /**
   * Whether this is the root kind.
   *
   * @return true for {@link Root}
   */
  default boolean isRoot() {
    return this instanceof Root;
  }

  /** The node spanning the entire input. */
  record Root() implements NodeKind {
    static final Root INSTANCE = new Root();

    @Override
    public String toString() {
      return "Root";
    }
  }

  /**
   * A node delimited by a matched open and close token.
   *
   * @param pair the pair whose tokens delimit the node
   */
  record Region(TokenPair pair) implements NodeKind {
    public Region {
      Objects.requireNonNull(pair, "pair must not be null");
    }

    @Override
    public String toString() {
      return "Region(" + pair.name() + ")";
    }
  }
}
