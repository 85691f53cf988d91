package io.nestor.parser.api;

/**
 * A named open/close delimiter pair defining a structural region.
 *
 * <p>When {@code open} equals {@code close} the pair is symmetric (a quote-style delimiter): it
 * toggles instead of nesting inside itself. Token validity is checked when the pair is registered
 * in a {@link TokenRegistry}, not here.
 *
 * @param name identifier of the pair, used in diagnostics and {@link NodePredicates#byPairName}
 * @param open the opening token
 * @param close the closing token
 */
public record TokenPair(String name, String open, String close) {

  /**
   * Creates a pair named after its tokens.
   *
   * @param open the opening token
   * @param close the closing token
   * @return a pair named {@code open + close}
   */
  public static TokenPair of(String open, String close) {
    return new TokenPair(open + close, open, close);
  }

  /**
   * Whether the same token both opens and closes this pair.
   *
   * @return true for quote-style pairs
   */
  public boolean isSymmetric() {
    return open != null && open.equals(close);
  }

  @Override
  public String toString() {
    return name + "[" + open + " " + close + "]";
  }
}
