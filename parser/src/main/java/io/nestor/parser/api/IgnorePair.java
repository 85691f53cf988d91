package io.nestor.parser.api;

/**
 * A start/end delimiter pair inside which no {@link TokenPair} token is recognized.
 *
 * <p>Only the {@code end} token is looked for once an ignore span starts, so ignore spans never
 * nest, and a symmetric pair ({@code start.equals(end)}) simply toggles.
 *
 * @param start the token starting an ignored span
 * @param end the token ending it
 */
public record IgnorePair(String start, String end) {

  /**
   * Whether the same token starts and ends the span.
   *
   * @return true for quote-style ignore pairs
   */
  public boolean isSymmetric() {
    return start != null && start.equals(end);
  }

  @Override
  public String toString() {
    return "ignore[" + start + " " + end + "]";
  }
}
