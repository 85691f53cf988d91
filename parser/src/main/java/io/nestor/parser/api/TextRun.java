package io.nestor.parser.api;

/**
 * A contiguous piece of literal text owned by a single node.
 *
 * @param offset char offset of the run in the parsed input
 * @param text the literal text
 */
public record TextRun(int offset, String text) {

  /**
   * Returns the offset just past this run.
   *
   * @return {@code offset + text.length()}
   */
  public int end() {
    return offset + text.length();
  }

  /**
   * Returns the range of input covered by this run.
   *
   * @return the span of this run
   */
  public Span span() {
    return new Span(offset, end());
  }
}
