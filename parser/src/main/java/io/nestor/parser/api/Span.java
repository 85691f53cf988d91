package io.nestor.parser.api;

/**
 * Half-open range {@code [start, end)} of char offsets into the parsed input.
 *
 * @param start offset of the first char (inclusive)
 * @param end offset after the last char (exclusive)
 */
public record Span(int start, int end) {

  public Span {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  /**
   * Returns the number of chars covered.
   *
   * @return {@code end - start}
   */
  public int length() {
    return end - start;
  }

  /**
   * Checks whether the other span lies entirely within this one.
   *
   * @param other the span to check
   * @return true if {@code other} is contained in this span
   */
  public boolean contains(Span other) {
    return other.start >= start && other.end <= end;
  }

  /**
   * Cuts this span out of the given text.
   *
   * @param text the text this span refers to
   * @return the covered substring
   * @throws IllegalArgumentException if the text is shorter than {@code end}
   */
  public String substring(String text) {
    if (text.length() < end) {
      throw new IllegalArgumentException(
          "Span " + this + " exceeds text of length " + text.length());
    }
    return text.substring(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
