package io.nestor.parser.impl;

import io.nestor.parser.api.IgnorePair;
import io.nestor.parser.api.TokenPair;

/**
 * Structural events produced by {@link Scanner}, in input order.
 *
 * <p>All offsets are char offsets into the scanned text. Every successful scan ends with exactly
 * one {@link End}; a failed scan emits no {@code End}.
 */
public sealed interface ScanEvent
    permits ScanEvent.EnterRegion,
        ScanEvent.ExitRegion,
        ScanEvent.EnterIgnore,
        ScanEvent.ExitIgnore,
        ScanEvent.Literal,
        ScanEvent.End {

  /**
   * Returns the offset at which the event begins.
   *
   * @return a char offset
   */
  int offset();

  /**
   * An open token was matched.
   *
   * @param pair the opened pair
   * @param offset offset of the open token
   */
  record EnterRegion(TokenPair pair, int offset) implements ScanEvent {}

  /**
   * A close token ended the innermost region.
   *
   * @param pair the closed pair
   * @param offset offset of the close token
   */
  record ExitRegion(TokenPair pair, int offset) implements ScanEvent {
    /** Offset just past the close token, which is where the region's span ends. */
    public int end() {
      return offset + pair.close().length();
    }
  }

  /**
   * An ignore start token was matched.
   *
   * @param ignore the started ignore pair
   * @param offset offset of the start token
   */
  record EnterIgnore(IgnorePair ignore, int offset) implements ScanEvent {}

  /**
   * The active ignore span ended.
   *
   * @param ignore the ended ignore pair
   * @param offset offset of the end token
   */
  record ExitIgnore(IgnorePair ignore, int offset) implements ScanEvent {
    /** Offset just past the end token. */
    public int end() {
      return offset + ignore.end().length();
    }
  }

  /**
   * Literal text outside any ignore span.
   *
   * @param offset first char of the literal
   * @param end offset after the last char
   */
  record Literal(int offset, int end) implements ScanEvent {
    public int length() {
      return end - offset;
    }
  }

  /**
   * The input was consumed with no region or ignore span left open; closes the root.
   *
   * @param offset the input length
   */
  record End(int offset) implements ScanEvent {}
}
