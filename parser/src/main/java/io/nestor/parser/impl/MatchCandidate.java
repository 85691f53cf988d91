package io.nestor.parser.impl;

import io.nestor.parser.api.IgnorePair;
import io.nestor.parser.api.TokenPair;
import java.util.Comparator;

/**
 * One token the scanner tries at each input position, together with what a match means.
 *
 * @param role what a match of this token does
 * @param token the literal token text
 * @param pair the owning token pair, or null for ignore tokens
 * @param ignore the owning ignore pair, or null for token pair tokens
 * @param order registration index of the owning pair; lower matches first
 */
public record MatchCandidate(
    Role role, String token, TokenPair pair, IgnorePair ignore, int order) {

  /** Registration order first, then longer tokens before shorter ones. */
  public static final Comparator<MatchCandidate> PRIORITY =
      Comparator.comparingInt(MatchCandidate::order)
          .thenComparing(
              Comparator.comparingInt((MatchCandidate c) -> c.token().length()).reversed());

  /** What a matching token does to the scanner state. */
  public enum Role {
    IGNORE_START,
    IGNORE_END,
    CLOSE,
    OPEN
  }

  public static MatchCandidate open(TokenPair pair, int order) {
    return new MatchCandidate(Role.OPEN, pair.open(), pair, null, order);
  }

  public static MatchCandidate close(TokenPair pair, int order) {
    return new MatchCandidate(Role.CLOSE, pair.close(), pair, null, order);
  }

  public static MatchCandidate ignoreStart(IgnorePair ignore, int order) {
    return new MatchCandidate(Role.IGNORE_START, ignore.start(), null, ignore, order);
  }

  public static MatchCandidate ignoreEnd(IgnorePair ignore, int order) {
    return new MatchCandidate(Role.IGNORE_END, ignore.end(), null, ignore, order);
  }

  /**
   * Checks whether this token occurs in {@code text} at {@code pos}.
   *
   * @param text the input
   * @param pos the position to test
   * @return true on a match
   */
  public boolean matchesAt(String text, int pos) {
    return text.startsWith(token, pos);
  }

  @Override
  public String toString() {
    return String.format("%s['%s']#%d", role, token, order);
  }
}
