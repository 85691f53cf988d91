package io.nestor.parser.api;

import java.util.Objects;

/**
 * Structured description of a registry or parse failure.
 *
 * <p>Fields that do not apply to the error kind are {@code null}; {@code offset} is {@code -1} for
 * configuration errors, which are detected before any input is read.
 *
 * @param kind what went wrong
 * @param offset char offset into the input where the problem was detected
 * @param token the offending token text, if any
 * @param pair the token pair involved, if any
 * @param ignore the ignore pair involved, if any
 * @param message human readable description
 */
public record ParseError(
    ErrorKind kind, int offset, String token, TokenPair pair, IgnorePair ignore, String message) {

  public ParseError {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  static ParseError config(TokenPair pair, IgnorePair ignore, String message) {
    return new ParseError(ErrorKind.CONFIG_CONFLICT, -1, null, pair, ignore, message);
  }

  static ParseError unmatchedClose(int offset, TokenPair pair) {
    return new ParseError(
        ErrorKind.UNMATCHED_CLOSE,
        offset,
        pair.close(),
        pair,
        null,
        String.format(
            "'%s' closes '%s' without a matching '%s'", pair.close(), pair.name(), pair.open()));
  }

  static ParseError unterminatedOpen(int offset, TokenPair pair) {
    return new ParseError(
        ErrorKind.UNTERMINATED_OPEN,
        offset,
        pair.open(),
        pair,
        null,
        String.format(
            "'%s' opens '%s' without later being closed by '%s'",
            pair.open(), pair.name(), pair.close()));
  }

  static ParseError unterminatedIgnore(int offset, IgnorePair ignore) {
    return new ParseError(
        ErrorKind.UNTERMINATED_IGNORE,
        offset,
        ignore.start(),
        null,
        ignore,
        String.format(
            "'%s' starts an ignored span never ended by '%s'", ignore.start(), ignore.end()));
  }

  static ParseError depthExceeded(int offset, TokenPair pair, int maxDepth) {
    return new ParseError(
        ErrorKind.DEPTH_EXCEEDED,
        offset,
        pair.open(),
        pair,
        null,
        String.format("'%s' would nest regions deeper than %d", pair.open(), maxDepth));
  }

  /**
   * Describes where the error happened, for exception messages.
   *
   * @return the location description, or {@code null} for errors without a location
   */
  public String context() {
    if (offset < 0) {
      return pair != null ? pair.toString() : ignore != null ? ignore.toString() : null;
    }
    StringBuilder sb = new StringBuilder("offset ").append(offset);
    if (token != null) {
      sb.append(", token '").append(token).append('\'');
    }
    return sb.toString();
  }
}
