package io.nestor.parser.api;

import java.util.Objects;

/**
 * Base exception for all nestor errors. Wraps a {@link ParseError} and renders its location and
 * kind into the message.
 *
 * <p>Parse failures are final: no partial tree accompanies the exception.
 */
public class NestorParseException extends Exception {
  /** The structured error. */
  private final ParseError error;

  /** Contextual information about where the error occurred. */
  private final String context;

  /** Error code identifying the kind of error. */
  private final String errorCode;

  /**
   * Constructs a new NestorParseException for the given error.
   *
   * @param error the structured error
   */
  public NestorParseException(ParseError error) {
    this(error, null);
  }

  /**
   * Constructs a new NestorParseException for the given error and cause.
   *
   * @param error the structured error
   * @param cause the cause of the exception
   */
  public NestorParseException(ParseError error, Throwable cause) {
    super(
        formatMessage(
            Objects.requireNonNull(error, "error must not be null").message(),
            error.context(),
            error.kind().name()),
        cause);
    this.error = error;
    this.context = error.context();
    this.errorCode = error.kind().name();
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  /**
   * Creates an exception for a close token that does not close the innermost open region.
   *
   * @param offset offset of the close token
   * @param pair the pair whose close token matched
   * @return a new NestorParseException instance
   */
  public static NestorParseException unmatchedClose(int offset, TokenPair pair) {
    return new NestorParseException(ParseError.unmatchedClose(offset, pair));
  }

  /**
   * Creates an exception for a region still open when the input ended.
   *
   * @param offset offset of the unmatched open token
   * @param pair the unclosed pair
   * @return a new NestorParseException instance
   */
  public static NestorParseException unterminatedOpen(int offset, TokenPair pair) {
    return new NestorParseException(ParseError.unterminatedOpen(offset, pair));
  }

  /**
   * Creates an exception for an ignore span still active when the input ended.
   *
   * @param offset offset of the ignore start token
   * @param ignore the active ignore pair
   * @return a new NestorParseException instance
   */
  public static NestorParseException unterminatedIgnore(int offset, IgnorePair ignore) {
    return new NestorParseException(ParseError.unterminatedIgnore(offset, ignore));
  }

  /**
   * Creates an exception for an open token that would exceed the configured nesting limit.
   *
   * @param offset offset of the open token
   * @param pair the pair that failed to open
   * @param maxDepth the configured limit
   * @return a new NestorParseException instance
   */
  public static NestorParseException depthExceeded(int offset, TokenPair pair, int maxDepth) {
    return new NestorParseException(ParseError.depthExceeded(offset, pair, maxDepth));
  }

  /**
   * Gets the structured error.
   *
   * @return the error, never null
   */
  public ParseError error() {
    return error;
  }

  /**
   * Gets the error kind.
   *
   * @return the kind
   */
  public ErrorKind kind() {
    return error.kind();
  }

  /**
   * Gets the offset at which the problem was detected.
   *
   * @return the offset, or -1 for configuration errors
   */
  public int offset() {
    return error.offset();
  }

  /**
   * Gets the context information for this exception.
   *
   * @return the context information, or null if none
   */
  public String getContext() {
    return context;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return the error code
   */
  public String getErrorCode() {
    return errorCode;
  }
}
