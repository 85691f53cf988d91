package io.nestor.parser.api;

/** Classification of the failures reported by the registry and the parser. */
public enum ErrorKind {
  /** Token configuration cannot be prioritized deterministically (empty token, duplicate pair). */
  CONFIG_CONFLICT,

  /** A close token was found that does not close the innermost open region. */
  UNMATCHED_CLOSE,

  /** The input ended while at least one region was still open. */
  UNTERMINATED_OPEN,

  /** The input ended inside an ignore span. */
  UNTERMINATED_IGNORE,

  /** Regions were nested deeper than {@link ParserOptions#maxDepth()} allows. */
  DEPTH_EXCEEDED
}
