package io.nestor.parser.api;

/**
 * Exception thrown when a {@link TokenRegistry} cannot be built from the supplied token and ignore
 * pairs, such as empty tokens or duplicate definitions.
 */
public class NestorConfigurationException extends NestorParseException {

  /**
   * Constructs a new NestorConfigurationException for the given error.
   *
   * @param error the structured error, of kind {@link ErrorKind#CONFIG_CONFLICT}
   */
  public NestorConfigurationException(ParseError error) {
    super(error);
    if (error.kind() != ErrorKind.CONFIG_CONFLICT) {
      throw new IllegalArgumentException("Not a configuration error: " + error.kind());
    }
  }

  /**
   * Constructs a new NestorConfigurationException with the specified message.
   *
   * @param message the detail message
   */
  public NestorConfigurationException(String message) {
    this(ParseError.config(null, null, message));
  }

  /**
   * Creates a NestorConfigurationException for a token pair with an empty or missing token.
   *
   * @param pair the offending pair
   * @param which which token is empty ("open" or "close")
   * @return a new NestorConfigurationException instance
   */
  public static NestorConfigurationException emptyToken(TokenPair pair, String which) {
    return new NestorConfigurationException(
        ParseError.config(
            pair,
            null,
            String.format("Token pair '%s' has an empty %s token", pair.name(), which)));
  }

  /**
   * Creates a NestorConfigurationException for an ignore pair with an empty or missing token.
   *
   * @param ignore the offending ignore pair
   * @param which which token is empty ("start" or "end")
   * @return a new NestorConfigurationException instance
   */
  public static NestorConfigurationException emptyToken(IgnorePair ignore, String which) {
    return new NestorConfigurationException(
        ParseError.config(null, ignore, String.format("Ignore pair has an empty %s token", which)));
  }

  /**
   * Creates a NestorConfigurationException for a token pair without a usable name.
   *
   * @param pair the offending pair
   * @return a new NestorConfigurationException instance
   */
  public static NestorConfigurationException blankName(TokenPair pair) {
    return new NestorConfigurationException(
        ParseError.config(pair, null, "Token pair name cannot be null or blank"));
  }

  /**
   * Creates a NestorConfigurationException for two token pairs with the same open and close tokens.
   *
   * @param first the earlier registration
   * @param second the later, rejected registration
   * @return a new NestorConfigurationException instance
   */
  public static NestorConfigurationException duplicatePair(TokenPair first, TokenPair second) {
    return new NestorConfigurationException(
        ParseError.config(
            second,
            null,
            String.format(
                "Token pair '%s' duplicates '%s' ('%s' ... '%s')",
                second.name(), first.name(), second.open(), second.close())));
  }

  /**
   * Creates a NestorConfigurationException for an ignore pair registered twice.
   *
   * @param ignore the duplicated ignore pair
   * @return a new NestorConfigurationException instance
   */
  public static NestorConfigurationException duplicateIgnore(IgnorePair ignore) {
    return new NestorConfigurationException(
        ParseError.config(
            null,
            ignore,
            String.format(
                "Ignore pair '%s' ... '%s' is registered twice", ignore.start(), ignore.end())));
  }
}
