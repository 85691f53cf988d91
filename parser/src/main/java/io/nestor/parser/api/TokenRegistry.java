package io.nestor.parser.api;

import io.nestor.parser.impl.MatchCandidate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validated, indexed set of {@link TokenPair}s and {@link IgnorePair}s used to parse input.
 *
 * <p>Registration order is matching priority: when several tokens match at the same input
 * position, the one registered earliest wins, and among tokens of equal priority the longer one
 * wins. Registering {@code <} before {@code <<} therefore makes {@code <<x>>} parse as two nested
 * single-char regions.
 *
 * <p>A registry is immutable once built and may be shared between any number of concurrent parses.
 *
 * <pre>{@code
 * TokenRegistry registry = TokenRegistry.builder()
 *     .pair("paren", "(", ")")
 *     .pair("quote", "\"", "\"")
 *     .ignore("'", "'")
 *     .build();
 * }</pre>
 */
public final class TokenRegistry {
  private static final Logger log = LoggerFactory.getLogger(TokenRegistry.class);

  private final List<TokenPair> pairs;
  private final List<IgnorePair> ignores;
  private final List<MatchCandidate> ignoreStarts;
  private final List<MatchCandidate> closes;
  private final List<MatchCandidate> opens;
  private final Map<IgnorePair, MatchCandidate> ignoreEnds;

  private TokenRegistry(List<TokenPair> pairs, List<IgnorePair> ignores) {
    this.pairs = List.copyOf(pairs);
    this.ignores = List.copyOf(ignores);

    List<MatchCandidate> starts = new ArrayList<>();
    Map<IgnorePair, MatchCandidate> ends = new HashMap<>();
    for (int i = 0; i < this.ignores.size(); i++) {
      IgnorePair ignore = this.ignores.get(i);
      starts.add(MatchCandidate.ignoreStart(ignore, i));
      ends.put(ignore, MatchCandidate.ignoreEnd(ignore, i));
    }
    List<MatchCandidate> closeTokens = new ArrayList<>();
    List<MatchCandidate> openTokens = new ArrayList<>();
    for (int i = 0; i < this.pairs.size(); i++) {
      TokenPair pair = this.pairs.get(i);
      closeTokens.add(MatchCandidate.close(pair, i));
      openTokens.add(MatchCandidate.open(pair, i));
    }
    starts.sort(MatchCandidate.PRIORITY);
    closeTokens.sort(MatchCandidate.PRIORITY);
    openTokens.sort(MatchCandidate.PRIORITY);

    this.ignoreStarts = List.copyOf(starts);
    this.closes = List.copyOf(closeTokens);
    this.opens = List.copyOf(openTokens);
    this.ignoreEnds = Map.copyOf(ends);
  }

  /**
   * Validates and indexes the given pairs.
   *
   * @param pairs token pairs in priority order
   * @param ignores ignore pairs in priority order
   * @return the registry
   * @throws NestorConfigurationException if a token is empty, a pair name is blank, a pair or
   *     ignore pair is registered twice, or no token pair is given
   * @throws NullPointerException if either list is null
   */
  public static TokenRegistry build(List<TokenPair> pairs, List<IgnorePair> ignores)
      throws NestorConfigurationException {
    Objects.requireNonNull(pairs, "pairs must not be null");
    Objects.requireNonNull(ignores, "ignores must not be null");

    if (pairs.isEmpty()) {
      throw new NestorConfigurationException("At least one token pair must be registered");
    }

    Map<List<String>, TokenPair> seenPairs = new HashMap<>();
    for (TokenPair pair : pairs) {
      Objects.requireNonNull(pair, "pair must not be null");
      if (pair.name() == null || pair.name().isBlank()) {
        throw NestorConfigurationException.blankName(pair);
      }
      if (pair.open() == null || pair.open().isEmpty()) {
        throw NestorConfigurationException.emptyToken(pair, "open");
      }
      if (pair.close() == null || pair.close().isEmpty()) {
        throw NestorConfigurationException.emptyToken(pair, "close");
      }
      TokenPair previous = seenPairs.putIfAbsent(List.of(pair.open(), pair.close()), pair);
      if (previous != null) {
        throw NestorConfigurationException.duplicatePair(previous, pair);
      }
    }

    Set<IgnorePair> seenIgnores = new HashSet<>();
    for (IgnorePair ignore : ignores) {
      Objects.requireNonNull(ignore, "ignore must not be null");
      if (ignore.start() == null || ignore.start().isEmpty()) {
        throw NestorConfigurationException.emptyToken(ignore, "start");
      }
      if (ignore.end() == null || ignore.end().isEmpty()) {
        throw NestorConfigurationException.emptyToken(ignore, "end");
      }
      if (!seenIgnores.add(ignore)) {
        throw NestorConfigurationException.duplicateIgnore(ignore);
      }
    }

    TokenRegistry registry = new TokenRegistry(pairs, ignores);
    log.debug(
        "Built token registry: {} pairs, {} ignore pairs, {} candidates",
        registry.pairs.size(),
        registry.ignores.size(),
        registry.candidates().size());
    return registry;
  }

  /**
   * Starts a fluent registry definition.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the registered token pairs in priority order.
   *
   * @return unmodifiable list of pairs
   */
  public List<TokenPair> pairs() {
    return pairs;
  }

  /**
   * Returns the registered ignore pairs in priority order.
   *
   * @return unmodifiable list of ignore pairs
   */
  public List<IgnorePair> ignores() {
    return ignores;
  }

  /**
   * Checks whether the pair is part of this registry.
   *
   * @param pair the pair to look up
   * @return true if registered
   */
  public boolean contains(TokenPair pair) {
    return pairs.contains(pair);
  }

  /**
   * Returns every token the scanner checks, in the order it checks them when no ignore span is
   * active: ignore starts, then closes, then opens, each group by priority.
   *
   * @return unmodifiable list of candidates
   */
  public List<MatchCandidate> candidates() {
    List<MatchCandidate> all = new ArrayList<>(ignoreStarts.size() + closes.size() + opens.size());
    all.addAll(ignoreStarts);
    all.addAll(closes);
    all.addAll(opens);
    return Collections.unmodifiableList(all);
  }

  @Internal
  public List<MatchCandidate> ignoreStartCandidates() {
    return ignoreStarts;
  }

  @Internal
  public List<MatchCandidate> closeCandidates() {
    return closes;
  }

  @Internal
  public List<MatchCandidate> openCandidates() {
    return opens;
  }

  @Internal
  public MatchCandidate ignoreEndCandidate(IgnorePair ignore) {
    MatchCandidate end = ignoreEnds.get(ignore);
    if (end == null) {
      throw new IllegalArgumentException("Unregistered ignore pair: " + ignore);
    }
    return end;
  }

  @Override
  public String toString() {
    return "TokenRegistry{pairs=" + pairs + ", ignores=" + ignores + "}";
  }

  /** Collects pairs in registration order for {@link TokenRegistry#build}. */
  public static final class Builder {
    private final List<TokenPair> pairs = new ArrayList<>();
    private final List<IgnorePair> ignores = new ArrayList<>();

    private Builder() {}

    public Builder pair(TokenPair pair) {
      pairs.add(Objects.requireNonNull(pair, "pair must not be null"));
      return this;
    }

    public Builder pair(String name, String open, String close) {
      return pair(new TokenPair(name, open, close));
    }

    public Builder pair(String open, String close) {
      return pair(TokenPair.of(open, close));
    }

    public Builder ignore(IgnorePair ignore) {
      ignores.add(Objects.requireNonNull(ignore, "ignore must not be null"));
      return this;
    }

    public Builder ignore(String start, String end) {
      return ignore(new IgnorePair(start, end));
    }

    /**
     * Validates the collected pairs.
     *
     * @return the registry
     * @throws NestorConfigurationException if the configuration is invalid
     */
    public TokenRegistry build() throws NestorConfigurationException {
      return TokenRegistry.build(pairs, ignores);
    }
  }
}
