package io.nestor.parser.impl;

import io.nestor.parser.api.NestorParseException;
import io.nestor.parser.api.ParserOptions;
import io.nestor.parser.api.TokenPair;
import io.nestor.parser.api.TokenRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single left-to-right pass over the input that turns registry tokens into {@link ScanEvent}s.
 *
 * <p>At each position the scanner tries, when no ignore span is active, ignore start tokens, then
 * close tokens, then open tokens, each group in registry priority order. A symmetric pair closes
 * when it is on top of the nesting stack and opens otherwise. Inside an ignore span only that
 * span's end token is recognized.
 *
 * <p>The nesting stack is local to each {@link #scan} call, so one scanner may serve concurrent
 * scans.
 */
public final class Scanner {
  private static final Logger log = LoggerFactory.getLogger(Scanner.class);

  private final TokenRegistry registry;
  private final ParserOptions options;

  public Scanner(TokenRegistry registry) {
    this(registry, ParserOptions.DEFAULT);
  }

  public Scanner(TokenRegistry registry, ParserOptions options) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.options = Objects.requireNonNull(options, "options must not be null");
  }

  /**
   * Scans the text and collects the produced events.
   *
   * @param text the input
   * @return events in input order, ending with {@link ScanEvent.End}
   * @throws NestorParseException on the first structural violation
   */
  public List<ScanEvent> scan(String text) throws NestorParseException {
    List<ScanEvent> events = new ArrayList<>();
    scan(text, events::add);
    return events;
  }

  /**
   * Scans the text, handing each event to the sink as soon as it is known.
   *
   * @param text the input
   * @param sink receiver of the events
   * @throws NestorParseException on the first structural violation; events already delivered are
   *     not retracted
   */
  public void scan(String text, ScanEventSink sink) throws NestorParseException {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(sink, "sink must not be null");

    Deque<OpenRegion> stack = new ArrayDeque<>();
    MatchCandidate activeIgnoreEnd = null;
    int ignoreStart = -1;
    int literalStart = -1;
    int deepest = 0;
    int pos = 0;
    int len = text.length();

    while (pos < len) {
      if (activeIgnoreEnd != null) {
        if (activeIgnoreEnd.matchesAt(text, pos)) {
          emit(sink, new ScanEvent.ExitIgnore(activeIgnoreEnd.ignore(), pos));
          pos += activeIgnoreEnd.token().length();
          activeIgnoreEnd = null;
          ignoreStart = -1;
        } else {
          pos++;
        }
        continue;
      }

      MatchCandidate ignore = firstMatch(registry.ignoreStartCandidates(), text, pos);
      if (ignore != null) {
        literalStart = flushLiteral(sink, literalStart, pos);
        emit(sink, new ScanEvent.EnterIgnore(ignore.ignore(), pos));
        activeIgnoreEnd = registry.ignoreEndCandidate(ignore.ignore());
        ignoreStart = pos;
        pos += ignore.token().length();
        continue;
      }

      OpenRegion top = stack.peek();
      MatchCandidate close = null;
      MatchCandidate strayClose = null;
      for (MatchCandidate candidate : registry.closeCandidates()) {
        if (!candidate.matchesAt(text, pos)) {
          continue;
        }
        if (top != null && top.pair().equals(candidate.pair())) {
          close = candidate;
          break;
        }
        // symmetric pairs not on top fall through to the open group
        if (strayClose == null && !candidate.pair().isSymmetric()) {
          strayClose = candidate;
        }
      }
      if (close != null) {
        literalStart = flushLiteral(sink, literalStart, pos);
        stack.pop();
        emit(sink, new ScanEvent.ExitRegion(close.pair(), pos));
        pos += close.token().length();
        continue;
      }
      if (strayClose != null) {
        throw NestorParseException.unmatchedClose(pos, strayClose.pair());
      }

      MatchCandidate open = firstMatch(registry.openCandidates(), text, pos);
      if (open != null) {
        if (options.maxDepth() > 0 && stack.size() >= options.maxDepth()) {
          throw NestorParseException.depthExceeded(pos, open.pair(), options.maxDepth());
        }
        literalStart = flushLiteral(sink, literalStart, pos);
        stack.push(new OpenRegion(open.pair(), pos));
        deepest = Math.max(deepest, stack.size());
        emit(sink, new ScanEvent.EnterRegion(open.pair(), pos));
        pos += open.token().length();
        continue;
      }

      if (options.coalesceLiterals()) {
        if (literalStart < 0) {
          literalStart = pos;
        }
      } else {
        emit(sink, new ScanEvent.Literal(pos, pos + 1));
      }
      pos++;
    }

    if (activeIgnoreEnd != null) {
      throw NestorParseException.unterminatedIgnore(ignoreStart, activeIgnoreEnd.ignore());
    }
    if (!stack.isEmpty()) {
      OpenRegion unclosed = stack.peek();
      throw NestorParseException.unterminatedOpen(unclosed.offset(), unclosed.pair());
    }
    flushLiteral(sink, literalStart, len);
    emit(sink, new ScanEvent.End(len));
    log.debug("Scanned {} chars, max nesting depth {}", len, deepest);
  }

  private static MatchCandidate firstMatch(List<MatchCandidate> candidates, String text, int pos) {
    for (MatchCandidate candidate : candidates) {
      if (candidate.matchesAt(text, pos)) {
        return candidate;
      }
    }
    return null;
  }

  /** Emits the pending literal, if any, and returns the reset literal start. */
  private static int flushLiteral(ScanEventSink sink, int literalStart, int pos) {
    if (literalStart >= 0 && pos > literalStart) {
      emit(sink, new ScanEvent.Literal(literalStart, pos));
    }
    return -1;
  }

  private static void emit(ScanEventSink sink, ScanEvent event) {
    if (log.isTraceEnabled()) {
      log.trace("{}", event);
    }
    sink.accept(event);
  }

  private record OpenRegion(TokenPair pair, int offset) {}
}
