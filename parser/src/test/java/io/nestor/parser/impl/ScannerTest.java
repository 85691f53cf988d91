package io.nestor.parser.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.nestor.parser.api.ErrorKind;
import io.nestor.parser.api.IgnorePair;
import io.nestor.parser.api.NestorParseException;
import io.nestor.parser.api.ParserOptions;
import io.nestor.parser.api.TokenPair;
import io.nestor.parser.api.TokenRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ScannerTest {
  private static final TokenPair PAREN = new TokenPair("paren", "(", ")");
  private static final IgnorePair QUOTES = new IgnorePair("\"", "\"");

  private Scanner scanner;

  @BeforeEach
  void setUp() throws Exception {
    scanner = new Scanner(TokenRegistry.builder().pair(PAREN).ignore(QUOTES).build());
  }

  @Test
  void emitsOnlyEndForEmptyInput() throws Exception {
    assertEquals(List.of(new ScanEvent.End(0)), scanner.scan(""));
  }

  @Test
  void emitsRegionAndCoalescedLiterals() throws Exception {
    List<ScanEvent> events = scanner.scan("ab(cd)e");

    assertEquals(
        List.of(
            new ScanEvent.Literal(0, 2),
            new ScanEvent.EnterRegion(PAREN, 2),
            new ScanEvent.Literal(3, 5),
            new ScanEvent.ExitRegion(PAREN, 5),
            new ScanEvent.Literal(6, 7),
            new ScanEvent.End(7)),
        events);
  }

  @Test
  void emitsOneLiteralPerCharWhenNotCoalescing() throws Exception {
    Scanner perChar =
        new Scanner(
            TokenRegistry.builder().pair(PAREN).build(),
            ParserOptions.builder().coalesceLiterals(false).build());

    assertEquals(
        List.of(new ScanEvent.Literal(0, 1), new ScanEvent.Literal(1, 2), new ScanEvent.End(2)),
        perChar.scan("ab"));
  }

  @Test
  void suppressesTokensInsideIgnoreSpan() throws Exception {
    List<ScanEvent> events = scanner.scan("(a \"b)c\" d)");

    assertEquals(
        List.of(
            new ScanEvent.EnterRegion(PAREN, 0),
            new ScanEvent.Literal(1, 3),
            new ScanEvent.EnterIgnore(QUOTES, 3),
            new ScanEvent.ExitIgnore(QUOTES, 7),
            new ScanEvent.Literal(8, 10),
            new ScanEvent.ExitRegion(PAREN, 10),
            new ScanEvent.End(11)),
        events);
  }

  @Test
  void asymmetricIgnoreEndsAtFirstEndToken() throws Exception {
    IgnorePair comment = new IgnorePair("/*", "*/");
    Scanner commentScanner =
        new Scanner(TokenRegistry.builder().pair(PAREN).ignore(comment).build());

    List<ScanEvent> events = commentScanner.scan("(/* ( */)");

    assertEquals(
        List.of(
            new ScanEvent.EnterRegion(PAREN, 0),
            new ScanEvent.EnterIgnore(comment, 1),
            new ScanEvent.ExitIgnore(comment, 6),
            new ScanEvent.ExitRegion(PAREN, 8),
            new ScanEvent.End(9)),
        events);
  }

  @Test
  void symmetricPairTogglesInsteadOfNesting() throws Exception {
    TokenPair quote = new TokenPair("quote", "\"", "\"");
    Scanner quoteScanner = new Scanner(TokenRegistry.builder().pair(quote).build());

    assertEquals(
        List.of(
            new ScanEvent.Literal(0, 1),
            new ScanEvent.EnterRegion(quote, 1),
            new ScanEvent.Literal(2, 3),
            new ScanEvent.ExitRegion(quote, 3),
            new ScanEvent.Literal(4, 5),
            new ScanEvent.End(5)),
        quoteScanner.scan("a\"b\"c"));
  }

  @Test
  void symmetricPairOpensAgainInsideAnotherRegion() throws Exception {
    TokenPair quote = new TokenPair("quote", "|", "|");
    Scanner mixed = new Scanner(TokenRegistry.builder().pair(PAREN).pair(quote).build());

    List<ScanEvent> events = mixed.scan("|(|x|)|");

    assertEquals(
        List.of(
            new ScanEvent.EnterRegion(quote, 0),
            new ScanEvent.EnterRegion(PAREN, 1),
            new ScanEvent.EnterRegion(quote, 2),
            new ScanEvent.Literal(3, 4),
            new ScanEvent.ExitRegion(quote, 4),
            new ScanEvent.ExitRegion(PAREN, 5),
            new ScanEvent.ExitRegion(quote, 6),
            new ScanEvent.End(7)),
        events);
  }

  @Test
  void sharedCloseTokenClosesTheInnermostRegion() throws Exception {
    TokenPair halfOpen = new TokenPair("half", "[", ")");
    Scanner shared = new Scanner(TokenRegistry.builder().pair(PAREN).pair(halfOpen).build());

    List<ScanEvent> events = shared.scan("([x))");

    assertEquals(new ScanEvent.ExitRegion(halfOpen, 3), events.get(3));
    assertEquals(new ScanEvent.ExitRegion(PAREN, 4), events.get(4));
  }

  @Test
  void failsOnUnmatchedClose() {
    NestorParseException e = assertThrows(NestorParseException.class, () -> scanner.scan("a)"));

    assertEquals(ErrorKind.UNMATCHED_CLOSE, e.kind());
    assertEquals(1, e.offset());
    assertEquals(")", e.error().token());
    assertEquals(PAREN, e.error().pair());
  }

  @Test
  void failsOnCloseOfAnotherPair() throws Exception {
    TokenPair bracket = TokenPair.of("[", "]");
    Scanner two = new Scanner(TokenRegistry.builder().pair(PAREN).pair(bracket).build());

    NestorParseException e = assertThrows(NestorParseException.class, () -> two.scan("(a]"));

    assertEquals(ErrorKind.UNMATCHED_CLOSE, e.kind());
    assertEquals(2, e.offset());
    assertEquals(bracket, e.error().pair());
  }

  @Test
  void failsOnUnterminatedOpenNamingInnermostUnclosedRegion() {
    NestorParseException e = assertThrows(NestorParseException.class, () -> scanner.scan("x((a)"));

    assertEquals(ErrorKind.UNTERMINATED_OPEN, e.kind());
    assertEquals(1, e.offset());
    assertEquals(PAREN, e.error().pair());
  }

  @Test
  void failsOnUnterminatedIgnore() {
    NestorParseException e = assertThrows(NestorParseException.class, () -> scanner.scan("(\"abc"));

    assertEquals(ErrorKind.UNTERMINATED_IGNORE, e.kind());
    assertEquals(1, e.offset());
    assertEquals(QUOTES, e.error().ignore());
  }

  @Test
  void failsWhenDepthLimitExceeded() throws Exception {
    Scanner shallow =
        new Scanner(
            TokenRegistry.builder().pair(PAREN).build(),
            ParserOptions.builder().maxDepth(2).build());

    assertDoesNotThrow(() -> shallow.scan("(())"));
    NestorParseException e = assertThrows(NestorParseException.class, () -> shallow.scan("((()))"));

    assertEquals(ErrorKind.DEPTH_EXCEEDED, e.kind());
    assertEquals(2, e.offset());
  }

  @Test
  void deliversEventsToSinkInOrder() throws Exception {
    ScanEventSink sink = mock(ScanEventSink.class);

    scanner.scan("(x)", sink);

    InOrder inOrder = inOrder(sink);
    inOrder.verify(sink).accept(new ScanEvent.EnterRegion(PAREN, 0));
    inOrder.verify(sink).accept(new ScanEvent.Literal(1, 2));
    inOrder.verify(sink).accept(new ScanEvent.ExitRegion(PAREN, 2));
    inOrder.verify(sink).accept(new ScanEvent.End(3));
    verifyNoMoreInteractions(sink);
  }

  @Test
  void failedScanNeverEmitsEnd() {
    ScanEventSink sink = mock(ScanEventSink.class);

    assertThrows(NestorParseException.class, () -> scanner.scan("(x", sink));

    verify(sink).accept(new ScanEvent.EnterRegion(PAREN, 0));
    verify(sink, never()).accept(any(ScanEvent.End.class));
  }

  @Test
  void rejectsNullArguments() {
    assertThrows(NullPointerException.class, () -> scanner.scan(null));
    assertThrows(NullPointerException.class, () -> scanner.scan("x", null));
    assertThrows(NullPointerException.class, () -> new Scanner(null));
  }
}
