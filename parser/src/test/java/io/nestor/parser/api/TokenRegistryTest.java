package io.nestor.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import io.nestor.parser.impl.MatchCandidate;
import io.nestor.parser.impl.MatchCandidate.Role;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenRegistryTest {

  @Test
  void buildsRegistryInRegistrationOrder() throws Exception {
    TokenRegistry registry =
        TokenRegistry.builder().pair("paren", "(", ")").pair("bracket", "[", "]").build();

    assertEquals(2, registry.pairs().size());
    assertEquals("paren", registry.pairs().get(0).name());
    assertEquals("bracket", registry.pairs().get(1).name());
    assertTrue(registry.ignores().isEmpty());
    assertTrue(registry.contains(new TokenPair("paren", "(", ")")));
    assertFalse(registry.contains(new TokenPair("other", "(", ")")));
  }

  @Test
  void unnamedPairIsNamedAfterItsTokens() throws Exception {
    TokenRegistry registry = TokenRegistry.builder().pair("<<", ">>").build();

    assertEquals("<<>>", registry.pairs().get(0).name());
  }

  @Test
  void candidatesAreGroupedAndOrderedByPriority() throws Exception {
    TokenRegistry registry =
        TokenRegistry.builder().pair("<", ">").pair("<<", ">>").ignore("\"", "\"").build();

    List<MatchCandidate> candidates = registry.candidates();

    assertEquals(5, candidates.size());
    assertEquals(Role.IGNORE_START, candidates.get(0).role());
    assertEquals(Role.CLOSE, candidates.get(1).role());
    assertEquals(">", candidates.get(1).token());
    assertEquals(">>", candidates.get(2).token());
    assertEquals(Role.OPEN, candidates.get(3).role());
    assertEquals("<", candidates.get(3).token());
    assertEquals("<<", candidates.get(4).token());
  }

  @Test
  void priorityPrefersEarlierRegistrationThenLongerToken() {
    TokenPair shortPair = TokenPair.of("<", ">");
    TokenPair longPair = TokenPair.of("<<", ">>");

    MatchCandidate early = MatchCandidate.open(longPair, 0);
    MatchCandidate late = MatchCandidate.open(shortPair, 1);
    MatchCandidate sameOrderShort = MatchCandidate.open(shortPair, 0);

    assertTrue(MatchCandidate.PRIORITY.compare(early, late) < 0);
    assertTrue(MatchCandidate.PRIORITY.compare(early, sameOrderShort) < 0);
  }

  @Test
  void rejectsEmptyOpenToken() {
    NestorConfigurationException e =
        assertThrows(
            NestorConfigurationException.class,
            () -> TokenRegistry.builder().pair("empty", "", ")").build());

    assertEquals(ErrorKind.CONFIG_CONFLICT, e.kind());
    assertEquals(-1, e.offset());
    assertTrue(e.getMessage().contains("empty open token"));
  }

  @Test
  void rejectsMissingCloseToken() {
    NestorConfigurationException e =
        assertThrows(
            NestorConfigurationException.class,
            () -> TokenRegistry.build(List.of(new TokenPair("p", "(", null)), List.of()));

    assertTrue(e.getMessage().contains("empty close token"));
  }

  @Test
  void rejectsBlankName() {
    assertThrows(
        NestorConfigurationException.class,
        () -> TokenRegistry.builder().pair("  ", "(", ")").build());
  }

  @Test
  void rejectsDuplicatePairEvenUnderAnotherName() {
    NestorConfigurationException e =
        assertThrows(
            NestorConfigurationException.class,
            () -> TokenRegistry.builder().pair("a", "(", ")").pair("b", "(", ")").build());

    assertEquals("b", e.error().pair().name());
    assertTrue(e.getMessage().contains("duplicates 'a'"));
  }

  @Test
  void acceptsPairsSharingOnlyOneToken() throws Exception {
    TokenRegistry registry = TokenRegistry.builder().pair("(", ")").pair("[", ")").build();

    assertEquals(2, registry.pairs().size());
  }

  @Test
  void rejectsDuplicateIgnorePair() {
    NestorConfigurationException e =
        assertThrows(
            NestorConfigurationException.class,
            () -> TokenRegistry.builder().pair("(", ")").ignore("'", "'").ignore("'", "'").build());

    assertEquals(new IgnorePair("'", "'"), e.error().ignore());
  }

  @Test
  void rejectsEmptyIgnoreToken() {
    assertThrows(
        NestorConfigurationException.class,
        () -> TokenRegistry.builder().pair("(", ")").ignore("/*", "").build());
  }

  @Test
  void rejectsRegistryWithoutPairs() {
    NestorConfigurationException e =
        assertThrows(
            NestorConfigurationException.class,
            () -> TokenRegistry.build(List.of(), List.of(new IgnorePair("'", "'"))));

    assertEquals(ErrorKind.CONFIG_CONFLICT, e.kind());
  }

  @Test
  void rejectsNullLists() {
    assertThrows(NullPointerException.class, () -> TokenRegistry.build(null, List.of()));
    assertThrows(
        NullPointerException.class,
        () -> TokenRegistry.build(List.of(TokenPair.of("(", ")")), null));
  }

  @Test
  void exposedListsAreUnmodifiable() throws Exception {
    TokenRegistry registry = TokenRegistry.builder().pair("(", ")").ignore("'", "'").build();

    assertThrows(
        UnsupportedOperationException.class, () -> registry.pairs().add(TokenPair.of("[", "]")));
    assertThrows(UnsupportedOperationException.class, () -> registry.candidates().clear());
  }

  @Test
  void ignoreEndLookupRejectsUnregisteredPair() throws Exception {
    TokenRegistry registry = TokenRegistry.builder().pair("(", ")").ignore("'", "'").build();

    assertEquals("'", registry.ignoreEndCandidate(new IgnorePair("'", "'")).token());
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.ignoreEndCandidate(new IgnorePair("/*", "*/")));
  }
}
