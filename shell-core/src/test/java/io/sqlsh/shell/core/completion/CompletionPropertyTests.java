package io.sqlsh.shell.core.completion;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Locale;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/** Property-based tests for identifier quoting and candidate matching. */
@PropertyDefaults(tries = 500)
class CompletionPropertyTests {

  @Provide
  Arbitrary<String> plainIdentifiers() {
    Arbitrary<Character> first = Arbitraries.chars().range('a', 'z').with('_');
    Arbitrary<String> rest =
        Arbitraries.strings()
            .withCharRange('a', 'z')
            .withCharRange('0', '9')
            .withChars('_', '$')
            .ofMaxLength(12);
    return Combinators.combine(first, rest).as((f, r) -> f + r);
  }

  @Provide
  Arbitrary<String> namesWithUpperCase() {
    Arbitrary<String> lower = Arbitraries.strings().withCharRange('a', 'z').ofMaxLength(6);
    Arbitrary<Character> upper = Arbitraries.chars().range('A', 'Z');
    return Combinators.combine(lower, upper, lower).as((a, u, b) -> a + u + b);
  }

  @Property
  void plainIdentifiersAreNotQuoted(@ForAll("plainIdentifiers") String name) {
    assertEquals(name, NameCodec.escape(name));
    assertEquals(name, NameCodec.unescape(NameCodec.escape(name)));
  }

  @Property
  void upperCaseNamesAreQuoted(@ForAll("namesWithUpperCase") String name) {
    assertEquals('"' + name + '"', NameCodec.escape(name));
  }

  @Property
  void leadingDigitIsQuoted(
      @ForAll @IntRange(min = 0, max = 9) int digit,
      @ForAll("plainIdentifiers") String name) {
    String withDigit = digit + name;
    assertEquals('"' + withDigit + '"', NameCodec.escape(withDigit));
  }

  @Property
  void unescapeUndoesEscapeForAnyString(@ForAll String name) {
    assertEquals(name, NameCodec.unescape(NameCodec.escape(name)));
  }

  @Property
  void anchoredMatchesAreExactlyThePrefixMatchesInOrder(
      @ForAll @AlphaChars @StringLength(max = 3) String fragment,
      @ForAll @Size(max = 20) List<@AlphaChars @StringLength(max = 8) String> candidates) {
    String key = fragment.toLowerCase(Locale.ROOT);
    List<String> expected =
        candidates.stream()
            .filter(c -> c.toLowerCase(Locale.ROOT).startsWith(key))
            .sorted()
            .toList();

    List<Completion> actual = CompletionMatcher.findMatches(fragment, candidates, true).toList();

    assertEquals(expected, actual.stream().map(Completion::text).toList());
    assertTrue(actual.stream().allMatch(c -> c.deleteBackCount() == fragment.length()));
  }

  @Property
  void substringMatchesAreExactlyTheContainingCandidatesInOrder(
      @ForAll @AlphaChars @StringLength(max = 3) String fragment,
      @ForAll @Size(max = 20) List<@AlphaChars @StringLength(max = 8) String> candidates) {
    String key = fragment.toLowerCase(Locale.ROOT);
    List<String> expected =
        candidates.stream()
            .filter(c -> c.toLowerCase(Locale.ROOT).contains(key))
            .sorted()
            .toList();

    List<String> actual =
        CompletionMatcher.findMatches(fragment, candidates, false).map(Completion::text).toList();

    assertEquals(expected, actual);
  }

  @Property
  void anchoredIsASubsetOfSubstring(
      @ForAll @AlphaChars @StringLength(max = 3) String fragment,
      @ForAll @Size(max = 20) List<@AlphaChars @StringLength(max = 8) String> candidates) {
    List<Completion> anchored = CompletionMatcher.findMatches(fragment, candidates, true).toList();
    List<Completion> substring =
        CompletionMatcher.findMatches(fragment, candidates, false).toList();
    assertTrue(substring.containsAll(anchored));
  }
}
