package io.sqlsh.shell.core.completion;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/** Stateless prefix and substring matching over candidate names. */
public final class CompletionMatcher {

  private CompletionMatcher() {}

  /**
   * Finds the candidates matching the last word of {@code text}.
   *
   * <p>The fragment is taken with {@link WordBoundary#MOST_PUNCTUATIONS} and compared
   * case-insensitively. Candidates are visited in natural {@link String} order, which is also the
   * order of the result. With {@code anchored} the fragment must start the candidate; otherwise it
   * may occur anywhere in it.
   *
   * <p>The returned stream is lazy and can be consumed once.
   *
   * @param text text whose trailing word is matched
   * @param candidates names eligible for completion
   * @param anchored true for prefix matching, false for substring matching
   * @return one {@link Completion} per matching candidate, replacing the fragment
   */
  public static Stream<Completion> findMatches(
      String text, Collection<String> candidates, boolean anchored) {
    String fragment = WordBoundary.MOST_PUNCTUATIONS.lastWord(text).toLowerCase(Locale.ROOT);
    int deleteBack = fragment.length();
    return candidates.stream()
        .filter(Objects::nonNull)
        .sorted()
        .filter(candidate -> matches(candidate, fragment, anchored))
        .map(candidate -> new Completion(candidate, deleteBack));
  }

  /**
   * Returns the run of non-whitespace characters that ends at the cursor.
   *
   * @param textBeforeCursor buffer content up to the cursor
   * @return the word before the cursor, or "" if the cursor follows whitespace
   */
  public static String wordBeforeCursor(String textBeforeCursor) {
    return WordBoundary.ALL_PUNCTUATIONS.lastWord(textBeforeCursor);
  }

  private static boolean matches(String candidate, String fragment, boolean anchored) {
    String lower = candidate.toLowerCase(Locale.ROOT);
    return anchored ? lower.startsWith(fragment) : lower.contains(fragment);
  }
}
