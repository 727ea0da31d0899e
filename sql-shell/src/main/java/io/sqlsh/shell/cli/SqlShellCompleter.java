package io.sqlsh.shell.cli;

import io.sqlsh.shell.core.completion.Catalog;
import io.sqlsh.shell.core.completion.Completion;
import io.sqlsh.shell.core.completion.SuggestionClassifier;
import io.sqlsh.shell.core.completion.SuggestionRouter;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.ParsedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JLine completer for SQL input. Hands the buffer to a {@link SuggestionRouter} and turns each
 * {@link Completion} into a JLine {@link Candidate}.
 *
 * <p>JLine replaces the whole current word with the selected candidate, while a completion only
 * replaces the fragment after the last separator. For "u.na" the router suggests "name" replacing
 * two characters, so the candidate value becomes "u.name" and its display stays "name".
 *
 * <p>Register it with {@link #install(LineReaderBuilder)} so JLine does not filter the candidates
 * a second time.
 */
public final class SqlShellCompleter implements Completer {
  private static final Logger log = LoggerFactory.getLogger(SqlShellCompleter.class);

  private final SuggestionRouter router;

  public SqlShellCompleter(SuggestionRouter router) {
    this.router = Objects.requireNonNull(router, "router");
  }

  /**
   * Creates a completer whose default mode comes from {@code config}.
   *
   * @param config completion settings
   * @param catalog supplies the current catalog, e.g. a refresher's {@code current()}
   * @param classifier classifies the cursor position in smart mode
   */
  public static SqlShellCompleter create(
      CompletionConfig config, Supplier<Catalog> catalog, SuggestionClassifier classifier) {
    return new SqlShellCompleter(
        new SuggestionRouter(catalog, classifier, config.smartCompletion()));
  }

  /**
   * Registers this completer and a {@link PassThroughCompletionMatcher} on {@code builder}.
   *
   * @return {@code builder}
   */
  public LineReaderBuilder install(LineReaderBuilder builder) {
    return builder.completer(this).completionMatcher(new PassThroughCompletionMatcher());
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String fullText = line.line();
    int cursor = Math.max(0, Math.min(line.cursor(), fullText.length()));
    String textBeforeCursor = fullText.substring(0, cursor);

    List<Completion> completions = router.getCompletions(fullText, textBeforeCursor);
    log.debug(
        "line='{}' cursor={} word='{}' -> {} completions",
        fullText,
        cursor,
        line.word(),
        completions.size());

    String typed = typedWord(line);
    for (Completion completion : completions) {
      String value = replacedPrefix(typed, completion.deleteBackCount()) + completion.text();
      candidates.add(new Candidate(value, completion.text(), null, null, null, null, true));
    }
  }

  /** The part of JLine's current word left of the cursor. */
  static String typedWord(ParsedLine line) {
    String word = line.word();
    if (word == null) {
      return "";
    }
    int wordCursor = Math.max(0, Math.min(line.wordCursor(), word.length()));
    return word.substring(0, wordCursor);
  }

  /**
   * The part of the typed word that a completion keeps.
   *
   * <ul>
   *   <li>typed="u.na", deleteBack=2 → "u."
   *   <li>typed="sel", deleteBack=3 → ""
   *   <li>typed="", deleteBack=0 → ""
   * </ul>
   */
  static String replacedPrefix(String typed, int deleteBackCount) {
    if (typed.length() <= deleteBackCount) {
      return "";
    }
    return typed.substring(0, typed.length() - deleteBackCount);
  }
}
