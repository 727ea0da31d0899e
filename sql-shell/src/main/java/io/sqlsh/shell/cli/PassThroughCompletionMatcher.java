package io.sqlsh.shell.cli;

import java.util.Map;
import org.jline.reader.CompletingParsedLine;
import org.jline.reader.LineReader;
import org.jline.reader.impl.CompletionMatcherImpl;

/**
 * Keeps every candidate the {@link SqlShellCompleter} produced.
 *
 * <p>JLine's default matcher only keeps candidates whose value starts with the typed word,
 * case-sensitively. The router already filtered case-insensitively and by substring for relation,
 * column, alias and database names, so a second filter would drop "orders" for "ORD" or
 * "user_orders" for "ord".
 */
public class PassThroughCompletionMatcher extends CompletionMatcherImpl {

  @Override
  protected void defaultMatchers(
      Map<LineReader.Option, Boolean> options,
      boolean prefix,
      CompletingParsedLine line,
      boolean caseInsensitive,
      int errors,
      String originalGroupName) {
    String typed = SqlShellCompleter.typedWord(line);
    exact = value -> value.equals(typed);
    matchers.add(simpleMatcher(value -> true));
  }
}
