package io.sqlsh.shell.core.completion;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules for extracting the word immediately before the cursor. They differ in which punctuation
 * ends a word.
 */
public enum WordBoundary {
  /** Letters, digits and underscores only. */
  ALPHANUM_UNDERSCORE("(\\w+)$"),

  /** Everything except whitespace, parentheses, colon and comma. */
  MANY_PUNCTUATIONS("([^():,\\s]+)$"),

  /** Like {@link #MANY_PUNCTUATIONS}, but a period also ends the word. */
  MOST_PUNCTUATIONS("([^.():,\\s]+)$"),

  /** Everything except whitespace. */
  ALL_PUNCTUATIONS("(\\S+)$");

  private final Pattern pattern;

  WordBoundary(String regex) {
    this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
  }

  /**
   * Returns the trailing word of {@code text} under this rule.
   *
   * <p>Examples for {@link #MOST_PUNCTUATIONS}:
   *
   * <ul>
   *   <li>"select u.na" → "na"
   *   <li>"count(*" → "*"
   *   <li>"select " → ""
   * </ul>
   *
   * @param text text before the cursor, may be null
   * @return the trailing word, or "" when the text is empty or ends in whitespace
   */
  public String lastWord(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    if (Character.isWhitespace(text.charAt(text.length() - 1))) {
      return "";
    }
    Matcher m = pattern.matcher(text);
    return m.find() ? m.group(1) : "";
  }
}
