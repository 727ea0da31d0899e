package io.sqlsh.shell.core.completion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Quoting rules for identifiers offered as completions. A name is left bare only when it is a
 * plain lower-case identifier; everything else is wrapped in double quotes.
 *
 * <p>The rule is not case-folding aware: {@code Users} is always quoted even on dialects that
 * would accept it bare.
 */
public final class NameCodec {

  /** Identifiers that never need quoting. */
  private static final Pattern NAME_PATTERN = Pattern.compile("^[_a-z][_a-z0-9$]*$");

  private NameCodec() {}

  /**
   * Quotes {@code name} unless it is a plain lower-case identifier. An empty name is quoted.
   *
   * @param name raw identifier, may be null
   * @return the escaped identifier, or null for null input
   */
  public static String escape(String name) {
    if (name == null) {
      return null;
    }
    if (name.isEmpty() || !NAME_PATTERN.matcher(name).matches()) {
      return '"' + name + '"';
    }
    return name;
  }

  /**
   * Strips one pair of surrounding double quotes. Embedded quotes are not interpreted.
   *
   * @param name possibly quoted identifier, may be null
   * @return the identifier without its outer quotes
   */
  public static String unescape(String name) {
    if (name != null && name.length() >= 2 && name.charAt(0) == '"' && name.endsWith("\"")) {
      return name.substring(1, name.length() - 1);
    }
    return name;
  }

  /** Escapes every element, preserving order. */
  public static List<String> escapeAll(Collection<String> names) {
    List<String> escaped = new ArrayList<>(names.size());
    for (String name : names) {
      escaped.add(escape(name));
    }
    return escaped;
  }
}
