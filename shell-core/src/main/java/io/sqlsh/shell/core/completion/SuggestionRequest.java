package io.sqlsh.shell.core.completion;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One thing the classifier expects at the cursor. Only {@link SuggestionType#COLUMN} carries a
 * scope and only {@link SuggestionType#ALIAS} carries alias names; both lists are empty otherwise.
 * Null lists are treated as empty and null elements are dropped.
 */
public record SuggestionRequest(SuggestionType type, List<TableRef> scope, List<String> aliases) {

  public SuggestionRequest {
    Objects.requireNonNull(type, "type");
    scope = copyNonNull(scope);
    aliases = copyNonNull(aliases);
  }

  /** Columns of the given relations, in scope order. */
  public static SuggestionRequest column(List<TableRef> scope) {
    return new SuggestionRequest(SuggestionType.COLUMN, scope, null);
  }

  /** Aliases declared in the current statement. */
  public static SuggestionRequest alias(List<String> aliases) {
    return new SuggestionRequest(SuggestionType.ALIAS, null, aliases);
  }

  public static SuggestionRequest function() {
    return of(SuggestionType.FUNCTION);
  }

  public static SuggestionRequest table() {
    return of(SuggestionType.TABLE);
  }

  public static SuggestionRequest view() {
    return of(SuggestionType.VIEW);
  }

  public static SuggestionRequest database() {
    return of(SuggestionType.DATABASE);
  }

  public static SuggestionRequest keyword() {
    return of(SuggestionType.KEYWORD);
  }

  public static SuggestionRequest special() {
    return of(SuggestionType.SPECIAL);
  }

  private static <T> List<T> copyNonNull(Collection<T> values) {
    return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
  }

  private static SuggestionRequest of(SuggestionType type) {
    return new SuggestionRequest(type, null, null);
  }
}
