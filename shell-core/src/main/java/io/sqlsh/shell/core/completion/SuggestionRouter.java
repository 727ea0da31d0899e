package io.sqlsh.shell.core.completion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for SQL completion. In dumb mode the word before the cursor is prefix-matched
 * against the whole catalog vocabulary. In smart mode a {@link SuggestionClassifier} decides what
 * may follow, and each of its requests is answered from the matching part of the {@link Catalog}.
 *
 * <p>Keywords, functions and special commands are matched from the start of the word; tables,
 * views, columns, aliases and databases match anywhere in the name.
 */
public final class SuggestionRouter {
  private static final Logger log = LoggerFactory.getLogger(SuggestionRouter.class);

  private final Supplier<Catalog> catalog;
  private final SuggestionClassifier classifier;
  private final boolean smartCompletion;

  /**
   * @param catalog supplies the catalog to read; called once per completion request
   * @param classifier classifies the cursor position in smart mode
   * @param smartCompletion default mode when none is passed per call
   */
  public SuggestionRouter(
      Supplier<Catalog> catalog, SuggestionClassifier classifier, boolean smartCompletion) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.smartCompletion = smartCompletion;
  }

  public SuggestionRouter(Catalog catalog, SuggestionClassifier classifier) {
    this(constant(catalog), classifier, true);
  }

  public boolean isSmartCompletion() {
    return smartCompletion;
  }

  /** Completes using the router's default mode. */
  public List<Completion> getCompletions(String fullText, String textBeforeCursor) {
    return getCompletions(fullText, textBeforeCursor, smartCompletion);
  }

  /**
   * Computes the completions for the cursor position.
   *
   * @param fullText the whole buffer
   * @param textBeforeCursor buffer content up to the cursor
   * @param smartMode false to match the plain vocabulary without classification
   * @return candidates from a single consistent view of the catalog, in request order, each
   *     request's candidates sorted; never null
   */
  public List<Completion> getCompletions(
      String fullText, String textBeforeCursor, boolean smartMode) {
    String wordBeforeCursor = CompletionMatcher.wordBeforeCursor(textBeforeCursor);
    return catalog
        .get()
        .read(current -> complete(fullText, textBeforeCursor, wordBeforeCursor, smartMode, current));
  }

  private List<Completion> complete(
      String fullText,
      String textBeforeCursor,
      String wordBeforeCursor,
      boolean smartMode,
      Catalog current) {
    if (!smartMode) {
      return collect(CompletionMatcher.findMatches(wordBeforeCursor, current.vocabulary(), true));
    }

    List<SuggestionRequest> requests = classifier.classify(fullText, textBeforeCursor);
    if (requests == null) {
      return new ArrayList<>();
    }

    List<Completion> completions = new ArrayList<>();
    for (SuggestionRequest request : requests) {
      log.debug("Suggestion type: {}", request.type());
      completions.addAll(collect(complete(request, wordBeforeCursor, current)));
    }
    return completions;
  }

  private Stream<Completion> complete(SuggestionRequest request, String word, Catalog current) {
    return switch (request.type()) {
      case COLUMN -> substring(word, new ScopeResolver(current).resolveColumns(request.scope()));
      case FUNCTION -> anchored(word, current.functionNames());
      case TABLE -> substring(word, current.relationNames(RelationKind.TABLE));
      case VIEW -> substring(word, current.relationNames(RelationKind.VIEW));
      case ALIAS -> substring(word, request.aliases());
      case DATABASE -> substring(word, current.databases());
      case KEYWORD -> anchored(word, current.keywords());
      case SPECIAL -> anchored(word, current.specialCommands());
    };
  }

  private static Stream<Completion> anchored(String word, Collection<String> candidates) {
    return CompletionMatcher.findMatches(word, candidates, true);
  }

  private static Stream<Completion> substring(String word, Collection<String> candidates) {
    return CompletionMatcher.findMatches(word, candidates, false);
  }

  private static List<Completion> collect(Stream<Completion> matches) {
    return matches.collect(Collectors.toCollection(ArrayList::new));
  }

  private static Supplier<Catalog> constant(Catalog catalog) {
    Objects.requireNonNull(catalog, "catalog");
    return () -> catalog;
  }
}
