package io.sqlsh.shell.core.completion;

import java.util.List;

/**
 * Decides what kinds of names may appear at the cursor. Implementations inspect the raw SQL; the
 * completion core only consumes their output.
 */
@FunctionalInterface
public interface SuggestionClassifier {

  /**
   * Classifies the cursor position.
   *
   * @param fullText the whole buffer
   * @param textBeforeCursor buffer content up to the cursor
   * @return requests in the order their candidates should be listed; empty if nothing applies
   */
  List<SuggestionRequest> classify(String fullText, String textBeforeCursor);
}
