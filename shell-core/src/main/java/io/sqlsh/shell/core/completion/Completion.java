package io.sqlsh.shell.core.completion;

import java.util.Objects;

/**
 * A single completion candidate.
 *
 * @param text the text to insert
 * @param deleteBackCount number of characters before the cursor that {@code text} replaces
 */
public record Completion(String text, int deleteBackCount) {

  public Completion {
    Objects.requireNonNull(text, "text");
    if (deleteBackCount < 0) {
      throw new IllegalArgumentException("deleteBackCount must not be negative: " + deleteBackCount);
    }
  }

  /** Start of the replaced span relative to the cursor (zero or negative). */
  public int startPosition() {
    return -deleteBackCount;
  }
}
