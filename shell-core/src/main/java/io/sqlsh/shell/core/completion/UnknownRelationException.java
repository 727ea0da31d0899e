package io.sqlsh.shell.core.completion;

import java.util.Locale;

/**
 * Thrown when columns are added for a relation that was never registered with {@link
 * Catalog#extendRelations}. Signals a misordered schema load.
 */
public final class UnknownRelationException extends RuntimeException {
  private final String relationName;
  private final RelationKind kind;

  public UnknownRelationException(String relationName, RelationKind kind) {
    super(
        String.format(
            "Cannot add columns to unregistered %s '%s'",
            kind.name().toLowerCase(Locale.ROOT), relationName));
    this.relationName = relationName;
    this.kind = kind;
  }

  /** The escaped relation name that was not found. */
  public String getRelationName() {
    return relationName;
  }

  public RelationKind getKind() {
    return kind;
  }
}
