package io.sqlsh.shell.core.completion;

import java.util.Objects;

/**
 * A relation in the column scope of a statement.
 *
 * @param table the relation name as written in the FROM clause, may be null when unknown
 * @param reference the name columns are qualified with: the alias if one was given, else the
 *     table name
 */
public record TableRef(String table, String reference) {

  public TableRef {
    Objects.requireNonNull(reference, "reference");
  }

  /** The name to look up in the catalog: the table name, or the reference if it is unknown. */
  public String relationName() {
    return table != null ? table : reference;
  }

  /** Creates a reference that resolves through {@code alias}, or through {@code table} if null. */
  public static TableRef of(String table, String alias) {
    return new TableRef(table, alias != null ? alias : table);
  }
}
