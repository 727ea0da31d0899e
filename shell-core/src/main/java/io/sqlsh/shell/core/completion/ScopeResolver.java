package io.sqlsh.shell.core.completion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Expands a column scope into the columns of its relations. */
public final class ScopeResolver {
  private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

  private final Catalog catalog;

  public ScopeResolver(Catalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * Collects the columns of every relation in {@code scope}.
   *
   * <p>Each entry is looked up by its {@link TableRef#relationName()}, so an alias resolves through
   * the table it stands for. Lookup checks tables first and views second, so a table shadows a view
   * of the same name. References found in neither are skipped. Columns are returned in scope order
   * and are not deduplicated: a column shared by two joined relations appears twice.
   *
   * @param scope relations visible at the cursor
   * @return column names, each relation's list starting with {@link Catalog#UNKNOWN_COLUMNS}
   */
  public List<String> resolveColumns(List<TableRef> scope) {
    log.debug("Completion column scope: {}", scope);
    return catalog.read(c -> collect(scope));
  }

  private List<String> collect(List<TableRef> scope) {
    List<String> columns = new ArrayList<>();
    for (TableRef ref : scope) {
      String relation = NameCodec.escape(ref.relationName());
      Optional<List<String>> found = catalog.columns(RelationKind.TABLE, relation);
      if (found.isEmpty()) {
        found = catalog.columns(RelationKind.VIEW, relation);
      }
      found.ifPresentOrElse(
          columns::addAll, () -> log.debug("No relation named {} in scope", relation));
    }
    return columns;
  }
}
