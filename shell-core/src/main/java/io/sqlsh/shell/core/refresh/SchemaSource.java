package io.sqlsh.shell.core.refresh;

import java.util.List;
import java.util.Map;

/**
 * Raw schema rows from the connected database. Implementations run the introspection queries; the
 * {@link CatalogRefresher} turns their rows into a catalog. Names are unescaped.
 */
public interface SchemaSource {

  List<String> databases() throws Exception;

  List<String> tables() throws Exception;

  /** (table name, column name) rows, in column order. */
  List<Map.Entry<String, String>> tableColumns() throws Exception;

  List<String> views() throws Exception;

  /** (view name, column name) rows, in column order. */
  List<Map.Entry<String, String>> viewColumns() throws Exception;

  /** (schema name, function name) rows. */
  List<Map.Entry<String, String>> functions() throws Exception;
}
