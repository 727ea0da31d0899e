package io.sqlsh.shell.core.completion;

import java.util.List;

/**
 * Built-in SQL vocabulary every {@link Catalog} starts from. These lists are immutable; per-session
 * additions go through {@link Catalog#extendKeywords}.
 */
public final class SqlVocabulary {

  /** SQL keywords, including the multi-word forms offered as a single completion. */
  public static final List<String> KEYWORDS =
      List.of(
          "ACCESS", "ADD", "ALL", "ALTER TABLE", "AND", "ANY", "AS", "ASC", "AUDIT", "BETWEEN",
          "BY", "CASE", "CHAR", "CHECK", "CLUSTER", "COLUMN", "COMMENT", "COMPRESS", "CONNECT",
          "COPY", "CREATE", "CURRENT", "DATABASE", "DATE", "DECIMAL", "DEFAULT", "DELETE FROM",
          "DELIMITER", "DESC", "DESCRIBE", "DISTINCT", "DROP", "ELSE", "ENCODING", "ESCAPE",
          "EXCLUSIVE", "EXISTS", "EXTENSION", "FILE", "FLOAT", "FOR", "FORMAT", "FORCE_QUOTE",
          "FORCE_NOT_NULL", "FREEZE", "FROM", "FULL", "FUNCTION", "GRANT", "GROUP BY", "HAVING",
          "HEADER", "IDENTIFIED", "IMMEDIATE", "IN", "INCREMENT", "INDEX", "INITIAL",
          "INSERT INTO", "INTEGER", "INTERSECT", "INTO", "IS", "JOIN", "LEFT", "LEVEL", "LIKE",
          "LIMIT", "LOCK", "LONG", "MAXEXTENTS", "MINUS", "MLSLABEL", "MODE", "MODIFY",
          "NOAUDIT", "NOCOMPRESS", "NOT", "NOWAIT", "NULL", "NUMBER", "OIDS", "OF", "OFFLINE",
          "ON", "ONLINE", "OPTION", "OR", "ORDER BY", "OUTER", "OWNER", "PCTFREE", "PRIMARY",
          "PRIOR", "PRIVILEGES", "QUOTE", "RAW", "RENAME", "RESOURCE", "REVOKE", "RIGHT", "ROW",
          "ROWID", "ROWNUM", "ROWS", "SELECT", "SESSION", "SET", "SHARE", "SIZE", "SMALLINT",
          "START", "SUCCESSFUL", "SYNONYM", "SYSDATE", "TABLE", "TEMPLATE", "THEN", "TO",
          "TRIGGER", "UID", "UNION", "UNIQUE", "UPDATE", "USE", "USER", "VALIDATE", "VALUES",
          "VARCHAR", "VARCHAR2", "VIEW", "WHEN", "WHENEVER", "WHERE", "WITH");

  /** Built-in aggregate and scalar functions. */
  public static final List<String> FUNCTIONS =
      List.of(
          "AVG", "COUNT", "DISTINCT", "FIRST", "FORMAT", "LAST", "LCASE", "LEN", "MAX", "MIN",
          "MID", "NOW", "ROUND", "SUM", "TOP", "UCASE");

  private SqlVocabulary() {}
}
