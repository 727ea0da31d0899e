package io.sqlsh.shell.core.completion;

/** Kind of relation tracked by the {@link Catalog}. Tables and views live in separate maps. */
public enum RelationKind {
  TABLE,
  VIEW
}
