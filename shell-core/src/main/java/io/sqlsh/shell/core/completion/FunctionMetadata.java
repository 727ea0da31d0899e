package io.sqlsh.shell.core.completion;

/**
 * Value stored per function in the {@link Catalog}. Only the name is completed today, so a single
 * placeholder stands in for signatures and return types.
 */
public enum FunctionMetadata {
  PLACEHOLDER
}
