package io.sqlsh.shell.core.completion;

/**
 * What kind of name the classifier expects at the cursor. Each type maps to one candidate source
 * in {@link SuggestionRouter}.
 */
public enum SuggestionType {
  /** Columns of the relations in scope - after SELECT, WHERE, ON, etc. */
  COLUMN,

  /** Function names - anchored matching */
  FUNCTION,

  /** Table names - after FROM, JOIN, INTO */
  TABLE,

  /** View names */
  VIEW,

  /** Table aliases declared in the statement */
  ALIAS,

  /** Database names - after USE */
  DATABASE,

  /** SQL keywords - anchored matching */
  KEYWORD,

  /** Shell meta-commands, only at the start of a line */
  SPECIAL
}
