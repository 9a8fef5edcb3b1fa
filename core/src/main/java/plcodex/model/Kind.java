//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.model;

/**
 * Denotes the different kinds of program units that appear in structured text.
 */
public enum Kind {

  /** A function block: a type with state, methods, actions and properties. */
  FUNCTION_BLOCK,

  /** A program: a singleton function block scheduled by a task. */
  PROGRAM,

  /** A stateless function. */
  FUNCTION,

  /** A method of a function block or program. */
  METHOD,

  /** A property of a function block or program. */
  PROPERTY,

  /** A parameterless body of code belonging to a function block or program. */
  ACTION,

  /** A {@code TYPE} declaration: structs, enumerations and aliases. */
  DATA_TYPE,

  /** A list of global variables. */
  GLOBAL_VARIABLES;
}
