package com.github.ccs;

/**
 * Front end from the textual input language to terms and environments.
 *
 * A specification is a sequence of definitions {@code Name = expression}. Expressions are built
 * from {@code 0}, prefixes {@code a.P}, {@code a'.P} and {@code tau.P}, choice {@code P + Q},
 * parallel composition {@code P | Q}, restriction {@code P \ a \ b}, relabeling {@code P[a/b]},
 * parentheses and process names. The name {@code _} defines an anonymous process that cannot be
 * referenced.
 */
public interface SpecificationParser {

  /**
   * Parse a whole specification. The result is a validated environment.
   *
   * @throws CcsException with {@link CcsException.Code#SYNTAX_ERROR} on malformed text, or with
   *         the code of the failed validation
   */
  Environment parse(final String specification) throws CcsException;

  /**
   * Parse a single process expression. Names it refers to are not checked.
   */
  Process parseProcess(final String expression) throws CcsException;
}
