package io.promptloop.core;

/**
 * A single failed parse attempt, as handed to an {@link ErrorHandler}.
 *
 * @param input the offending text, after stripping
 * @param expectedType display name of the requested type
 * @param attempt 1-based number of the attempt that failed
 * @param cause the parser's explanation
 */
public record ParseFailure(
    String input, String expectedType, int attempt, ValueParseException cause) {

  /** The parser's description of what was wrong with the input. */
  public String message() {
    return cause.getMessage();
  }
}
