package io.promptloop.core;

/**
 * Thrown when text cannot be converted to the requested type. The engine always recovers from it
 * by invoking the request's error handler and prompting again.
 */
public class ValueParseException extends Exception {

  private final String input;
  private final String expectedType;

  /**
   * Creates a new parse exception.
   *
   * @param input the text that failed to parse
   * @param expectedType display name of the target type
   * @param message why the text was rejected
   */
  public ValueParseException(String input, String expectedType, String message) {
    super(message);
    this.input = input;
    this.expectedType = expectedType;
  }

  /**
   * Creates a new parse exception with a cause.
   *
   * @param input the text that failed to parse
   * @param expectedType display name of the target type
   * @param message why the text was rejected
   * @param cause the underlying conversion failure
   */
  public ValueParseException(
      String input, String expectedType, String message, Throwable cause) {
    super(message, cause);
    this.input = input;
    this.expectedType = expectedType;
  }

  public String getInput() {
    return input;
  }

  public String getExpectedType() {
    return expectedType;
  }
}
