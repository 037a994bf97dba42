package io.promptloop.core;

import java.util.Objects;

/**
 * Policy invoked exactly once for every failed parse attempt, before the engine prompts again.
 *
 * <p>The engine's default policy is {@link #reporting(OutputWriter)}. Passing a handler with a
 * request replaces the default for that request only.
 */
@FunctionalInterface
public interface ErrorHandler {

  /** Diagnostic printed by {@link #reporting(OutputWriter)}. */
  String DEFAULT_FORMAT = "Invalid input '%s'. Expected type: %s. Error: %s";

  void onParseFailure(ParseFailure failure);

  /**
   * Handler writing {@code Invalid input '<input>'. Expected type: <type>. Error: <message>} to
   * the error channel of {@code out}.
   */
  static ErrorHandler reporting(OutputWriter out) {
    Objects.requireNonNull(out, "out");
    return failure ->
        out.error(
            String.format(
                DEFAULT_FORMAT, failure.input(), failure.expectedType(), failure.message()));
  }

  /** Handler that does nothing. The engine still prompts again. */
  static ErrorHandler silent() {
    return failure -> {};
  }

  /** Returns a handler running this handler and then {@code next}. */
  default ErrorHandler andThen(ErrorHandler next) {
    Objects.requireNonNull(next, "next");
    return failure -> {
      onParseFailure(failure);
      next.onParseFailure(failure);
    };
  }
}
