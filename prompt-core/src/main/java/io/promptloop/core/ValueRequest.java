package io.promptloop.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Describes one value to ask for: how to parse it, what to show, and optionally how to react to
 * bad input.
 *
 * @param parser parse capability of the target type
 * @param prompt text displayed before every attempt; may be empty
 * @param handler custom error handler, or {@code null} for the engine's default
 * @param <T> the requested type
 */
public record ValueRequest<T>(ValueParser<T> parser, String prompt, ErrorHandler handler) {

  public ValueRequest {
    Objects.requireNonNull(parser, "parser");
    Objects.requireNonNull(prompt, "prompt");
  }

  public static <T> ValueRequest<T> of(ValueParser<T> parser, String prompt) {
    return new ValueRequest<>(parser, prompt, null);
  }

  public static <T> ValueRequest<T> of(
      ValueParser<T> parser, String prompt, ErrorHandler handler) {
    return new ValueRequest<>(parser, prompt, Objects.requireNonNull(handler, "handler"));
  }

  /** Returns a copy of this request using {@code handler} instead of the default. */
  public ValueRequest<T> withHandler(ErrorHandler handler) {
    return of(parser, prompt, handler);
  }

  public Optional<ErrorHandler> customHandler() {
    return Optional.ofNullable(handler);
  }

  public String typeName() {
    return parser.typeName();
  }
}
