package io.promptloop.core;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Converts a line of text into a value of type {@code T}, or explains why it cannot.
 *
 * <p>This is the only capability the prompt engine needs from a target type. Built-in parsers for
 * numbers, booleans, characters, strings and enums live in {@link Parsers}; custom domain types
 * can be adapted with {@link #of(String, Conversion)} or derived from an existing parser with
 * {@link #map(String, Function)} and {@link #validate(Predicate, String)}.
 *
 * @param <T> the parsed type
 */
public interface ValueParser<T> {

  /**
   * Parses the given text.
   *
   * @param text the input text, already stripped of its line terminator
   * @return the parsed value, never {@code null}
   * @throws ValueParseException if the text is not a valid {@code T}
   */
  T parse(String text) throws ValueParseException;

  /** Display name of the target type, used in prompts and diagnostics (e.g. {@code "int"}). */
  String typeName();

  /** A conversion function that may throw any exception on bad input. */
  @FunctionalInterface
  interface Conversion<T> {
    T convert(String text) throws Exception;
  }

  /**
   * Adapts a conversion function. Any exception it throws (for example {@link
   * NumberFormatException}) becomes a {@link ValueParseException}, as does a {@code null} result.
   *
   * @param typeName display name of the target type
   * @param conversion the conversion
   * @return a parser delegating to {@code conversion}
   */
  static <T> ValueParser<T> of(String typeName, Conversion<T> conversion) {
    Objects.requireNonNull(typeName, "typeName");
    Objects.requireNonNull(conversion, "conversion");
    return new ValueParser<>() {
      @Override
      public T parse(String text) throws ValueParseException {
        T value;
        try {
          value = conversion.convert(text);
        } catch (ValueParseException e) {
          throw e;
        } catch (Exception e) {
          String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
          throw new ValueParseException(text, typeName, msg, e);
        }
        if (value == null) {
          throw new ValueParseException(text, typeName, "no value");
        }
        return value;
      }

      @Override
      public String typeName() {
        return typeName;
      }

      @Override
      public String toString() {
        return "ValueParser[" + typeName + "]";
      }
    };
  }

  /**
   * Returns a parser that converts the result of this parser. Exceptions thrown by {@code fn} are
   * reported as parse failures of the new type.
   */
  default <R> ValueParser<R> map(String typeName, Function<? super T, ? extends R> fn) {
    ValueParser<T> self = this;
    return of(typeName, text -> fn.apply(self.parse(text)));
  }

  /**
   * Returns a parser that additionally rejects values failing {@code predicate}.
   *
   * @param predicate acceptance test for parsed values
   * @param message diagnostic used when the predicate fails
   */
  default ValueParser<T> validate(Predicate<? super T> predicate, String message) {
    ValueParser<T> self = this;
    return of(
        typeName(),
        text -> {
          T value = self.parse(text);
          if (!predicate.test(value)) {
            throw new ValueParseException(text, self.typeName(), message);
          }
          return value;
        });
  }
}
