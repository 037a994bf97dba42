package io.promptloop.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Built-in {@link ValueParser}s for common value types. */
public final class Parsers {

  // Plain decimal text with an optional exponent. Java literal suffixes and hex floats
  // do not match.
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  // ASCII digits only; the JDK parsers also accept other Unicode digits.
  private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");
  private static final Pattern SPECIAL_FLOAT =
      Pattern.compile("([+-]?)(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

  private static final ValueParser<Integer> INTEGER =
      ValueParser.of("int", text -> Integer.valueOf(integerText(text)));
  private static final ValueParser<Long> LONG =
      ValueParser.of("long", text -> Long.valueOf(integerText(text)));
  private static final ValueParser<Short> SHORT =
      ValueParser.of("short", text -> Short.valueOf(integerText(text)));
  private static final ValueParser<Byte> BYTE =
      ValueParser.of("byte", text -> Byte.valueOf(integerText(text)));
  private static final ValueParser<Double> DOUBLE = ValueParser.of("double", Parsers::toDouble);
  private static final ValueParser<Float> FLOAT = ValueParser.of("float", Parsers::toFloat);
  private static final ValueParser<BigInteger> BIG_INTEGER =
      ValueParser.of("BigInteger", text -> new BigInteger(integerText(text)));
  private static final ValueParser<BigDecimal> BIG_DECIMAL =
      ValueParser.of("BigDecimal", text -> new BigDecimal(decimalText(text)));
  private static final ValueParser<Boolean> BOOL = ValueParser.of("boolean", Parsers::toBoolean);
  private static final ValueParser<Character> CHARACTER =
      ValueParser.of("char", Parsers::toCharacter);
  private static final ValueParser<String> STRING = ValueParser.of("String", text -> text);
  private static final ValueParser<String> NON_EMPTY =
      STRING.validate(s -> !s.isEmpty(), "value must not be empty");

  private Parsers() {}

  public static ValueParser<Integer> integer() {
    return INTEGER;
  }

  public static ValueParser<Long> longInteger() {
    return LONG;
  }

  public static ValueParser<Short> shortInteger() {
    return SHORT;
  }

  public static ValueParser<Byte> byteInteger() {
    return BYTE;
  }

  public static ValueParser<Double> doubleValue() {
    return DOUBLE;
  }

  public static ValueParser<Float> floatValue() {
    return FLOAT;
  }

  public static ValueParser<BigInteger> bigInteger() {
    return BIG_INTEGER;
  }

  public static ValueParser<BigDecimal> bigDecimal() {
    return BIG_DECIMAL;
  }

  /** Accepts exactly {@code true} or {@code false}. */
  public static ValueParser<Boolean> bool() {
    return BOOL;
  }

  /**
   * Accepts exactly one character from the Basic Multilingual Plane. A supplementary code point
   * (a surrogate pair) is rejected since it does not fit in a {@code char}.
   */
  public static ValueParser<Character> character() {
    return CHARACTER;
  }

  /** Accepts any text, including the empty string. */
  public static ValueParser<String> string() {
    return STRING;
  }

  /** Accepts any text except the empty string. */
  public static ValueParser<String> nonEmpty() {
    return NON_EMPTY;
  }

  /**
   * Parser for the constants of an enum, matched case-insensitively by name.
   *
   * @param type the enum class
   * @return a parser for {@code type}
   */
  public static <E extends Enum<E>> ValueParser<E> enumOf(Class<E> type) {
    E[] constants = type.getEnumConstants();
    String allowed =
        Arrays.stream(constants).map(Enum::name).collect(Collectors.joining(", "));
    return ValueParser.of(
        type.getSimpleName(),
        text -> {
          for (E c : constants) {
            if (c.name().equalsIgnoreCase(text)) {
              return c;
            }
          }
          throw new IllegalArgumentException("expected one of: " + allowed);
        });
  }

  private static String integerText(String text) {
    if (text.isEmpty()) {
      throw new NumberFormatException("cannot parse integer from empty string");
    }
    if (!INTEGER_TEXT.matcher(text).matches()) {
      throw new NumberFormatException("invalid digit found in string");
    }
    return text;
  }

  private static String decimalText(String text) {
    if (!DECIMAL.matcher(text).matches()) {
      throw new NumberFormatException("invalid decimal literal");
    }
    return text;
  }

  private static Double toDouble(String text) {
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    return special(text);
  }

  private static Float toFloat(String text) {
    if (DECIMAL.matcher(text).matches()) {
      return Float.parseFloat(text);
    }
    return special(text).floatValue();
  }

  private static Double special(String text) {
    var m = SPECIAL_FLOAT.matcher(text);
    if (!m.matches()) {
      throw new NumberFormatException("invalid float literal");
    }
    if (m.group(2).toLowerCase(Locale.ROOT).equals("nan")) {
      return Double.NaN;
    }
    return "-".equals(m.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
  }

  private static Boolean toBoolean(String text) {
    switch (text) {
      case "true":
        return Boolean.TRUE;
      case "false":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("expected 'true' or 'false'");
    }
  }

  private static Character toCharacter(String text) {
    if (text.isEmpty()) {
      throw new IllegalArgumentException("cannot parse char from empty string");
    }
    int codePoints = text.codePointCount(0, text.length());
    if (codePoints > 1) {
      throw new IllegalArgumentException("too many characters");
    }
    if (text.length() != 1) {
      String hex = Integer.toHexString(text.codePointAt(0)).toUpperCase(Locale.ROOT);
      throw new IllegalArgumentException("code point U+" + hex + " does not fit in a char");
    }
    return text.charAt(0);
  }
}
