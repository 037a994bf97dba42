package io.promptloop.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up {@link ValueParser}s by Java type or by type name.
 *
 * <p>Names are case-insensitive. The built-in set understands Java names ({@code int}, {@code
 * double}, {@code boolean}, {@code String}) as well as the short fixed-width spellings used on the
 * command line ({@code i32}, {@code i64}, {@code f32}, {@code f64}, {@code bool}).
 */
public final class ParserRegistry {
  private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

  private final Map<Class<?>, ValueParser<?>> byType = new LinkedHashMap<>();
  private final Map<String, ValueParser<?>> byName = new LinkedHashMap<>();

  private ParserRegistry() {}

  /** Creates a registry holding only the built-in parsers. */
  public static ParserRegistry builtIn() {
    ParserRegistry registry = new ParserRegistry();
    registry.registerBuiltIns();
    return registry;
  }

  /** Creates a registry holding the built-in parsers plus those of discovered providers. */
  public static ParserRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  /**
   * Creates a registry holding the built-in parsers plus those of providers visible to the given
   * class loader.
   *
   * @param classLoader loader used for {@link ServiceLoader} lookup
   * @return the populated registry
   */
  public static ParserRegistry discover(ClassLoader classLoader) {
    if (classLoader == null) {
      classLoader = ParserRegistry.class.getClassLoader();
    }
    ParserRegistry registry = builtIn();
    List<ParserProvider> providers = new ArrayList<>();
    for (ParserProvider provider : ServiceLoader.load(ParserProvider.class, classLoader)) {
      providers.add(provider);
    }
    providers.sort(Comparator.comparingInt(ParserProvider::getPriority));
    for (ParserProvider provider : providers) {
      log.debug("Registering parsers from {}", provider.getClass().getName());
      provider.register(registry);
    }
    return registry;
  }

  private void registerBuiltIns() {
    register(Integer.class, Parsers.integer(), "int", "integer", "i32");
    register(int.class, Parsers.integer());
    register(Long.class, Parsers.longInteger(), "long", "i64");
    register(long.class, Parsers.longInteger());
    register(Short.class, Parsers.shortInteger(), "short", "i16");
    register(short.class, Parsers.shortInteger());
    register(Byte.class, Parsers.byteInteger(), "byte", "i8");
    register(byte.class, Parsers.byteInteger());
    register(Double.class, Parsers.doubleValue(), "double", "f64");
    register(double.class, Parsers.doubleValue());
    register(Float.class, Parsers.floatValue(), "float", "f32");
    register(float.class, Parsers.floatValue());
    register(BigInteger.class, Parsers.bigInteger(), "biginteger", "bigint");
    register(BigDecimal.class, Parsers.bigDecimal(), "bigdecimal", "decimal");
    register(Boolean.class, Parsers.bool(), "boolean", "bool");
    register(boolean.class, Parsers.bool());
    register(Character.class, Parsers.character(), "char", "character");
    register(char.class, Parsers.character());
    register(String.class, Parsers.string(), "string", "str");
  }

  /**
   * Registers a parser for a type and any number of names, replacing earlier registrations.
   *
   * @param type the Java type produced by the parser
   * @param parser the parser
   * @param names additional lookup names
   * @return this registry
   */
  public <T> ParserRegistry register(
      Class<T> type, ValueParser<? extends T> parser, String... names) {
    byType.put(type, parser);
    for (String name : names) {
      register(name, parser);
    }
    return this;
  }

  /**
   * Registers a parser under a name only.
   *
   * @param name lookup name (case-insensitive)
   * @param parser the parser
   * @return this registry
   */
  public ParserRegistry register(String name, ValueParser<?> parser) {
    byName.put(name.toLowerCase(Locale.ROOT), parser);
    return this;
  }

  /**
   * Finds the parser for a Java type. Enum types without an explicit registration get a
   * name-matching parser.
   *
   * @param type the requested type
   * @return optional containing the parser if one is known
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public <T> Optional<ValueParser<T>> find(Class<T> type) {
    ValueParser<?> parser = byType.get(type);
    if (parser == null && type.isEnum()) {
      parser = Parsers.enumOf((Class) type);
    }
    return Optional.ofNullable((ValueParser<T>) parser);
  }

  /**
   * Finds the parser registered under a name.
   *
   * @param name the type name (case-insensitive)
   * @return optional containing the parser if one is known
   */
  public Optional<ValueParser<?>> find(String name) {
    return Optional.ofNullable(byName.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Gets the parser for a Java type.
   *
   * @throws IllegalArgumentException if no parser is registered for {@code type}
   */
  public <T> ValueParser<T> get(Class<T> type) {
    return find(type)
        .orElseThrow(
            () -> new IllegalArgumentException("No parser registered for type " + type.getName()));
  }

  /**
   * Gets the parser registered under a name.
   *
   * @throws IllegalArgumentException if no parser is registered under {@code name}
   */
  public ValueParser<?> get(String name) {
    return find(name)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown type '" + name + "'. Known types: " + String.join(", ", names())));
  }

  /** Returns all registered names, in registration order. */
  public Set<String> names() {
    return Collections.unmodifiableSet(byName.keySet());
  }
}
