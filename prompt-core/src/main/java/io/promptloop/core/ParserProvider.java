package io.promptloop.core;

/**
 * Service Provider Interface for contributing parsers of custom domain types. Providers are
 * discovered via {@link java.util.ServiceLoader} when a {@link ParserRegistry} is created with
 * {@link ParserRegistry#discover()}.
 */
public interface ParserProvider {

  /**
   * Registers this provider's parsers.
   *
   * @param registry the registry to add parsers to
   */
  void register(ParserRegistry registry);

  /**
   * Returns the priority of this provider. Providers registering the same type or name later win,
   * and higher priority providers are applied last.
   *
   * @return priority value (default 0)
   */
  default int getPriority() {
    return 0;
  }
}
