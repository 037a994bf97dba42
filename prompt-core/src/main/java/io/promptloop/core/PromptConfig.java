package io.promptloop.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings. Loads from {@code ~/.prompt-loop/prompt.properties} by default, then applies
 * environment variables and system properties on top, later sources winning:
 *
 * <ol>
 *   <li>defaults
 *   <li>properties file keys {@code style}, {@code trim}, {@code maxAttempts}
 *   <li>{@code PROMPT_LOOP_STYLE}, {@code PROMPT_LOOP_TRIM}, {@code PROMPT_LOOP_MAX_ATTEMPTS}
 *   <li>{@code prompt.style}, {@code prompt.trim}, {@code prompt.maxAttempts} system properties
 * </ol>
 *
 * <p>Malformed values are ignored with a warning.
 *
 * @param style how prompts are rendered
 * @param trimInput whether surrounding whitespace is stripped before parsing
 * @param maxAttempts maximum parse attempts per request; {@code 0} retries without limit
 */
public record PromptConfig(PromptStyle style, boolean trimInput, int maxAttempts) {
  private static final Logger log = LoggerFactory.getLogger(PromptConfig.class);

  /** Value of {@link #maxAttempts()} meaning "retry until a value parses". */
  public static final int UNBOUNDED = 0;

  public PromptConfig {
    if (style == null) {
      throw new IllegalArgumentException("style must not be null");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
    }
  }

  /**
   * Creates default configuration: plain prompts, trimmed input, unbounded retry.
   *
   * @return default configuration
   */
  public static PromptConfig defaults() {
    return new PromptConfig(PromptStyle.PLAIN, true, UNBOUNDED);
  }

  /**
   * Loads configuration from the default file, environment and system properties.
   *
   * @return loaded configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static PromptConfig load() throws IOException {
    return load(getConfigPath(), System.getenv(), System.getProperties());
  }

  /**
   * Loads configuration from explicit sources.
   *
   * @param configPath properties file; skipped if it does not exist
   * @param env environment variables
   * @param sysProps system properties
   * @return loaded configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static PromptConfig load(Path configPath, Map<String, String> env, Properties sysProps)
      throws IOException {
    PromptConfig config = defaults();
    if (configPath != null && Files.exists(configPath)) {
      Properties props = new Properties();
      try (var reader = Files.newBufferedReader(configPath)) {
        props.load(reader);
      }
      config =
          config.apply(
              props.getProperty("style"),
              props.getProperty("trim"),
              props.getProperty("maxAttempts"),
              configPath.toString());
    }
    config =
        config.apply(
            env.get("PROMPT_LOOP_STYLE"),
            env.get("PROMPT_LOOP_TRIM"),
            env.get("PROMPT_LOOP_MAX_ATTEMPTS"),
            "environment");
    return config.apply(
        sysProps.getProperty("prompt.style"),
        sysProps.getProperty("prompt.trim"),
        sysProps.getProperty("prompt.maxAttempts"),
        "system properties");
  }

  /**
   * Gets the path to the configuration file.
   *
   * @return configuration file path
   */
  public static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".prompt-loop", "prompt.properties");
  }

  public PromptConfig withStyle(PromptStyle style) {
    return new PromptConfig(style, trimInput, maxAttempts);
  }

  public PromptConfig withTrimInput(boolean trimInput) {
    return new PromptConfig(style, trimInput, maxAttempts);
  }

  public PromptConfig withMaxAttempts(int maxAttempts) {
    return new PromptConfig(style, trimInput, maxAttempts);
  }

  public boolean isBounded() {
    return maxAttempts != UNBOUNDED;
  }

  private PromptConfig apply(String style, String trim, String maxAttempts, String origin) {
    PromptStyle newStyle = this.style;
    boolean newTrim = this.trimInput;
    int newMax = this.maxAttempts;

    if (style != null && !style.isBlank()) {
      try {
        newStyle = PromptStyle.valueOf(style.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        log.warn("Ignoring unknown prompt style '{}' from {}", style, origin);
      }
    }
    if (trim != null && !trim.isBlank()) {
      String v = trim.trim().toLowerCase(Locale.ROOT);
      if (v.equals("1") || v.equals("on") || v.equals("true")) {
        newTrim = true;
      } else if (v.equals("0") || v.equals("off") || v.equals("false")) {
        newTrim = false;
      } else {
        log.warn("Ignoring trim setting '{}' from {}", trim, origin);
      }
    }
    if (maxAttempts != null && !maxAttempts.isBlank()) {
      try {
        int parsed = Integer.parseInt(maxAttempts.trim());
        if (parsed < 0) {
          log.warn("Ignoring negative maxAttempts {} from {}", parsed, origin);
        } else {
          newMax = parsed;
        }
      } catch (NumberFormatException e) {
        log.warn("Ignoring maxAttempts '{}' from {}", maxAttempts, origin);
      }
    }
    return new PromptConfig(newStyle, newTrim, newMax);
  }
}
