package io.promptloop.shell;

import io.promptloop.core.Answers;
import io.promptloop.core.OutputWriter;
import io.promptloop.core.ParserRegistry;
import io.promptloop.core.PromptAbortedException;
import io.promptloop.core.PromptConfig;
import io.promptloop.core.PromptEngine;
import io.promptloop.core.PromptStyle;
import io.promptloop.core.ReaderLineSource;
import io.promptloop.core.ValueParser;
import io.promptloop.core.ValueRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "prompt-loop",
    description = "Ask for typed values until each one parses, then print them one per line",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  static final int EXIT_ABORTED = 1;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  private final Callable<PromptConfig> baseConfig;

  @CommandLine.Option(
      names = {"-a", "--ask"},
      required = true,
      paramLabel = "TYPE:PROMPT",
      description = "Value to ask for, e.g. int:\"Enter a number: \". Repeat for several values.")
  private List<String> asks = new ArrayList<>();

  @CommandLine.Option(
      names = {"--plain"},
      description = "Read standard input directly instead of through the terminal")
  private boolean plain;

  @CommandLine.Option(
      names = {"--style"},
      description = "Prompt style: ${COMPLETION-CANDIDATES}")
  private PromptStyle style;

  @CommandLine.Option(
      names = {"--max-attempts"},
      description = "Give up after this many invalid inputs (0 = never)")
  private Integer maxAttempts;

  @CommandLine.Option(
      names = {"--no-trim"},
      description = "Keep surrounding whitespace")
  private boolean noTrim;

  public Main() {
    this(PromptConfig::load);
  }

  /** Uses {@code baseConfig} instead of the user's settings file and environment. */
  Main(Callable<PromptConfig> baseConfig) {
    this.baseConfig = baseConfig;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    PromptConfig config = effectiveConfig();
    ParserRegistry registry = ParserRegistry.discover();
    List<ValueRequest<?>> requests = new ArrayList<>();
    for (String ask : asks) {
      requests.add(toRequest(registry, ask));
    }
    log.debug("Asking for {} value(s) with {}", requests.size(), config);

    if (plain) {
      // prompts and diagnostics on stderr keep stdout to the answers alone
      OutputWriter prompts = OutputWriter.forPrintStream(System.err);
      PromptEngine engine =
          PromptEngine.builder()
              .lineSource(ReaderLineSource.stdin())
              .output(prompts)
              .config(config)
              .registry(registry)
              .build();
      return run(engine, requests, OutputWriter.system());
    }

    try (JLineConsole console = JLineConsole.system()) {
      PromptEngine engine =
          PromptEngine.builder()
              .lineSource(console)
              .output(console)
              .config(config)
              .registry(registry)
              .build();
      return run(engine, requests, console);
    }
  }

  private int run(PromptEngine engine, List<ValueRequest<?>> requests, OutputWriter results) {
    Answers answers;
    try {
      answers = engine.requestAll(requests);
    } catch (PromptAbortedException e) {
      for (Object value : e.partialAnswers().asList()) {
        results.println(String.valueOf(value));
      }
      results.error("Aborted: " + e.getMessage());
      log.debug("Aborted with reason {}", e.getReason());
      return EXIT_ABORTED;
    }
    for (Object value : answers.asList()) {
      results.println(String.valueOf(value));
    }
    return 0;
  }

  private PromptConfig effectiveConfig() throws Exception {
    PromptConfig config = baseConfig.call();
    if (style != null) {
      config = config.withStyle(style);
    }
    if (noTrim) {
      config = config.withTrimInput(false);
    }
    if (maxAttempts != null) {
      if (maxAttempts < 0) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "--max-attempts must be >= 0: " + maxAttempts);
      }
      config = config.withMaxAttempts(maxAttempts);
    }
    return config;
  }

  private ValueRequest<?> toRequest(ParserRegistry registry, String ask) {
    int colon = ask.indexOf(':');
    if (colon <= 0) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "Expected TYPE:PROMPT but got '" + ask + "'");
    }
    String typeName = ask.substring(0, colon);
    String prompt = ask.substring(colon + 1);
    ValueParser<?> parser =
        registry
            .find(typeName)
            .orElseThrow(
                () ->
                    new CommandLine.ParameterException(
                        spec.commandLine(),
                        "Unknown type '"
                            + typeName
                            + "'. Known types: "
                            + String.join(", ", registry.names())));
    return ValueRequest.of(parser, prompt);
  }
}
