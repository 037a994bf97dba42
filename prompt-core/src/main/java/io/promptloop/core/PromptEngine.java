package io.promptloop.core;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prompts for typed values: prints a prompt, reads a line, parses it and, on bad input, reports
 * the problem and asks again until a value parses.
 *
 * <p>Each request moves through {@code Prompting -> Reading -> Parsing} and ends in exactly one of
 * two ways:
 *
 * <ul>
 *   <li>a successfully parsed value is returned, or
 *   <li>a {@link PromptAbortedException} is thrown because the {@link LineSource} reported end of
 *       input, a read failure or an interrupt.
 * </ul>
 *
 * <p>Parse failures never escape. Each one invokes the request's {@link ErrorHandler} (or the
 * engine's default, {@link ErrorHandler#reporting(OutputWriter)}) exactly once and the same prompt
 * is shown again. Retry is unbounded unless {@link PromptConfig#maxAttempts()} sets a limit.
 *
 * <p>An engine holds its lock for the whole of a request or sequence, so concurrent callers never
 * interleave prompts and reads on the same channel. Engines sharing a channel must share a lock;
 * see {@link Builder#lock(ReentrantLock)}.
 */
public final class PromptEngine {
  private static final Logger log = LoggerFactory.getLogger(PromptEngine.class);

  // Guards the process-wide System.in / System.out pair.
  private static final ReentrantLock CONSOLE_LOCK = new ReentrantLock();

  private final LineSource source;
  private final OutputWriter out;
  private final PromptConfig config;
  private final ParserRegistry registry;
  private final ErrorHandler defaultHandler;
  private final ReentrantLock lock;

  private PromptEngine(Builder builder) {
    this.source = Objects.requireNonNull(builder.source, "lineSource");
    this.out = Objects.requireNonNull(builder.out, "output");
    this.config = builder.config != null ? builder.config : PromptConfig.defaults();
    this.registry = builder.registry != null ? builder.registry : ParserRegistry.builtIn();
    this.defaultHandler =
        builder.defaultHandler != null ? builder.defaultHandler : ErrorHandler.reporting(out);
    this.lock = builder.lock != null ? builder.lock : new ReentrantLock();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Engine over standard input and output with default settings. */
  public static PromptEngine console() {
    return console(PromptConfig.defaults());
  }

  /**
   * Engine over standard input and output. All console engines share one lock.
   *
   * @param config engine settings
   * @return the engine
   */
  public static PromptEngine console(PromptConfig config) {
    return builder()
        .lineSource(ReaderLineSource.stdin())
        .output(OutputWriter.system())
        .config(config)
        .registry(ParserRegistry.discover())
        .lock(CONSOLE_LOCK)
        .build();
  }

  /**
   * Requests one value.
   *
   * @param request what to ask for
   * @return the parsed value
   * @throws PromptAbortedException if the input stream ends or fails before a value parses
   */
  public <T> T request(ValueRequest<T> request) throws PromptAbortedException {
    Objects.requireNonNull(request, "request");
    lock.lock();
    try {
      return runLoop(request);
    } finally {
      lock.unlock();
    }
  }

  public <T> T request(ValueParser<T> parser, String prompt) throws PromptAbortedException {
    return request(ValueRequest.of(parser, prompt));
  }

  public <T> T request(ValueParser<T> parser, String prompt, ErrorHandler handler)
      throws PromptAbortedException {
    return request(ValueRequest.of(parser, prompt, handler));
  }

  /**
   * Requests one value using the registered parser for {@code type}.
   *
   * @throws IllegalArgumentException if no parser is registered for {@code type}
   */
  public <T> T request(Class<T> type, String prompt) throws PromptAbortedException {
    return request(ValueRequest.of(registry.get(type), prompt));
  }

  /**
   * Requests several values in order. Each request runs its own retry loop to completion before
   * the next one starts.
   *
   * @param requests the requests, in order
   * @return the values, in request order
   * @throws PromptAbortedException if the input stream ends or fails; values obtained so far are
   *     available from {@link PromptAbortedException#partialAnswers()}
   */
  public Answers requestAll(List<? extends ValueRequest<?>> requests)
      throws PromptAbortedException {
    RequestSequence sequence = sequence();
    for (ValueRequest<?> request : requests) {
      sequence.add(request);
    }
    return sequence.run();
  }

  /** Starts building an ordered sequence of requests. */
  public RequestSequence sequence() {
    return new RequestSequence(this);
  }

  /**
   * Runs a request on {@code executor}. A stream failure completes the returned future
   * exceptionally with the {@link PromptAbortedException}.
   *
   * @param request what to ask for
   * @param executor where to run the blocking loop
   * @return future completed with the parsed value
   */
  public <T> CompletableFuture<T> requestAsync(ValueRequest<T> request, Executor executor) {
    Objects.requireNonNull(request, "request");
    CompletableFuture<T> future = new CompletableFuture<>();
    executor.execute(
        () -> {
          try {
            future.complete(request(request));
          } catch (PromptAbortedException | RuntimeException e) {
            future.completeExceptionally(e);
          }
        });
    return future;
  }

  public PromptConfig config() {
    return config;
  }

  public ParserRegistry registry() {
    return registry;
  }

  ReentrantLock lock() {
    return lock;
  }

  /** Runs one request's loop. Callers hold {@link #lock}. */
  <T> T runLoop(ValueRequest<T> request) throws PromptAbortedException {
    ErrorHandler handler = request.customHandler().orElse(defaultHandler);
    String typeName = request.typeName();
    String rendered = config.style().render(request.prompt(), typeName);

    int attempt = 0;
    while (true) {
      attempt++;
      if (!rendered.isEmpty()) {
        out.print(rendered);
      }

      String raw;
      try {
        raw = source.readLine();
        if (raw == null) {
          throw LineSourceException.endOfInput();
        }
      } catch (LineSourceException e) {
        log.debug("Aborting {} request on attempt {}: {}", typeName, attempt, e.getKind());
        throw PromptAbortedException.fromStream(e);
      }

      String text = strip(raw);
      try {
        T value = request.parser().parse(text);
        log.debug("Parsed {} on attempt {}", typeName, attempt);
        return value;
      } catch (ValueParseException e) {
        log.debug("Attempt {} rejected as {}: {}", attempt, typeName, e.getMessage());
        handler.onParseFailure(new ParseFailure(text, typeName, attempt, e));
        if (config.isBounded() && attempt >= config.maxAttempts()) {
          log.warn("Giving up on {} after {} attempts", typeName, attempt);
          throw new PromptAbortedException(
              PromptAbortedException.Reason.ATTEMPTS_EXHAUSTED,
              "No valid " + typeName + " after " + attempt + " attempts",
              e);
        }
      }
    }
  }

  private String strip(String raw) {
    String text = raw;
    if (text.endsWith("\r\n")) {
      text = text.substring(0, text.length() - 2);
    } else if (text.endsWith("\n") || text.endsWith("\r")) {
      text = text.substring(0, text.length() - 1);
    }
    return config.trimInput() ? text.strip() : text;
  }

  /** Builder for {@link PromptEngine}. Line source and output are required. */
  public static final class Builder {
    private LineSource source;
    private OutputWriter out;
    private PromptConfig config;
    private ParserRegistry registry;
    private ErrorHandler defaultHandler;
    private ReentrantLock lock;

    private Builder() {}

    public Builder lineSource(LineSource source) {
      this.source = source;
      return this;
    }

    public Builder output(OutputWriter out) {
      this.out = out;
      return this;
    }

    public Builder config(PromptConfig config) {
      this.config = config;
      return this;
    }

    public Builder registry(ParserRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** Replaces the engine-wide default handler. Requests may still override it. */
    public Builder defaultHandler(ErrorHandler defaultHandler) {
      this.defaultHandler = defaultHandler;
      return this;
    }

    /** Shares a lock with other engines using the same channels. */
    public Builder lock(ReentrantLock lock) {
      this.lock = lock;
      return this;
    }

    public PromptEngine build() {
      return new PromptEngine(this);
    }
  }
}
