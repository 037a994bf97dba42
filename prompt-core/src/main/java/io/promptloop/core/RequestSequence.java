package io.promptloop.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Ordered list of value requests run by one {@link PromptEngine}.
 *
 * <pre>{@code
 * Answers answers =
 *     engine.sequence()
 *         .add(ValueRequest.of(Parsers.integer(), "Age: "), age -> this.age = age)
 *         .add(ValueRequest.of(Parsers.doubleValue(), "Height: "))
 *         .run();
 * }</pre>
 *
 * <p>Requests share nothing but their order and the engine's channels. A stream failure stops
 * the sequence at that request; earlier values are kept and earlier binders have already run.
 */
public final class RequestSequence {

  private record Entry<T>(ValueRequest<T> request, Consumer<? super T> binder) {
    Object run(PromptEngine engine) throws PromptAbortedException {
      T value = engine.runLoop(request);
      if (binder != null) {
        binder.accept(value);
      }
      return value;
    }
  }

  private final PromptEngine engine;
  private final List<Entry<?>> entries = new ArrayList<>();

  RequestSequence(PromptEngine engine) {
    this.engine = engine;
  }

  public <T> RequestSequence add(ValueRequest<T> request) {
    entries.add(new Entry<>(Objects.requireNonNull(request, "request"), null));
    return this;
  }

  /**
   * Adds a request whose value is also handed to {@code binder} as soon as it parses.
   *
   * @param request what to ask for
   * @param binder receives the value
   * @return this sequence
   */
  public <T> RequestSequence add(ValueRequest<T> request, Consumer<? super T> binder) {
    entries.add(
        new Entry<>(
            Objects.requireNonNull(request, "request"), Objects.requireNonNull(binder, "binder")));
    return this;
  }

  public <T> RequestSequence add(ValueParser<T> parser, String prompt) {
    return add(ValueRequest.of(parser, prompt));
  }

  public <T> RequestSequence add(ValueParser<T> parser, String prompt, ErrorHandler handler) {
    return add(ValueRequest.of(parser, prompt, handler));
  }

  public int size() {
    return entries.size();
  }

  /**
   * Runs every request in order while holding the engine's lock.
   *
   * @return the values, in request order
   * @throws PromptAbortedException if the input stream ends or fails
   */
  public Answers run() throws PromptAbortedException {
    List<Object> values = new ArrayList<>(entries.size());
    engine.lock().lock();
    try {
      for (Entry<?> entry : entries) {
        try {
          values.add(entry.run(engine));
        } catch (PromptAbortedException e) {
          throw e.withPartialAnswers(values);
        }
      }
    } finally {
      engine.lock().unlock();
    }
    return Answers.of(values);
  }
}
