package io.promptloop.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncRequestTest {

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static PromptEngine engine(String... lines) {
    return PromptEngine.builder()
        .lineSource(new ScriptedLineSource(lines))
        .output(OutputWriter.forPrintStream(new PrintStream(new ByteArrayOutputStream())))
        .build();
  }

  @Test
  void futureCompletesWithParsedValue() throws Exception {
    CompletableFuture<Double> future =
        engine("pi", "3.14")
            .requestAsync(ValueRequest.of(Parsers.doubleValue(), "x: "), executor);

    assertEquals(3.14, future.get(5, TimeUnit.SECONDS));
  }

  @Test
  void streamFailureCompletesExceptionally() {
    CompletableFuture<Integer> future =
        engine("nope").requestAsync(ValueRequest.of(Parsers.integer(), "n: "), executor);

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    PromptAbortedException cause = assertInstanceOf(PromptAbortedException.class, e.getCause());
    assertEquals(PromptAbortedException.Reason.END_OF_INPUT, cause.getReason());
  }

  @Test
  void callerThreadIsNotUsed() throws Exception {
    Thread caller = Thread.currentThread();
    CompletableFuture<Thread> future =
        engine("go")
            .requestAsync(
                ValueRequest.of(Parsers.string().map("thread", s -> Thread.currentThread()), ""),
                executor);

    assertNotSame(caller, future.get(5, TimeUnit.SECONDS));
  }
}
