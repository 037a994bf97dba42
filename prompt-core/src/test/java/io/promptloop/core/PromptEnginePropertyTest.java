package io.promptloop.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/**
 * Property-based tests of the retry loop: whatever the number of rejected lines, the handler fires
 * once per rejection and the first valid line wins.
 */
@PropertyDefaults(tries = 200)
class PromptEnginePropertyTest {

  private static PromptEngine engine(List<String> lines) {
    return PromptEngine.builder()
        .lineSource(new ScriptedLineSource(lines))
        .output(OutputWriter.forPrintStream(new PrintStream(new ByteArrayOutputStream())))
        .build();
  }

  @Property
  void wellFormedIntegerParsesOnFirstAttempt(@ForAll int n) throws Exception {
    AtomicInteger failures = new AtomicInteger();

    int value =
        engine(List.of(Integer.toString(n)))
            .request(Parsers.integer(), "> ", f -> failures.incrementAndGet());

    assertEquals(n, value);
    assertEquals(0, failures.get());
  }

  @Property
  void handlerFiresOncePerMalformedLine(
      @ForAll("malformed") List<String> junk, @ForAll long expected) throws Exception {
    List<String> lines = new ArrayList<>(junk);
    lines.add(Long.toString(expected));
    List<String> seen = new ArrayList<>();

    long value =
        engine(lines).request(Parsers.longInteger(), "> ", f -> seen.add(f.input()));

    assertEquals(expected, value);
    assertEquals(junk.size(), seen.size());
    assertEquals(junk.stream().map(String::strip).toList(), seen);
  }

  @Property
  void attemptNumbersCountUpFromOne(@ForAll @IntRange(max = 50) int rejected) throws Exception {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < rejected; i++) {
      lines.add("no");
    }
    lines.add("yes-but-string");
    List<Integer> attempts = new ArrayList<>();

    engine(lines)
        .request(
            Parsers.nonEmpty().validate(s -> !s.equals("no"), "no is not an answer"),
            "",
            f -> attempts.add(f.attempt()));

    assertEquals(rejected, attempts.size());
    for (int i = 0; i < rejected; i++) {
      assertEquals(i + 1, attempts.get(i));
    }
  }

  @Property
  void exhaustedInputNeverYieldsAValue(@ForAll("malformed") List<String> junk) {
    AtomicInteger failures = new AtomicInteger();

    PromptAbortedException e =
        assertThrows(
            PromptAbortedException.class,
            () -> engine(junk).request(Parsers.integer(), "", f -> failures.incrementAndGet()));

    assertEquals(PromptAbortedException.Reason.END_OF_INPUT, e.getReason());
    assertEquals(junk.size(), failures.get());
  }

  @Provide
  Arbitrary<List<String>> malformed() {
    Arbitrary<String> words = Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8);
    Arbitrary<String> padded = words.map(w -> "  " + w + " ");
    Arbitrary<String> blanks = Arbitraries.of("", " ", "\t");
    Arbitrary<String> decimals = Arbitraries.of("1.5", "1e3", "--1", "0x10", "9".repeat(30));
    return Arbitraries.oneOf(words, padded, blanks, decimals).list().ofMaxSize(100);
  }
}
