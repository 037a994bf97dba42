package io.promptloop.shell;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.promptloop.core.LineSourceException;
import io.promptloop.core.Parsers;
import io.promptloop.core.PromptAbortedException;
import io.promptloop.core.PromptEngine;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOError;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JLineConsoleTest {

  private Terminal terminal;
  private LineReader lineReader;
  private StringWriter screen;
  private JLineConsole console;

  @BeforeEach
  void setUp() {
    terminal = mock(Terminal.class);
    lineReader = mock(LineReader.class);
    screen = new StringWriter();
    when(terminal.writer()).thenReturn(new PrintWriter(screen, true));
    console = new JLineConsole(terminal, lineReader);
  }

  @Test
  void printedPromptIsHandedToTheLineReader() throws Exception {
    when(lineReader.readLine("Name: ")).thenReturn("Ada");

    console.print("Name: ");

    assertEquals("Ada", console.readLine());
    verify(lineReader).readLine("Name: ");
    assertEquals("", screen.toString());
  }

  @Test
  void promptIsConsumedByOneRead() throws Exception {
    when(lineReader.readLine(anyString())).thenReturn("1", "2");

    console.print("n: ");
    console.readLine();
    console.readLine();

    verify(lineReader).readLine("n: ");
    verify(lineReader).readLine("");
  }

  @Test
  void printlnFlushesPendingPromptFirst() {
    console.print("partial ");
    console.println("line");

    assertEquals("partial line" + System.lineSeparator(), screen.toString());
  }

  @Test
  void errorsGoToTheTerminal() {
    console.error("Invalid input 'x'");

    assertTrue(screen.toString().contains("Invalid input 'x'"));
    verify(terminal).flush();
  }

  @Test
  void endOfFileMapsToEndOfInput() {
    when(lineReader.readLine(anyString())).thenThrow(new EndOfFileException());

    LineSourceException e = assertThrows(LineSourceException.class, console::readLine);
    assertEquals(LineSourceException.Kind.END_OF_INPUT, e.getKind());
  }

  @Test
  void ctrlCMapsToInterrupted() {
    when(lineReader.readLine(anyString())).thenThrow(new UserInterruptException("half"));

    LineSourceException e = assertThrows(LineSourceException.class, console::readLine);
    assertEquals(LineSourceException.Kind.INTERRUPTED, e.getKind());
  }

  @Test
  void terminalFailureMapsToIoFailure() {
    when(lineReader.readLine(anyString())).thenThrow(new IOError(new IOException("tty lost")));

    LineSourceException e = assertThrows(LineSourceException.class, console::readLine);
    assertEquals(LineSourceException.Kind.IO_FAILURE, e.getKind());
  }

  @Test
  void engineRetriesThroughTheConsole() throws Exception {
    when(lineReader.readLine(anyString())).thenReturn("twelve", "12");
    PromptEngine engine = PromptEngine.builder().lineSource(console).output(console).build();

    assertEquals(12, engine.request(Parsers.integer(), "Age: "));

    verify(lineReader, times(2)).readLine("Age: ");
    assertTrue(screen.toString().contains("Invalid input 'twelve'. Expected type: int."));
  }

  @Test
  void interruptAbortsTheRequest() {
    when(lineReader.readLine(anyString())).thenThrow(new UserInterruptException(""));
    PromptEngine engine = PromptEngine.builder().lineSource(console).output(console).build();

    PromptAbortedException e =
        assertThrows(
            PromptAbortedException.class, () -> engine.request(Parsers.integer(), "Age: "));
    assertEquals(PromptAbortedException.Reason.INTERRUPTED, e.getReason());
  }

  @Test
  void percentSignsInPromptAreShownLiterally() throws Exception {
    ByteArrayOutputStream screenBytes = new ByteArrayOutputStream();
    DumbTerminal dumb =
        new DumbTerminal(
            "test",
            Terminal.TYPE_DUMB,
            new ByteArrayInputStream("x\n5\n".getBytes(StandardCharsets.UTF_8)),
            screenBytes,
            StandardCharsets.UTF_8);
    LineReader reader = LineReaderBuilder.builder().terminal(dumb).build();

    try (JLineConsole real = new JLineConsole(dumb, reader)) {
      PromptEngine engine = PromptEngine.builder().lineSource(real).output(real).build();

      assertEquals(5, engine.request(Parsers.integer(), "Discount %d (50%): "));
    }

    String shown = screenBytes.toString(StandardCharsets.UTF_8);
    int first = shown.indexOf("Discount %d (50%): ");
    assertTrue(first >= 0, shown);
    assertTrue(shown.indexOf("Discount %d (50%): ", first + 1) > first, shown);
  }

  @Test
  void closeClosesTheTerminal() throws Exception {
    console.close();

    verify(terminal).close();
  }
}
