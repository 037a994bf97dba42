package io.promptloop.shell;

import io.promptloop.core.LineSource;
import io.promptloop.core.LineSourceException;
import io.promptloop.core.OutputWriter;
import java.io.IOError;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

/**
 * Terminal-backed line source and output channel.
 *
 * <p>Text passed to {@link #print(String)} is held back and handed to {@link
 * LineReader#readLine(String)} as the prompt of the next read, so JLine can redraw it while the
 * user types. Anything printed with a newline flushes the pending prompt first.
 */
public final class JLineConsole implements LineSource, OutputWriter, AutoCloseable {
  private final Terminal terminal;
  private final LineReader lineReader;
  private final StringBuilder pendingPrompt = new StringBuilder();

  public JLineConsole(Terminal terminal, LineReader lineReader) {
    this.terminal = terminal;
    this.lineReader = lineReader;
  }

  /**
   * Opens the system terminal. History is disabled: each read is a fresh value.
   *
   * @return a console over the system terminal
   * @throws IOException if the terminal cannot be opened
   */
  public static JLineConsole system() throws IOException {
    Terminal terminal = TerminalBuilder.builder().system(true).build();
    LineReader lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.DISABLE_HISTORY, true)
            .build();
    return new JLineConsole(terminal, lineReader);
  }

  @Override
  public String readLine() throws LineSourceException {
    String prompt = pendingPrompt.toString();
    pendingPrompt.setLength(0);
    try {
      // JLine expands %-sequences in prompts; %% is a literal percent sign
      String line = lineReader.readLine(prompt.replace("%", "%%"));
      if (line == null) {
        throw LineSourceException.endOfInput();
      }
      return line;
    } catch (EndOfFileException e) {
      throw new LineSourceException(LineSourceException.Kind.END_OF_INPUT, "End of input", e);
    } catch (UserInterruptException e) {
      throw new LineSourceException(LineSourceException.Kind.INTERRUPTED, "Interrupted", e);
    } catch (IOError | UncheckedIOException e) {
      throw new LineSourceException(
          LineSourceException.Kind.IO_FAILURE, "Terminal read error: " + e.getMessage(), e);
    }
  }

  @Override
  public void print(String s) {
    pendingPrompt.append(s);
  }

  @Override
  public void println(String s) {
    flushPending();
    terminal.writer().println(s);
    terminal.flush();
  }

  @Override
  public void printf(String fmt, Object... args) {
    flushPending();
    terminal.writer().printf(fmt, args);
    terminal.flush();
  }

  @Override
  public void error(String s) {
    println(s);
  }

  private void flushPending() {
    if (pendingPrompt.length() > 0) {
      terminal.writer().print(pendingPrompt);
      pendingPrompt.setLength(0);
    }
  }

  @Override
  public void close() throws IOException {
    terminal.close();
  }
}
