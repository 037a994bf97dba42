package io.promptloop.core;

import java.io.PrintStream;

/**
 * Output channel used by the prompt engine. Prompts go through {@link #print(String)} so the
 * cursor stays on the prompt line; diagnostics go through {@link #error(String)}.
 *
 * <p>Writes are best-effort: implementations must not throw on failure.
 */
public interface OutputWriter {

  /** Prints text without a trailing newline and flushes it. */
  void print(String s);

  /** Prints a line to standard output. */
  void println(String s);

  /** Prints formatted output to standard output. */
  void printf(String fmt, Object... args);

  /** Prints an error message (typically to stderr). */
  void error(String s);

  /** Creates an OutputWriter that writes everything to the given PrintStream. */
  static OutputWriter forPrintStream(PrintStream out) {
    return forPrintStream(out, out);
  }

  /** Creates an OutputWriter that writes to separate stdout and stderr streams. */
  static OutputWriter forPrintStream(PrintStream out, PrintStream err) {
    return new OutputWriter() {
      @Override
      public void print(String s) {
        out.print(s);
        out.flush();
      }

      @Override
      public void println(String s) {
        out.println(s);
      }

      @Override
      public void printf(String fmt, Object... args) {
        out.printf(fmt, args);
      }

      @Override
      public void error(String s) {
        // keep prompt and diagnostic ordered when both streams share a terminal
        out.flush();
        err.println(s);
        err.flush();
      }
    };
  }

  /** Creates an OutputWriter that writes to System.out and System.err. */
  static OutputWriter system() {
    return forPrintStream(System.out, System.err);
  }
}
