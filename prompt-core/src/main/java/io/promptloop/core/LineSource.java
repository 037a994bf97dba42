package io.promptloop.core;

/**
 * Supplies one line of raw text per call. Implementations block until a line is available or the
 * stream ends; there is no timeout.
 *
 * <p>An empty line is a normal result. End of input and read failures are reported as a {@link
 * LineSourceException}, never as {@code null}.
 */
@FunctionalInterface
public interface LineSource {

  /**
   * Reads the next line. The returned text may still carry its line terminator; callers strip it.
   *
   * @return the next line, possibly empty
   * @throws LineSourceException if the stream is exhausted, broken or interrupted
   */
  String readLine() throws LineSourceException;
}
