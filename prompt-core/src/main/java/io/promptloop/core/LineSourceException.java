package io.promptloop.core;

import java.io.IOException;

/**
 * Thrown by a {@link LineSource} when no further line can be produced. Every kind is fatal to a
 * value request: an exhausted or broken stream cannot succeed on retry.
 */
public class LineSourceException extends IOException {

  /** Why the source could not produce a line. */
  public enum Kind {
    /** The input stream is exhausted. */
    END_OF_INPUT,
    /** Reading from the underlying stream failed. */
    IO_FAILURE,
    /** The user interrupted the read (e.g. Ctrl-C at a terminal). */
    INTERRUPTED
  }

  private final Kind kind;

  /**
   * Creates a new line source exception.
   *
   * @param kind the failure kind
   * @param message the error message
   */
  public LineSourceException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Creates a new line source exception with a cause.
   *
   * @param kind the failure kind
   * @param message the error message
   * @param cause the underlying cause
   */
  public LineSourceException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /** Convenience factory for an exhausted stream. */
  public static LineSourceException endOfInput() {
    return new LineSourceException(Kind.END_OF_INPUT, "End of input");
  }

  /**
   * Gets the failure kind.
   *
   * @return the failure kind
   */
  public Kind getKind() {
    return kind;
  }

  public boolean isEndOfInput() {
    return kind == Kind.END_OF_INPUT;
  }
}
