package io.promptloop.core;

import java.util.List;

/**
 * Thrown when a value request ends without a value. This never happens because of bad input
 * alone: parse failures are retried, and only a failed input stream (or an exhausted attempt
 * limit, when one is configured) aborts a request.
 *
 * <p>When the request was part of a sequence, values obtained before the abort are available
 * from {@link #partialAnswers()}.
 */
public class PromptAbortedException extends Exception {

  /** Why the request was aborted. */
  public enum Reason {
    /** The input stream was exhausted. */
    END_OF_INPUT,
    /** Reading from the input stream failed. */
    IO_FAILURE,
    /** The user interrupted the read. */
    INTERRUPTED,
    /** The configured attempt limit was reached without a valid value. */
    ATTEMPTS_EXHAUSTED
  }

  private final Reason reason;
  private final Answers partialAnswers;

  /**
   * Creates a new abort exception.
   *
   * @param reason why the request was aborted
   * @param message the error message
   * @param cause the underlying stream failure, may be null
   */
  public PromptAbortedException(Reason reason, String message, Throwable cause) {
    this(reason, message, cause, Answers.empty());
  }

  /**
   * Creates a new abort exception carrying the values obtained so far.
   *
   * @param reason why the request was aborted
   * @param message the error message
   * @param cause the underlying stream failure, may be null
   * @param partialAnswers values of requests that completed before the abort
   */
  public PromptAbortedException(
      Reason reason, String message, Throwable cause, Answers partialAnswers) {
    super(message, cause);
    this.reason = reason;
    this.partialAnswers = partialAnswers;
  }

  static PromptAbortedException fromStream(LineSourceException e) {
    Reason reason =
        switch (e.getKind()) {
          case END_OF_INPUT -> Reason.END_OF_INPUT;
          case IO_FAILURE -> Reason.IO_FAILURE;
          case INTERRUPTED -> Reason.INTERRUPTED;
        };
    return new PromptAbortedException(reason, e.getMessage(), e);
  }

  /** Returns a copy of this exception carrying {@code answers} as the partial result. */
  PromptAbortedException withPartialAnswers(List<Object> answers) {
    PromptAbortedException copy =
        new PromptAbortedException(reason, getMessage(), getCause(), Answers.of(answers));
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  /**
   * Gets the reason for the abort.
   *
   * @return the reason
   */
  public Reason getReason() {
    return reason;
  }

  /**
   * Values obtained by earlier requests of the same sequence. Empty for single requests.
   *
   * @return the partial answers
   */
  public Answers partialAnswers() {
    return partialAnswers;
  }
}
