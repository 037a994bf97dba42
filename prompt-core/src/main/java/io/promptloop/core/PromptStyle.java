package io.promptloop.core;

/** How a request's prompt text is rendered before each read. */
public enum PromptStyle {
  /** The prompt text exactly as given; the caller controls spacing and punctuation. */
  PLAIN {
    @Override
    public String render(String prompt, String typeName) {
      return prompt;
    }
  },
  /** The prompt followed by the expected type: {@code "Enter a number (int): "}. */
  ANNOTATED {
    @Override
    public String render(String prompt, String typeName) {
      return prompt.isEmpty() ? "" : prompt + " (" + typeName + "): ";
    }
  };

  /**
   * Renders a prompt. An empty prompt renders as the empty string in every style.
   *
   * @param prompt the request's prompt text
   * @param typeName display name of the requested type
   * @return the text to print
   */
  public abstract String render(String prompt, String typeName);
}
