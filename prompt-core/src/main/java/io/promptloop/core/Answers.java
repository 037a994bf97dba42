package io.promptloop.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Values produced by a sequence of requests, in request order. */
public final class Answers {
  private static final Answers EMPTY = new Answers(List.of());

  private final List<Object> values;

  private Answers(List<Object> values) {
    this.values = values;
  }

  static Answers empty() {
    return EMPTY;
  }

  static Answers of(List<Object> values) {
    if (values.isEmpty()) {
      return EMPTY;
    }
    return new Answers(Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Gets the value of the request at {@code index}.
   *
   * @param index position of the request in the sequence
   * @param type expected value type
   * @return the value
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T get(int index, Class<T> type) {
    return type.cast(values.get(index));
  }

  public Object get(int index) {
    return values.get(index);
  }

  public List<Object> asList() {
    return values;
  }

  @Override
  public String toString() {
    return "Answers" + values;
  }
}
