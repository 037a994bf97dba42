package io.promptloop.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link LineSource} backed by a {@link BufferedReader}, standard input by default. */
public final class ReaderLineSource implements LineSource {
  private static final Logger log = LoggerFactory.getLogger(ReaderLineSource.class);

  private final BufferedReader reader;

  public ReaderLineSource(Reader reader) {
    this.reader =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
  }

  public ReaderLineSource(InputStream in, Charset charset) {
    this(new InputStreamReader(in, charset));
  }

  /**
   * Creates a source reading standard input with the platform console encoding.
   *
   * @return a line source over {@code System.in}
   */
  public static ReaderLineSource stdin() {
    Charset cs =
        System.console() != null ? System.console().charset() : StandardCharsets.UTF_8;
    return new ReaderLineSource(System.in, cs);
  }

  @Override
  public String readLine() throws LineSourceException {
    String line;
    try {
      line = reader.readLine();
    } catch (IOException e) {
      log.debug("Read failed", e);
      throw new LineSourceException(
          LineSourceException.Kind.IO_FAILURE, "Input read error: " + e.getMessage(), e);
    }
    if (line == null) {
      throw LineSourceException.endOfInput();
    }
    return line;
  }
}
