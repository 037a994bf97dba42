package io.promptloop.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ReaderLineSourceTest {

  @Test
  void readsLinesIncludingEmptyOnes() throws Exception {
    ReaderLineSource source = new ReaderLineSource(new StringReader("one\n\nthree\r\n"));

    assertEquals("one", source.readLine());
    assertEquals("", source.readLine());
    assertEquals("three", source.readLine());
  }

  @Test
  void exhaustedReaderReportsEndOfInput() throws Exception {
    ReaderLineSource source = new ReaderLineSource(new StringReader("last"));
    source.readLine();

    LineSourceException e = assertThrows(LineSourceException.class, source::readLine);
    assertTrue(e.isEndOfInput());
    assertEquals(LineSourceException.Kind.END_OF_INPUT, e.getKind());
  }

  @Test
  void failingReaderReportsIoFailure() {
    Reader broken =
        new Reader() {
          @Override
          public int read(char[] cbuf, int off, int len) throws IOException {
            throw new IOException("device gone");
          }

          @Override
          public void close() {}
        };

    LineSourceException e =
        assertThrows(LineSourceException.class, new ReaderLineSource(broken)::readLine);

    assertEquals(LineSourceException.Kind.IO_FAILURE, e.getKind());
    assertFalse(e.isEndOfInput());
    assertTrue(e.getMessage().contains("device gone"));
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void decodesInputStreamWithGivenCharset() throws Exception {
    byte[] bytes = "grüße\n".getBytes(StandardCharsets.UTF_8);
    ReaderLineSource source =
        new ReaderLineSource(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8);

    assertEquals("grüße", source.readLine());
  }

  @Test
  void drivesEngineEndToEnd() throws Exception {
    PromptEngine engine =
        PromptEngine.builder()
            .lineSource(new ReaderLineSource(new StringReader("ten\n10\n")))
            .output(OutputWriter.forPrintStream(new PrintStream(new ByteArrayOutputStream())))
            .build();

    assertEquals(10, engine.request(Integer.class, "n: "));
    assertThrows(PromptAbortedException.class, () -> engine.request(Integer.class, "n: "));
  }
}
