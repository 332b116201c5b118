package partialspan.trace.common.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import okio.BufferedSink;
import okio.Okio;

/** Writes newline delimited snapshots to an {@link OutputStream}. */
public class PrintingLogSink implements LogSink {
  private final BufferedSink sink;

  public PrintingLogSink(final OutputStream outputStream) {
    sink = Okio.buffer(Okio.sink(outputStream));
  }

  @Override
  public void write(final String line) {
    try {
      synchronized (sink) {
        sink.writeString(line, StandardCharsets.UTF_8);
        sink.writeByte('\n');
        sink.flush();
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public String toString() {
    return "PrintingLogSink { }";
  }
}
