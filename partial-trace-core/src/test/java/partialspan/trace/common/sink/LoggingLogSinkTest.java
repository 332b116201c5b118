package partialspan.trace.common.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
class LoggingLogSinkTest {
  @Mock Logger snapshotLogger;

  @Test
  void writesEachLineAtInfo() {
    when(snapshotLogger.getName()).thenReturn("partialspan.snapshots");
    LoggingLogSink sink = new LoggingLogSink(snapshotLogger);

    sink.write("{\"resource_spans\":[]}");

    verify(snapshotLogger).info("{\"resource_spans\":[]}");
    assertEquals("LoggingLogSink { logger=partialspan.snapshots }", sink.toString());
  }

  @Test
  void resolvesLoggerByName() {
    LoggingLogSink sink = new LoggingLogSink("custom.snapshots");

    assertEquals("LoggingLogSink { logger=custom.snapshots }", sink.toString());
  }
}
