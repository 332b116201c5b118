package partialspan.opentelemetry.trace;

import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import partialspan.trace.api.Config;
import partialspan.trace.common.sink.LogSinkFactory;
import partialspan.trace.core.PartialSpanProcessor;

/**
 * OpenTelemetry SDK span processor writing heartbeat snapshots of long running spans.
 *
 * <pre>
 *   SdkTracerProvider.builder()
 *       .addSpanProcessor(OtelPartialSpanProcessor.create(Config.get()))
 *       .build();
 * </pre>
 */
public final class OtelPartialSpanProcessor implements SpanProcessor {
  private final PartialSpanProcessor delegate;

  private OtelPartialSpanProcessor(PartialSpanProcessor delegate) {
    this.delegate = delegate;
  }

  /** Creates and starts a processor writing to the sink configured in {@code config}. */
  public static OtelPartialSpanProcessor create(Config config) {
    return create(
        PartialSpanProcessor.builder()
            .config(config)
            .logSink(LogSinkFactory.createLogSink(config))
            .build());
  }

  public static OtelPartialSpanProcessor create(PartialSpanProcessor delegate) {
    return new OtelPartialSpanProcessor(delegate);
  }

  PartialSpanProcessor delegate() {
    return delegate;
  }

  @Override
  public void onStart(Context parentContext, ReadWriteSpan span) {
    delegate.onStart(new OtelPartialSpan(span));
  }

  @Override
  public boolean isStartRequired() {
    return true;
  }

  @Override
  public void onEnd(ReadableSpan span) {
    delegate.onEnd(new OtelPartialSpan(span));
  }

  @Override
  public boolean isEndRequired() {
    return true;
  }

  @Override
  public CompletableResultCode shutdown() {
    delegate.close();
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public CompletableResultCode forceFlush() {
    return CompletableResultCode.ofSuccess();
  }
}
