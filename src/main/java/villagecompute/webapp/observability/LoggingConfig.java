package villagecompute.webapp.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log entries with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP request path that produced the log entry</li>
 * </ul>
 *
 * <p>
 * <b>Usage in resources:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("/sitemap.xml");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers must clear the MDC
 * at the end of each request so worker threads do not carry stale values.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * HTTP request path (e.g., "/sitemap.xml").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are
     * set to empty strings so the log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the request origin.
     *
     * @param requestOrigin
     *            path like "/sitemap.xml"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
