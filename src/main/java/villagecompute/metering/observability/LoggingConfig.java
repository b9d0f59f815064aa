package villagecompute.metering.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names for billing logs and helpers to set and clear them.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier</li>
 * <li>{@code user_id} - requesting user UUID (absent for guests)</li>
 * <li>{@code conversation_id} - conversation the turn belongs to</li>
 * <li>{@code funding_source} - resolved funding source of the turn</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> MDC is ThreadLocal. Every turn must call {@link #clearMDC()} on exit.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_CONVERSATION_ID = "conversation_id";

    /**
     * One of {@code personal_balance}, {@code free_allowance}, {@code owner_balance}, {@code guest_fixed}. Set once the
     * billing decision is made.
     */
    public static final String MDC_FUNDING_SOURCE = "funding_source";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings when no span is active.
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

    public static void setUserId(UUID userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }
    }

    public static void setConversationId(UUID conversationId) {
        if (conversationId != null) {
            MDC.put(MDC_CONVERSATION_ID, conversationId.toString());
        }
    }

    public static void setFundingSource(String fundingSource) {
        if (fundingSource != null) {
            MDC.put(MDC_FUNDING_SOURCE, fundingSource);
        }
    }

    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_CONVERSATION_ID);
        MDC.remove(MDC_FUNDING_SOURCE);
    }
}
