/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching pipeline logs with run context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry identifiers of the current span</li>
 * <li>{@code run_id} - pipeline run identifier</li>
 * <li>{@code run_trigger} - {@code scheduled} or {@code on_demand}</li>
 * <li>{@code source_name} - feed source being fetched (worker threads only)</li>
 * <li>{@code article_id} - article being rewritten (worker threads only)</li>
 * <li>{@code request_origin} - HTTP path or component name</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads set their
 * own fields and must call {@link #clearMDC()} when the unit of work ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_RUN_ID = "run_id";

    public static final String MDC_RUN_TRIGGER = "run_trigger";

    public static final String MDC_SOURCE_NAME = "source_name";

    public static final String MDC_ARTICLE_ID = "article_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id of the current OpenTelemetry span into MDC. Empty strings when no span is active.
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

    public static void setRunId(String runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId);
        }
    }

    public static void setRunTrigger(String trigger) {
        if (trigger != null) {
            MDC.put(MDC_RUN_TRIGGER, trigger);
        }
    }

    public static void setSourceName(String sourceName) {
        if (sourceName != null) {
            MDC.put(MDC_SOURCE_NAME, sourceName);
        }
    }

    public static void setArticleId(String articleId) {
        if (articleId != null) {
            MDC.put(MDC_ARTICLE_ID, articleId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all pipeline MDC fields. Call at the end of every run and every worker task.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_RUN_TRIGGER);
        MDC.remove(MDC_SOURCE_NAME);
        MDC.remove(MDC_ARTICLE_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
