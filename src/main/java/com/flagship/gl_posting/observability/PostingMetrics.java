package com.flagship.gl_posting.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for posting operations.
 *
 * - posting.journals{status,action}: entries recorded, by resulting status
 * - posting.failures{kind}: requests refused, by error kind
 * - posting.idempotency{result}: fresh / replay / conflict admissions
 * - posting.tax.degraded{code}: tax warnings where tax was expected but not applied
 * - posting.approvals{decision}: approve / reject actions
 * - posting.latency{operation}: end-to-end time per operation
 */
@Component
public class PostingMetrics {

    private final MeterRegistry registry;

    public PostingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJournal(String status, String action) {
        registry.counter("posting.journals",
            "status", sanitizeTag(status),
            "action", sanitizeTag(action)
        ).increment();
    }

    public void recordFailure(String kind) {
        registry.counter("posting.failures", "kind", sanitizeTag(kind)).increment();
    }

    public void recordIdempotency(String result) {
        registry.counter("posting.idempotency", "result", sanitizeTag(result)).increment();
    }

    public void recordTaxDegraded(String warningCode) {
        registry.counter("posting.tax.degraded", "code", sanitizeTag(warningCode)).increment();
    }

    public void recordApproval(String decision) {
        registry.counter("posting.approvals", "decision", sanitizeTag(decision)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("posting.latency")
            .tag("operation", sanitizeTag(operation))
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of odd characters so they cannot blow up cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
