package com.flagship.gl_posting.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for posting logs, and the correlation id that ties one request's
 * log lines together.
 *
 * A correlation id already bound by the caller is kept; otherwise one is generated on first use.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String JOURNAL_NUMBER_MDC_KEY = "journalNumber";
    public static final String JOURNAL_ID_MDC_KEY = "journalId";
    public static final String IDEMPOTENCY_KEY_MDC_KEY = "idempotencyKey";

    private CorrelationContext() {
    }

    /**
     * The current correlation id, generating and binding one if none is set.
     */
    public static String getCorrelationId() {
        String id = MDC.get(CORRELATION_ID_MDC_KEY);
        if (id == null) {
            id = generateCorrelationId();
            MDC.put(CORRELATION_ID_MDC_KEY, id);
        }
        return id;
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY) != null;
    }

    /**
     * Binds the posting keys and returns a scope that removes them, and the
     * correlation id if this call created it, when closed.
     */
    public static Scope open(String tenantId, String journalNumber, String idempotencyKey) {
        boolean ownsCorrelationId = !hasCorrelationId();
        getCorrelationId();
        putIfPresent(TENANT_ID_MDC_KEY, tenantId);
        putIfPresent(JOURNAL_NUMBER_MDC_KEY, journalNumber);
        putIfPresent(IDEMPOTENCY_KEY_MDC_KEY, idempotencyKey);
        return () -> {
            MDC.remove(TENANT_ID_MDC_KEY);
            MDC.remove(JOURNAL_NUMBER_MDC_KEY);
            MDC.remove(JOURNAL_ID_MDC_KEY);
            MDC.remove(IDEMPOTENCY_KEY_MDC_KEY);
            if (ownsCorrelationId) {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        };
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * MDC bindings for the duration of one operation.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
