package com.flagship.gl_posting.posting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.idempotency.AdmitOutcome;
import com.flagship.gl_posting.idempotency.IdempotencyGate;
import com.flagship.gl_posting.idempotency.RequestHasher;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.journal.JournalStatus;
import com.flagship.gl_posting.journal.JournalStore;
import com.flagship.gl_posting.journal.JournalValidator;
import com.flagship.gl_posting.journal.ValidationResult;
import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.observability.CorrelationContext;
import com.flagship.gl_posting.observability.PostingMetrics;
import com.flagship.gl_posting.posting.derived.BillPostingBuilder;
import com.flagship.gl_posting.posting.derived.DerivedPosting;
import com.flagship.gl_posting.posting.derived.DocumentPostingRequest;
import com.flagship.gl_posting.posting.derived.InvoicePostingBuilder;
import com.flagship.gl_posting.sod.SodPolicyEvaluator;
import com.flagship.gl_posting.sod.SodPolicyProvider;
import com.flagship.gl_posting.sod.SodRequest;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for recording journal entries.
 *
 * One call runs admit, validate, authorize, decide, write and record inside a
 * single transaction. A crash or failure at any step leaves no journal, no
 * outbox event and no idempotency record behind, so the caller can simply retry.
 *
 * Ordering within a call:
 * 1. Idempotency admission (a replay returns the stored result and does nothing else)
 * 2. Validation (every structural, COA and balance error at once)
 * 3. Journal number uniqueness, reversal preconditions
 * 4. SoD evaluation on the functional-currency amount
 * 5. Journal insert, lifecycle events, idempotency record
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingService {

    public static final String DUPLICATE_JOURNAL_NUMBER = "DUPLICATE_JOURNAL_NUMBER";
    public static final String MISSING_IDEMPOTENCY_KEY = "MISSING_IDEMPOTENCY_KEY";
    public static final String GENERATED_LINE_NOT_ALLOWED = "GENERATED_LINE_NOT_ALLOWED";
    public static final String ALREADY_REVERSED = "ALREADY_REVERSED";

    private static final String ACTIVE_REVERSAL_INDEX = "uq_journal_active_reversal";

    private final IdempotencyGate idempotencyGate;
    private final RequestHasher requestHasher;
    private final JournalValidator validator;
    private final SodPolicyProvider policyProvider;
    private final SodPolicyEvaluator policyEvaluator;
    private final PostingDecisionMachine decisionMachine;
    private final JournalStore journalStore;
    private final PostingFinalizer finalizer;
    private final JournalEventWriter eventWriter;
    private final InvoicePostingBuilder invoiceBuilder;
    private final BillPostingBuilder billBuilder;
    private final PostingMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records a manual journal entry, or a reversal built by {@link ReversalService}.
     * Tax lines are always derived here from the lines' tax codes; a submitted line
     * marked as generated is refused.
     */
    @Transactional
    public PostingResult post(JournalPostingInput input) {
        Objects.requireNonNull(input.getContext(), "posting context is required");
        return run("post", input.getContext(), input.getJournalNumber(), input.getIdempotencyKey(), input,
            () -> new Prepared(requireSubmittedLines(input), List.of()));
    }

    /**
     * Records a sales invoice: receivable against revenue and output tax.
     * The idempotency hash covers the invoice as submitted, not the derived lines.
     */
    @Transactional
    public PostingResult postInvoice(DocumentPostingRequest request) {
        Objects.requireNonNull(request.getContext(), "posting context is required");
        return run("invoice", request.getContext(), request.getDocumentNumber(), request.getIdempotencyKey(), request,
            () -> prepared(invoiceBuilder.build(request)));
    }

    @Transactional
    public PostingResult postBill(DocumentPostingRequest request) {
        Objects.requireNonNull(request.getContext(), "posting context is required");
        return run("bill", request.getContext(), request.getDocumentNumber(), request.getIdempotencyKey(), request,
            () -> prepared(billBuilder.build(request)));
    }

    private PostingResult run(String operation, PostingContext context, String journalNumber, String idempotencyKey,
                              Object hashSource, Supplier<Prepared> prepare) {
        long startTime = System.currentTimeMillis();

        try (CorrelationContext.Scope ignored = CorrelationContext.open(
                context.getTenantId().toString(), journalNumber, idempotencyKey)) {
            try {
                requireIdempotencyKey(idempotencyKey);
                String requestHash = requestHasher.hash(hashSource);
                AdmitOutcome outcome = idempotencyGate.admit(context.getTenantId(), idempotencyKey, requestHash);

                switch (outcome.getType()) {
                    case REPLAY -> {
                        metrics.recordIdempotency("replay");
                        PostingResult replayed = readSnapshot(outcome.getStoredResponse());
                        log.info("Replayed stored result for journal {}: status={}",
                            replayed.getJournalNumber(), replayed.getStatus());
                        return replayed;
                    }
                    case CONFLICT -> {
                        metrics.recordIdempotency("conflict");
                        throw new PostingException(PostingError.builder()
                            .kind(ErrorKind.IDEMPOTENCY_CONFLICT)
                            .code(IdempotencyGate.IDEMPOTENCY_CONFLICT)
                            .message("Idempotency key " + idempotencyKey + " was already used for a different request")
                            .detail("idempotencyKey", idempotencyKey)
                            .build());
                    }
                    case FRESH -> metrics.recordIdempotency("fresh");
                }

                Prepared prepared = prepare.get();
                PostingResult result = record(prepared, requestHash);

                long duration = System.currentTimeMillis() - startTime;
                metrics.recordJournal(result.getStatus().name(), prepared.getInput().getAction().name());
                metrics.recordLatency(operation, duration);
                log.info("Journal {} recorded: status={}, totalDebit={}, currency={}, duration={}ms",
                    result.getJournalNumber(), result.getStatus(), result.getTotalDebit(),
                    result.getCurrency(), duration);
                return result;

            } catch (PostingException e) {
                long duration = System.currentTimeMillis() - startTime;
                metrics.recordFailure(e.getKind().name());
                metrics.recordLatency(operation, duration);
                if (e.getKind() == ErrorKind.POLICY_CONFIGURATION_ERROR || e.getKind().isRetryable()) {
                    log.error("Posting failed: kind={}, retryable={}, codes={}, error={}",
                        e.getKind(), e.getKind().isRetryable(), e.getCodes(), e.getMessage());
                } else {
                    log.warn("Posting refused: kind={}, codes={}, error={}", e.getKind(), e.getCodes(), e.getMessage());
                }
                throw e;
            }
        }
    }

    private PostingResult record(Prepared prepared, String requestHash) {
        JournalPostingInput input = prepared.getInput();
        PostingContext context = input.getContext();

        ValidationResult validation = validator.validate(input);
        if (validation.isValid()) {
            requireUniqueNumber(input);
            if (input.getReversalOf() != null) {
                requireReversible(context, input.getReversalOf());
            }
        }

        PostingDecision decision = decisionMachine.decide(validation, context.getUserRole(), input.getAction(),
            () -> policyEvaluator.evaluate(
                policyProvider.policyFor(context.getTenantId()),
                context,
                input.getAction(),
                new SodRequest(validation.getFunctionalTotal().getAmount(), input.getModule(), context.getUserRole())));

        Instant now = clock.instant();
        JournalEntry entry = decisionMachine.apply(JournalEntry.draft(input, validation, now), decision, now);
        try {
            journalStore.insertJournal(entry);
        } catch (DuplicateKeyException e) {
            throw lostInsertRace(input, e);
        }
        MDC.put(CorrelationContext.JOURNAL_ID_MDC_KEY, entry.getId().toString());

        if (entry.getStatus() == JournalStatus.POSTED) {
            finalizer.onPosted(entry, context, now);
        } else {
            eventWriter.pendingApproval(entry);
            log.info("Journal {} held for approval by {}: {}",
                entry.getJournalNumber(), entry.getApproverRoles(), decision.getReason());
        }

        Set<PostingWarning> warnings = new LinkedHashSet<>(prepared.getWarnings());
        warnings.addAll(validation.getWarnings());
        List<PostingWarning> allWarnings = new ArrayList<>(warnings);
        eventWriter.taxDegraded(entry, allWarnings);
        allWarnings.stream()
            .filter(PostingWarning::isTaxDegradation)
            .forEach(w -> {
                metrics.recordTaxDegraded(w.getCode());
                log.warn("Journal {} recorded with degraded tax: {}", entry.getJournalNumber(), w.getMessage());
            });

        PostingResult result = PostingResult.from(entry, allWarnings);
        idempotencyGate.record(context.getTenantId(), input.getIdempotencyKey(), requestHash, writeSnapshot(result));
        return result;
    }

    private void requireUniqueNumber(JournalPostingInput input) {
        String number = input.getJournalNumber().trim();
        if (journalStore.existsByJournalNumber(input.getContext(), number)) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(DUPLICATE_JOURNAL_NUMBER)
                .message("Journal number " + number + " already exists")
                .detail("journalNumber", number)
                .build());
        }
    }

    /**
     * Only a POSTED entry can be reversed, and only once.
     */
    private void requireReversible(PostingContext context, UUID originalId) {
        JournalEntry original = journalStore.findById(context, originalId)
            .orElseThrow(() -> new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code(ApprovalService.JOURNAL_NOT_FOUND)
                .message("Journal to reverse not found: " + originalId)
                .detail("journalId", originalId.toString())
                .build()));
        if (original.getStatus() != JournalStatus.POSTED) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code("INVALID_STATE_TRANSITION")
                .message(String.format("Cannot reverse journal %s in %s status, it must be POSTED",
                    original.getJournalNumber(), original.getStatus()))
                .detail("journalId", originalId.toString())
                .detail("status", original.getStatus().name())
                .build());
        }
        journalStore.findActiveReversalOf(context, originalId).ifPresent(existing -> {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code(ALREADY_REVERSED)
                .message("Journal " + original.getJournalNumber() + " already has a reversal")
                .detail("journalId", originalId.toString())
                .detail("reversalId", existing.toString())
                .build());
        });
    }

    /**
     * A concurrent request got the journal number (or the reversal slot) between our
     * checks and the insert. If it holds our idempotency key too, it was a retry of this
     * same request, and the caller gets its stored result by retrying.
     */
    private PostingException lostInsertRace(JournalPostingInput input, DuplicateKeyException e) {
        PostingContext context = input.getContext();
        String key = input.getIdempotencyKey();
        if (idempotencyGate.isRecorded(context.getTenantId(), key)) {
            metrics.recordIdempotency("conflict");
            return new PostingException(PostingError.builder()
                .kind(ErrorKind.IDEMPOTENCY_CONFLICT)
                .code(IdempotencyGate.IDEMPOTENCY_CONFLICT)
                .message("Another request with idempotency key " + key + " completed first")
                .detail("idempotencyKey", key)
                .build(), e);
        }
        if (input.getReversalOf() != null && String.valueOf(e.getMessage()).contains(ACTIVE_REVERSAL_INDEX)) {
            return new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code(ALREADY_REVERSED)
                .message("Journal " + input.getReversalOf() + " already has a reversal")
                .detail("journalId", input.getReversalOf().toString())
                .build(), e);
        }
        String number = input.getJournalNumber().trim();
        return new PostingException(PostingError.builder()
            .kind(ErrorKind.VALIDATION_ERROR)
            .code(DUPLICATE_JOURNAL_NUMBER)
            .message("Journal number " + number + " already exists")
            .detail("journalNumber", number)
            .build(), e);
    }

    private static JournalPostingInput requireSubmittedLines(JournalPostingInput input) {
        List<Integer> generated = new ArrayList<>();
        for (int i = 0; i < input.getLines().size(); i++) {
            if (input.getLines().get(i).isGenerated()) {
                generated.add(i);
            }
        }
        if (!generated.isEmpty()) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(GENERATED_LINE_NOT_ALLOWED)
                .message("Tax lines are derived from tax codes and cannot be submitted as generated lines")
                .detail("lineIndexes", generated)
                .build());
        }
        return input;
    }

    private static void requireIdempotencyKey(String key) {
        if (key == null || key.isBlank()) {
            throw new PostingException(PostingError.validation(MISSING_IDEMPOTENCY_KEY, "Idempotency key is required"));
        }
    }

    private static Prepared prepared(DerivedPosting derived) {
        return new Prepared(derived.getInput(), derived.getWarnings());
    }

    private String writeSnapshot(PostingResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize posting result", e);
        }
    }

    private PostingResult readSnapshot(String snapshot) {
        try {
            return objectMapper.readValue(snapshot, PostingResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored posting result is unreadable", e);
        }
    }

    @Value
    private static class Prepared {
        JournalPostingInput input;
        List<PostingWarning> warnings;
    }
}
