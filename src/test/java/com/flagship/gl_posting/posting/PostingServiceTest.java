package com.flagship.gl_posting.posting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gl_posting.TestLedger.FakeAccountDirectory;
import com.flagship.gl_posting.TestLedger.FakeTaxCodeDirectory;
import com.flagship.gl_posting.coa.CoaPolicy;
import com.flagship.gl_posting.config.JacksonConfig;
import com.flagship.gl_posting.config.PostingProperties;
import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.idempotency.AdmitOutcome;
import com.flagship.gl_posting.idempotency.IdempotencyGate;
import com.flagship.gl_posting.idempotency.RequestHasher;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalLine;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.journal.JournalStatus;
import com.flagship.gl_posting.journal.JournalStore;
import com.flagship.gl_posting.journal.JournalValidator;
import com.flagship.gl_posting.observability.PostingMetrics;
import com.flagship.gl_posting.outbox.OutboxEvent;
import com.flagship.gl_posting.outbox.OutboxService;
import com.flagship.gl_posting.posting.derived.BillPostingBuilder;
import com.flagship.gl_posting.posting.derived.DocumentLine;
import com.flagship.gl_posting.posting.derived.DocumentPostingRequest;
import com.flagship.gl_posting.posting.derived.InvoicePostingBuilder;
import com.flagship.gl_posting.posting.event.JournalPendingApprovalEvent;
import com.flagship.gl_posting.posting.event.JournalPostedEvent;
import com.flagship.gl_posting.posting.event.JournalReversedEvent;
import com.flagship.gl_posting.posting.event.TaxLookupDegradedEvent;
import com.flagship.gl_posting.sod.SodAction;
import com.flagship.gl_posting.sod.SodPolicyEvaluator;
import com.flagship.gl_posting.sod.SodPolicyTable;
import com.flagship.gl_posting.sod.SodRule;
import com.flagship.gl_posting.tax.TaxCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.gl_posting.TestLedger.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostingServiceTest {

    private static final SodPolicyTable POLICY = SodPolicyTable.of(List.of(
        SodRule.allow("admin", SodAction.JOURNAL_POST),
        SodRule.allow("admin", SodAction.JOURNAL_REVERSE),
        SodRule.threshold("manager", SodAction.JOURNAL_POST, new BigDecimal("50000"), List.of("finance-lead", "admin")),
        SodRule.approval("clerk", SodAction.JOURNAL_POST, List.of("manager", "finance-lead", "admin")),
        SodRule.deny("viewer", SodAction.JOURNAL_POST),
        SodRule.allow("accountant", SodAction.INVOICE_POST),
        SodRule.allow("accountant", SodAction.BILL_POST),
        SodRule.allow("finance-lead", SodAction.JOURNAL_POST)
    ), Map.of());

    @Mock
    private IdempotencyGate idempotencyGate;

    @Mock
    private JournalStore journalStore;

    @Mock
    private OutboxService outboxService;

    private final FakeAccountDirectory accounts = new FakeAccountDirectory();
    private final FakeTaxCodeDirectory taxCodes = new FakeTaxCodeDirectory();
    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private PostingService service;

    @BeforeEach
    void setUp() {
        PostingProperties properties = new PostingProperties();
        TaxCalculator taxCalculator = new TaxCalculator(taxCodes);
        JournalEventWriter eventWriter = new JournalEventWriter(outboxService);
        service = new PostingService(
            idempotencyGate,
            new RequestHasher(objectMapper),
            new JournalValidator(accounts, taxCalculator, new CoaPolicy(), properties, CLOCK),
            tenantId -> POLICY,
            new SodPolicyEvaluator(),
            new PostingDecisionMachine(),
            journalStore,
            new PostingFinalizer(journalStore, eventWriter),
            eventWriter,
            new InvoicePostingBuilder(taxCalculator, properties),
            new BillPostingBuilder(taxCalculator, properties),
            new PostingMetrics(registry),
            objectMapper,
            CLOCK);
    }

    private void admitFresh() {
        when(idempotencyGate.admit(any(), anyString(), anyString())).thenReturn(AdmitOutcome.fresh());
    }

    private JournalEntry inserted() {
        ArgumentCaptor<JournalEntry> captor = ArgumentCaptor.forClass(JournalEntry.class);
        verify(journalStore).insertJournal(captor.capture());
        return captor.getValue();
    }

    private void verifyEvent(String aggregateType, String eventType) {
        verify(outboxService).saveEvent(eq(aggregateType), any(UUID.class), eq(TENANT), eq(eventType), any());
    }

    private void verifyNothingRecorded() {
        verify(journalStore, never()).insertJournal(any());
        verify(idempotencyGate, never()).record(any(), any(), any(), any());
        verifyNoInteractions(outboxService);
    }

    @Nested
    @DisplayName("Direct and held postings")
    class Decisions {

        @Test
        @DisplayName("Admin posting a balanced entry is POSTED with a posted event and a stored result")
        void adminPostsDirectly() throws Exception {
            admitFresh();
            JournalPostingInput input = cashSale("admin").build();

            PostingResult result = service.post(input);

            assertEquals(JournalStatus.POSTED, result.getStatus());
            assertFalse(result.isRequiresApproval());
            assertEquals(new BigDecimal("1000.00"), result.getTotalDebit());
            assertEquals(new BigDecimal("1000.00"), result.getTotalCredit());

            JournalEntry entry = inserted();
            assertEquals(JournalStatus.POSTED, entry.getStatus());
            assertEquals(result.getId(), entry.getId());
            verifyEvent(OutboxEvent.AGGREGATE_JOURNAL, JournalPostedEvent.EVENT_TYPE);

            ArgumentCaptor<String> snapshot = ArgumentCaptor.forClass(String.class);
            verify(idempotencyGate).record(eq(TENANT), eq(input.getIdempotencyKey()), anyString(), snapshot.capture());
            assertEquals(result, objectMapper.readValue(snapshot.getValue(), PostingResult.class));
        }

        @Test
        @DisplayName("Clerk posting is held for approval by the listed roles and nothing is posted")
        void clerkIsHeld() {
            admitFresh();

            PostingResult result = service.post(cashSale("clerk").build());

            assertEquals(JournalStatus.PENDING_APPROVAL, result.getStatus());
            assertTrue(result.isRequiresApproval());
            assertTrue(result.getApproverRoles().contains("manager"));
            assertEquals(JournalStatus.PENDING_APPROVAL, inserted().getStatus());
            verifyEvent(OutboxEvent.AGGREGATE_JOURNAL, JournalPendingApprovalEvent.EVENT_TYPE);
            verify(outboxService, never()).saveEvent(any(), any(), any(), eq(JournalPostedEvent.EVENT_TYPE), any());
        }

        @Test
        @DisplayName("Viewer is refused as a SoD violation and nothing is written")
        void viewerDenied() {
            admitFresh();

            PostingException e = assertThrows(PostingException.class, () -> service.post(cashSale("viewer").build()));

            assertEquals(ErrorKind.SOD_VIOLATION, e.getKind());
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("Thresholds compare the functional-currency amount, not the entry amount")
        void thresholdUsesFunctionalAmount() {
            admitFresh();
            JournalPostingInput usd = cashSale("manager").clearLines()
                .currency("USD")
                .exchangeRate(new BigDecimal("4.7"))
                .line(JournalLine.debit(CASH.getId(), new BigDecimal("12000.00"), null))
                .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("12000.00"), null))
                .build();
            JournalPostingInput myr = usd.toBuilder()
                .currency("MYR")
                .exchangeRate(null)
                .journalNumber("JV-MYR-1")
                .idempotencyKey("key-myr-1")
                .build();

            assertEquals(JournalStatus.PENDING_APPROVAL, service.post(usd).getStatus());
            assertEquals(JournalStatus.POSTED, service.post(myr).getStatus());
        }
    }

    @Nested
    @DisplayName("Validation before authority")
    class Validation {

        @Test
        @DisplayName("An unbalanced single-line entry is refused even for a role that would be denied")
        void invalidBeatsSod() {
            admitFresh();
            JournalPostingInput input = cashSale("viewer").clearLines()
                .line(JournalLine.debit(CASH.getId(), new BigDecimal("1000.00"), null))
                .build();

            PostingException e = assertThrows(PostingException.class, () -> service.post(input));

            assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
            assertTrue(e.hasCode(JournalValidator.INSUFFICIENT_LINES));
            assertTrue(e.hasCode(JournalValidator.UNBALANCED_JOURNAL));
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("An inactive account refuses the entry as a COA error")
        void inactiveAccount() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").clearLines()
                .line(JournalLine.debit(INACTIVE.getId(), new BigDecimal("50.00"), null))
                .line(JournalLine.credit(CASH.getId(), new BigDecimal("50.00"), null))
                .build();

            PostingException e = assertThrows(PostingException.class, () -> service.post(input));

            assertEquals(ErrorKind.COA_ERROR, e.getKind());
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("A reused journal number is refused")
        void duplicateNumber() {
            admitFresh();
            when(journalStore.existsByJournalNumber(any(), eq("JV-2026-0001"))).thenReturn(true);

            PostingException e = assertThrows(PostingException.class,
                () -> service.post(cashSale("admin").journalNumber(" JV-2026-0001 ").build()));

            assertTrue(e.hasCode(PostingService.DUPLICATE_JOURNAL_NUMBER));
            verify(journalStore, never()).insertJournal(any());
        }

        @Test
        @DisplayName("A journal number wider than the stored column is refused before any write")
        void overlongNumber() {
            admitFresh();

            PostingException e = assertThrows(PostingException.class,
                () -> service.post(cashSale("admin").journalNumber("JV-" + "9".repeat(57)).build()));

            assertTrue(e.hasCode(JournalValidator.JOURNAL_NUMBER_TOO_LONG));
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("A taxed line submitted as already generated is refused instead of skipping its tax")
        void generatedLineRefused() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").clearLines()
                .line(JournalLine.debit(CASH.getId(), new BigDecimal("1000.00"), null))
                .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("1000.00"), null).toBuilder()
                    .taxCode("SST6").generated(true).build())
                .build();

            PostingException e = assertThrows(PostingException.class, () -> service.post(input));

            assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
            assertTrue(e.hasCode(PostingService.GENERATED_LINE_NOT_ALLOWED));
            assertEquals(List.of(1), e.getErrors().get(0).getDetails().get("lineIndexes"));
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("A missing idempotency key is refused before anything else runs")
        void missingKey() {
            PostingException e = assertThrows(PostingException.class,
                () -> service.post(cashSale("admin").idempotencyKey(null).build()));

            assertTrue(e.hasCode(PostingService.MISSING_IDEMPOTENCY_KEY));
            verifyNoInteractions(idempotencyGate, journalStore, outboxService);
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("A retried request returns the stored result and writes exactly one journal")
        void replayReturnsStoredResult() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").build();
            PostingResult first = service.post(input);

            ArgumentCaptor<String> snapshot = ArgumentCaptor.forClass(String.class);
            verify(idempotencyGate).record(any(), any(), any(), snapshot.capture());
            when(idempotencyGate.admit(any(), anyString(), anyString()))
                .thenReturn(AdmitOutcome.replay(snapshot.getValue()));

            PostingResult second = service.post(input);

            assertEquals(first, second);
            verify(journalStore, times(1)).insertJournal(any());
            verify(idempotencyGate, times(1)).record(any(), any(), any(), any());
            assertEquals(1, accounts.getLookups(), "a replay does not validate again");
        }

        @Test
        @DisplayName("The same payload hashes the same whether amounts say 1000 or 1000.00")
        void hashIgnoresTrailingZeros() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").build();
            JournalPostingInput sameAmounts = input.toBuilder().clearLines()
                .line(JournalLine.debit(CASH.getId(), new BigDecimal("1000"), "Cash received"))
                .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("1000"), "Sales"))
                .build();

            service.post(input);
            service.post(sameAmounts);

            ArgumentCaptor<String> hashes = ArgumentCaptor.forClass(String.class);
            verify(idempotencyGate, times(2)).admit(eq(TENANT), eq(input.getIdempotencyKey()), hashes.capture());
            assertEquals(hashes.getAllValues().get(0), hashes.getAllValues().get(1));
        }

        @Test
        @DisplayName("A concurrent retry that loses the insert is answered as a key conflict, not a database error")
        void concurrentRetryLosesInsert() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").build();
            when(journalStore.insertJournal(any()))
                .thenThrow(new DuplicateKeyException("duplicate key value violates unique constraint \"uq_journal_number\""));
            when(idempotencyGate.isRecorded(TENANT, input.getIdempotencyKey())).thenReturn(true);

            PostingException e = assertThrows(PostingException.class, () -> service.post(input));

            assertEquals(ErrorKind.IDEMPOTENCY_CONFLICT, e.getKind());
            assertInstanceOf(DuplicateKeyException.class, e.getCause());
            assertEquals(1.0, registry.get("posting.failures").tag("kind", "IDEMPOTENCY_CONFLICT").counter().count());
            verify(idempotencyGate, never()).record(any(), any(), any(), any());
        }

        @Test
        @DisplayName("A different request taking the same number first is reported as a duplicate number")
        void concurrentNumberClash() {
            admitFresh();
            JournalPostingInput input = cashSale("admin").journalNumber("JV-2026-0099").build();
            when(journalStore.insertJournal(any()))
                .thenThrow(new DuplicateKeyException("duplicate key value violates unique constraint \"uq_journal_number\""));
            when(idempotencyGate.isRecorded(TENANT, input.getIdempotencyKey())).thenReturn(false);

            PostingException e = assertThrows(PostingException.class, () -> service.post(input));

            assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
            assertTrue(e.hasCode(PostingService.DUPLICATE_JOURNAL_NUMBER));
            assertEquals("JV-2026-0099", e.getErrors().get(0).getDetails().get("journalNumber"));
        }

        @Test
        @DisplayName("The same key with a different payload is a conflict and nothing is written")
        void conflict() {
            when(idempotencyGate.admit(any(), anyString(), anyString())).thenReturn(AdmitOutcome.conflict());

            PostingException e = assertThrows(PostingException.class, () -> service.post(cashSale("admin").build()));

            assertEquals(ErrorKind.IDEMPOTENCY_CONFLICT, e.getKind());
            verifyNothingRecorded();
            assertEquals(0, accounts.getLookups());
        }
    }

    @Nested
    @DisplayName("Upstream failures")
    class Upstream {

        @Test
        @DisplayName("Tax lookup down: the entry posts with zero tax, a warning and an audit event")
        void taxFailsOpen() {
            admitFresh();
            taxCodes.failWith(new DataAccessResourceFailureException("tax master unreachable"));
            JournalPostingInput input = cashSale("admin").clearLines()
                .line(JournalLine.debit(CASH.getId(), new BigDecimal("1000.00"), null))
                .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("1000.00"), null).toBuilder()
                    .taxCode("SST6").build())
                .build();

            PostingResult result = service.post(input);

            assertEquals(JournalStatus.POSTED, result.getStatus());
            assertEquals(1, result.getWarnings().size());
            assertEquals(PostingWarning.TAX_LOOKUP_UNAVAILABLE, result.getWarnings().get(0).getCode());
            assertEquals(2, inserted().getLines().size());
            verifyEvent(OutboxEvent.AGGREGATE_POSTING_AUDIT, TaxLookupDegradedEvent.EVENT_TYPE);
        }

        @Test
        @DisplayName("Account lookup down: the entry is refused, nothing is assumed valid")
        void accountsFailClosed() {
            admitFresh();
            accounts.failWith(new DataAccessResourceFailureException("connection refused"));

            PostingException e = assertThrows(PostingException.class, () -> service.post(cashSale("admin").build()));

            assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, e.getKind());
            verifyNothingRecorded();
        }
    }

    @Nested
    @DisplayName("Reversals")
    class Reversals {

        private final UUID originalId = UUID.randomUUID();

        private JournalEntry original(JournalStatus status) {
            return JournalEntry.builder()
                .id(originalId)
                .tenantId(TENANT)
                .companyId(COMPANY)
                .journalNumber("JV-ORIG")
                .status(status)
                .build();
        }

        private JournalPostingInput reversal() {
            return cashSale("admin").clearLines()
                .action(SodAction.JOURNAL_REVERSE)
                .reversalOf(originalId)
                .line(JournalLine.debit(REVENUE.getId(), new BigDecimal("1000.00"), null))
                .line(JournalLine.credit(CASH.getId(), new BigDecimal("1000.00"), null))
                .build();
        }

        @Test
        @DisplayName("A posted reversal moves the original to REVERSED and emits a reversed event")
        void reversalMarksOriginal() {
            admitFresh();
            when(journalStore.findById(any(), eq(originalId))).thenReturn(Optional.of(original(JournalStatus.POSTED)));
            when(journalStore.updateStatus(any(), eq(JournalStatus.POSTED))).thenReturn(true);

            PostingResult result = service.post(reversal());

            assertEquals(JournalStatus.POSTED, result.getStatus());
            verify(journalStore).updateStatus(argThat(e -> e.getId().equals(originalId)
                && e.getStatus() == JournalStatus.REVERSED), eq(JournalStatus.POSTED));
            verify(outboxService).saveEvent(eq(OutboxEvent.AGGREGATE_JOURNAL), eq(originalId), eq(TENANT),
                eq(JournalReversedEvent.EVENT_TYPE), any());
        }

        @Test
        @DisplayName("Reversing an unknown journal is refused")
        void unknownOriginal() {
            admitFresh();

            PostingException e = assertThrows(PostingException.class, () -> service.post(reversal()));

            assertTrue(e.hasCode(ApprovalService.JOURNAL_NOT_FOUND));
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("Only POSTED journals can be reversed")
        void pendingOriginal() {
            admitFresh();
            when(journalStore.findById(any(), eq(originalId)))
                .thenReturn(Optional.of(original(JournalStatus.PENDING_APPROVAL)));

            PostingException e = assertThrows(PostingException.class, () -> service.post(reversal()));

            assertEquals(ErrorKind.INVALID_STATE_TRANSITION, e.getKind());
            verifyNothingRecorded();
        }

        @Test
        @DisplayName("A second reversal of the same journal is refused")
        void alreadyReversed() {
            admitFresh();
            when(journalStore.findById(any(), eq(originalId))).thenReturn(Optional.of(original(JournalStatus.POSTED)));
            when(journalStore.findActiveReversalOf(any(), eq(originalId))).thenReturn(Optional.of(UUID.randomUUID()));

            PostingException e = assertThrows(PostingException.class, () -> service.post(reversal()));

            assertTrue(e.hasCode("ALREADY_REVERSED"));
            verifyNothingRecorded();
        }
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        private DocumentPostingRequest invoice() {
            return DocumentPostingRequest.builder()
                .documentNumber("INV-2026-0042")
                .description("March consulting")
                .documentDate(TODAY)
                .currency("MYR")
                .controlAccountId(RECEIVABLE.getId())
                .line(DocumentLine.builder().accountId(REVENUE.getId()).amount(new BigDecimal("1000.00"))
                    .taxCode("SST6").build())
                .idempotencyKey("inv-key-42")
                .context(context("accountant"))
                .build();
        }

        @Test
        @DisplayName("An invoice posts revenue, output tax and the receivable in one balanced entry")
        void invoicePosts() {
            admitFresh();

            PostingResult result = service.postInvoice(invoice());

            assertEquals(JournalStatus.POSTED, result.getStatus());
            assertEquals(new BigDecimal("1060.00"), result.getTotalDebit());
            JournalEntry entry = inserted();
            assertEquals("AR", entry.getSourceModule());
            assertEquals(3, entry.getLines().size());
            assertEquals(RECEIVABLE.getId(), entry.getLines().get(2).getAccountId());
        }

        @Test
        @DisplayName("A replayed invoice is answered from the store without rebuilding it")
        void invoiceReplay() {
            admitFresh();
            PostingResult first = service.postInvoice(invoice());
            ArgumentCaptor<String> snapshot = ArgumentCaptor.forClass(String.class);
            verify(idempotencyGate).record(any(), any(), any(), snapshot.capture());
            when(idempotencyGate.admit(any(), anyString(), anyString()))
                .thenReturn(AdmitOutcome.replay(snapshot.getValue()));

            assertEquals(first, service.postInvoice(invoice()));
            verify(journalStore, times(1)).insertJournal(any());
        }

        @Test
        @DisplayName("A bill posts expense and input tax against the payable")
        void billPosts() {
            admitFresh();

            PostingResult result = service.postBill(DocumentPostingRequest.builder()
                .documentNumber("BILL-2026-0103")
                .description("Office supplies")
                .documentDate(TODAY)
                .currency("MYR")
                .controlAccountId(PAYABLE.getId())
                .line(DocumentLine.builder().accountId(EXPENSE.getId()).amount(new BigDecimal("300.00"))
                    .taxCode("TX8").build())
                .idempotencyKey("bill-key-103")
                .context(context("accountant"))
                .build());

            assertEquals(JournalStatus.POSTED, result.getStatus());
            assertEquals(new BigDecimal("324.00"), result.getTotalCredit());
            JournalEntry entry = inserted();
            assertEquals("AP", entry.getSourceModule());
            assertEquals(PAYABLE.getId(), entry.getLines().get(2).getAccountId());
            verifyEvent(OutboxEvent.AGGREGATE_JOURNAL, JournalPostedEvent.EVENT_TYPE);
        }
    }
}
