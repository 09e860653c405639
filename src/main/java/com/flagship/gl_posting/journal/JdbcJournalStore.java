package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.PostingContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed journal store.
 *
 * Writes go through plain SQL so the database balance trigger on
 * {@code gl_journal_lines} sees exactly what the engine wrote.
 */
@Repository
public class JdbcJournalStore implements JournalStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcJournalStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID insertJournal(JournalEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO gl_journal (id, tenant_id, company_id, journal_number, description, journal_date, " +
            "currency, exchange_rate, total_debit, total_credit, status, source_module, idempotency_key, " +
            "created_by, created_by_role, approver_roles, reversal_of, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getTenantId(),
            entry.getCompanyId(),
            entry.getJournalNumber(),
            entry.getDescription(),
            entry.getJournalDate(),
            entry.getCurrency().name(),
            entry.getExchangeRate(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getStatus().name(),
            entry.getSourceModule(),
            entry.getIdempotencyKey(),
            entry.getCreatedBy(),
            entry.getCreatedByRole(),
            String.join(",", entry.getApproverRoles()),
            entry.getReversalOf(),
            Timestamp.from(entry.getCreatedAt()),
            Timestamp.from(entry.getUpdatedAt())
        );

        List<JournalLine> lines = entry.getLines();
        for (int i = 0; i < lines.size(); i++) {
            JournalLine line = lines.get(i);
            jdbcTemplate.update(
                "INSERT INTO gl_journal_lines (id, journal_id, line_number, account_id, debit, credit, " +
                "description, tax_code, cost_center, is_generated) " +
                "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getId(),
                i + 1,
                line.getAccountId(),
                line.debitOrZero(),
                line.creditOrZero(),
                line.getDescription(),
                line.getTaxCode(),
                line.getCostCenter(),
                line.isGenerated()
            );
        }
        return entry.getId();
    }

    @Override
    public Optional<JournalEntry> findById(PostingContext scope, UUID journalId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT * FROM gl_journal WHERE id = ? AND tenant_id = ? AND company_id = ?",
            journalRowMapper(),
            journalId, scope.getTenantId(), scope.getCompanyId());
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT account_id, debit, credit, description, tax_code, cost_center, is_generated " +
            "FROM gl_journal_lines WHERE journal_id = ? ORDER BY line_number",
            lineRowMapper(),
            journalId);
        return Optional.of(headers.get(0).toBuilder().lines(lines).build());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean updateStatus(JournalEntry updated, JournalStatus expected) {
        int rows = jdbcTemplate.update(
            "UPDATE gl_journal SET status = ?, decided_by = ?, rejection_reason = ?, updated_at = ? " +
            "WHERE id = ? AND tenant_id = ? AND status = ?",
            updated.getStatus().name(),
            updated.getDecidedBy(),
            updated.getRejectionReason(),
            Timestamp.from(updated.getUpdatedAt()),
            updated.getId(),
            updated.getTenantId(),
            expected.name());
        return rows == 1;
    }

    @Override
    public boolean existsByJournalNumber(PostingContext scope, String journalNumber) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM gl_journal WHERE tenant_id = ? AND company_id = ? AND journal_number = ?",
            Integer.class,
            scope.getTenantId(), scope.getCompanyId(), journalNumber);
        return count != null && count > 0;
    }

    @Override
    public Optional<UUID> findActiveReversalOf(PostingContext scope, UUID originalId) {
        return jdbcTemplate.query(
                "SELECT id FROM gl_journal WHERE tenant_id = ? AND company_id = ? AND reversal_of = ? " +
                "AND status IN ('PENDING_APPROVAL', 'POSTED')",
                (rs, rowNum) -> rs.getObject("id", UUID.class),
                scope.getTenantId(), scope.getCompanyId(), originalId)
            .stream()
            .findFirst();
    }

    private RowMapper<JournalEntry> journalRowMapper() {
        return (rs, rowNum) -> {
            String approverRoles = rs.getString("approver_roles");
            return JournalEntry.builder()
                .id(rs.getObject("id", UUID.class))
                .tenantId(rs.getObject("tenant_id", UUID.class))
                .companyId(rs.getObject("company_id", UUID.class))
                .journalNumber(rs.getString("journal_number"))
                .description(rs.getString("description"))
                .journalDate(rs.getDate("journal_date").toLocalDate())
                .currency(CurrencyCode.valueOf(rs.getString("currency")))
                .exchangeRate(rs.getBigDecimal("exchange_rate"))
                .totalDebit(rs.getBigDecimal("total_debit"))
                .totalCredit(rs.getBigDecimal("total_credit"))
                .status(JournalStatus.valueOf(rs.getString("status")))
                .sourceModule(rs.getString("source_module"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .createdBy(rs.getObject("created_by", UUID.class))
                .createdByRole(rs.getString("created_by_role"))
                .approverRoles(approverRoles == null || approverRoles.isBlank()
                    ? List.of()
                    : Arrays.asList(approverRoles.split(",")))
                .decidedBy(rs.getObject("decided_by", UUID.class))
                .rejectionReason(rs.getString("rejection_reason"))
                .reversalOf(rs.getObject("reversal_of", UUID.class))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
        };
    }

    private RowMapper<JournalLine> lineRowMapper() {
        return (rs, rowNum) -> JournalLine.builder()
            .accountId(rs.getObject("account_id", UUID.class))
            .debit(rs.getBigDecimal("debit"))
            .credit(rs.getBigDecimal("credit"))
            .description(rs.getString("description"))
            .taxCode(rs.getString("tax_code"))
            .costCenter(rs.getString("cost_center"))
            .generated(rs.getBoolean("is_generated"))
            .build();
    }
}
