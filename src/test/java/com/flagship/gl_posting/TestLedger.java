package com.flagship.gl_posting;

import com.flagship.gl_posting.coa.Account;
import com.flagship.gl_posting.coa.AccountDirectory;
import com.flagship.gl_posting.coa.AccountType;
import com.flagship.gl_posting.journal.JournalLine;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.tax.TaxCode;
import com.flagship.gl_posting.tax.TaxCodeDirectory;
import com.flagship.gl_posting.tax.TaxType;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A small chart of accounts and helpers shared by the unit tests.
 */
public final class TestLedger {

    public static final UUID TENANT = UUID.fromString("11111111-1111-1111-1111-111111111111");
    public static final UUID COMPANY = UUID.fromString("22222222-2222-2222-2222-222222222222");

    public static final LocalDate TODAY = LocalDate.of(2026, 3, 31);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-31T09:00:00Z"), ZoneOffset.UTC);

    public static final Account CASH = account("1000", "Cash", AccountType.CASH);
    public static final Account RECEIVABLE = account("1200", "Trade receivables", AccountType.RECEIVABLE);
    public static final Account INPUT_TAX = account("1400", "Input tax recoverable", AccountType.ASSET);
    public static final Account PAYABLE = account("2000", "Trade payables", AccountType.PAYABLE);
    public static final Account SST_PAYABLE = account("2200", "SST payable", AccountType.TAX);
    public static final Account REVENUE = account("4000", "Sales", AccountType.INCOME);
    public static final Account EXPENSE = account("6000", "Office expenses", AccountType.EXPENSE);
    public static final Account INACTIVE = account("6900", "Old expenses", AccountType.EXPENSE).toBuilder()
        .active(false).build();
    public static final Account ASSETS_GROUP = account("1", "Assets", AccountType.ASSET).toBuilder()
        .group(true).build();

    public static final TaxCode SST6 = TaxCode.builder()
        .id(UUID.randomUUID()).code("SST6").name("Sales and service tax 6%")
        .rate(new BigDecimal("0.06")).taxType(TaxType.OUTPUT).taxAccountId(SST_PAYABLE.getId()).active(true)
        .build();

    public static final TaxCode TX8 = TaxCode.builder()
        .id(UUID.randomUUID()).code("TX8").name("Input tax 8%")
        .rate(new BigDecimal("0.08")).taxType(TaxType.INPUT).taxAccountId(INPUT_TAX.getId()).active(true)
        .build();

    private TestLedger() {
    }

    public static Account account(String code, String name, AccountType type) {
        return Account.builder()
            .id(UUID.randomUUID())
            .tenantId(TENANT)
            .companyId(COMPANY)
            .code(code)
            .name(name)
            .accountType(type)
            .active(true)
            .group(false)
            .build();
    }

    public static PostingContext context(String role) {
        return new PostingContext(TENANT, COMPANY, UUID.randomUUID(), role);
    }

    public static Map<UUID, Account> chart() {
        Map<UUID, Account> chart = new LinkedHashMap<>();
        for (Account account : new Account[] {CASH, RECEIVABLE, INPUT_TAX, PAYABLE, SST_PAYABLE, REVENUE, EXPENSE,
                INACTIVE, ASSETS_GROUP}) {
            chart.put(account.getId(), account);
        }
        return chart;
    }

    /**
     * Writes the chart and tax codes into a real database. Safe to call before every test.
     */
    public static void seed(JdbcTemplate jdbcTemplate) {
        for (Account account : chart().values()) {
            jdbcTemplate.update(
                "INSERT INTO chart_of_accounts (id, tenant_id, company_id, code, name, account_type, " +
                "is_group, is_active) VALUES (?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (id) DO NOTHING",
                account.getId(), account.getTenantId(), account.getCompanyId(), account.getCode(),
                account.getName(), account.getAccountType().name(), account.isGroup(), account.isActive());
        }
        for (TaxCode taxCode : List.of(SST6, TX8)) {
            jdbcTemplate.update(
                "INSERT INTO tax_codes (id, tenant_id, company_id, code, name, rate, tax_type, tax_account_id) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (id) DO NOTHING",
                taxCode.getId(), TENANT, COMPANY, taxCode.getCode(), taxCode.getName(), taxCode.getRate(),
                taxCode.getTaxType().name(), taxCode.getTaxAccountId());
        }
    }

    /**
     * Cash 1000.00 debit against revenue 1000.00 credit, in MYR.
     */
    public static JournalPostingInput.JournalPostingInputBuilder cashSale(String role) {
        return JournalPostingInput.builder()
            .journalNumber("JV-" + UUID.randomUUID().toString().substring(0, 8))
            .description("Cash sale")
            .journalDate(TODAY)
            .currency("MYR")
            .line(JournalLine.debit(CASH.getId(), new BigDecimal("1000.00"), "Cash received"))
            .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("1000.00"), "Sales"))
            .idempotencyKey("key-" + UUID.randomUUID())
            .context(context(role));
    }

    /**
     * Serves accounts from a fixed chart; can be switched to fail like an unreachable database.
     */
    public static class FakeAccountDirectory implements AccountDirectory {

        private final Map<UUID, Account> accounts = new HashMap<>(chart());
        private RuntimeException failure;
        private int lookups;

        public void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        public void add(Account account) {
            accounts.put(account.getId(), account);
        }

        public int getLookups() {
            return lookups;
        }

        @Override
        public Map<UUID, Account> lookupAccounts(PostingContext scope, Collection<UUID> accountIds) {
            lookups++;
            if (failure != null) {
                throw failure;
            }
            Map<UUID, Account> found = new HashMap<>();
            for (UUID id : accountIds) {
                Account account = accounts.get(id);
                if (account != null) {
                    found.put(id, account);
                }
            }
            return found;
        }
    }

    /**
     * Serves SST6 and TX8; can be switched to fail so tax degrades.
     */
    public static class FakeTaxCodeDirectory implements TaxCodeDirectory {

        private final Map<String, TaxCode> codes = new HashMap<>(Map.of(SST6.getCode(), SST6, TX8.getCode(), TX8));
        private RuntimeException failure;

        public void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public List<TaxCode> lookupTaxCodes(PostingContext scope, Collection<String> requested) {
            if (failure != null) {
                throw failure;
            }
            List<TaxCode> found = new ArrayList<>();
            for (String code : requested) {
                TaxCode taxCode = codes.get(code);
                if (taxCode != null) {
                    found.add(taxCode);
                }
            }
            return found;
        }
    }
}
