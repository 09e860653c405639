package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.coa.Account;
import com.flagship.gl_posting.coa.AccountDirectory;
import com.flagship.gl_posting.coa.CoaPolicy;
import com.flagship.gl_posting.config.PostingProperties;
import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.ledger.ExchangeRate;
import com.flagship.gl_posting.ledger.Money;
import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.tax.LineTax;
import com.flagship.gl_posting.tax.TaxCalculator;
import com.flagship.gl_posting.tax.TaxableAmount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Checks a proposed entry against the double-entry rules.
 *
 * Steps run in data-dependency order:
 * 1. structure of the header and every line
 * 2. tax computation for lines carrying a tax code
 * 3. one batched account lookup, then the COA check per distinct account
 * 4. expansion of tax into generated lines
 * 5. balance of the expanded lines, within one minor unit
 *
 * Validation and COA errors are collected across all steps so the caller sees
 * every problem at once. The only thing that aborts validation is an account
 * lookup failure: without account data the entry is refused outright.
 */
@Service
@Slf4j
public class JournalValidator {

    public static final String NO_LINES = "NO_LINES";
    public static final String INSUFFICIENT_LINES = "INSUFFICIENT_LINES";
    public static final String TOO_MANY_LINES = "TOO_MANY_LINES";
    public static final String MISSING_ACCOUNT = "MISSING_ACCOUNT";
    public static final String NEGATIVE_AMOUNT = "NEGATIVE_AMOUNT";
    public static final String INVALID_LINE_AMOUNTS = "INVALID_LINE_AMOUNTS";
    public static final String ZERO_AMOUNTS = "ZERO_AMOUNTS";
    public static final String INVALID_PRECISION = "INVALID_PRECISION";
    public static final String CURRENCY_MISMATCH = "CURRENCY_MISMATCH";
    public static final String MISSING_JOURNAL_NUMBER = "MISSING_JOURNAL_NUMBER";
    public static final String JOURNAL_NUMBER_TOO_LONG = "JOURNAL_NUMBER_TOO_LONG";
    public static final String MISSING_DATE = "MISSING_DATE";
    public static final String FUTURE_DATE = "FUTURE_DATE";
    public static final String INVALID_CURRENCY = "INVALID_CURRENCY";
    public static final String FX_RATE_REQUIRED = "FX_RATE_REQUIRED";
    public static final String INVALID_EXCHANGE_RATE = "INVALID_EXCHANGE_RATE";
    public static final String UNBALANCED_JOURNAL = "UNBALANCED_JOURNAL";
    public static final String ACCOUNT_LOOKUP_UNAVAILABLE = "ACCOUNT_LOOKUP_UNAVAILABLE";

    /**
     * Width of {@code gl_journal.journal_number}.
     */
    public static final int MAX_JOURNAL_NUMBER_LENGTH = 50;

    private static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    private final AccountDirectory accountDirectory;
    private final TaxCalculator taxCalculator;
    private final CoaPolicy coaPolicy;
    private final PostingProperties properties;
    private final Clock clock;

    public JournalValidator(AccountDirectory accountDirectory, TaxCalculator taxCalculator, CoaPolicy coaPolicy,
                            PostingProperties properties, Clock clock) {
        this.accountDirectory = accountDirectory;
        this.taxCalculator = taxCalculator;
        this.coaPolicy = coaPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates an entry.
     *
     * @return valid result with totals and expanded lines, or invalid result listing every error
     * @throws PostingException with {@link ErrorKind#UPSTREAM_UNAVAILABLE} if the chart of accounts cannot be read
     */
    public ValidationResult validate(JournalPostingInput input) {
        PostingContext scope = Objects.requireNonNull(input.getContext(), "posting context is required");
        List<PostingError> errors = new ArrayList<>();
        List<JournalLine> lines = input.getLines();

        checkHeader(input, errors);
        CurrencyCode currency = CurrencyCode.parse(input.getCurrency()).orElse(null);
        if (currency == null) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(INVALID_CURRENCY)
                .message("Currency must be a supported 3-letter ISO code, got '" + input.getCurrency() + "'")
                .detail("currency", String.valueOf(input.getCurrency()))
                .build());
        }
        ExchangeRate rate = currency == null ? null : resolveRate(currency, input.getExchangeRate(), errors);
        boolean amountsUsable = checkLines(lines, currency, errors);

        List<LineTax> lineTaxes = amountsUsable && currency != null
            ? computeTaxes(scope, lines, currency)
            : List.of();

        Map<UUID, List<Integer>> linesByAccount = linesByAccount(lines, lineTaxes);
        Map<UUID, Account> accounts = lookupAccounts(scope, linesByAccount.keySet());
        Set<UUID> rejectedAccounts = checkAccounts(scope, linesByAccount, accounts, currency, errors);

        List<JournalLine> expanded = expand(lines, lineTaxes);

        ValidationResult.ValidationResultBuilder result = ValidationResult.builder()
            .currency(currency)
            .exchangeRate(rate);

        if (amountsUsable) {
            checkBalance(expanded, currency, errors);
            if (currency != null) {
                result.totalDebit(sum(expanded, currency, EntryType.DEBIT))
                    .totalCredit(sum(expanded, currency, EntryType.CREDIT));
                if (rate != null) {
                    result.functionalTotal(functionalDebitTotal(expanded, currency, rate));
                }
            }
        }

        Set<PostingWarning> warnings = new LinkedHashSet<>();
        lineTaxes.forEach(tax -> tax.warning().ifPresent(warnings::add));
        if (amountsUsable) {
            for (JournalLine line : lines) {
                Account account = accounts.get(line.getAccountId());
                if (account != null && !rejectedAccounts.contains(line.getAccountId())) {
                    coaPolicy.normalBalanceWarning(account, line.side(), line.amount().toPlainString())
                        .ifPresent(warnings::add);
                }
            }
        }

        ValidationResult validation = result
            .errors(errors)
            .warnings(warnings)
            .expandedLines(expanded)
            .build();

        log.debug("Validated journal {}: valid={}, errors={}, warnings={}",
            input.getJournalNumber(), validation.isValid(), errors.size(), warnings.size());
        return validation;
    }

    private void checkHeader(JournalPostingInput input, List<PostingError> errors) {
        if (input.getJournalNumber() == null || input.getJournalNumber().isBlank()) {
            errors.add(PostingError.validation(MISSING_JOURNAL_NUMBER, "Journal number is required"));
        } else if (input.getJournalNumber().trim().length() > MAX_JOURNAL_NUMBER_LENGTH) {
            String number = input.getJournalNumber().trim();
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(JOURNAL_NUMBER_TOO_LONG)
                .message(String.format("Journal number is %d characters, at most %d are allowed",
                    number.length(), MAX_JOURNAL_NUMBER_LENGTH))
                .detail("journalNumber", number)
                .detail("maxLength", MAX_JOURNAL_NUMBER_LENGTH)
                .build());
        }
        LocalDate date = input.getJournalDate();
        if (date == null) {
            errors.add(PostingError.validation(MISSING_DATE, "Journal date is required"));
        } else if (!properties.isAllowFutureDates() && date.isAfter(LocalDate.now(clock))) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(FUTURE_DATE)
                .message("Journal date cannot be in the future: " + date)
                .detail("journalDate", date.toString())
                .detail("today", LocalDate.now(clock).toString())
                .build());
        }
    }

    private ExchangeRate resolveRate(CurrencyCode currency, BigDecimal supplied, List<PostingError> errors) {
        CurrencyCode functional = properties.getFunctionalCurrency();
        if (currency == functional) {
            return ExchangeRate.identity(currency);
        }
        if (supplied == null) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(FX_RATE_REQUIRED)
                .message(String.format("Exchange rate required for %s to %s conversion", currency, functional))
                .detail("currency", currency.name())
                .detail("functionalCurrency", functional.name())
                .build());
            return null;
        }
        if (supplied.signum() <= 0) {
            errors.add(PostingError.validation(INVALID_EXCHANGE_RATE,
                "Exchange rate must be positive, got " + supplied.toPlainString()));
            return null;
        }
        return ExchangeRate.of(currency, functional, supplied);
    }

    /**
     * @return whether every line's amounts are well-formed, i.e. whether totals mean anything
     */
    private boolean checkLines(List<JournalLine> lines, CurrencyCode currency, List<PostingError> errors) {
        if (lines.isEmpty()) {
            errors.add(PostingError.validation(NO_LINES, "Journal must have at least one line"));
            return false;
        }
        if (lines.size() == 1) {
            errors.add(PostingError.validation(INSUFFICIENT_LINES,
                "Journal must have at least two lines to balance debits against credits"));
        }
        if (lines.size() > properties.getMaxLines()) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(TOO_MANY_LINES)
                .message("Journal cannot have more than " + properties.getMaxLines() + " lines")
                .detail("lineCount", lines.size())
                .detail("maxLines", properties.getMaxLines())
                .build());
        }

        boolean usable = true;
        for (int i = 0; i < lines.size(); i++) {
            JournalLine line = lines.get(i);
            if (line.getAccountId() == null) {
                errors.add(PostingError.line(i, MISSING_ACCOUNT, "Account is required"));
            }

            BigDecimal debit = line.debitOrZero();
            BigDecimal credit = line.creditOrZero();
            if (debit.signum() < 0 || credit.signum() < 0) {
                errors.add(PostingError.line(i, NEGATIVE_AMOUNT, "Debit and credit cannot be negative"));
                usable = false;
            } else if (debit.signum() > 0 && credit.signum() > 0) {
                errors.add(PostingError.line(i, INVALID_LINE_AMOUNTS, "Cannot have both debit and credit amounts"));
                usable = false;
            } else if (debit.signum() == 0 && credit.signum() == 0) {
                errors.add(PostingError.line(i, ZERO_AMOUNTS, "Must have either debit or credit amount"));
                usable = false;
            } else if (currency != null && !Money.fitsScale(line.amount(), currency)) {
                errors.add(PostingError.line(i, INVALID_PRECISION, String.format(
                    "Amount %s has more decimal places than %s allows", line.amount().toPlainString(), currency)));
                usable = false;
            }

            if (line.getCurrency() != null && currency != null
                && CurrencyCode.parse(line.getCurrency()).orElse(null) != currency) {
                errors.add(PostingError.line(i, CURRENCY_MISMATCH, String.format(
                    "Line currency %s differs from journal currency %s", line.getCurrency(), currency)));
            }
        }
        return usable;
    }

    private List<LineTax> computeTaxes(PostingContext scope, List<JournalLine> lines, CurrencyCode currency) {
        if (lines.stream().noneMatch(line -> !line.isGenerated() && line.getTaxCode() != null)) {
            return List.of();
        }
        List<TaxableAmount> taxable = new ArrayList<>(lines.size());
        for (JournalLine line : lines) {
            taxable.add(new TaxableAmount(
                Money.of(line.amount(), currency),
                line.isGenerated() ? null : line.getTaxCode()));
        }
        return taxCalculator.calculateInvoiceTaxes(scope, taxable);
    }

    /**
     * Every account the expanded entry will touch, mapped to the input lines that
     * bring it in. A tax account maps to the lines whose tax lands on it.
     */
    private Map<UUID, List<Integer>> linesByAccount(List<JournalLine> lines, List<LineTax> lineTaxes) {
        Map<UUID, List<Integer>> byAccount = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            UUID accountId = lines.get(i).getAccountId();
            if (accountId != null) {
                byAccount.computeIfAbsent(accountId, id -> new ArrayList<>()).add(i);
            }
        }
        for (int i = 0; i < lineTaxes.size(); i++) {
            LineTax tax = lineTaxes.get(i);
            if (tax.hasTax()) {
                byAccount.computeIfAbsent(tax.getTaxAccountId(), id -> new ArrayList<>()).add(i);
            }
        }
        return byAccount;
    }

    private Map<UUID, Account> lookupAccounts(PostingContext scope, Set<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Map.of();
        }
        try {
            return accountDirectory.lookupAccounts(scope, accountIds);
        } catch (RuntimeException e) {
            log.error("Account lookup failed for tenant {}, refusing posting: {}", scope.getTenantId(), e.getMessage());
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.UPSTREAM_UNAVAILABLE)
                .code(ACCOUNT_LOOKUP_UNAVAILABLE)
                .message("Chart of accounts is unavailable, the entry cannot be validated")
                .detail("accountCount", accountIds.size())
                .build(), e);
        }
    }

    /**
     * @return ids of accounts that failed the COA check
     */
    private Set<UUID> checkAccounts(PostingContext scope, Map<UUID, List<Integer>> linesByAccount,
                                    Map<UUID, Account> accounts, CurrencyCode currency, List<PostingError> errors) {
        Set<UUID> rejected = new HashSet<>();
        linesByAccount.forEach((accountId, lineIndexes) ->
            coaPolicy.canPost(accountId, accounts.get(accountId), scope, currency).ifPresent(error -> {
                rejected.add(accountId);
                errors.add(error.toBuilder().detail("lineIndexes", List.copyOf(lineIndexes)).build());
            }));
        if (!rejected.isEmpty()) {
            log.warn("COA check rejected accounts {} for tenant {}", rejected, scope.getTenantId());
        }
        return rejected;
    }

    /**
     * Appends one generated tax line per (side, tax code), on the same side as the
     * lines that carried the code.
     */
    private List<JournalLine> expand(List<JournalLine> lines, List<LineTax> lineTaxes) {
        if (lineTaxes.stream().noneMatch(LineTax::hasTax)) {
            return lines;
        }
        Map<String, JournalLine> taxLines = new LinkedHashMap<>();
        for (int i = 0; i < lineTaxes.size(); i++) {
            LineTax tax = lineTaxes.get(i);
            if (!tax.hasTax()) {
                continue;
            }
            EntryType side = lines.get(i).side();
            BigDecimal amount = tax.getTaxAmount().getAmount();
            JournalLine taxLine = JournalLine.builder()
                .accountId(tax.getTaxAccountId())
                .debit(side == EntryType.DEBIT ? amount : BigDecimal.ZERO)
                .credit(side == EntryType.CREDIT ? amount : BigDecimal.ZERO)
                .description("Tax " + tax.getTaxCode())
                .taxCode(tax.getTaxCode())
                .generated(true)
                .build();
            taxLines.merge(side + ":" + tax.getTaxCode(), taxLine, (a, b) -> a.toBuilder()
                .debit(a.debitOrZero().add(b.debitOrZero()))
                .credit(a.creditOrZero().add(b.creditOrZero()))
                .build());
        }
        List<JournalLine> expanded = new ArrayList<>(lines);
        expanded.addAll(taxLines.values());
        return expanded;
    }

    private void checkBalance(List<JournalLine> lines, CurrencyCode currency, List<PostingError> errors) {
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        for (JournalLine line : lines) {
            totalDebit = totalDebit.add(line.debitOrZero());
            totalCredit = totalCredit.add(line.creditOrZero());
        }
        BigDecimal tolerance = currency != null ? currency.minorUnit() : DEFAULT_TOLERANCE;
        BigDecimal difference = totalDebit.subtract(totalCredit);
        if (difference.abs().compareTo(tolerance) <= 0) {
            return;
        }
        EntryType shortSide = difference.signum() > 0 ? EntryType.CREDIT : EntryType.DEBIT;
        errors.add(PostingError.builder()
            .kind(ErrorKind.VALIDATION_ERROR)
            .code(UNBALANCED_JOURNAL)
            .message(String.format("Journal is not balanced. Debit: %s, Credit: %s, Difference: %s (%s side short)",
                totalDebit.toPlainString(), totalCredit.toPlainString(), difference.abs().toPlainString(),
                shortSide.name().toLowerCase()))
            .detail("totalDebit", totalDebit)
            .detail("totalCredit", totalCredit)
            .detail("difference", difference.abs())
            .detail("shortSide", shortSide.name())
            .build());
    }

    private static Money sum(List<JournalLine> lines, CurrencyCode currency, EntryType side) {
        Money total = Money.zero(currency);
        for (JournalLine line : lines) {
            BigDecimal amount = side == EntryType.DEBIT ? line.debitOrZero() : line.creditOrZero();
            total = total.add(Money.of(amount, currency));
        }
        return total;
    }

    private Money functionalDebitTotal(List<JournalLine> lines, CurrencyCode currency, ExchangeRate rate) {
        Money total = Money.zero(rate.getTo());
        for (JournalLine line : lines) {
            if (line.debitOrZero().signum() > 0) {
                total = total.add(taxCalculator.toFunctional(Money.of(line.debitOrZero(), currency), rate));
            }
        }
        return total;
    }
}
