package com.flagship.gl_posting.posting.derived;

import com.flagship.gl_posting.config.PostingProperties;
import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.journal.JournalLine;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.journal.JournalValidator;
import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.ledger.ExchangeRate;
import com.flagship.gl_posting.ledger.Money;
import com.flagship.gl_posting.sod.SodAction;
import com.flagship.gl_posting.tax.LineTax;
import com.flagship.gl_posting.tax.TaxCalculator;
import com.flagship.gl_posting.tax.TaxGroup;
import com.flagship.gl_posting.tax.TaxableAmount;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a commercial document into a balanced journal input in the functional currency.
 *
 * Each line is converted once, then taxed once on its converted amount. Tax is
 * summed per code into one generated line on the document side, and the control
 * account takes the gross on the other side. The result still goes through the
 * full validator; this class only rejects what it cannot translate at all.
 */
@Slf4j
public abstract class DocumentPostingBuilder {

    private final TaxCalculator taxCalculator;
    private final PostingProperties properties;

    protected DocumentPostingBuilder(TaxCalculator taxCalculator, PostingProperties properties) {
        this.taxCalculator = taxCalculator;
        this.properties = properties;
    }

    /**
     * Side the revenue or expense lines and their tax lines go on.
     */
    protected abstract EntryType documentSide();

    protected abstract SodAction action();

    protected abstract String module();

    protected abstract String controlDescription(DocumentPostingRequest request);

    public DerivedPosting build(DocumentPostingRequest request) {
        List<PostingError> errors = new ArrayList<>();
        CurrencyCode functional = properties.getFunctionalCurrency();

        CurrencyCode currency = CurrencyCode.parse(request.getCurrency()).orElse(null);
        if (currency == null) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(JournalValidator.INVALID_CURRENCY)
                .message("Currency must be a supported 3-letter ISO code, got '" + request.getCurrency() + "'")
                .detail("currency", String.valueOf(request.getCurrency()))
                .build());
        }
        ExchangeRate rate = currency == null ? null : resolveRate(currency, functional, request.getExchangeRate(), errors);

        if (request.getLines().isEmpty()) {
            errors.add(PostingError.validation(JournalValidator.NO_LINES, "Document has no lines"));
        }

        List<Money> functionalAmounts = new ArrayList<>();
        for (int i = 0; i < request.getLines().size(); i++) {
            DocumentLine line = request.getLines().get(i);
            if (line.getAccountId() == null) {
                errors.add(PostingError.line(i, JournalValidator.MISSING_ACCOUNT, "account is required"));
            }
            if (line.getAmount() == null || line.getAmount().signum() <= 0) {
                errors.add(PostingError.line(i, JournalValidator.ZERO_AMOUNTS, "amount must be positive"));
                continue;
            }
            if (currency != null && !Money.fitsScale(line.getAmount(), currency)) {
                errors.add(PostingError.line(i, JournalValidator.INVALID_PRECISION,
                    "amount " + line.getAmount().toPlainString() + " has more decimals than " + currency + " allows"));
                continue;
            }
            if (rate != null) {
                functionalAmounts.add(taxCalculator.toFunctional(Money.of(line.getAmount(), currency), rate));
            }
        }
        if (request.getControlAccountId() == null) {
            errors.add(PostingError.validation(JournalValidator.MISSING_ACCOUNT, "Control account is required"));
        }
        if (!errors.isEmpty()) {
            throw new PostingException(errors);
        }

        List<TaxableAmount> taxables = new ArrayList<>();
        for (int i = 0; i < request.getLines().size(); i++) {
            taxables.add(new TaxableAmount(functionalAmounts.get(i), request.getLines().get(i).getTaxCode()));
        }
        List<LineTax> taxes = taxCalculator.calculateInvoiceTaxes(request.getContext(), taxables);
        List<TaxGroup> groups = taxCalculator.groupTaxesByCode(taxes);

        EntryType side = documentSide();
        JournalPostingInput.JournalPostingInputBuilder input = JournalPostingInput.builder()
            .journalNumber(request.getDocumentNumber())
            .description(request.getDescription())
            .journalDate(request.getDocumentDate())
            .currency(functional.name())
            .idempotencyKey(request.getIdempotencyKey())
            .context(request.getContext())
            .action(action())
            .module(module());

        Money net = Money.zero(functional);
        for (int i = 0; i < request.getLines().size(); i++) {
            DocumentLine line = request.getLines().get(i);
            Money amount = functionalAmounts.get(i);
            net = net.add(amount);
            input.line(sided(side, amount.getAmount()).toBuilder()
                .accountId(line.getAccountId())
                .description(line.getDescription())
                .costCenter(line.getCostCenter())
                .build());
        }

        Money tax = Money.zero(functional);
        for (TaxGroup group : groups) {
            tax = tax.add(group.getTaxAmount());
            input.line(sided(side, group.getTaxAmount().getAmount()).toBuilder()
                .accountId(group.getTaxAccountId())
                .description("Tax " + group.getTaxCode())
                .taxCode(group.getTaxCode())
                .generated(true)
                .build());
        }

        Money gross = net.add(tax);
        input.line(sided(side.opposite(), gross.getAmount()).toBuilder()
            .accountId(request.getControlAccountId())
            .description(controlDescription(request))
            .build());

        Set<PostingWarning> warnings = new LinkedHashSet<>();
        taxes.forEach(t -> t.warning().ifPresent(warnings::add));

        log.debug("Derived {} posting for {}: net={}, tax={}, gross={}",
            module(), request.getDocumentNumber(), net, tax, gross);
        return new DerivedPosting(input.build(), List.copyOf(warnings), net, tax, gross);
    }

    private static JournalLine sided(EntryType side, BigDecimal amount) {
        return side == EntryType.DEBIT
            ? JournalLine.debit(null, amount, null)
            : JournalLine.credit(null, amount, null);
    }

    private static ExchangeRate resolveRate(CurrencyCode currency, CurrencyCode functional, BigDecimal supplied,
                                            List<PostingError> errors) {
        if (currency == functional) {
            return ExchangeRate.identity(currency);
        }
        if (supplied == null) {
            errors.add(PostingError.builder()
                .kind(ErrorKind.VALIDATION_ERROR)
                .code(JournalValidator.FX_RATE_REQUIRED)
                .message(String.format("Exchange rate required for %s to %s conversion", currency, functional))
                .detail("currency", currency.name())
                .detail("functionalCurrency", functional.name())
                .build());
            return null;
        }
        if (supplied.signum() <= 0) {
            errors.add(PostingError.validation(JournalValidator.INVALID_EXCHANGE_RATE,
                "Exchange rate must be positive, got " + supplied.toPlainString()));
            return null;
        }
        return ExchangeRate.of(currency, functional, supplied);
    }
}
