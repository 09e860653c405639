package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.ledger.ExchangeRate;
import com.flagship.gl_posting.ledger.Money;
import com.flagship.gl_posting.ledger.PostingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes tax amounts for posting lines.
 *
 * Tax is rounded per line, half away from zero to the currency's minor unit,
 * and the rounded line amounts are summed. It is never rounded once on the total.
 *
 * Missing tax master data degrades to zero tax with a warning instead of
 * failing the posting. Account lookups elsewhere in the engine do the opposite.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxCalculator {

    private final TaxCodeDirectory taxCodeDirectory;

    /**
     * Tax for a single line. Costs one lookup; prefer {@link #calculateInvoiceTaxes} for several lines.
     */
    public LineTax calculateLineTax(PostingContext scope, Money lineAmount, String taxCode) {
        return calculateInvoiceTaxes(scope, List.of(new TaxableAmount(lineAmount, taxCode))).get(0);
    }

    /**
     * Tax for many lines with one batched lookup. Results are in input order and
     * identical to calling {@link #calculateLineTax} per line.
     */
    public List<LineTax> calculateInvoiceTaxes(PostingContext scope, List<TaxableAmount> lines) {
        Set<String> codes = new LinkedHashSet<>();
        for (TaxableAmount line : lines) {
            if (hasCode(line.getTaxCode())) {
                codes.add(normalize(line.getTaxCode()));
            }
        }

        Optional<Map<String, TaxCode>> resolved = resolve(scope, codes);

        List<LineTax> result = new ArrayList<>(lines.size());
        for (TaxableAmount line : lines) {
            if (!hasCode(line.getTaxCode())) {
                result.add(LineTax.none(line.getAmount()));
            } else if (resolved.isEmpty()) {
                result.add(LineTax.degraded(line.getAmount(), normalize(line.getTaxCode()),
                    warning(PostingWarning.TAX_LOOKUP_UNAVAILABLE,
                        "Tax lookup unavailable, no tax applied for code " + normalize(line.getTaxCode()),
                        normalize(line.getTaxCode()))));
            } else {
                result.add(applyTax(line.getAmount(), normalize(line.getTaxCode()),
                    resolved.get().get(normalize(line.getTaxCode()))));
            }
        }
        return result;
    }

    /**
     * Pure tax computation for a line whose code has already been resolved.
     *
     * @param taxCode the resolved master record, or null if the code is unknown
     */
    public LineTax applyTax(Money lineAmount, String code, TaxCode taxCode) {
        if (taxCode == null || !taxCode.isActive()) {
            log.warn("Tax code {} not found, applying zero tax", code);
            return LineTax.degraded(lineAmount, code,
                warning(PostingWarning.TAX_CODE_NOT_FOUND, "Unknown tax code " + code + ", no tax applied", code));
        }
        if (taxCode.getTaxType() == TaxType.EXEMPT || taxCode.getRate().signum() == 0) {
            return new LineTax(code, BigDecimal.ZERO, Money.zero(lineAmount.getCurrency()), taxCode.getTaxAccountId(), null);
        }
        if (taxCode.getTaxAccountId() == null) {
            log.warn("Tax code {} has no tax account, applying zero tax", code);
            return LineTax.degraded(lineAmount, code,
                warning(PostingWarning.TAX_ACCOUNT_MISSING, "Tax code " + code + " has no tax account, no tax applied", code));
        }
        Money tax = lineAmount.multiply(taxCode.getRate());
        return new LineTax(code, taxCode.getRate(), tax, taxCode.getTaxAccountId(), null);
    }

    /**
     * Sums line taxes per code so each code produces one tax-liability posting.
     * Lines without tax are skipped. Groups keep first-seen order.
     */
    public List<TaxGroup> groupTaxesByCode(List<LineTax> lineTaxes) {
        Map<String, TaxGroup> groups = new LinkedHashMap<>();
        for (LineTax lineTax : lineTaxes) {
            if (!lineTax.hasTax()) {
                continue;
            }
            groups.merge(lineTax.getTaxCode(),
                new TaxGroup(lineTax.getTaxCode(), lineTax.getTaxAccountId(), lineTax.getTaxAmount()),
                (a, b) -> new TaxGroup(a.getTaxCode(), a.getTaxAccountId(), a.getTaxAmount().add(b.getTaxAmount())));
        }
        return new ArrayList<>(groups.values());
    }

    /**
     * Functional-currency equivalent of an amount, rounded once.
     */
    public Money toFunctional(Money amount, ExchangeRate rate) {
        return amount.convert(rate);
    }

    private Optional<Map<String, TaxCode>> resolve(PostingContext scope, Set<String> codes) {
        if (codes.isEmpty()) {
            return Optional.of(Map.of());
        }
        try {
            return Optional.of(taxCodeDirectory.lookupTaxCodes(scope, codes).stream()
                .collect(Collectors.toMap(tc -> normalize(tc.getCode()), Function.identity(), (a, b) -> a)));
        } catch (RuntimeException e) {
            log.warn("Tax code lookup failed for {} in tenant {}, degrading to zero tax: {}",
                codes, scope.getTenantId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static PostingWarning warning(String code, String message, String taxCode) {
        return PostingWarning.builder().code(code).message(message).detail("taxCode", taxCode).build();
    }

    private static boolean hasCode(String taxCode) {
        return taxCode != null && !taxCode.isBlank();
    }

    private static String normalize(String taxCode) {
        return taxCode.trim().toUpperCase(Locale.ROOT);
    }
}
