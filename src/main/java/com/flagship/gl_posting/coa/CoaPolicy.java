package com.flagship.gl_posting.coa;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.ledger.PostingContext;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether an account may receive postings.
 *
 * Pure: no lookups, no side effects. The caller batches the account fetch and
 * asks once per distinct account; the first rule an account breaks is its error.
 */
@Component
public class CoaPolicy {

    public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String ACCOUNT_SCOPE_MISMATCH = "ACCOUNT_SCOPE_MISMATCH";
    public static final String ACCOUNT_INACTIVE = "ACCOUNT_INACTIVE";
    public static final String GROUP_ACCOUNT = "GROUP_ACCOUNT";
    public static final String CURRENCY_MISMATCH = "CURRENCY_MISMATCH";

    /**
     * Checks a single account.
     *
     * @param accountId the id referenced by the entry
     * @param account the looked-up account, or null if the lookup did not find it
     * @param scope tenant and company the entry belongs to
     * @param entryCurrency posting currency of the entry
     * @return the first violated rule, or empty if the account is postable
     */
    public Optional<PostingError> canPost(UUID accountId, Account account, PostingContext scope,
                                          CurrencyCode entryCurrency) {
        if (account == null) {
            return Optional.of(error(ACCOUNT_NOT_FOUND,
                "Account not found: " + accountId, accountId, null));
        }
        if (!scope.sameScopeAs(account.getTenantId(), account.getCompanyId())) {
            return Optional.of(error(ACCOUNT_SCOPE_MISMATCH,
                "Account " + account.getCode() + " does not belong to this company", accountId, account.getCode()));
        }
        if (!account.isActive()) {
            return Optional.of(error(ACCOUNT_INACTIVE,
                "Inactive account cannot be used: " + account.getCode(), accountId, account.getCode()));
        }
        if (account.isGroup()) {
            return Optional.of(error(GROUP_ACCOUNT,
                "Group account cannot be posted to directly: " + account.getCode(), accountId, account.getCode()));
        }
        if (account.getCurrency() != null && entryCurrency != null && account.getCurrency() != entryCurrency) {
            return Optional.of(PostingError.builder()
                .kind(ErrorKind.COA_ERROR)
                .code(CURRENCY_MISMATCH)
                .message(String.format("Account %s is denominated in %s, entry is in %s",
                    account.getCode(), account.getCurrency(), entryCurrency))
                .detail("accountId", accountId.toString())
                .detail("accountCode", account.getCode())
                .detail("accountCurrency", account.getCurrency().name())
                .detail("journalCurrency", entryCurrency.name())
                .build());
        }
        return Optional.empty();
    }

    /**
     * Flags a line on the side opposite the account's normal balance,
     * e.g. a credit to an asset. Legitimate, but worth a second look.
     */
    public Optional<PostingWarning> normalBalanceWarning(Account account, EntryType side, String amount) {
        EntryType normal = account.effectiveNormalBalance();
        if (normal == side) {
            return Optional.empty();
        }
        return Optional.of(PostingWarning.builder()
            .code(PostingWarning.ABNORMAL_BALANCE_SIDE)
            .message(String.format("%s account %s normally has %s balance",
                account.getAccountType().rootType(), account.getCode(), normal.name().toLowerCase()))
            .detail("accountId", account.getId().toString())
            .detail("accountType", account.getAccountType().rootType().name())
            .detail("side", side.name())
            .detail("amount", amount)
            .build());
    }

    private PostingError error(String code, String message, UUID accountId, String accountCode) {
        PostingError.PostingErrorBuilder builder = PostingError.builder()
            .kind(ErrorKind.COA_ERROR)
            .code(code)
            .message(message)
            .detail("accountId", accountId.toString());
        if (accountCode != null) {
            builder.detail("accountCode", accountCode);
        }
        return builder.build();
    }
}
