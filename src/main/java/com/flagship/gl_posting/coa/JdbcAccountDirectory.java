package com.flagship.gl_posting.coa;

import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.ledger.PostingContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Chart-of-accounts lookups over JDBC.
 *
 * Tenant and company predicates are part of every query, so accounts from
 * another scope come back as missing rather than as foreign rows.
 */
@Repository
public class JdbcAccountDirectory implements AccountDirectory {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcAccountDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<UUID, Account> lookupAccounts(PostingContext scope, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Map.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", scope.getTenantId())
            .addValue("companyId", scope.getCompanyId())
            .addValue("ids", accountIds);

        return jdbcTemplate.query(
                "SELECT id, tenant_id, company_id, code, name, account_type, normal_balance, " +
                "is_group, is_active, currency " +
                "FROM chart_of_accounts " +
                "WHERE tenant_id = :tenantId AND company_id = :companyId AND id IN (:ids)",
                params,
                accountRowMapper())
            .stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            AccountType type = AccountType.valueOf(rs.getString("account_type"));
            String normalBalance = rs.getString("normal_balance");
            String currency = rs.getString("currency");
            return Account.builder()
                .id(rs.getObject("id", UUID.class))
                .tenantId(rs.getObject("tenant_id", UUID.class))
                .companyId(rs.getObject("company_id", UUID.class))
                .code(rs.getString("code"))
                .name(rs.getString("name"))
                .accountType(type)
                .normalBalance(normalBalance != null ? EntryType.valueOf(normalBalance) : type.normalBalance())
                .group(rs.getBoolean("is_group"))
                .active(rs.getBoolean("is_active"))
                .currency(currency != null ? CurrencyCode.valueOf(currency) : null)
                .build();
        };
    }
}
