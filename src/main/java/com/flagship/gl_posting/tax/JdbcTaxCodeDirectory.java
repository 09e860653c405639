package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.ledger.PostingContext;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcTaxCodeDirectory implements TaxCodeDirectory {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcTaxCodeDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<TaxCode> lookupTaxCodes(PostingContext scope, Collection<String> codes) {
        if (codes.isEmpty()) {
            return List.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", scope.getTenantId())
            .addValue("companyId", scope.getCompanyId())
            .addValue("codes", codes);

        return jdbcTemplate.query(
            "SELECT id, code, name, rate, tax_type, tax_account_id, is_active " +
            "FROM tax_codes " +
            "WHERE tenant_id = :tenantId AND company_id = :companyId " +
            "AND code IN (:codes) AND is_active = true",
            params,
            (rs, rowNum) -> TaxCode.builder()
                .id(rs.getObject("id", UUID.class))
                .code(rs.getString("code"))
                .name(rs.getString("name"))
                .rate(rs.getBigDecimal("rate"))
                .taxType(TaxType.valueOf(rs.getString("tax_type")))
                .taxAccountId(rs.getObject("tax_account_id", UUID.class))
                .active(rs.getBoolean("is_active"))
                .build());
    }
}
