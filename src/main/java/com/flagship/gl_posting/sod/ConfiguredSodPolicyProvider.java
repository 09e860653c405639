package com.flagship.gl_posting.sod;

import com.flagship.gl_posting.error.PostingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Serves the table bound from application configuration. The table is built
 * and validated once at startup, so a malformed policy stops the service from
 * starting instead of failing individual postings.
 */
@Component
@Slf4j
public class ConfiguredSodPolicyProvider implements SodPolicyProvider {

    private final SodPolicyTable table;

    public ConfiguredSodPolicyProvider(SodPolicyProperties properties) {
        try {
            this.table = properties.toPolicyTable();
        } catch (PostingException e) {
            log.error("SoD policy configuration rejected: {}", e.getErrors());
            throw e;
        }
        log.info("Loaded SoD policy for roles {}", properties.getRoles().keySet());
    }

    @Override
    public SodPolicyTable policyFor(UUID tenantId) {
        return table;
    }
}
