package com.flagship.gl_posting.sod;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What is being asked: the amount at stake (functional currency), the
 * originating module, and the role of the user who created the entry.
 */
@Value
public class SodRequest {
    BigDecimal amount;
    String module;
    String creatorRole;
}
