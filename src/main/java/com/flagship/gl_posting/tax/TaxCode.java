package com.flagship.gl_posting.tax;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Tax master record. {@code rate} is a fraction: 0.06 for 6%.
 */
@Value
@Builder(toBuilder = true)
public class TaxCode {
    UUID id;
    String code;
    String name;
    BigDecimal rate;
    TaxType taxType;
    UUID taxAccountId;
    boolean active;
}
