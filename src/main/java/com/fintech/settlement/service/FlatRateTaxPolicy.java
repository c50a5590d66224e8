package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Single tax-inclusive rate for every tenant: tax = gross * rate / (1 + rate), rounded half up.
 * The default rate is zero.
 */
@Component
public class FlatRateTaxPolicy implements TaxPolicy {

    private final SettlementProperties properties;

    public FlatRateTaxPolicy(SettlementProperties properties) {
        this.properties = properties;
    }

    @Override
    public long taxOn(String tenantId, long grossAmount) {
        BigDecimal rate = properties.getTax().getRate();
        if (rate == null || rate.signum() <= 0 || grossAmount <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(grossAmount)
                .multiply(rate)
                .divide(BigDecimal.ONE.add(rate), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
