package com.fintech.settlement.service;

/**
 * Hook computing the tax share carried inside a settled amount.
 */
public interface TaxPolicy {

    /**
     * @param grossAmount settled amount in minor units, tax inclusive
     * @return the tax share in minor units, between 0 and grossAmount
     */
    long taxOn(String tenantId, long grossAmount);
}
