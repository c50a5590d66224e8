package com.fintech.settlement.entity;

/**
 * Why money is being collected. Drives the revenue account a settlement is posted to.
 */
public enum PaymentPurpose {
    ONE_OFF("revenue:payments"),
    SUBSCRIPTION_RENEWAL("revenue:subscriptions"),
    REVERSAL(null);

    private final String revenueAccount;

    PaymentPurpose(String revenueAccount) {
        this.revenueAccount = revenueAccount;
    }

    public String getRevenueAccount() {
        return revenueAccount;
    }
}
