package com.fintech.settlement.provider;

public enum CollectionMode {
    /**
     * The customer approves a prompt on their handset (M-Pesa STK push).
     */
    PUSH_APPROVAL,
    /**
     * The provider debits the customer wallet against a collect request (Airtel Money).
     */
    DIRECT_COLLECT
}
