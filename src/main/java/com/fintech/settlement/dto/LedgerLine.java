package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One requested journal line. Exactly one of debit and credit must be positive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerLine {

    private String account;
    private long debit;
    private long credit;

    public static LedgerLine debit(String account, long amount) {
        return new LedgerLine(account, amount, 0);
    }

    public static LedgerLine credit(String account, long amount) {
        return new LedgerLine(account, 0, amount);
    }
}
