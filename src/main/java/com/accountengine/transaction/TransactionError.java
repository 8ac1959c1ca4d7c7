package com.accountengine.transaction;

/**
 * Recoverable reasons a transaction can be declined.
 */
public enum TransactionError {
    /**
     * The requested withdrawal exceeds the current balance.
     * The account balance is left unchanged.
     */
    INSUFFICIENT_FUNDS
}
