package com.accountengine.transaction;

/**
 * Types of balance-changing operations an account can perform.
 */
public enum TransactionType {
    /**
     * Funds added to an account. Available on every account.
     */
    DEPOSIT,

    /**
     * Funds taken out of a withdraw-capable account.
     */
    WITHDRAWAL
}
