package com.accountengine.transaction;

import com.accountengine.common.Money;
import lombok.Value;

/**
 * Outcome of a withdrawal.
 *
 * On success {@code balance} is the balance after the funds left the account.
 * On failure it is the untouched balance and {@code error} names the reason.
 */
@Value
public class TransactionResult {
    boolean successful;
    TransactionError error;
    Money balance;

    public static TransactionResult success(Money balance) {
        return new TransactionResult(true, null, balance);
    }

    public static TransactionResult failure(TransactionError error, Money balance) {
        return new TransactionResult(false, error, balance);
    }
}
