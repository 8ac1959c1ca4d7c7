package com.accountengine.transaction;

import com.accountengine.accounts.AccountType;
import com.accountengine.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of one operation performed by the client against an account.
 */
@Value
@Builder
public class TransactionRecord {

    String accountId;

    AccountType accountType;

    TransactionType transactionType;

    Money amount;

    /**
     * Balance observed right after the operation completed (or was declined).
     */
    Money balanceAfter;

    boolean successful;

    /**
     * Null when the operation succeeded.
     */
    TransactionError error;

    public static TransactionRecord deposit(String accountId, AccountType accountType,
                                            Money amount, Money balanceAfter) {
        return TransactionRecord.builder()
            .accountId(accountId)
            .accountType(accountType)
            .transactionType(TransactionType.DEPOSIT)
            .amount(amount)
            .balanceAfter(balanceAfter)
            .successful(true)
            .build();
    }

    public static TransactionRecord withdrawal(String accountId, AccountType accountType,
                                               Money amount, TransactionResult result) {
        return TransactionRecord.builder()
            .accountId(accountId)
            .accountType(accountType)
            .transactionType(TransactionType.WITHDRAWAL)
            .amount(amount)
            .balanceAfter(result.getBalance())
            .successful(result.isSuccessful())
            .error(result.getError())
            .build();
    }
}
