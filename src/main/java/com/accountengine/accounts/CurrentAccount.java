package com.accountengine.accounts;

import com.accountengine.common.Money;
import com.accountengine.transaction.TransactionResult;

/**
 * Current account for day-to-day use.
 *
 * Withdrawals follow exactly the same rules as {@link SavingsAccount}, so either can be
 * handed to code written against {@link WithdrawCapable}.
 */
public class CurrentAccount extends BaseAccount implements WithdrawCapable {

    public CurrentAccount(Money initialBalance) {
        super(initialBalance, AccountType.CURRENT);
    }

    @Override
    public TransactionResult withdraw(Money amount) {
        return debit(amount);
    }
}
