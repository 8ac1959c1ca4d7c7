package com.accountengine.accounts;

import com.accountengine.common.Money;
import com.accountengine.transaction.TransactionResult;

/**
 * Savings account. Supports deposits and withdrawals covered by the balance.
 */
public class SavingsAccount extends BaseAccount implements WithdrawCapable {

    public SavingsAccount(Money initialBalance) {
        super(initialBalance, AccountType.SAVINGS);
    }

    @Override
    public TransactionResult withdraw(Money amount) {
        return debit(amount);
    }
}
