package com.accountengine.accounts;

import com.accountengine.common.Currency;
import com.accountengine.common.Money;

/**
 * Contract shared by every account: it holds a non-negative balance and accepts deposits.
 *
 * Accounts that only implement this interface (such as {@link FixedTermAccount}) do not
 * offer withdrawal at all. Code that needs to withdraw must ask for {@link WithdrawCapable}.
 */
public interface DepositCapable {

    /**
     * Get the unique identifier for this account.
     */
    String getAccountId();

    /**
     * Get the account type, which also fixes the account's capability.
     */
    AccountType getAccountType();

    /**
     * Get the current balance. Never negative.
     */
    Money getBalance();

    /**
     * Get the currency of this account.
     */
    Currency getCurrency();

    /**
     * Add funds to the account.
     *
     * Always succeeds for a valid amount and increases the balance by exactly {@code amount}.
     *
     * @param amount a positive amount in the account's currency
     * @throws IllegalArgumentException if the amount is null, not positive, or in another currency
     */
    void deposit(Money amount);
}
