package com.accountengine.accounts;

import com.accountengine.common.Money;
import com.accountengine.transaction.TransactionResult;

/**
 * Contract for accounts that allow funds to be taken out.
 *
 * Every implementation must honor the same pre- and postconditions:
 * <ul>
 *   <li>if {@code balance >= amount}, the balance decreases by exactly {@code amount}
 *       and the result is successful;</li>
 *   <li>otherwise the result fails with
 *       {@link com.accountengine.transaction.TransactionError#INSUFFICIENT_FUNDS}
 *       and the balance is unchanged.</li>
 * </ul>
 * An implementation may never reject a withdrawal that the balance covers, and may never
 * let the balance go below zero.
 */
public interface WithdrawCapable extends DepositCapable {

    /**
     * Take funds out of the account.
     *
     * @param amount a positive amount in the account's currency
     * @return the outcome, carrying the balance after the attempt
     * @throws IllegalArgumentException if the amount is null, not positive, or in another currency
     */
    TransactionResult withdraw(Money amount);
}
