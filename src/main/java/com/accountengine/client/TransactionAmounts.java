package com.accountengine.client;

import com.accountengine.common.Currency;
import com.accountengine.common.Money;
import lombok.Value;

/**
 * Fixed amounts the {@link BankClient} moves through each account.
 */
@Value
public class TransactionAmounts {

    /**
     * Deposited into every withdraw-capable account before the withdrawal.
     */
    Money depositAmount;

    /**
     * Withdrawn from every withdraw-capable account after the deposit.
     */
    Money withdrawAmount;

    /**
     * Deposited into every deposit-only account.
     */
    Money depositOnlyAmount;

    public TransactionAmounts(Money depositAmount, Money withdrawAmount, Money depositOnlyAmount) {
        requirePositive(depositAmount, "depositAmount");
        requirePositive(withdrawAmount, "withdrawAmount");
        requirePositive(depositOnlyAmount, "depositOnlyAmount");
        if (!depositAmount.isSameCurrency(withdrawAmount) || !depositAmount.isSameCurrency(depositOnlyAmount)) {
            throw new IllegalArgumentException("All transaction amounts must share one currency");
        }
        this.depositAmount = depositAmount;
        this.withdrawAmount = withdrawAmount;
        this.depositOnlyAmount = depositOnlyAmount;
    }

    public static TransactionAmounts defaults(Currency currency) {
        return new TransactionAmounts(
            Money.of(1000, currency),
            Money.of(500, currency),
            Money.of(5000, currency)
        );
    }

    public Currency getCurrency() {
        return depositAmount.getCurrency();
    }

    private static void requirePositive(Money amount, String name) {
        if (amount == null || !amount.isPositive()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
