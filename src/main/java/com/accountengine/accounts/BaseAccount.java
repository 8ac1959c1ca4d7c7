package com.accountengine.accounts;

import com.accountengine.common.Currency;
import com.accountengine.common.Money;
import com.accountengine.common.exception.InvalidAccountException;
import com.accountengine.transaction.TransactionError;
import com.accountengine.transaction.TransactionResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Base class for all account implementations.
 * Holds the balance and guards the invariant {@code balance >= 0}.
 *
 * This class only implements {@link DepositCapable}. Variants that allow withdrawal
 * implement {@link WithdrawCapable} and delegate to {@link #debit(Money)}.
 */
@Getter
@Slf4j
public abstract class BaseAccount implements DepositCapable {

    private final String accountId;

    private final AccountType accountType;

    private Money balance;

    protected BaseAccount(Money initialBalance, AccountType accountType) {
        if (initialBalance == null) {
            throw new InvalidAccountException(accountType, "initial balance is required");
        }
        if (initialBalance.isNegative()) {
            throw new InvalidAccountException(accountType, initialBalance);
        }
        this.accountId = UUID.randomUUID().toString();
        this.accountType = accountType;
        this.balance = initialBalance;
    }

    @Override
    public Currency getCurrency() {
        return balance.getCurrency();
    }

    @Override
    public void deposit(Money amount) {
        validateAmount(amount, "Deposit");
        checkInvariant();

        balance = balance.add(amount);

        checkInvariant();
        log.info("Deposited: {} in {}. New Balance: {}",
            amount.getAmount(), accountType.getDisplayName(), balance.getAmount());
    }

    /**
     * Take funds out if the balance covers them. Declines without touching the balance otherwise.
     */
    protected TransactionResult debit(Money amount) {
        validateAmount(amount, "Withdrawal");
        checkInvariant();

        if (balance.isLessThan(amount)) {
            log.warn("Insufficient funds in {}!", accountType.getDisplayName());
            log.debug("Declined withdrawal on account {}: requested {}, available {}",
                accountId, amount, balance);
            return TransactionResult.failure(TransactionError.INSUFFICIENT_FUNDS, balance);
        }

        balance = balance.subtract(amount);

        checkInvariant();
        log.info("Withdrawn: {} from {}. New Balance: {}",
            amount.getAmount(), accountType.getDisplayName(), balance.getAmount());
        return TransactionResult.success(balance);
    }

    private void validateAmount(Money amount, String operation) {
        if (amount == null) {
            throw new IllegalArgumentException(operation + " amount cannot be null");
        }
        if (!amount.isPositive()) {
            throw new IllegalArgumentException(operation + " amount must be positive: " + amount);
        }
        if (!balance.isSameCurrency(amount)) {
            throw new IllegalArgumentException(String.format("Currency mismatch: account %s holds %s, got %s",
                accountId, balance.getCurrency(), amount.getCurrency()));
        }
    }

    private void checkInvariant() {
        if (balance.isNegative()) {
            throw new IllegalStateException("Balance of account " + accountId + " is negative: " + balance);
        }
    }

    @Override
    public String toString() {
        return String.format("%s[%s, balance=%s]", getClass().getSimpleName(), accountId, balance);
    }
}
