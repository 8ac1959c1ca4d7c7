package com.accountengine.common.exception;

import com.accountengine.accounts.AccountType;
import com.accountengine.common.Money;

/**
 * Thrown when an account cannot be opened because its initial state would break
 * the non-negative balance invariant.
 */
public class InvalidAccountException extends AccountEngineException {

    private final AccountType accountType;

    public InvalidAccountException(AccountType accountType, Money initialBalance) {
        super(String.format("Cannot open %s with initial balance %s: balance can't be negative",
            accountType.getDisplayName(), initialBalance));
        this.accountType = accountType;
    }

    public InvalidAccountException(AccountType accountType, String reason) {
        super(String.format("Cannot open %s: %s", accountType.getDisplayName(), reason));
        this.accountType = accountType;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
