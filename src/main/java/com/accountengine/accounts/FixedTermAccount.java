package com.accountengine.accounts;

import com.accountengine.common.Money;

/**
 * Fixed term account.
 *
 * Funds stay locked for the term, so this account is only {@link DepositCapable}.
 * It deliberately has no withdraw operation rather than one that always fails.
 */
public class FixedTermAccount extends BaseAccount {

    public FixedTermAccount(Money initialBalance) {
        super(initialBalance, AccountType.FIXED_TERM);
    }
}
