package com.accountengine.accounts;

import com.accountengine.common.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for opening accounts.
 *
 * Accounts are plain in-memory objects owned by the caller; nothing is stored here.
 */
@Service
@Slf4j
public class AccountService {

    public SavingsAccount openSavingsAccount(Money initialBalance) {
        SavingsAccount account = new SavingsAccount(initialBalance);
        logOpened(account);
        return account;
    }

    public CurrentAccount openCurrentAccount(Money initialBalance) {
        CurrentAccount account = new CurrentAccount(initialBalance);
        logOpened(account);
        return account;
    }

    public FixedTermAccount openFixedTermAccount(Money initialBalance) {
        FixedTermAccount account = new FixedTermAccount(initialBalance);
        logOpened(account);
        return account;
    }

    /**
     * Open an account of the given type.
     *
     * Callers that need withdrawal should use the typed methods, which return
     * a {@link WithdrawCapable} where the type allows it.
     *
     * @throws com.accountengine.common.exception.InvalidAccountException if the initial balance is negative
     */
    public DepositCapable openAccount(AccountType accountType, Money initialBalance) {
        return switch (accountType) {
            case SAVINGS -> openSavingsAccount(initialBalance);
            case CURRENT -> openCurrentAccount(initialBalance);
            case FIXED_TERM -> openFixedTermAccount(initialBalance);
        };
    }

    private void logOpened(BaseAccount account) {
        log.info("Opened {} {} with balance {} {}",
            account.getAccountType().getDisplayName(), account.getAccountId(),
            account.getBalance().getAmount(), account.getCurrency());
    }
}
