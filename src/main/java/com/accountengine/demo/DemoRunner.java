package com.accountengine.demo;

import com.accountengine.accounts.AccountService;
import com.accountengine.accounts.CurrentAccount;
import com.accountengine.accounts.DepositCapable;
import com.accountengine.accounts.SavingsAccount;
import com.accountengine.accounts.WithdrawCapable;
import com.accountengine.client.BankClient;
import com.accountengine.common.Currency;
import com.accountengine.common.Money;
import com.accountengine.common.exception.InvalidAccountException;
import com.accountengine.transaction.TransactionRecord;
import com.accountengine.transaction.TransactionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints the account demonstration transcript on startup.
 *
 * 1. Substitution: savings and current accounts go through the same withdraw-capable path,
 *    the fixed term account through the deposit-only path.
 * 2. Invariant: withdrawing from an emptied account is declined and the balance stays at zero.
 * 3. Construction: opening an account with a negative balance is refused.
 */
@Component
@ConditionalOnProperty(prefix = "account-engine.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DemoRunner implements CommandLineRunner {

    private final AccountService accountService;
    private final DemoProperties properties;

    @Override
    public void run(String... args) {
        runDemo();
    }

    public List<TransactionRecord> runDemo() {
        List<TransactionRecord> records = new ArrayList<>();
        records.addAll(runSubstitutionDemo());
        records.addAll(runInvariantDemo());
        runInvalidConstructionDemo();
        return records;
    }

    private List<TransactionRecord> runSubstitutionDemo() {
        log.info("--- Substitutable accounts ---");
        Currency currency = properties.getCurrency();

        List<WithdrawCapable> withdrawCapable = List.of(
            accountService.openSavingsAccount(Money.zero(currency)),
            accountService.openCurrentAccount(Money.zero(currency))
        );
        List<DepositCapable> depositOnly = List.of(
            accountService.openFixedTermAccount(Money.zero(currency))
        );

        BankClient client = new BankClient(withdrawCapable, depositOnly, properties.toTransactionAmounts());
        return client.processTransactions();
    }

    private List<TransactionRecord> runInvariantDemo() {
        log.info("--- Balance can't go negative ---");
        Currency currency = properties.getCurrency();
        SavingsAccount account = accountService.openSavingsAccount(Money.of(100, currency));

        List<TransactionRecord> records = new ArrayList<>();
        records.add(withdraw(account, Money.of(100, currency)));
        records.add(withdraw(account, Money.of(50, currency)));
        return records;
    }

    private void runInvalidConstructionDemo() {
        log.info("--- Negative opening balance ---");
        try {
            CurrentAccount account = accountService.openCurrentAccount(Money.of(-10, properties.getCurrency()));
            log.error("Account {} was opened with a negative balance", account.getAccountId());
        } catch (InvalidAccountException e) {
            log.warn("Account not opened: {}", e.getMessage());
        }
    }

    private TransactionRecord withdraw(WithdrawCapable account, Money amount) {
        TransactionResult result = account.withdraw(amount);
        return TransactionRecord.withdrawal(account.getAccountId(), account.getAccountType(), amount, result);
    }
}
