package com.accountengine.client;

import com.accountengine.accounts.DepositCapable;
import com.accountengine.accounts.WithdrawCapable;
import com.accountengine.common.Money;
import com.accountengine.transaction.TransactionRecord;
import com.accountengine.transaction.TransactionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Client that runs a fixed set of transactions against two groups of accounts.
 *
 * Withdraw-capable accounts get a deposit followed by a withdrawal; deposit-only accounts
 * get a deposit. The client is written purely against {@link WithdrawCapable} and
 * {@link DepositCapable}: swapping one variant for another inside a group never changes
 * the code path taken here.
 */
@Slf4j
public class BankClient {

    private final List<WithdrawCapable> withdrawCapableAccounts;
    private final List<DepositCapable> depositOnlyAccounts;
    private final TransactionAmounts amounts;

    public BankClient(List<? extends WithdrawCapable> withdrawCapableAccounts,
                      List<? extends DepositCapable> depositOnlyAccounts,
                      TransactionAmounts amounts) {
        if (withdrawCapableAccounts == null || depositOnlyAccounts == null) {
            throw new IllegalArgumentException("Account lists cannot be null");
        }
        if (withdrawCapableAccounts.stream().anyMatch(Objects::isNull)
                || depositOnlyAccounts.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Account lists cannot contain null accounts");
        }
        if (amounts == null) {
            throw new IllegalArgumentException("Transaction amounts cannot be null");
        }
        this.withdrawCapableAccounts = List.copyOf(withdrawCapableAccounts);
        this.depositOnlyAccounts = List.copyOf(depositOnlyAccounts);
        this.amounts = amounts;
        requireDisjoint();
    }

    /**
     * Run the transactions against every account, in list order.
     *
     * @return one record per operation, in execution order
     */
    public List<TransactionRecord> processTransactions() {
        log.debug("Processing {} withdraw-capable and {} deposit-only accounts",
            withdrawCapableAccounts.size(), depositOnlyAccounts.size());

        List<TransactionRecord> records = new ArrayList<>();

        for (WithdrawCapable account : withdrawCapableAccounts) {
            records.add(deposit(account, amounts.getDepositAmount()));

            TransactionResult result = account.withdraw(amounts.getWithdrawAmount());
            records.add(TransactionRecord.withdrawal(
                account.getAccountId(), account.getAccountType(), amounts.getWithdrawAmount(), result));
        }

        for (DepositCapable account : depositOnlyAccounts) {
            records.add(deposit(account, amounts.getDepositOnlyAmount()));
        }

        long declined = records.stream().filter(r -> !r.isSuccessful()).count();
        log.debug("Processed {} transactions, {} declined", records.size(), declined);
        return Collections.unmodifiableList(records);
    }

    private TransactionRecord deposit(DepositCapable account, Money amount) {
        account.deposit(amount);
        return TransactionRecord.deposit(
            account.getAccountId(), account.getAccountType(), amount, account.getBalance());
    }

    private void requireDisjoint() {
        Set<DepositCapable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.addAll(withdrawCapableAccounts);
        for (DepositCapable account : depositOnlyAccounts) {
            if (seen.contains(account)) {
                throw new IllegalArgumentException(
                    "Account " + account.getAccountId() + " is in both the withdraw-capable and deposit-only groups");
            }
        }
    }
}
