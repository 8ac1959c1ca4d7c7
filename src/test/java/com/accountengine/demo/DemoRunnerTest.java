package com.accountengine.demo;

import com.accountengine.accounts.AccountService;
import com.accountengine.accounts.AccountType;
import com.accountengine.common.Currency;
import com.accountengine.common.Money;
import com.accountengine.transaction.TransactionError;
import com.accountengine.transaction.TransactionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the startup demonstration.
 */
@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class DemoRunnerTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private DemoProperties demoProperties;

    @Autowired
    private ApplicationContext applicationContext;

    @Test
    void testRunnerDisabledInTestProfile() {
        assertFalse(demoProperties.isEnabled());
        assertTrue(applicationContext.getBeansOfType(DemoRunner.class).isEmpty());
    }

    @Test
    void testPropertiesBound() {
        assertEquals(Currency.USD, demoProperties.getCurrency());
        assertEquals(Money.of(1000, Currency.USD), demoProperties.toTransactionAmounts().getDepositAmount());
        assertEquals(Money.of(500, Currency.USD), demoProperties.toTransactionAmounts().getWithdrawAmount());
        assertEquals(Money.of(5000, Currency.USD), demoProperties.toTransactionAmounts().getDepositOnlyAmount());
    }

    @Test
    void testRunDemo() {
        DemoRunner runner = new DemoRunner(accountService, demoProperties);

        List<TransactionRecord> records = runner.runDemo();

        // 2 withdraw-capable accounts x 2 operations, 1 deposit-only, 2 invariant withdrawals
        assertEquals(7, records.size());

        assertEquals(AccountType.SAVINGS, records.get(0).getAccountType());
        assertEquals(Money.of(1000, Currency.USD), records.get(0).getBalanceAfter());
        assertEquals(Money.of(500, Currency.USD), records.get(1).getBalanceAfter());
        assertEquals(AccountType.CURRENT, records.get(2).getAccountType());
        assertEquals(Money.of(500, Currency.USD), records.get(3).getBalanceAfter());
        assertEquals(AccountType.FIXED_TERM, records.get(4).getAccountType());
        assertEquals(Money.of(5000, Currency.USD), records.get(4).getBalanceAfter());

        TransactionRecord emptied = records.get(5);
        assertTrue(emptied.isSuccessful());
        assertEquals(Money.zero(Currency.USD), emptied.getBalanceAfter());

        TransactionRecord declined = records.get(6);
        assertFalse(declined.isSuccessful());
        assertEquals(TransactionError.INSUFFICIENT_FUNDS, declined.getError());
        assertEquals(Money.zero(Currency.USD), declined.getBalanceAfter());
    }

    @Test
    void testRunDoesNotThrow() {
        DemoRunner runner = new DemoRunner(accountService, demoProperties);

        assertDoesNotThrow(() -> runner.run());
    }

    @Test
    void testTranscript(CapturedOutput output) {
        new DemoRunner(accountService, demoProperties).runDemo();

        assertTrue(output.getOut().contains("Deposited: 1000.00 in Savings Account. New Balance: 1000.00"));
        assertTrue(output.getOut().contains("Withdrawn: 500.00 from Current Account. New Balance: 500.00"));
        assertTrue(output.getOut().contains("Deposited: 5000.00 in Fixed Term Account. New Balance: 5000.00"));
        assertTrue(output.getOut().contains("Insufficient funds in Savings Account!"));
        assertTrue(output.getOut().contains("Account not opened"));
    }
}
