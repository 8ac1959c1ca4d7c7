package com.accountengine.demo;

import com.accountengine.client.TransactionAmounts;
import com.accountengine.common.Currency;
import com.accountengine.common.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Settings for the startup demonstration, bound from {@code account-engine.demo.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "account-engine.demo")
public class DemoProperties {

    private boolean enabled = true;

    @NotNull(message = "Currency is required")
    private Currency currency = Currency.USD;

    @NotNull
    @Positive(message = "Deposit amount must be positive")
    @DecimalMin(value = "0.01", message = "Deposit amount must be at least 0.01")
    private BigDecimal depositAmount = new BigDecimal("1000");

    @NotNull
    @Positive(message = "Withdraw amount must be positive")
    @DecimalMin(value = "0.01", message = "Withdraw amount must be at least 0.01")
    private BigDecimal withdrawAmount = new BigDecimal("500");

    @NotNull
    @Positive(message = "Deposit-only amount must be positive")
    @DecimalMin(value = "0.01", message = "Deposit-only amount must be at least 0.01")
    private BigDecimal depositOnlyAmount = new BigDecimal("5000");

    public TransactionAmounts toTransactionAmounts() {
        return new TransactionAmounts(
            Money.of(depositAmount, currency),
            Money.of(withdrawAmount, currency),
            Money.of(depositOnlyAmount, currency)
        );
    }
}
