package com.accountengine.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    void testScaleIsNormalizedToTwoDecimals() {
        Money money = Money.of("10.005", Currency.USD);

        assertEquals(new BigDecimal("10.01"), money.getAmount());
        assertEquals(Money.of("10.01", Currency.USD), money);
    }

    @Test
    void testAddAndSubtract() {
        Money a = Money.of(1000, Currency.EUR);
        Money b = Money.of("250.50", Currency.EUR);

        assertEquals(Money.of("1250.50", Currency.EUR), a.add(b));
        assertEquals(Money.of("749.50", Currency.EUR), a.subtract(b));
    }

    @Test
    void testComparisons() {
        Money small = Money.of(50, Currency.USD);
        Money large = Money.of(500, Currency.USD);

        assertTrue(small.isLessThan(large));
        assertTrue(large.isGreaterThan(small));
        assertTrue(large.isGreaterThanOrEqual(Money.of("500.00", Currency.USD)));
        assertTrue(Money.of(-10, Currency.USD).isNegative());
        assertFalse(Money.zero(Currency.USD).isPositive());
        assertFalse(Money.zero(Currency.USD).isNegative());
    }

    @Test
    void testDifferentCurrenciesRejected() {
        Money usd = Money.of(100, Currency.USD);
        Money gbp = Money.of(100, Currency.GBP);

        assertThrows(IllegalArgumentException.class, () -> usd.add(gbp));
        assertThrows(IllegalArgumentException.class, () -> usd.isLessThan(gbp));
        assertFalse(usd.isSameCurrency(gbp));
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Money.of((BigDecimal) null, Currency.USD));
        assertThrows(IllegalArgumentException.class, () -> Money.of(BigDecimal.ONE, null));
    }

    @Test
    void testToString() {
        assertEquals("1100.00 INR", Money.of(1100, Currency.INR).toString());
    }
}
