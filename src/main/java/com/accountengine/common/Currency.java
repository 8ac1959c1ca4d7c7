package com.accountengine.common;

/**
 * Supported account currencies.
 */
public enum Currency {
    USD,
    EUR,
    GBP,
    INR
}
