package com.accountengine.accounts;

/**
 * Operations an account supports. Fixed when the account is opened.
 */
public enum Capability {
    DEPOSIT_ONLY,
    DEPOSIT_AND_WITHDRAW
}
