package com.accountengine.accounts;

/**
 * Kinds of accounts the engine can open, each tagged with its capability.
 */
public enum AccountType {
    /**
     * Savings account. Funds can be deposited and withdrawn.
     */
    SAVINGS("Savings Account", Capability.DEPOSIT_AND_WITHDRAW),

    /**
     * Current account. Funds can be deposited and withdrawn.
     */
    CURRENT("Current Account", Capability.DEPOSIT_AND_WITHDRAW),

    /**
     * Fixed term account. Funds are locked in, so deposits are the only operation.
     */
    FIXED_TERM("Fixed Term Account", Capability.DEPOSIT_ONLY);

    private final String displayName;
    private final Capability capability;

    AccountType(String displayName, Capability capability) {
        this.displayName = displayName;
        this.capability = capability;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Capability getCapability() {
        return capability;
    }

    public boolean supportsWithdrawal() {
        return capability == Capability.DEPOSIT_AND_WITHDRAW;
    }
}
