package com.simscan.ledger;

/**
 * Per-user integer credit balance. Balances never go negative.
 */
public interface CreditLedger {

    /**
     * Atomically checks {@code credits >= amount} and decrements if so.
     * Two concurrent calls for the same user can never both succeed on the last unit.
     *
     * @return whether the deduction happened
     * @throws com.simscan.error.NotFoundException   unknown user
     * @throws com.simscan.error.ValidationException amount below 1
     */
    boolean tryDeduct(long userId, int amount);

    default boolean tryDeduct(long userId) {
        return tryDeduct(userId, 1);
    }

    /** Unconditional increase, used when a credit request is approved. */
    void grant(long userId, int amount);

    /**
     * Sets every balance of the given role to a fixed value. Last writer wins against
     * in-flight deductions.
     *
     * @return number of accounts touched
     */
    int resetAll(int defaultValue, String role);

    int balanceOf(long userId);
}
