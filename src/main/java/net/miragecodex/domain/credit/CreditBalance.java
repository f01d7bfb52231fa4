package net.miragecodex.domain.credit;

/**
 * Ledger projection for a user: settled balance and outstanding holds.
 */
public record CreditBalance(String userId, int balance, int held) {

    public static CreditBalance empty(String userId) {
        return new CreditBalance(userId, 0, 0);
    }

    /** Balance minus outstanding holds; what a new authorization may reserve. */
    public int available() {
        return balance - held;
    }
}
