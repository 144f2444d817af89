package dev.fairbid.games.escrow;

/**
 * Settlement arithmetic for the escrow bank.
 *
 * <p>The winner receives {@code fee + bidSum}, the loser {@code fee - bidSum}; together they drain the
 * {@code 2 * fee} bank exactly.
 */
public final class Ledger {

    private Ledger() {}

    public static long payout(boolean won, long fee, int bidSum) {
        if (bidSum < 0 || bidSum > fee) {
            throw new IllegalStateException("bid sum " + bidSum + " outside [0, " + fee + "]");
        }
        return won ? fee + bidSum : fee - bidSum;
    }

    /**
     * Authorize a payout against the bank and return the remaining balance.
     */
    public static long debit(long bank, long amount) {
        if (amount < 0) {
            throw new IllegalStateException("negative payout " + amount);
        }
        if (amount > bank) {
            throw new IllegalStateException("payout " + amount + " exceeds bank " + bank);
        }
        return bank - amount;
    }

    public static long credit(long bank, long amount) {
        if (amount <= 0) {
            throw new IllegalStateException("credit must be positive, got " + amount);
        }
        return Math.addExact(bank, amount);
    }
}
