package dev.fairbid.games.escrow.engine;

/**
 * Thrown when funds cannot be delivered to a recipient.
 */
public class TransferFailedException extends Exception {
    private final String recipient;
    private final long amount;

    public TransferFailedException(String recipient, long amount, String message) {
        super(message);
        this.recipient = recipient;
        this.amount = amount;
    }

    public String getRecipient() {
        return recipient;
    }

    public long getAmount() {
        return amount;
    }
}
