package dev.fairbid.games.escrow.engine;

/**
 * Value-transfer primitive that pays principals out of the escrow.
 *
 * <p>Implementations may call back into the engine; the engine has already recorded the
 * operation's effects when a transfer runs.
 */
@FunctionalInterface
public interface FundsTransfer {

    /**
     * @throws TransferFailedException if the recipient cannot receive the funds
     */
    void transfer(String recipient, long amount) throws TransferFailedException;
}
