package dev.fairbid.games.escrow.projector;

import dev.fairbid.EventBook;

/**
 * Interface for escrow event logging projector.
 */
public interface EscrowLogProjector {
    void logEvents(EventBook eventBook);
}
