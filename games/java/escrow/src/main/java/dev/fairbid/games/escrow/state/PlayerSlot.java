package dev.fairbid.games.escrow.state;

import com.google.protobuf.ByteString;
import dev.fairbid.games.Phase;

/**
 * One of the two seats in a session.
 */
public class PlayerSlot {

    private String identity = "";
    private ByteString commitment = ByteString.EMPTY;
    private int revealedValue;
    private Phase phase = Phase.PHASE_REGISTER;

    public String getIdentity() { return identity; }

    public ByteString getCommitment() { return commitment; }
    public void setCommitment(ByteString commitment) { this.commitment = commitment; }

    public int getRevealedValue() { return revealedValue; }
    public void setRevealedValue(int revealedValue) { this.revealedValue = revealedValue; }

    public Phase getPhase() { return phase; }
    public void setPhase(Phase phase) { this.phase = phase; }

    public boolean isOccupied() {
        return !identity.isEmpty();
    }

    public boolean hasCommitment() {
        return !commitment.isEmpty();
    }

    public boolean hasRevealed() {
        return revealedValue != 0;
    }

    /**
     * Seat a newly registered player, discarding anything left from a previous occupant.
     */
    public void seat(String player) {
        identity = player;
        commitment = ByteString.EMPTY;
        revealedValue = 0;
        phase = Phase.PHASE_BID;
    }

    public void clear() {
        identity = "";
        commitment = ByteString.EMPTY;
        revealedValue = 0;
        phase = Phase.PHASE_REGISTER;
    }
}
