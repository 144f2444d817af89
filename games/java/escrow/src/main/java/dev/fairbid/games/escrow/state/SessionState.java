package dev.fairbid.games.escrow.state;

import dev.fairbid.games.Phase;
import dev.fairbid.games.escrow.FairnessAssigner.Outcome;

/**
 * Internal state of the escrow session aggregate.
 *
 * <p>Exactly two slots exist for the lifetime of the state. The session phase is not stored; it is the
 * slower of the two players' phases, an empty slot counting as {@link Phase#PHASE_REGISTER}.
 */
public class SessionState {

    public static final int SLOTS = 2;

    private final PlayerSlot[] slots = {new PlayerSlot(), new PlayerSlot()};
    private long bank;
    private long phaseDeadline;
    private Outcome outcome;

    public PlayerSlot slot(int index) {
        return slots[index];
    }

    public PlayerSlot opponentOf(int index) {
        return slots[1 - index];
    }

    public long getBank() { return bank; }
    public void setBank(long bank) { this.bank = bank; }

    public long getPhaseDeadline() { return phaseDeadline; }
    public void setPhaseDeadline(long phaseDeadline) { this.phaseDeadline = phaseDeadline; }

    /**
     * Roles and winner, known once both bids are revealed.
     */
    public Outcome getOutcome() { return outcome; }
    public void setOutcome(Outcome outcome) { this.outcome = outcome; }

    public int getBidSum() {
        return outcome == null ? 0 : outcome.bidSum();
    }

    public Phase getSessionPhase() {
        Phase first = slots[0].getPhase();
        Phase second = slots[1].getPhase();
        return first.getNumber() <= second.getNumber() ? first : second;
    }

    /**
     * Slot index held by the player, or -1.
     */
    public int slotOf(String player) {
        if (player == null || player.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < SLOTS; i++) {
            if (player.equals(slots[i].getIdentity())) {
                return i;
            }
        }
        return -1;
    }

    public int firstEmptySlot() {
        for (int i = 0; i < SLOTS; i++) {
            if (!slots[i].isOccupied()) {
                return i;
            }
        }
        return -1;
    }

    public int occupiedCount() {
        int count = 0;
        for (PlayerSlot slot : slots) {
            if (slot.isOccupied()) {
                count++;
            }
        }
        return count;
    }

    /**
     * True when a new player may take a seat: no session at all, or one player waiting alone with their fee.
     */
    public boolean acceptsRegistration(long fee) {
        int occupied = occupiedCount();
        if (occupied == 0) {
            return bank == 0;
        }
        if (occupied == 1) {
            PlayerSlot waiting = slots[firstEmptySlot() == 0 ? 1 : 0];
            return waiting.getPhase() == Phase.PHASE_BID && bank == fee;
        }
        return false;
    }

    public boolean isPristine() {
        return occupiedCount() == 0 && bank == 0 && phaseDeadline == 0 && outcome == null
            && slots[0].getPhase() == Phase.PHASE_REGISTER && slots[1].getPhase() == Phase.PHASE_REGISTER;
    }

    /**
     * Return to the "no session" state.
     */
    public void reset() {
        for (PlayerSlot slot : slots) {
            slot.clear();
        }
        bank = 0;
        phaseDeadline = 0;
        outcome = null;
    }
}
