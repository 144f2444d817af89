package dev.fairbid.games.escrow;

import dev.fairbid.games.Role;

/**
 * Maps the two revealed bids to roles and a winner.
 *
 * <p>Slot 0 takes role A when both bids fall on the same side of {@code maxBid / 2}, otherwise slot 1 does.
 * Role A wins when the bid sum is even. Neither player can pick a role alone because the assignment
 * depends on both committed values.
 */
public final class FairnessAssigner {

    private FairnessAssigner() {}

    /**
     * Result of a settled round.
     *
     * @param firstSlotRole role of the player in slot 0
     * @param winningRole role whose holder collects the bid sum
     * @param bidSum sum of both revealed bids
     */
    public record Outcome(Role firstSlotRole, Role winningRole, int bidSum) {

        public Role roleOf(int slot) {
            if (slot == 0) {
                return firstSlotRole;
            }
            return firstSlotRole == Role.ROLE_A ? Role.ROLE_B : Role.ROLE_A;
        }

        public boolean isWinner(int slot) {
            return roleOf(slot) == winningRole;
        }

        public int winningSlot() {
            return isWinner(0) ? 0 : 1;
        }
    }

    public static Outcome assign(int firstBid, int secondBid, int maxBid) {
        int half = maxBid / 2;
        boolean sameSide = (firstBid <= half && secondBid <= half) || (firstBid > half && secondBid > half);
        Role firstSlotRole = sameSide ? Role.ROLE_A : Role.ROLE_B;

        int sum = firstBid + secondBid;
        Role winningRole = sum % 2 == 0 ? Role.ROLE_A : Role.ROLE_B;
        return new Outcome(firstSlotRole, winningRole, sum);
    }
}
