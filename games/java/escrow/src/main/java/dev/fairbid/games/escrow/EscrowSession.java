package dev.fairbid.games.escrow;

import dev.fairbid.EventBook;
import dev.fairbid.client.Aggregate;
import dev.fairbid.client.annotations.Applies;
import dev.fairbid.client.annotations.Handles;
import dev.fairbid.games.BidRevealed;
import dev.fairbid.games.ClaimOpponentTimeout;
import dev.fairbid.games.CommitmentPlaced;
import dev.fairbid.games.ForceResolve;
import dev.fairbid.games.Payout;
import dev.fairbid.games.PayoutRedirected;
import dev.fairbid.games.PayoutWithdrawn;
import dev.fairbid.games.Phase;
import dev.fairbid.games.PlaceCommitment;
import dev.fairbid.games.PlayerQuit;
import dev.fairbid.games.PlayerRegistered;
import dev.fairbid.games.QuitSession;
import dev.fairbid.games.RegisterPlayer;
import dev.fairbid.games.RevealBid;
import dev.fairbid.games.SessionForceResolved;
import dev.fairbid.games.TimeoutClaimed;
import dev.fairbid.games.WithdrawPayout;
import dev.fairbid.games.escrow.FairnessAssigner.Outcome;
import dev.fairbid.games.escrow.state.PlayerSlot;
import dev.fairbid.games.escrow.state.SessionState;

import java.util.ArrayList;
import java.util.List;

/**
 * Escrow session aggregate with event sourcing (OO pattern).
 *
 * <p>Two players escrow a fee, commit to a hidden bid, reveal it, and withdraw according to the parity
 * of the bid sum. A player left waiting on an opponent past the phase deadline may claim the whole bank.
 * Command handlers follow the guard/validate/compute pattern and never move funds themselves: events
 * that release funds carry a {@link Payout} the session engine executes after recording them.
 */
public class EscrowSession extends Aggregate<SessionState> {

    public static final String DOMAIN = "escrow";

    private final EscrowConfig config;
    private final long now;

    /**
     * @param history committed events of the session
     * @param config deployment constants
     * @param now current clock tick, fixed for the command being handled
     */
    public EscrowSession(EventBook history, EscrowConfig config, long now) {
        super(history);
        this.config = config;
        this.now = now;
    }

    @Override
    public String getDomain() {
        return DOMAIN;
    }

    @Override
    protected SessionState createEmptyState() {
        return new SessionState();
    }

    // --- Event appliers ---

    @Applies(PlayerRegistered.class)
    public void applyRegistered(SessionState state, PlayerRegistered event) {
        state.slot(event.getSlot()).seat(event.getPlayer());
        state.setBank(event.getBank());
        if (event.getSessionStarted()) {
            state.setOutcome(null);
            state.setPhaseDeadline(event.getPhaseDeadline());
        }
    }

    @Applies(PlayerQuit.class)
    public void applyQuit(SessionState state, PlayerQuit event) {
        state.reset();
    }

    @Applies(CommitmentPlaced.class)
    public void applyCommitment(SessionState state, CommitmentPlaced event) {
        PlayerSlot slot = state.slot(event.getSlot());
        slot.setCommitment(event.getCommitment());
        slot.setPhase(Phase.PHASE_REVEAL);
        if (event.getPhaseAdvanced()) {
            state.setPhaseDeadline(event.getPhaseDeadline());
        }
    }

    @Applies(BidRevealed.class)
    public void applyRevealed(SessionState state, BidRevealed event) {
        PlayerSlot slot = state.slot(event.getSlot());
        slot.setRevealedValue(event.getValue());
        slot.setPhase(Phase.PHASE_WITHDRAW);
        if (event.getPhaseAdvanced()) {
            state.setPhaseDeadline(event.getPhaseDeadline());
            state.setOutcome(new Outcome(event.getFirstSlotRole(), event.getWinningRole(), event.getBidSum()));
        }
    }

    @Applies(PayoutWithdrawn.class)
    public void applyWithdrawn(SessionState state, PayoutWithdrawn event) {
        state.slot(event.getSlot()).clear();
        state.setBank(event.getBank());
        if (event.getSessionClosed()) {
            state.reset();
        }
    }

    @Applies(TimeoutClaimed.class)
    public void applyTimeoutClaimed(SessionState state, TimeoutClaimed event) {
        state.reset();
    }

    @Applies(SessionForceResolved.class)
    public void applyForceResolved(SessionState state, SessionForceResolved event) {
        state.reset();
    }

    @Applies(PayoutRedirected.class)
    public void applyRedirected(SessionState state, PayoutRedirected event) {
        // Bank was already drained by the SessionForceResolved it follows
    }

    // --- State accessors ---

    public long getBank() {
        return getState().getBank();
    }

    public long getPhaseDeadline() {
        return getState().getPhaseDeadline();
    }

    public Phase getSessionPhase() {
        return getState().getSessionPhase();
    }

    // --- Command handlers ---

    @Handles(RegisterPlayer.class)
    public PlayerRegistered register(RegisterPlayer cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();
        long fee = config.registrationFee();

        // Guard
        if (state.slotOf(caller) >= 0) {
            throw Rejection.ALREADY_REGISTERED.error();
        }
        if (state.occupiedCount() == SessionState.SLOTS) {
            throw Rejection.SESSION_FULL.error();
        }
        if (!state.acceptsRegistration(fee)) {
            throw Rejection.SESSION_UNSETTLED.error("bank " + state.getBank());
        }

        // Validate
        if (cmd.getPayment() != fee) {
            throw Rejection.WRONG_FEE_AMOUNT.error("expected " + fee + ", got " + cmd.getPayment());
        }

        // Compute
        boolean starts = state.occupiedCount() == 1;
        return PlayerRegistered.newBuilder()
            .setPlayer(caller)
            .setSlot(state.firstEmptySlot())
            .setFee(fee)
            .setBank(Ledger.credit(state.getBank(), fee))
            .setSessionStarted(starts)
            .setPhaseDeadline(starts ? now + config.timeoutTicks() : state.getPhaseDeadline())
            .setTick(now)
            .build();
    }

    @Handles(QuitSession.class)
    public PlayerQuit quit(QuitSession cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();
        int index = requireSeat(state, caller);

        // Guard
        if (state.slot(index).getPhase() != Phase.PHASE_BID || state.opponentOf(index).isOccupied()) {
            throw Rejection.CANNOT_QUIT_NOW.error();
        }

        // Compute
        return PlayerQuit.newBuilder()
            .setPlayer(caller)
            .setSlot(index)
            .setRefund(payout(caller, state.getBank()))
            .setTick(now)
            .build();
    }

    @Handles(PlaceCommitment.class)
    public CommitmentPlaced placeCommitment(PlaceCommitment cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();
        int index = requireSeat(state, caller);
        PlayerSlot opponent = state.opponentOf(index);

        // Guard
        if (!opponent.isOccupied()) {
            throw Rejection.OPPONENT_MISSING.error();
        }
        if (state.slot(index).hasCommitment()) {
            throw Rejection.DUPLICATE_BID.error();
        }
        requireBeforeDeadline(state);

        // Validate
        if (!CommitmentVerifier.isWellFormed(cmd.getCommitment())) {
            throw Rejection.MALFORMED_COMMITMENT.error(cmd.getCommitment().size() + " bytes");
        }

        // Compute
        boolean advances = opponent.getPhase() == Phase.PHASE_REVEAL;
        return CommitmentPlaced.newBuilder()
            .setPlayer(caller)
            .setSlot(index)
            .setCommitment(cmd.getCommitment())
            .setPhaseAdvanced(advances)
            .setPhaseDeadline(advances ? now + config.timeoutTicks() : state.getPhaseDeadline())
            .setTick(now)
            .build();
    }

    @Handles(RevealBid.class)
    public BidRevealed revealBid(RevealBid cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();
        int index = requireSeat(state, caller);
        PlayerSlot own = state.slot(index);
        PlayerSlot opponent = state.opponentOf(index);

        // Guard
        if (!own.hasCommitment() || !opponent.hasCommitment()) {
            throw Rejection.BIDS_INCOMPLETE.error();
        }

        // Validate
        int value = cmd.getValue();
        if (value < config.minBid() || value > config.maxBid()) {
            throw Rejection.INVALID_RANGE.error(value + " not in [" + config.minBid() + ", " + config.maxBid() + "]");
        }
        requireBeforeDeadline(state);
        if (!CommitmentVerifier.matches(own.getCommitment(), value, cmd.getSecret())) {
            throw Rejection.COMMITMENT_MISMATCH.error();
        }
        if (own.hasRevealed()) {
            throw Rejection.ALREADY_REVEALED.error();
        }

        // Compute
        var event = BidRevealed.newBuilder()
            .setPlayer(caller)
            .setSlot(index)
            .setValue(value)
            .setTick(now);

        if (opponent.getPhase() == Phase.PHASE_WITHDRAW) {
            int first = index == 0 ? value : opponent.getRevealedValue();
            int second = index == 0 ? opponent.getRevealedValue() : value;
            Outcome outcome = FairnessAssigner.assign(first, second, config.maxBid());
            event.setPhaseAdvanced(true)
                .setPhaseDeadline(now + config.timeoutTicks())
                .setBidSum(outcome.bidSum())
                .setFirstSlotRole(outcome.firstSlotRole())
                .setWinningRole(outcome.winningRole());
        } else {
            event.setPhaseDeadline(state.getPhaseDeadline());
        }
        return event.build();
    }

    @Handles(WithdrawPayout.class)
    public PayoutWithdrawn withdraw(WithdrawPayout cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();
        int index = requireSeat(state, caller);
        Outcome outcome = state.getOutcome();

        // Guard
        if (state.slot(index).getPhase() != Phase.PHASE_WITHDRAW || outcome == null) {
            throw Rejection.REVEAL_INCOMPLETE.error();
        }
        requireBeforeDeadline(state);

        // Compute
        boolean won = outcome.isWinner(index);
        long amount = Ledger.payout(won, config.registrationFee(), outcome.bidSum());
        long remaining = Ledger.debit(state.getBank(), amount);
        return PayoutWithdrawn.newBuilder()
            .setPlayer(caller)
            .setSlot(index)
            .setRole(outcome.roleOf(index))
            .setWon(won)
            .setPayout(payout(caller, amount))
            .setBank(remaining)
            .setSessionClosed(!state.opponentOf(index).isOccupied())
            .setTick(now)
            .build();
    }

    @Handles(ClaimOpponentTimeout.class)
    public TimeoutClaimed claimOpponentTimeout(ClaimOpponentTimeout cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();

        // Guard
        if (now <= state.getPhaseDeadline()) {
            throw Rejection.PHASE_NOT_EXPIRED.error("deadline " + state.getPhaseDeadline() + ", now " + now);
        }
        int index = state.slotOf(caller);
        if (index < 0) {
            throw Rejection.CANNOT_CLAIM_NOW.error(caller + " holds no seat");
        }
        PlayerSlot own = state.slot(index);
        PlayerSlot opponent = state.opponentOf(index);
        if (!opponent.isOccupied() || !waitingOn(own.getPhase(), opponent.getPhase())) {
            throw Rejection.CANNOT_CLAIM_NOW.error();
        }

        // Compute
        return TimeoutClaimed.newBuilder()
            .setPlayer(caller)
            .setSlot(index)
            .setOpponent(opponent.getIdentity())
            .setOpponentPhase(opponent.getPhase())
            .setPayout(payout(caller, state.getBank()))
            .setTick(now)
            .build();
    }

    @Handles(ForceResolve.class)
    public SessionForceResolved forceResolve(ForceResolve cmd) {
        String caller = requireCaller(cmd.getCaller());
        SessionState state = getState();

        // Guard
        if (!caller.equals(config.administrator())) {
            throw Rejection.NOT_ADMINISTRATOR.error();
        }
        if (now <= state.getPhaseDeadline()) {
            throw Rejection.PHASE_NOT_EXPIRED.error("deadline " + state.getPhaseDeadline() + ", now " + now);
        }
        List<Integer> stuck = timedOutSlots(state);
        if (stuck.isEmpty()) {
            throw Rejection.NOBODY_TIMED_OUT.error();
        }

        // Compute
        String beneficiary = config.administrator();
        if (stuck.size() == 1) {
            PlayerSlot counterpart = state.opponentOf(stuck.get(0));
            if (counterpart.isOccupied()) {
                beneficiary = counterpart.getIdentity();
            }
        }

        var event = SessionForceResolved.newBuilder()
            .setAdministrator(caller)
            .setSessionPhase(state.getSessionPhase())
            .setPayout(payout(beneficiary, state.getBank()))
            .setFallbackRecipient(config.administrator())
            .setTick(now);
        for (int index : stuck) {
            event.addTimedOut(state.slot(index).getIdentity());
        }
        return event.build();
    }

    /**
     * Record that a force-resolve payout went to the fallback recipient instead of the intended one.
     */
    public PayoutRedirected recordRedirect(Payout original, String recipient, String reason) {
        PayoutRedirected event = PayoutRedirected.newBuilder()
            .setIntendedRecipient(original.getRecipient())
            .setPayout(payout(recipient, original.getAmount()))
            .setReason(reason)
            .build();
        applyAndRecord(event);
        return event;
    }

    // --- Helpers ---

    /**
     * Occupied slots that failed to act before the deadline.
     *
     * <p>With both players seated, whoever sits in the slower phase is stuck (both when they are level).
     * A lone player still in the withdraw phase, the opponent having already collected, is stuck on
     * their own. A lone player waiting for an opponent is never stuck.
     */
    static List<Integer> timedOutSlots(SessionState state) {
        List<Integer> stuck = new ArrayList<>();
        if (state.occupiedCount() == SessionState.SLOTS) {
            Phase slowest = state.getSessionPhase();
            for (int i = 0; i < SessionState.SLOTS; i++) {
                if (state.slot(i).getPhase() == slowest) {
                    stuck.add(i);
                }
            }
        } else if (state.occupiedCount() == 1) {
            int index = state.firstEmptySlot() == 0 ? 1 : 0;
            if (state.slot(index).getPhase() == Phase.PHASE_WITHDRAW) {
                stuck.add(index);
            }
        }
        return stuck;
    }

    private static boolean waitingOn(Phase own, Phase opponent) {
        return (own == Phase.PHASE_REVEAL && opponent == Phase.PHASE_BID)
            || (own == Phase.PHASE_WITHDRAW && opponent == Phase.PHASE_REVEAL);
    }

    private void requireBeforeDeadline(SessionState state) {
        if (now > state.getPhaseDeadline()) {
            throw Rejection.TIMED_OUT.error("deadline " + state.getPhaseDeadline() + ", now " + now);
        }
    }

    private static String requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw Rejection.MISSING_CALLER.error();
        }
        return caller;
    }

    private static int requireSeat(SessionState state, String caller) {
        int index = state.slotOf(caller);
        if (index < 0) {
            throw Rejection.NOT_REGISTERED.error();
        }
        return index;
    }

    private static Payout payout(String recipient, long amount) {
        return Payout.newBuilder().setRecipient(recipient).setAmount(amount).build();
    }
}
