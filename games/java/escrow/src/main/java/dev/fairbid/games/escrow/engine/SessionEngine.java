package dev.fairbid.games.escrow.engine;

import com.google.protobuf.Message;
import dev.fairbid.EventBook;
import dev.fairbid.client.Errors;
import dev.fairbid.client.Helpers;
import dev.fairbid.games.Payout;
import dev.fairbid.games.PayoutRedirected;
import dev.fairbid.games.PayoutWithdrawn;
import dev.fairbid.games.PlayerQuit;
import dev.fairbid.games.SessionForceResolved;
import dev.fairbid.games.TimeoutClaimed;
import dev.fairbid.games.escrow.EscrowConfig;
import dev.fairbid.games.escrow.EscrowSession;
import dev.fairbid.games.escrow.projector.EscrowLogProjector;
import dev.fairbid.games.escrow.state.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Runs escrow commands one at a time against the committed session history.
 *
 * <p>Each command is atomic. Its events are committed before any funds move, so a recipient that calls
 * back into the engine during a transfer observes the post-operation state. If a transfer fails the
 * history is restored to what it was before the command and the command fails with
 * {@link Errors.ExecutionAbortedError}. The one exception is a force-resolve payout: when the intended
 * recipient refuses it, the bank goes to the administrator instead.
 *
 * <p>While a transfer is in flight the recipient may read {@link #currentState()}, but any command it
 * submits is aborted. Rolling back the outer command must never discard a nested command whose funds
 * have already left.
 */
public class SessionEngine {
    private static final Logger logger = LoggerFactory.getLogger(SessionEngine.class);

    private final EscrowConfig config;
    private final Clock clock;
    private final FundsTransfer funds;
    private final EscrowLogProjector projector;

    private EventBook history = Helpers.emptyBook(EscrowSession.DOMAIN);
    private boolean settling;

    public SessionEngine(EscrowConfig config, Clock clock, FundsTransfer funds, EscrowLogProjector projector) {
        this.config = config;
        this.clock = clock;
        this.funds = funds;
        this.projector = projector;
    }

    /**
     * Handle a command and settle any payout it produces.
     *
     * @return the events the command recorded
     * @throws Errors.CommandRejectedError if a precondition does not hold; nothing is recorded
     * @throws Errors.ExecutionAbortedError if a transfer failed, in which case the command's events are
     *     rolled back, or if the command was submitted from inside a transfer
     */
    public synchronized EventBook execute(Message command) {
        String commandType = command.getDescriptorForType().getName();
        if (settling) {
            logger.warn("reentrant_command_refused", kv("command", commandType));
            throw new Errors.ExecutionAbortedError(commandType + " refused: a payout is in flight", null);
        }
        long tick = clock.currentTick();
        EventBook before = history;
        EscrowSession session = new EscrowSession(before, config, tick);

        Message event;
        try {
            event = session.handleCommand(command);
        } catch (Errors.CommandRejectedError e) {
            logger.debug("command_rejected",
                kv("command", commandType),
                kv("reason", e.getReason()),
                kv("tick", tick));
            throw e;
        }

        EventBook produced = commit(session.getEventBook());
        settling = true;
        try {
            produced = settle(session, event, produced);
        } catch (TransferFailedException e) {
            history = before;
            logger.warn("transfer_failed",
                kv("command", commandType),
                kv("recipient", e.getRecipient()),
                kv("amount", e.getAmount()),
                kv("error", e.getMessage()));
            throw new Errors.ExecutionAbortedError(commandType + " rolled back: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            history = before;
            throw e;
        } finally {
            settling = false;
        }

        logger.info("command_executed",
            kv("command", commandType),
            kv("tick", tick),
            kv("events", produced.getPagesCount()),
            kv("bank", session.getBank()),
            kv("session_phase", session.getSessionPhase()));
        notifyProjector(produced);
        return produced;
    }

    /**
     * Committed history of the session.
     */
    public synchronized EventBook history() {
        return history;
    }

    /**
     * Committed history starting at the given sequence number.
     */
    public synchronized EventBook history(int lowerBound) {
        int from = Math.min(Math.max(lowerBound, 0), history.getPagesCount());
        return history.toBuilder()
            .clearPages()
            .addAllPages(history.getPagesList().subList(from, history.getPagesCount()))
            .build();
    }

    /**
     * Session state rebuilt from the committed history.
     */
    public synchronized SessionState currentState() {
        return new EscrowSession(history, config, clock.currentTick()).getState();
    }

    public EscrowConfig getConfig() {
        return config;
    }

    private EventBook commit(EventBook recorded) {
        int first = Helpers.nextSequence(history);
        history = Helpers.append(history, recorded.getPagesList());
        return history(first);
    }

    private EventBook settle(EscrowSession session, Message event, EventBook produced)
            throws TransferFailedException {
        if (event instanceof SessionForceResolved resolved) {
            return settleForceResolve(session, resolved, produced);
        }
        Payout payout = payoutOf(event);
        if (payout != null) {
            pay(payout);
        }
        return produced;
    }

    private EventBook settleForceResolve(EscrowSession session, SessionForceResolved resolved, EventBook produced)
            throws TransferFailedException {
        Payout payout = resolved.getPayout();
        try {
            pay(payout);
            return produced;
        } catch (TransferFailedException e) {
            String fallback = resolved.getFallbackRecipient();
            if (fallback.equals(payout.getRecipient())) {
                throw e;
            }
            logger.warn("payout_redirected",
                kv("intended_recipient", payout.getRecipient()),
                kv("recipient", fallback),
                kv("amount", payout.getAmount()),
                kv("error", e.getMessage()));

            int recorded = session.getEventBook().getPagesCount();
            PayoutRedirected redirected = session.recordRedirect(payout, fallback, e.getMessage());
            EventBook redirect = commit(session.getEventBook().toBuilder()
                .clearPages()
                .addAllPages(session.getEventBook().getPagesList().subList(recorded, recorded + 1))
                .build());
            pay(redirected.getPayout());
            return produced.toBuilder().addAllPages(redirect.getPagesList()).build();
        }
    }

    private void pay(Payout payout) throws TransferFailedException {
        if (payout.getAmount() == 0) {
            return;
        }
        funds.transfer(payout.getRecipient(), payout.getAmount());
    }

    private static Payout payoutOf(Message event) {
        if (event instanceof PlayerQuit quit) {
            return quit.getRefund();
        }
        if (event instanceof PayoutWithdrawn withdrawn) {
            return withdrawn.getPayout();
        }
        if (event instanceof TimeoutClaimed claimed) {
            return claimed.getPayout();
        }
        return null;
    }

    private void notifyProjector(EventBook produced) {
        try {
            projector.logEvents(produced);
        } catch (RuntimeException e) {
            logger.warn("projector_failed", kv("error", e.getMessage()));
        }
    }
}
