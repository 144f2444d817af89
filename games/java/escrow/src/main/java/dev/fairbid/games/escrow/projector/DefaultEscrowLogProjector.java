package dev.fairbid.games.escrow.projector;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import dev.fairbid.EventBook;
import dev.fairbid.EventPage;
import dev.fairbid.client.Helpers;
import dev.fairbid.games.BidRevealed;
import dev.fairbid.games.CommitmentPlaced;
import dev.fairbid.games.PayoutRedirected;
import dev.fairbid.games.PayoutWithdrawn;
import dev.fairbid.games.PlayerQuit;
import dev.fairbid.games.PlayerRegistered;
import dev.fairbid.games.SessionForceResolved;
import dev.fairbid.games.TimeoutClaimed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HexFormat;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Default implementation of escrow event logging projector.
 */
public class DefaultEscrowLogProjector implements EscrowLogProjector {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEscrowLogProjector.class);

    @Override
    public void logEvents(EventBook eventBook) {
        if (eventBook == null || eventBook.getPagesList().isEmpty()) {
            return;
        }

        String domain = Helpers.domain(eventBook);
        for (EventPage page : eventBook.getPagesList()) {
            if (!page.hasEvent()) {
                continue;
            }

            String eventType = Helpers.simpleTypeName(page.getEvent().getTypeUrl());
            logEventDetails(domain, page.getSequence(), eventType, page.getEvent());
        }
    }

    private void logEventDetails(String domain, int sequence, String eventType, Any event) {
        try {
            switch (eventType) {
                case "PlayerRegistered" -> {
                    PlayerRegistered registered = event.unpack(PlayerRegistered.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", registered.getPlayer()),
                        kv("amount", registered.getFee()),
                        kv("bank", registered.getBank()));
                }
                case "PlayerQuit" -> {
                    PlayerQuit quit = event.unpack(PlayerQuit.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", quit.getPlayer()),
                        kv("amount", quit.getRefund().getAmount()));
                }
                case "CommitmentPlaced" -> {
                    CommitmentPlaced placed = event.unpack(CommitmentPlaced.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", placed.getPlayer()),
                        kv("commitment", HexFormat.of().formatHex(placed.getCommitment().toByteArray())));
                }
                case "BidRevealed" -> {
                    BidRevealed revealed = event.unpack(BidRevealed.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", revealed.getPlayer()),
                        kv("value", revealed.getValue()),
                        kv("bid_sum", revealed.getBidSum()));
                }
                case "PayoutWithdrawn" -> {
                    PayoutWithdrawn withdrawn = event.unpack(PayoutWithdrawn.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", withdrawn.getPlayer()),
                        kv("won", withdrawn.getWon()),
                        kv("amount", withdrawn.getPayout().getAmount()));
                }
                case "TimeoutClaimed" -> {
                    TimeoutClaimed claimed = event.unpack(TimeoutClaimed.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", claimed.getPlayer()),
                        kv("opponent", claimed.getOpponent()),
                        kv("amount", claimed.getPayout().getAmount()));
                }
                case "SessionForceResolved" -> {
                    SessionForceResolved resolved = event.unpack(SessionForceResolved.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("player", resolved.getAdministrator()),
                        kv("timed_out", resolved.getTimedOutList()),
                        kv("recipient", resolved.getPayout().getRecipient()),
                        kv("amount", resolved.getPayout().getAmount()));
                }
                case "PayoutRedirected" -> {
                    PayoutRedirected redirected = event.unpack(PayoutRedirected.class);
                    logger.info("event",
                        kv("domain", domain),
                        kv("sequence", sequence),
                        kv("event_type", eventType),
                        kv("intended_recipient", redirected.getIntendedRecipient()),
                        kv("recipient", redirected.getPayout().getRecipient()),
                        kv("amount", redirected.getPayout().getAmount()));
                }
                default -> logger.info("event",
                    kv("domain", domain),
                    kv("sequence", sequence),
                    kv("event_type", eventType),
                    kv("raw_bytes", event.getValue().size()));
            }
        } catch (InvalidProtocolBufferException e) {
            logger.warn("Failed to unpack event",
                kv("event_type", eventType),
                kv("error", e.getMessage()));
        }
    }
}
