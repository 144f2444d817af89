package dev.fairbid.games.escrow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Deployment constants of an escrow session. Fixed for the lifetime of the process.
 *
 * @param minBid smallest bid a player may reveal
 * @param maxBid largest bid a player may reveal
 * @param timeoutTicks length of every phase window, in clock ticks
 * @param administrator principal allowed to force-resolve a stuck session
 */
public record EscrowConfig(int minBid, int maxBid, long timeoutTicks, String administrator) {

    private static final Logger logger = LoggerFactory.getLogger(EscrowConfig.class);

    public static final int DEFAULT_MIN_BID = 1;
    public static final int DEFAULT_MAX_BID = 100;
    public static final long DEFAULT_TIMEOUT_TICKS = 25;

    public EscrowConfig {
        if (minBid < 1) {
            throw new IllegalArgumentException("minBid must be at least 1, got " + minBid);
        }
        if (maxBid < minBid) {
            throw new IllegalArgumentException("maxBid " + maxBid + " is below minBid " + minBid);
        }
        if (timeoutTicks < 1) {
            throw new IllegalArgumentException("timeoutTicks must be positive, got " + timeoutTicks);
        }
        if (administrator == null || administrator.isBlank()) {
            throw new IllegalArgumentException("administrator is required");
        }
    }

    public static EscrowConfig defaults(String administrator) {
        return new EscrowConfig(DEFAULT_MIN_BID, DEFAULT_MAX_BID, DEFAULT_TIMEOUT_TICKS, administrator);
    }

    /**
     * Registration fee each player escrows: twice the largest bid, so the loser can always cover the bid sum.
     */
    public long registrationFee() {
        return 2L * maxBid;
    }

    /**
     * Load from ESCROW_* environment variables, falling back to defaults for missing or unparsable numbers.
     */
    public static EscrowConfig fromEnv(Map<String, String> env) {
        return new EscrowConfig(
            readInt(env, "ESCROW_MIN_BID", DEFAULT_MIN_BID),
            readInt(env, "ESCROW_MAX_BID", DEFAULT_MAX_BID),
            readNumber(env, "ESCROW_TIMEOUT_TICKS", DEFAULT_TIMEOUT_TICKS),
            env.getOrDefault("ESCROW_ADMINISTRATOR", ""));
    }

    public static long readNumber(Map<String, String> env, String name, long fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using default {}", name, raw, fallback);
            return fallback;
        }
    }

    /**
     * Like {@link #readNumber} but also falls back when the value does not fit in an int.
     */
    public static int readInt(Map<String, String> env, String name, int fallback) {
        long value = readNumber(env, name, fallback);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            logger.warn("Out of range {} '{}', using default {}", name, value, fallback);
            return fallback;
        }
    }
}
