package dev.fairbid.games.escrow.engine;

/**
 * Monotonic, non-decreasing tick counter deadlines are measured in.
 */
@FunctionalInterface
public interface Clock {
    long currentTick();
}
