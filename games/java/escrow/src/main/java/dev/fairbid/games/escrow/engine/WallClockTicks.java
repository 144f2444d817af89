package dev.fairbid.games.escrow.engine;

import java.util.function.LongSupplier;

/**
 * Clock that advances one tick per fixed interval of monotonic time, starting at tick 1.
 */
public class WallClockTicks implements Clock {
    private final LongSupplier nanoTime;
    private final long origin;
    private final long tickNanos;

    public WallClockTicks(long tickMillis) {
        this(tickMillis, System::nanoTime);
    }

    WallClockTicks(long tickMillis, LongSupplier nanoTime) {
        if (tickMillis < 1) {
            throw new IllegalArgumentException("tickMillis must be positive, got " + tickMillis);
        }
        this.nanoTime = nanoTime;
        this.origin = nanoTime.getAsLong();
        this.tickNanos = tickMillis * 1_000_000L;
    }

    @Override
    public long currentTick() {
        return 1 + Math.max(0, nanoTime.getAsLong() - origin) / tickNanos;
    }
}
