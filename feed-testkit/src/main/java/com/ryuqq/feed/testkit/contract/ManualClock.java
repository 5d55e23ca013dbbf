package com.ryuqq.feed.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when a test moves it.
 *
 * <p>Shared by the rate limiter, the circuit breaker and the cache store of a contract fixture so
 * that refill, cooldown and TTL scenarios run without sleeping. Safe to read from worker threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualClock extends Clock {

    /** Default starting instant for contract scenarios. */
    public static final Instant DEFAULT_START = Instant.parse("2025-09-07T12:00:00Z");

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public ManualClock() {
        this(DEFAULT_START);
    }

    public ManualClock(Instant start) {
        this(new AtomicReference<>(start), ZoneOffset.UTC);
    }

    private ManualClock(AtomicReference<Instant> now, ZoneId zone) {
        if (now.get() == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = now;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param amount non-negative amount of time
     * @return the new current instant
     * @throws IllegalArgumentException if amount is null or negative
     */
    public Instant advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount cannot be null or negative (current: " + amount + ")");
        }
        return now.updateAndGet(current -> current.plus(amount));
    }

    /**
     * Jumps to an absolute instant. Moving backwards is allowed.
     *
     * @param instant new current instant
     */
    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new ManualClock(now, newZone);
    }
}
