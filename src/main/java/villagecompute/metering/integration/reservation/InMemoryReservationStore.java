/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.reservation;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-instance reservation store backed by a {@link ConcurrentHashMap}. Each increment runs inside
 * {@link ConcurrentMap#compute}, which serializes updates per key.
 */
public class InMemoryReservationStore implements ReservationStore {

    private record Counter(double cents, long expiresAtMillis) {
    }

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReservationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryReservationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public double increment(String key, double deltaCents, int ttlSeconds) {
        long now = clock.millis();
        Counter updated = counters.compute(key, (k, current) -> {
            double base = current == null || current.expiresAtMillis() <= now ? 0 : current.cents();
            double total = base + deltaCents;
            if (total <= 0) {
                return null;
            }
            return new Counter(total, now + ttlSeconds * 1000L);
        });
        return updated == null ? 0 : updated.cents();
    }

    @Override
    public double get(String key) {
        Counter counter = counters.get(key);
        if (counter == null || counter.expiresAtMillis() <= clock.millis()) {
            return 0;
        }
        return counter.cents();
    }
}
