/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.reservation;

/**
 * Atomic counter store holding the cents promised to in-flight inference calls, one counter per scope key.
 *
 * <p>
 * Implementations must apply the increment and return the new total in one atomic step. A counter that drops to zero
 * or below is deleted, and every change refreshes the key's TTL so counters leaked by a crashed instance expire.
 */
public interface ReservationStore {

    /**
     * Adds {@code deltaCents} (negative to release) to the counter and returns the new total.
     *
     * @param key
     *            scope key, e.g. {@code chat:reserved:<userId>}
     * @param deltaCents
     *            raw cents to add
     * @param ttlSeconds
     *            expiry applied after the change
     * @return new total in cents, 0 if the counter was removed
     */
    double increment(String key, double deltaCents, int ttlSeconds);

    /**
     * Current total for a key, 0 when absent or expired.
     */
    double get(String key);
}
