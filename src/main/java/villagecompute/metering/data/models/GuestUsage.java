/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;

/**
 * Daily message counter for unauthenticated guests. A guest is matched by its cookie token or by the hash of its
 * address, so clearing cookies does not reset the quota.
 */
@Entity
@Table(
        name = "guest_usage")
public class GuestUsage extends PanacheEntityBase {

    private static final String JPQL_FIND_BY_TOKEN_OR_IP = "FROM GuestUsage WHERE guestToken = ?1 OR ipHash = ?2 ORDER BY messageCount DESC";
    private static final String JPQL_FIND_BY_IP = "FROM GuestUsage WHERE ipHash = ?1 ORDER BY messageCount DESC";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "guest_token")
    public String guestToken;

    @Column(
            name = "ip_hash",
            nullable = false)
    public String ipHash;

    @Column(
            name = "message_count",
            nullable = false)
    public int messageCount = 0;

    /** UTC midnight of the day the counter belongs to. */
    @Column(
            name = "reset_at")
    public Instant resetAt;

    /**
     * Finds the record with the highest count matching either identifier, locked for update.
     */
    public static Optional<GuestUsage> findForUpdate(String guestToken, String ipHash) {
        if (guestToken == null) {
            return find(JPQL_FIND_BY_IP, ipHash).withLock(LockModeType.PESSIMISTIC_WRITE).firstResultOptional();
        }
        return find(JPQL_FIND_BY_TOKEN_OR_IP, guestToken, ipHash).withLock(LockModeType.PESSIMISTIC_WRITE)
                .firstResultOptional();
    }

    public static Optional<GuestUsage> findHighest(String guestToken, String ipHash) {
        if (guestToken == null) {
            return find(JPQL_FIND_BY_IP, ipHash).firstResultOptional();
        }
        return find(JPQL_FIND_BY_TOKEN_OR_IP, guestToken, ipHash).firstResultOptional();
    }
}
