/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.math.BigDecimal;
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
 * Per-member spending ceiling and running total in a group conversation funded by the owner.
 *
 * <p>
 * A member without a row has a budget of zero.
 */
@Entity
@Table(
        name = "member_budgets")
public class MemberBudget extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "member_id",
            nullable = false,
            unique = true)
    public UUID memberId;

    @Column(
            nullable = false,
            precision = 20,
            scale = 2)
    public BigDecimal budget = BigDecimal.ZERO;

    @Column(
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal spent = BigDecimal.ZERO;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    public static Optional<MemberBudget> findByMemberId(UUID memberId) {
        return find("memberId", memberId).firstResultOptional();
    }

    public static Optional<MemberBudget> findByMemberIdForUpdate(UUID memberId) {
        return find("memberId", memberId).withLock(LockModeType.PESSIMISTIC_WRITE).firstResultOptional();
    }
}
