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
 * Running total of owner-funded spending in a group conversation.
 */
@Entity
@Table(
        name = "conversation_spending")
public class ConversationSpending extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "conversation_id",
            nullable = false,
            unique = true)
    public UUID conversationId;

    @Column(
            name = "total_spent",
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal totalSpent = BigDecimal.ZERO;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    public static Optional<ConversationSpending> findByConversationId(UUID conversationId) {
        return find("conversationId", conversationId).firstResultOptional();
    }

    public static Optional<ConversationSpending> findByConversationIdForUpdate(UUID conversationId) {
        return find("conversationId", conversationId).withLock(LockModeType.PESSIMISTIC_WRITE).firstResultOptional();
    }
}
