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
import jakarta.persistence.Table;

/**
 * Chat conversation as seen by billing: owner, current epoch, the per-conversation message sequence counter and the
 * group budget ceilings.
 *
 * <p>
 * {@code next_sequence} is advanced only by {@link #claimSequences(UUID, int)}, whose UPDATE statement is the
 * serialization point for concurrent turns in the same conversation.
 */
@Entity
@Table(
        name = "conversations")
public class Conversation extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column
    public String title;

    @Column(
            name = "current_epoch",
            nullable = false)
    public int currentEpoch = 1;

    @Column(
            name = "next_sequence",
            nullable = false)
    public int nextSequence = 1;

    @Column(
            name = "conversation_budget",
            nullable = false,
            precision = 20,
            scale = 2)
    public BigDecimal conversationBudget = BigDecimal.ZERO;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    /**
     * Sequence numbers claimed for one turn, plus the epoch current at claim time.
     *
     * @param firstSequence
     *            first claimed sequence number
     * @param count
     *            how many consecutive numbers were claimed
     * @param currentEpoch
     *            conversation epoch when the claim was made
     */
    public record SequenceClaim(int firstSequence, int count, int currentEpoch) {

        public int sequence(int offset) {
            if (offset < 0 || offset >= count) {
                throw new IllegalArgumentException("Offset " + offset + " outside claimed range of " + count);
            }
            return firstSequence + offset;
        }
    }

    /**
     * Atomically advances {@code next_sequence} by {@code count} and returns the claimed range. Must run inside a
     * transaction; the updated row stays locked until it ends.
     *
     * @param conversationId
     *            the conversation UUID
     * @param count
     *            sequence numbers to claim (2 for a user + assistant pair)
     * @return the claimed range, or empty if the conversation does not exist
     */
    public static Optional<SequenceClaim> claimSequences(UUID conversationId, int count) {
        int updated = update("nextSequence = nextSequence + ?1, updatedAt = ?2 WHERE id = ?3", count, Instant.now(),
                conversationId);
        if (updated == 0) {
            return Optional.empty();
        }

        Conversation conversation = findById(conversationId);
        getEntityManager().refresh(conversation);
        return Optional.of(new SequenceClaim(conversation.nextSequence - count, count, conversation.currentEpoch));
    }

    public static Conversation create(UUID ownerId, String title) {
        Conversation conversation = new Conversation();
        conversation.userId = ownerId;
        conversation.title = title;
        conversation.createdAt = Instant.now();
        conversation.updatedAt = conversation.createdAt;
        conversation.persist();
        return conversation;
    }
}
