/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Sealed chat message. The user message id is supplied by the client and doubles as the idempotency key of a turn,
 * so ids are assigned rather than generated.
 *
 * <p>
 * Only assistant messages carry {@code cost} and {@code payer_id}.
 */
@Entity
@Table(
        name = "messages",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"conversation_id", "sequence_number"}))
public class Message extends PanacheEntityBase {

    public static final String SENDER_USER = "user";
    public static final String SENDER_AI = "ai";

    @Id
    public UUID id;

    @Column(
            name = "conversation_id",
            nullable = false)
    public UUID conversationId;

    @Column(
            name = "encrypted_blob",
            nullable = false)
    public byte[] encryptedBlob;

    @Column(
            name = "sender_type",
            nullable = false)
    public String senderType;

    @Column(
            name = "sender_id")
    public UUID senderId;

    @Column(
            name = "payer_id")
    public UUID payerId;

    @Column(
            precision = 20,
            scale = 8)
    public BigDecimal cost;

    @Column(
            name = "epoch_number",
            nullable = false)
    public int epochNumber;

    @Column(
            name = "sequence_number",
            nullable = false)
    public int sequenceNumber;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    public static List<Message> findByConversation(UUID conversationId) {
        return find("conversationId = ?1 ORDER BY sequenceNumber ASC", conversationId).list();
    }

    public static long countByConversation(UUID conversationId) {
        return count("conversationId", conversationId);
    }
}
