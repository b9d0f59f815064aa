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
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Key epoch of a conversation. Messages are sealed for the public key of the epoch current when they were written.
 */
@Entity
@Table(
        name = "epochs",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"conversation_id", "epoch_number"}))
public class Epoch extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "conversation_id",
            nullable = false)
    public UUID conversationId;

    @Column(
            name = "epoch_number",
            nullable = false)
    public int epochNumber;

    /** X.509-encoded X25519 public key. */
    @Column(
            name = "epoch_public_key",
            nullable = false)
    public byte[] epochPublicKey;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    public static Optional<Epoch> findByConversationAndNumber(UUID conversationId, int epochNumber) {
        return find("conversationId = ?1 AND epochNumber = ?2", conversationId, epochNumber).firstResultOptional();
    }

    public static Epoch create(UUID conversationId, int epochNumber, byte[] epochPublicKey) {
        Epoch epoch = new Epoch();
        epoch.conversationId = conversationId;
        epoch.epochNumber = epochNumber;
        epoch.epochPublicKey = epochPublicKey;
        epoch.createdAt = Instant.now();
        epoch.persist();
        return epoch;
    }
}
