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
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

/**
 * Durable record of one billable usage event (an assistant message), written at settlement time.
 *
 * <p>
 * Immutable once written. Linked 1:1 to an {@link LlmCompletion} and referenced by the {@link LedgerEntry} rows that
 * debited wallets for it.
 */
@Entity
@Table(
        name = "usage_records")
@NamedQuery(
        name = UsageRecord.QUERY_FIND_BY_SOURCE,
        query = UsageRecord.JPQL_FIND_BY_SOURCE)
@NamedQuery(
        name = UsageRecord.QUERY_FIND_BY_USER_ID,
        query = UsageRecord.JPQL_FIND_BY_USER_ID)
public class UsageRecord extends PanacheEntityBase {

    public static final String TYPE_LLM_COMPLETION = "llm_completion";

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    public static final String SOURCE_MESSAGE = "message";

    public static final String JPQL_FIND_BY_SOURCE = "FROM UsageRecord WHERE sourceType = ?1 AND sourceId = ?2";
    public static final String QUERY_FIND_BY_SOURCE = "UsageRecord.findBySource";

    public static final String JPQL_FIND_BY_USER_ID = "FROM UsageRecord WHERE userId = ?1 ORDER BY createdAt DESC";
    public static final String QUERY_FIND_BY_USER_ID = "UsageRecord.findByUserId";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public String type;

    @Column(
            nullable = false)
    public String status;

    @Column(
            nullable = false,
            precision = 20,
            scale = 8)
    public BigDecimal cost;

    @Column(
            name = "source_type",
            nullable = false)
    public String sourceType;

    @Column(
            name = "source_id",
            nullable = false)
    public String sourceId;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt = Instant.now();

    @Column(
            name = "completed_at")
    public Instant completedAt;

    public static List<UsageRecord> findBySource(String sourceType, String sourceId) {
        return find("#" + QUERY_FIND_BY_SOURCE, sourceType, sourceId).list();
    }

    public static List<UsageRecord> findByUserId(UUID userId) {
        return find("#" + QUERY_FIND_BY_USER_ID, userId).list();
    }

    /**
     * Creates a completed usage record for a settled message.
     */
    public static UsageRecord completed(UUID userId, BigDecimal cost, String sourceType, String sourceId) {
        Instant now = Instant.now();
        UsageRecord record = new UsageRecord();
        record.userId = userId;
        record.type = TYPE_LLM_COMPLETION;
        record.status = STATUS_COMPLETED;
        record.cost = cost;
        record.sourceType = sourceType;
        record.sourceId = sourceId;
        record.createdAt = now;
        record.completedAt = now;
        record.persist();
        return record;
    }
}
