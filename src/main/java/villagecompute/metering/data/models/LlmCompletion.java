/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Provider-side details of a settled completion: model, provider and token counts. One row per {@link UsageRecord}.
 */
@Entity
@Table(
        name = "llm_completions")
public class LlmCompletion extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "usage_record_id",
            nullable = false,
            unique = true)
    public UUID usageRecordId;

    @Column(
            nullable = false)
    public String model;

    @Column(
            nullable = false)
    public String provider;

    @Column(
            name = "input_tokens",
            nullable = false)
    public int inputTokens;

    @Column(
            name = "output_tokens",
            nullable = false)
    public int outputTokens;

    @Column(
            name = "cached_tokens",
            nullable = false)
    public int cachedTokens = 0;

    public static Optional<LlmCompletion> findByUsageRecord(UUID usageRecordId) {
        return find("usageRecordId", usageRecordId).firstResultOptional();
    }
}
