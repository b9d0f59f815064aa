/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.time.Instant;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import villagecompute.metering.billing.ModelPricing;

/**
 * Catalog row with a provider model's advertised prices and context window.
 *
 * <p>
 * Prices are dollars per token before platform fees, stored as provider quotes them.
 */
@Entity
@Table(
        name = "model_prices")
public class ModelPrice extends PanacheEntityBase {

    @Id
    @Column(
            name = "model_id")
    public String modelId;

    @Column(
            name = "input_price_per_token",
            nullable = false)
    public double inputPricePerToken;

    @Column(
            name = "output_price_per_token",
            nullable = false)
    public double outputPricePerToken;

    @Column(
            name = "context_length",
            nullable = false)
    public int contextLength;

    @Column(
            nullable = false)
    public boolean premium;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    public ModelPricing toPricing() {
        return new ModelPricing(modelId, inputPricePerToken, outputPricePerToken, contextLength, premium);
    }
}
