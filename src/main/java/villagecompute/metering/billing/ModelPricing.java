/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Provider pricing for one model, in dollars per token before platform fees.
 *
 * @param modelId
 *            provider model identifier (e.g., "openai/gpt-4-turbo")
 * @param inputPricePerToken
 *            advertised prompt price
 * @param outputPricePerToken
 *            advertised completion price
 * @param contextLength
 *            maximum context window in tokens
 * @param premium
 *            whether the model requires a paid tier or owner funding
 */
public record ModelPricing(String modelId, double inputPricePerToken, double outputPricePerToken, int contextLength,
        boolean premium) {

    public double adjustedInputPricePerToken() {
        return PricingPolicy.applyFees(inputPricePerToken);
    }

    public double adjustedOutputPricePerToken() {
        return PricingPolicy.applyFees(outputPricePerToken);
    }
}
