/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Inputs to {@link BudgetCalculator#calculateBudget(BudgetInput)}.
 *
 * @param tier
 *            requester tier
 * @param balanceCents
 *            purchased balance in cents, already net of in-flight reservations
 * @param freeAllowanceCents
 *            free allowance in cents, already net of in-flight reservations
 * @param promptCharacterCount
 *            system prompt + history + new message characters
 * @param inputPricePerToken
 *            model prompt price with fees applied
 * @param outputPricePerToken
 *            model completion price with fees applied
 * @param contextLength
 *            model context window in tokens
 */
public record BudgetInput(UserTier tier, double balanceCents, double freeAllowanceCents, long promptCharacterCount,
        double inputPricePerToken, double outputPricePerToken, int contextLength) {

    public static BudgetInput forModel(UserTier tier, double balanceCents, double freeAllowanceCents,
            long promptCharacterCount, ModelPricing pricing) {
        return new BudgetInput(tier, balanceCents, freeAllowanceCents, promptCharacterCount,
                pricing.adjustedInputPricePerToken(), pricing.adjustedOutputPricePerToken(), pricing.contextLength());
    }
}
