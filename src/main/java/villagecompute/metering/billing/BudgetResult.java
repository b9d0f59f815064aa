/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

import java.util.List;

/**
 * Outcome of a budget calculation. Costs are in dollars.
 *
 * @param canAfford
 *            whether the effective balance covers input plus the minimum output
 * @param maxOutputTokens
 *            largest affordable output token count, 0 when unaffordable
 * @param estimatedInputTokens
 *            tier-dependent prompt token estimate
 * @param estimatedInputCost
 *            prompt token cost plus prompt storage
 * @param outputCostPerToken
 *            completion price plus tier-dependent completion storage per token
 * @param estimatedMinimumCost
 *            input cost plus {@link PricingPolicy#MINIMUM_OUTPUT_TOKENS} output tokens
 * @param effectiveBalance
 *            funds available to this call including any cushion
 * @param currentUsage
 *            context tokens used by the prompt (standard ratio) plus the minimum output
 * @param capacityPercent
 *            {@code currentUsage} as a percentage of the context window
 * @param notices
 *            errors, warnings and info notices for display
 */
public record BudgetResult(boolean canAfford, int maxOutputTokens, int estimatedInputTokens,
        double estimatedInputCost, double outputCostPerToken, double estimatedMinimumCost, double effectiveBalance,
        int currentUsage, double capacityPercent, List<BudgetNotice> notices) {

    public double estimatedMinimumCostCents() {
        return estimatedMinimumCost * 100;
    }

    public boolean isOverCapacity() {
        return capacityPercent > 100;
    }
}
