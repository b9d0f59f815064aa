/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Pure budget math: how many output tokens a requester can afford for a prompt, and what the worst-case charge is.
 *
 * <p>
 * All prices passed in already include platform fees. Balances are cents and must already be net of in-flight
 * reservations; the cushion and fixed caps come from {@link TierPolicy}.
 *
 * <p>
 * <b>Invariant:</b> when {@code canAfford} is true,
 * {@code estimatedInputCost + maxOutputTokens * outputCostPerToken <= effectiveBalance}.
 */
public final class BudgetCalculator {

    /**
     * Absorbs float noise when dividing a balance that was computed as an exact multiple of the per-token cost.
     */
    private static final double TOKEN_ROUNDING_TOLERANCE = 1e-6;

    private BudgetCalculator() {
        // Utility class, no instantiation
    }

    /**
     * Estimates prompt tokens with the tier's characters-per-token ratio, rounding up.
     *
     * @param tier
     *            requester tier
     * @param characterCount
     *            prompt characters
     * @return estimated tokens, 0 for an empty prompt
     */
    public static int estimateTokensForTier(UserTier tier, long characterCount) {
        if (characterCount <= 0) {
            return 0;
        }
        int charsPerToken = TierPolicy.forTier(tier).inputCharsPerToken();
        return (int) Math.ceil((double) characterCount / charsPerToken);
    }

    /**
     * Effective balance in dollars for a tier: fixed cap for guest/trial, allowance for free, balance plus cushion for
     * paid.
     */
    public static double effectiveBalance(UserTier tier, double balanceCents, double freeAllowanceCents) {
        return TierPolicy.forTier(tier).availableCents(balanceCents, freeAllowanceCents) / 100;
    }

    /**
     * Completion price per token plus the storage cost of the characters that token is assumed to produce.
     *
     * @param outputPricePerToken
     *            completion price with fees
     * @param tier
     *            requester tier (selects the storage ratio)
     * @return dollars per output token
     */
    public static double outputCostPerToken(double outputPricePerToken, UserTier tier) {
        int storageChars = TierPolicy.forTier(tier).outputStorageCharsPerToken();
        return outputPricePerToken + storageChars * PricingPolicy.STORAGE_COST_PER_CHARACTER;
    }

    /**
     * Computes affordability, output budget, context usage and display notices for one prompt.
     *
     * @param input
     *            tier, net balances, prompt size and fee-adjusted pricing
     * @return complete budget result
     */
    public static BudgetResult calculateBudget(BudgetInput input) {
        UserTier tier = input.tier();

        int estimatedInputTokens = estimateTokensForTier(tier, input.promptCharacterCount());
        double inputStorageCost = input.promptCharacterCount() * PricingPolicy.STORAGE_COST_PER_CHARACTER;
        double estimatedInputCost = estimatedInputTokens * input.inputPricePerToken() + inputStorageCost;

        double outputCostPerToken = outputCostPerToken(input.outputPricePerToken(), tier);
        double estimatedMinimumCost = estimatedInputCost + PricingPolicy.MINIMUM_OUTPUT_TOKENS * outputCostPerToken;

        double effectiveBalance = effectiveBalance(tier, input.balanceCents(), input.freeAllowanceCents());
        double toleranceDollars = PricingPolicy.FLOAT_TOLERANCE_CENTS / 100;
        boolean canAfford = effectiveBalance + toleranceDollars >= estimatedMinimumCost;

        int maxOutputTokens = 0;
        if (canAfford) {
            double remainingBudget = effectiveBalance - estimatedInputCost;
            double affordable = Math.floor(remainingBudget / outputCostPerToken + TOKEN_ROUNDING_TOLERANCE);
            maxOutputTokens = (int) Math.max(0, Math.min(affordable, Integer.MAX_VALUE));
            if (maxOutputTokens < PricingPolicy.MINIMUM_OUTPUT_TOKENS) {
                canAfford = false;
                maxOutputTokens = 0;
            }
        }

        // Context usage always uses the standard ratio: the window is fixed regardless of tier
        int capacityInputTokens = (int) Math
                .ceil((double) input.promptCharacterCount() / PricingPolicy.CHARS_PER_TOKEN_STANDARD);
        int currentUsage = capacityInputTokens + PricingPolicy.MINIMUM_OUTPUT_TOKENS;
        double capacityPercent = input.contextLength() > 0 ? ((double) currentUsage / input.contextLength()) * 100
                : 0;

        List<BudgetNotice> notices = buildNotices(tier, canAfford, maxOutputTokens, capacityPercent);

        return new BudgetResult(canAfford, maxOutputTokens, estimatedInputTokens, estimatedInputCost,
                outputCostPerToken, estimatedMinimumCost, effectiveBalance, currentUsage, capacityPercent, notices);
    }

    /**
     * Returns the output token limit to send to the provider, or empty when the budget already covers the whole
     * remaining context window and no explicit limit is needed.
     *
     * @param budgetMaxTokens
     *            affordable output tokens
     * @param modelContextLength
     *            model context window
     * @param estimatedInputTokens
     *            prompt token estimate
     * @return explicit limit, or empty when the context window is the binding constraint
     */
    public static OptionalInt computeSafeMaxTokens(int budgetMaxTokens, int modelContextLength,
            int estimatedInputTokens) {
        int contextRemaining = modelContextLength - estimatedInputTokens;
        if (budgetMaxTokens < contextRemaining) {
            return OptionalInt.of(budgetMaxTokens);
        }
        return OptionalInt.empty();
    }

    /**
     * Output tokens the call may actually produce: the budget clamped to the remaining context window.
     */
    public static int effectiveMaxOutputTokens(int budgetMaxTokens, int modelContextLength, int estimatedInputTokens) {
        int contextRemaining = Math.max(0, modelContextLength - estimatedInputTokens);
        return computeSafeMaxTokens(budgetMaxTokens, modelContextLength, estimatedInputTokens)
                .orElse(contextRemaining);
    }

    /**
     * Worst-case charge of a call in cents, unrounded.
     *
     * @param estimatedInputCost
     *            input cost in dollars
     * @param maxOutputTokens
     *            output tokens the call may produce
     * @param outputCostPerToken
     *            dollars per output token
     * @return raw cents
     */
    public static double computeWorstCaseCents(double estimatedInputCost, int maxOutputTokens,
            double outputCostPerToken) {
        return (estimatedInputCost + maxOutputTokens * outputCostPerToken) * 100;
    }

    private static List<BudgetNotice> buildNotices(UserTier tier, boolean canAfford, int maxOutputTokens,
            double capacityPercent) {
        List<BudgetNotice> notices = new ArrayList<>();

        boolean overCapacity = capacityPercent > 100;
        if (overCapacity) {
            notices.add(BudgetNotice.CAPACITY_EXCEEDED);
        }

        if (!canAfford) {
            switch (tier) {
                case PAID:
                    notices.add(BudgetNotice.INSUFFICIENT_PAID);
                    break;
                case FREE:
                    notices.add(BudgetNotice.INSUFFICIENT_FREE);
                    break;
                default:
                    notices.add(BudgetNotice.INSUFFICIENT_GUEST);
                    break;
            }
        }

        boolean blocked = overCapacity || !canAfford;
        if (!blocked && capacityPercent >= PricingPolicy.CAPACITY_RED_THRESHOLD * 100) {
            notices.add(BudgetNotice.CAPACITY_WARNING);
        }

        if (tier == UserTier.PAID && canAfford
                && maxOutputTokens < PricingPolicy.LOW_BALANCE_OUTPUT_TOKEN_THRESHOLD) {
            notices.add(BudgetNotice.LOW_BALANCE);
        }

        if (tier == UserTier.FREE) {
            notices.add(BudgetNotice.FREE_TIER_NOTICE);
        } else if (!tier.isAuthenticated()) {
            notices.add(BudgetNotice.GUEST_NOTICE);
        }

        return Collections.unmodifiableList(notices);
    }
}
