/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Platform pricing constants and pure cost functions.
 *
 * <p>
 * Provider prices are quoted in dollars per token. The platform multiplies them by {@code 1 + TOTAL_FEE_RATE} and
 * adds a storage charge per character for every character persisted (prompt and completion). The fee never applies
 * to storage.
 *
 * <p>
 * <b>Fee Breakdown:</b>
 * <ul>
 * <li>Platform fee: 5%</li>
 * <li>Card processing fee: 4.5%</li>
 * <li>Provider fee: 5.5%</li>
 * </ul>
 *
 * <p>
 * <b>Storage:</b> $0.50 per GB-month for 50 years at 1000 characters per KB, i.e. $0.0000003 per character.
 */
public final class PricingPolicy {

    public static final double PLATFORM_FEE_RATE = 0.05;
    public static final double CREDIT_CARD_FEE_RATE = 0.045;
    public static final double PROVIDER_FEE_RATE = 0.055;
    public static final double TOTAL_FEE_RATE = PLATFORM_FEE_RATE + CREDIT_CARD_FEE_RATE + PROVIDER_FEE_RATE;

    public static final int CHARACTERS_PER_KILOBYTE = 1000;
    public static final double KILOBYTES_PER_GIGABYTE = 1_000_000;
    public static final double MONTHLY_COST_PER_GB = 0.5;
    public static final int MONTHS_PER_YEAR = 12;
    public static final int STORAGE_YEARS = 50;

    /** Dollars charged per stored character. */
    public static final double STORAGE_COST_PER_CHARACTER = (MONTHLY_COST_PER_GB * MONTHS_PER_YEAR * STORAGE_YEARS)
            / (CHARACTERS_PER_KILOBYTE * KILOBYTES_PER_GIGABYTE);

    public static final int CHARS_PER_TOKEN_CONSERVATIVE = 2;
    public static final int CHARS_PER_TOKEN_STANDARD = 4;

    public static final int MINIMUM_OUTPUT_TOKENS = 1000;
    public static final int LOW_BALANCE_OUTPUT_TOKEN_THRESHOLD = 10_000;

    public static final int MAX_ALLOWED_NEGATIVE_BALANCE_CENTS = 50;
    public static final int MAX_FIXED_MESSAGE_COST_CENTS = 1;

    public static final double CAPACITY_RED_THRESHOLD = 0.67;
    public static final double CAPACITY_YELLOW_THRESHOLD = 0.33;

    /**
     * Tolerance for comparisons between wallet-derived cents (numeric(20,8) dollars) and independently computed
     * estimates. 1e-6 cents is one unit of the wallet's precision.
     */
    public static final double FLOAT_TOLERANCE_CENTS = 1e-6;

    private PricingPolicy() {
        // Utility class, no instantiation
    }

    /**
     * Applies the platform fee multiplier to a provider price.
     *
     * @param providerPrice
     *            advertised provider price in dollars
     * @return price charged to users in dollars
     */
    public static double applyFees(double providerPrice) {
        return providerPrice * (1 + TOTAL_FEE_RATE);
    }

    /**
     * Raw provider cost of a completion before fees.
     */
    public static double estimateModelCost(ModelPricing pricing, long inputTokens, long outputTokens) {
        return inputTokens * pricing.inputPricePerToken() + outputTokens * pricing.outputPricePerToken();
    }

    /**
     * Total charge for a message in dollars: provider cost with fees plus storage for every persisted character.
     *
     * @param modelCost
     *            raw provider cost in dollars
     * @param inputCharacters
     *            prompt characters stored
     * @param outputCharacters
     *            completion characters stored
     * @return charge in dollars
     */
    public static double calculateMessageCost(double modelCost, long inputCharacters, long outputCharacters) {
        double storageCost = (inputCharacters + outputCharacters) * STORAGE_COST_PER_CHARACTER;
        return applyFees(modelCost) + storageCost;
    }
}
