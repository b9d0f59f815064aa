/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tier numeric policy, kept in a single table so the free/paid asymmetry can be audited in one place.
 *
 * <p>
 * <b>Policy Table:</b>
 *
 * <pre>
 * tier   input chars/token   output storage chars/token   cushion   funds basis         premium
 * guest  2                   4                            0         FIXED_CAP           no
 * trial  2                   4                            0         FIXED_CAP           no
 * free   2                   4                            0         FREE_ALLOWANCE      no
 * paid   4                   4                            50c       PURCHASED_BALANCE   yes
 * </pre>
 *
 * <p>
 * Input estimation is conservative for non-paying tiers (more tokens assumed per character). Output storage is priced
 * at the standard ratio for every tier, matching the character count a maximum-length reply is settled at.
 *
 * @param tier
 *            the tier this row describes
 * @param inputCharsPerToken
 *            characters assumed per prompt token
 * @param outputStorageCharsPerToken
 *            characters assumed per completion token when pricing completion storage
 * @param cushionCents
 *            negative balance tolerated on top of the available funds
 * @param fundsBasis
 *            which funds the budget is computed from
 * @param premiumAccess
 *            whether premium models may be used on the personal path
 */
public record TierPolicy(UserTier tier, int inputCharsPerToken, int outputStorageCharsPerToken, int cushionCents,
        FundsBasis fundsBasis, boolean premiumAccess) {

    /**
     * Source of the funds a tier's budget is computed from.
     */
    public enum FundsBasis {
        /** Fixed per-message cap, no wallet involved. */
        FIXED_CAP,
        /** The daily free-tier wallet. */
        FREE_ALLOWANCE,
        /** Purchased wallets plus the cushion. */
        PURCHASED_BALANCE
    }

    private static final Map<UserTier, TierPolicy> POLICIES;

    static {
        Map<UserTier, TierPolicy> table = new EnumMap<>(UserTier.class);
        table.put(UserTier.GUEST, new TierPolicy(UserTier.GUEST, PricingPolicy.CHARS_PER_TOKEN_CONSERVATIVE,
                PricingPolicy.CHARS_PER_TOKEN_STANDARD, 0, FundsBasis.FIXED_CAP, false));
        table.put(UserTier.TRIAL, new TierPolicy(UserTier.TRIAL, PricingPolicy.CHARS_PER_TOKEN_CONSERVATIVE,
                PricingPolicy.CHARS_PER_TOKEN_STANDARD, 0, FundsBasis.FIXED_CAP, false));
        table.put(UserTier.FREE, new TierPolicy(UserTier.FREE, PricingPolicy.CHARS_PER_TOKEN_CONSERVATIVE,
                PricingPolicy.CHARS_PER_TOKEN_STANDARD, 0, FundsBasis.FREE_ALLOWANCE, false));
        table.put(UserTier.PAID,
                new TierPolicy(UserTier.PAID, PricingPolicy.CHARS_PER_TOKEN_STANDARD,
                        PricingPolicy.CHARS_PER_TOKEN_STANDARD, PricingPolicy.MAX_ALLOWED_NEGATIVE_BALANCE_CENTS,
                        FundsBasis.PURCHASED_BALANCE, true));
        POLICIES = Collections.unmodifiableMap(table);
    }

    public static TierPolicy forTier(UserTier tier) {
        TierPolicy policy = POLICIES.get(tier);
        if (policy == null) {
            throw new IllegalArgumentException("No policy for tier: " + tier);
        }
        return policy;
    }

    /**
     * Funds available to a single call, in cents, including the cushion.
     *
     * @param balanceCents
     *            purchased balance net of reservations
     * @param freeAllowanceCents
     *            free allowance net of reservations
     * @return available cents for this tier
     */
    public double availableCents(double balanceCents, double freeAllowanceCents) {
        switch (fundsBasis) {
            case FIXED_CAP:
                return PricingPolicy.MAX_FIXED_MESSAGE_COST_CENTS;
            case FREE_ALLOWANCE:
                return freeAllowanceCents;
            case PURCHASED_BALANCE:
                return balanceCents + cushionCents;
            default:
                throw new IllegalStateException("Unhandled funds basis: " + fundsBasis);
        }
    }
}
