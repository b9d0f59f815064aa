/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Single source of truth for who pays for a message, or why it is denied.
 *
 * <p>
 * <b>Decision Order:</b>
 * <ol>
 * <li>Group funding: the member has a group context with positive effective budget and the owner may use the model
 * &rarr; {@link FundingSource#OWNER_BALANCE}</li>
 * <li>Otherwise fall through to the personal path</li>
 * <li>Premium gate: tiers without premium access are denied</li>
 * <li>Paid: balance plus cushion covers the estimated minimum &rarr; {@link FundingSource#PERSONAL_BALANCE}</li>
 * <li>Free: allowance covers the estimated minimum &rarr; {@link FundingSource#FREE_ALLOWANCE}</li>
 * <li>Guest/trial: estimated minimum within the fixed cap &rarr; {@link FundingSource#GUEST_FIXED}</li>
 * <li>Otherwise a tier-specific denial</li>
 * </ol>
 */
public final class BillingResolver {

    private BillingResolver() {
        // Utility class, no instantiation
    }

    public static BillingDecision resolveBilling(BillingInput input) {
        BillingDecision groupDecision = resolveGroupBilling(input.group(), input.premiumModel());
        if (groupDecision != null) {
            return groupDecision;
        }

        UserTier tier = input.tier();
        TierPolicy policy = TierPolicy.forTier(tier);

        if (input.premiumModel() && !policy.premiumAccess()) {
            return BillingDecision.denied(tier.isAuthenticated() ? DenialReason.PREMIUM_REQUIRES_BALANCE
                    : DenialReason.PREMIUM_REQUIRES_ACCOUNT);
        }

        double estimatedMinimum = input.estimatedMinimumCostCents();

        switch (policy.fundsBasis()) {
            case PURCHASED_BALANCE:
                if (input.balanceCents() + policy.cushionCents() >= estimatedMinimum) {
                    return BillingDecision.funded(FundingSource.PERSONAL_BALANCE);
                }
                return BillingDecision.denied(DenialReason.INSUFFICIENT_BALANCE);

            case FREE_ALLOWANCE:
                // Wallet round-trip through numeric(20,8) can lose sub-cent precision
                if (input.freeAllowanceCents() + PricingPolicy.FLOAT_TOLERANCE_CENTS >= estimatedMinimum) {
                    return BillingDecision.funded(FundingSource.FREE_ALLOWANCE);
                }
                return BillingDecision.denied(DenialReason.INSUFFICIENT_FREE_ALLOWANCE);

            default:
                if (estimatedMinimum <= PricingPolicy.MAX_FIXED_MESSAGE_COST_CENTS) {
                    return BillingDecision.funded(FundingSource.GUEST_FIXED);
                }
                return BillingDecision.denied(DenialReason.GUEST_LIMIT_EXCEEDED);
        }
    }

    private static BillingDecision resolveGroupBilling(BillingInput.GroupFunding group, boolean premiumModel) {
        if (group == null || group.effectiveCents() <= 0) {
            return null;
        }
        boolean ownerHasPremium = TierPolicy.forTier(group.ownerTier()).premiumAccess();
        if (!premiumModel || ownerHasPremium) {
            return BillingDecision.funded(FundingSource.OWNER_BALANCE);
        }
        return null;
    }
}
