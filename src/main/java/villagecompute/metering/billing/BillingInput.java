/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Everything {@link BillingResolver} needs to decide who pays. Balances are cents net of in-flight reservations.
 *
 * @param tier
 *            requester tier
 * @param balanceCents
 *            requester's purchased balance
 * @param freeAllowanceCents
 *            requester's free allowance
 * @param premiumModel
 *            whether the requested model is premium
 * @param estimatedMinimumCostCents
 *            input cost plus minimum output cost
 * @param group
 *            owner funding context for group chat members, or {@code null}
 */
public record BillingInput(UserTier tier, double balanceCents, double freeAllowanceCents, boolean premiumModel,
        double estimatedMinimumCostCents, GroupFunding group) {

    /**
     * Owner-side funding available to a group chat member.
     *
     * @param effectiveCents
     *            minimum of conversation, member and owner remaining cents
     * @param ownerTier
     *            the owner's tier
     * @param ownerBalanceCents
     *            owner balance net of the owner's in-flight reservations
     */
    public record GroupFunding(double effectiveCents, UserTier ownerTier, double ownerBalanceCents) {
    }

    public BillingInput withGroup(GroupFunding groupFunding) {
        return new BillingInput(tier, balanceCents, freeAllowanceCents, premiumModel, estimatedMinimumCostCents,
                groupFunding);
    }
}
