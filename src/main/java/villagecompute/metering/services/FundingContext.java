package villagecompute.metering.services;

import java.util.UUID;

import villagecompute.metering.api.types.UserTierInfoType;
import villagecompute.metering.billing.BillingDecision;
import villagecompute.metering.billing.BudgetResult;
import villagecompute.metering.billing.FundingSource;
import villagecompute.metering.billing.UserTier;

/**
 * Everything the turn needs after funding is resolved: the decision, the budget that applies to the chosen funding
 * source, who pays, and the ceilings the reservation race check uses.
 *
 * @param tier
 *            requester's tier
 * @param tierInfo
 *            requester's raw balances
 * @param decision
 *            funding source or denial reason
 * @param budget
 *            budget for the chosen source (the group budget when the owner pays)
 * @param payerId
 *            user whose wallets are charged, null for guest turns
 * @param memberId
 *            conversation member id of the requester on owner-funded turns, otherwise null
 * @param personalCeilingCents
 *            race-check ceiling for personal reservations
 * @param groupCeilings
 *            race-check ceilings for owner-funded turns, otherwise null
 */
public record FundingContext(UserTier tier, UserTierInfoType tierInfo, BillingDecision decision, BudgetResult budget,
        UUID payerId, UUID memberId, double personalCeilingCents, ReservationService.GroupCeilings groupCeilings) {

    public FundingSource fundingSource() {
        return decision.fundingSource();
    }

    public boolean isGroupFunded() {
        return decision.fundingSource() == FundingSource.OWNER_BALANCE;
    }

    public boolean isGuest() {
        return decision.fundingSource() == FundingSource.GUEST_FIXED;
    }
}
