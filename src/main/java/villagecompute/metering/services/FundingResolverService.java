/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.math.BigDecimal;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.metering.api.types.ChatTurnRequestType;
import villagecompute.metering.api.types.ConversationBudgetsType;
import villagecompute.metering.api.types.UserTierInfoType;
import villagecompute.metering.billing.BillingDecision;
import villagecompute.metering.billing.BillingInput;
import villagecompute.metering.billing.BillingResolver;
import villagecompute.metering.billing.BudgetCalculator;
import villagecompute.metering.billing.BudgetInput;
import villagecompute.metering.billing.BudgetResult;
import villagecompute.metering.billing.FundingSource;
import villagecompute.metering.billing.GroupRemaining;
import villagecompute.metering.billing.GroupReservedTotals;
import villagecompute.metering.billing.ModelPricing;
import villagecompute.metering.billing.TierPolicy;
import villagecompute.metering.billing.UserTier;
import villagecompute.metering.data.models.Conversation;
import villagecompute.metering.data.models.ConversationMember;
import villagecompute.metering.exceptions.ConversationNotFoundException;
import villagecompute.metering.exceptions.MemberNotFoundException;

/**
 * Works out who pays for a turn and how much output the payer can afford.
 *
 * <p>
 * Balances are read net of reservations already held by other in-flight calls, so budgeting sees headroom that
 * concurrent requests have already claimed. This is a pre-check only: the authoritative guard is the race check in
 * {@link ReservationService}, which uses the raw ceilings returned in the {@link FundingContext}.
 *
 * <p>
 * <b>Group Conversations:</b> when the requester is an active member but not the owner, the owner may fund the turn.
 * The group's effective headroom is the minimum of conversation, member and owner remaining amounts, each net of
 * reservations on its own counter. Group rows are read in a new transaction so spending committed by earlier turns is
 * visible.
 */
@ApplicationScoped
public class FundingResolverService {

    private static final Logger LOG = Logger.getLogger(FundingResolverService.class);

    @Inject
    BalanceService balanceService;

    @Inject
    ReservationService reservationService;

    @Inject
    ConversationBudgetService budgetService;

    /**
     * Resolves the funding of a turn.
     *
     * @param request
     *            the turn
     * @param pricing
     *            model pricing before fees
     * @return decision, applicable budget and race-check ceilings
     * @throws ConversationNotFoundException
     *             if the named conversation does not exist
     * @throws MemberNotFoundException
     *             if the requester is neither owner nor active member of the conversation
     */
    public FundingContext resolve(ChatTurnRequestType request, ModelPricing pricing) {
        if (request.isGuest()) {
            return resolveGuest(request, pricing);
        }

        UUID userId = request.userId();
        UserTierInfoType tierInfo = balanceService.getUserTierInfo(userId);
        UserTier tier = tierInfo.tier();

        double reservedCents = reservationService.getUserReservedTotal(userId);
        BudgetResult personalBudget = BudgetCalculator.calculateBudget(
                BudgetInput.forModel(tier, tierInfo.balanceCents() - reservedCents,
                        tierInfo.freeAllowanceCents() - reservedCents, request.promptCharacterCount(), pricing));

        BillingInput input = new BillingInput(tier, tierInfo.balanceCents() - reservedCents,
                tierInfo.freeAllowanceCents() - reservedCents, pricing.premium(),
                personalBudget.estimatedMinimumCostCents(), null);

        GroupResolution group = QuarkusTransaction.requiringNew()
                .call(() -> resolveGroup(request, pricing, userId));
        if (group != null) {
            input = input.withGroup(group.funding());
        }

        BillingDecision decision = BillingResolver.resolveBilling(input);
        LOG.debugf("Billing resolved: userId=%s, tier=%s, source=%s, denial=%s, reserved=%.8f¢", userId,
                tier.getValue(), decision.fundingSource(), decision.denialReason(), reservedCents);

        if (group != null && decision.fundingSource() == FundingSource.OWNER_BALANCE) {
            return new FundingContext(tier, tierInfo, decision, group.budget(), group.ownerId(), group.memberId(), 0,
                    group.ceilings());
        }

        double personalCeiling = TierPolicy.forTier(tier).availableCents(tierInfo.balanceCents(),
                tierInfo.freeAllowanceCents());
        return new FundingContext(tier, tierInfo, decision, personalBudget, userId, null, personalCeiling, null);
    }

    private FundingContext resolveGuest(ChatTurnRequestType request, ModelPricing pricing) {
        // Only unauthenticated tiers are accepted from the session
        UserTier tier = request.tier() == UserTier.TRIAL ? UserTier.TRIAL : UserTier.GUEST;
        UserTierInfoType tierInfo = new UserTierInfoType(tier, 0, 0);

        BudgetResult budget = BudgetCalculator
                .calculateBudget(BudgetInput.forModel(tier, 0, 0, request.promptCharacterCount(), pricing));
        BillingDecision decision = BillingResolver.resolveBilling(
                new BillingInput(tier, 0, 0, pricing.premium(), budget.estimatedMinimumCostCents(), null));
        return new FundingContext(tier, tierInfo, decision, budget, null, null, 0, null);
    }

    private record GroupResolution(UUID ownerId, UUID memberId, BillingInput.GroupFunding funding, BudgetResult budget,
            ReservationService.GroupCeilings ceilings) {
    }

    private GroupResolution resolveGroup(ChatTurnRequestType request, ModelPricing pricing, UUID userId) {
        UUID conversationId = request.conversationId();
        if (conversationId == null) {
            return null;
        }
        Conversation conversation = Conversation.findById(conversationId);
        if (conversation == null) {
            throw new ConversationNotFoundException("Conversation not found: " + conversationId);
        }
        if (userId.equals(conversation.userId)) {
            return null;
        }

        ConversationMember member = ConversationMember.findActiveMember(conversationId, userId)
                .orElseThrow(() -> new MemberNotFoundException(
                        "User " + userId + " is not an active member of conversation " + conversationId));

        UUID ownerId = conversation.userId;
        UserTierInfoType ownerInfo = balanceService.getUserTierInfo(ownerId);
        GroupReservedTotals reserved = reservationService.getGroupReservedTotals(ownerId, conversationId, member.id);

        ConversationBudgetsType budgets = budgetService.getConversationBudgets(conversationId);
        BigDecimal memberBudget = BigDecimal.ZERO;
        BigDecimal memberSpent = BigDecimal.ZERO;
        for (ConversationBudgetsType.MemberBudgetType row : budgets.members()) {
            if (row.memberId().equals(member.id)) {
                memberBudget = row.budget();
                memberSpent = row.spent();
            }
        }

        GroupRemaining remaining = GroupRemaining.compute(budgets.conversationBudget(), budgets.totalSpent(),
                memberBudget, memberSpent, ownerInfo.balanceCents(), reserved);
        double effectiveCents = remaining.effectiveCents();

        // Group headroom has no cushion: budgets are hard ceilings set by the owner
        BudgetResult groupBudget = BudgetCalculator.calculateBudget(BudgetInput.forModel(UserTier.FREE, 0,
                Math.max(0, effectiveCents), request.promptCharacterCount(), pricing));

        ReservationService.GroupCeilings ceilings = new ReservationService.GroupCeilings(
                TierPolicy.forTier(ownerInfo.tier()).availableCents(ownerInfo.balanceCents(),
                        ownerInfo.freeAllowanceCents()),
                cents(memberBudget) - cents(memberSpent),
                cents(budgets.conversationBudget()) - cents(budgets.totalSpent()));

        LOG.debugf("Group remaining: conversationId=%s, memberId=%s, conversation=%.8f¢, member=%.8f¢, owner=%.8f¢",
                conversationId, member.id, remaining.conversationRemainingCents(), remaining.memberRemainingCents(),
                remaining.ownerRemainingCents());

        BillingInput.GroupFunding funding = new BillingInput.GroupFunding(effectiveCents, ownerInfo.tier(),
                ownerInfo.balanceCents() - reserved.payerTotal());
        return new GroupResolution(ownerId, member.id, funding, groupBudget, ceilings);
    }

    private static double cents(BigDecimal dollars) {
        return dollars.movePointRight(2).doubleValue();
    }
}
