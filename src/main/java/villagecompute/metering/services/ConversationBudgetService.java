/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.metering.api.types.ConversationBudgetsType;
import villagecompute.metering.data.models.Conversation;
import villagecompute.metering.data.models.ConversationMember;
import villagecompute.metering.data.models.ConversationSpending;
import villagecompute.metering.data.models.MemberBudget;
import villagecompute.metering.exceptions.ConversationNotFoundException;
import villagecompute.metering.exceptions.MemberNotFoundException;

/**
 * Owner-funded budgets of group conversations.
 *
 * <p>
 * Budgets are set in whole cents and stored as 2-decimal dollars. Spending totals keep the 8-decimal precision of
 * charges. Upserts lock the existing row before updating and insert only when none exists.
 */
@ApplicationScoped
public class ConversationBudgetService {

    private static final Logger LOG = Logger.getLogger(ConversationBudgetService.class);

    /**
     * Reads the conversation budget, conversation spending and the budget of every active member.
     *
     * @throws ConversationNotFoundException
     *             if the conversation does not exist
     */
    @Transactional
    public ConversationBudgetsType getConversationBudgets(UUID conversationId) {
        Conversation conversation = Conversation.findById(conversationId);
        if (conversation == null) {
            throw new ConversationNotFoundException("Conversation not found: " + conversationId);
        }

        BigDecimal totalSpent = ConversationSpending.findByConversationId(conversationId).map(s -> s.totalSpent)
                .orElse(BigDecimal.ZERO);

        List<ConversationBudgetsType.MemberBudgetType> members = new ArrayList<>();
        for (ConversationMember member : ConversationMember.findActiveByConversation(conversationId)) {
            Optional<MemberBudget> budget = MemberBudget.findByMemberId(member.id);
            members.add(new ConversationBudgetsType.MemberBudgetType(member.id, member.userId,
                    budget.map(b -> b.budget).orElse(BigDecimal.ZERO),
                    budget.map(b -> b.spent).orElse(BigDecimal.ZERO)));
        }

        return new ConversationBudgetsType(conversation.conversationBudget, totalSpent, members);
    }

    /**
     * Sets a member's spending ceiling.
     *
     * @param memberId
     *            conversation member id
     * @param budgetCents
     *            new ceiling in cents
     */
    @Transactional
    public void updateMemberBudget(UUID memberId, long budgetCents) {
        requireNonNegative(budgetCents);
        BigDecimal budget = centsToDollars(budgetCents);

        MemberBudget row = MemberBudget.findByMemberIdForUpdate(memberId).orElse(null);
        if (row == null) {
            row = new MemberBudget();
            row.memberId = memberId;
            row.createdAt = Instant.now();
        }
        row.budget = budget;
        row.persist();

        LOG.infof("Updated member budget: memberId=%s, budget=%s", memberId, budget.toPlainString());
    }

    /**
     * Sets the conversation-wide spending ceiling.
     *
     * @throws ConversationNotFoundException
     *             if the conversation does not exist
     */
    @Transactional
    public void updateConversationBudget(UUID conversationId, long budgetCents) {
        requireNonNegative(budgetCents);
        BigDecimal budget = centsToDollars(budgetCents);

        int updated = Conversation.update("conversationBudget = ?1, updatedAt = ?2 WHERE id = ?3", budget,
                Instant.now(), conversationId);
        if (updated == 0) {
            throw new ConversationNotFoundException("Conversation not found: " + conversationId);
        }

        LOG.infof("Updated conversation budget: conversationId=%s, budget=%s", conversationId,
                budget.toPlainString());
    }

    /**
     * Adds a settled charge to the conversation total and to the member's spent amount. Must run inside the settlement
     * transaction; an inactive or unknown member fails the whole settlement.
     *
     * @throws MemberNotFoundException
     *             if the member is not an active member of the conversation
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public void updateGroupSpending(UUID conversationId, UUID memberId, BigDecimal costDollars) {
        ConversationMember member = ConversationMember.findById(memberId);
        if (member == null || member.leftAt != null || !conversationId.equals(member.conversationId)) {
            throw new MemberNotFoundException("Active member " + memberId + " not found in " + conversationId);
        }

        Instant now = Instant.now();
        ConversationSpending spending = ConversationSpending.findByConversationIdForUpdate(conversationId)
                .orElse(null);
        if (spending == null) {
            spending = new ConversationSpending();
            spending.conversationId = conversationId;
        }
        spending.totalSpent = spending.totalSpent.add(costDollars);
        spending.updatedAt = now;
        spending.persist();

        MemberBudget budget = MemberBudget.findByMemberIdForUpdate(memberId).orElse(null);
        if (budget == null) {
            budget = new MemberBudget();
            budget.memberId = memberId;
            budget.createdAt = now;
        }
        budget.spent = budget.spent.add(costDollars);
        budget.persist();

        LOG.debugf("Recorded group spending: conversationId=%s, memberId=%s, cost=%s", conversationId, memberId,
                costDollars.toPlainString());
    }

    static BigDecimal centsToDollars(long cents) {
        return BigDecimal.valueOf(cents).movePointLeft(2).setScale(2, RoundingMode.UNNECESSARY);
    }

    private static void requireNonNegative(long budgetCents) {
        if (budgetCents < 0) {
            throw new IllegalArgumentException("Budget must not be negative: " + budgetCents);
        }
    }
}
