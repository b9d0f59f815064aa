/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import villagecompute.metering.api.types.ChatTurnRequestType;
import villagecompute.metering.api.types.ChatTurnResultType;
import villagecompute.metering.billing.BudgetCalculator;
import villagecompute.metering.billing.BudgetResult;
import villagecompute.metering.billing.DenialReason;
import villagecompute.metering.billing.FundingSource;
import villagecompute.metering.billing.ModelPricing;
import villagecompute.metering.billing.PricingPolicy;
import villagecompute.metering.exceptions.BalanceReservedException;
import villagecompute.metering.exceptions.BillingMismatchException;
import villagecompute.metering.exceptions.ContextCapacityTooLowException;
import villagecompute.metering.exceptions.ConversationNotFoundException;
import villagecompute.metering.exceptions.DailyLimitExceededException;
import villagecompute.metering.exceptions.EpochNotFoundException;
import villagecompute.metering.exceptions.InsufficientBalanceException;
import villagecompute.metering.exceptions.PremiumRequiresAccountException;
import villagecompute.metering.exceptions.PremiumRequiresBalanceException;
import villagecompute.metering.integration.inference.InferenceRequest;
import villagecompute.metering.integration.inference.InferenceResult;
import villagecompute.metering.integration.inference.ProviderException;
import villagecompute.metering.observability.BillingMetrics;
import villagecompute.metering.observability.LoggingConfig;

/**
 * Runs one billable chat turn end to end.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Resolve funding and budget for the requester (net of in-flight reservations)</li>
 * <li>Reject denied, mismatched or unaffordable turns before any provider spend</li>
 * <li>Reserve the worst-case charge, race-checked against the payer's ceilings</li>
 * <li>Stream the completion through {@link ProviderCapacityGuard}</li>
 * <li>Settle the actual cost in one transaction</li>
 * <li>Release the reservation</li>
 * </ol>
 *
 * <p>
 * The reservation is held in a try-with-resources block around the provider call and settlement, so release runs on
 * every exit path and only after settlement has committed or rolled back. Guest and trial turns reserve nothing,
 * persist nothing and only advance the guest's daily counter.
 *
 * <p>
 * Callers may run turns from worker threads, so the entry point activates its own request context for the read-only
 * lookups done outside settlement.
 */
@ApplicationScoped
public class BillableChatTurnService {

    private static final Logger LOG = Logger.getLogger(BillableChatTurnService.class);

    @Inject
    ModelCatalogService modelCatalog;

    @Inject
    FundingResolverService fundingResolver;

    @Inject
    ReservationService reservationService;

    @Inject
    ProviderCapacityGuard capacityGuard;

    @Inject
    ChargeSettlementService settlementService;

    @Inject
    GuestUsageService guestUsageService;

    @Inject
    BillingMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * Runs a chat turn and charges its payer.
     *
     * @param request
     *            requester, model and prompt
     * @param listener
     *            receives streamed tokens and the stream outcome
     * @return actual cost, usage record and the output-token ceiling used
     * @throws InsufficientBalanceException
     *             if the payer cannot afford a minimal response, or cannot cover the settled cost
     * @throws BalanceReservedException
     *             if concurrent in-flight turns have claimed the headroom
     * @throws PremiumRequiresBalanceException
     *             if a premium model is requested without purchased balance
     * @throws PremiumRequiresAccountException
     *             if a guest requests a premium model
     * @throws ContextCapacityTooLowException
     *             if the model cannot fit a minimal response after the prompt
     * @throws ConversationNotFoundException
     *             if the conversation does not exist
     * @throws EpochNotFoundException
     *             if the conversation's current epoch has no key
     * @throws BillingMismatchException
     *             if the declared funding source differs from the resolved one
     * @throws DailyLimitExceededException
     *             if a guest has used up today's messages
     * @throws ProviderException
     *             if the provider call fails or the stream is aborted
     */
    @ActivateRequestContext
    public ChatTurnResultType runBillableChatTurn(@Valid @NotNull ChatTurnRequestType request,
            @NotNull StreamOutcomeListener listener) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setUserId(request.userId());
        LoggingConfig.setConversationId(request.conversationId());

        Span span = tracer.spanBuilder("billing.chat_turn").setAttribute("model", request.model())
                .setAttribute("tier", request.tier().getValue()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            ModelPricing pricing = modelCatalog.getPricing(request.model());
            if (!request.isGuest() && request.conversationId() == null) {
                throw new IllegalArgumentException("Authenticated chat turns require a conversation");
            }

            FundingContext funding = fundingResolver.resolve(request, pricing);
            rejectIfDenied(funding, request);
            FundingSource source = funding.fundingSource();
            LoggingConfig.setFundingSource(source.getValue());
            span.setAttribute("funding.source", source.getValue());
            metrics.recordBillingDecision(source.getValue());

            if (request.declaredFundingSource() != null && request.declaredFundingSource() != source) {
                LOG.warnf("Declared funding source %s does not match resolved %s: userId=%s",
                        request.declaredFundingSource(), source, request.userId());
                throw new BillingMismatchException("Declared funding source " + request.declaredFundingSource()
                        + " does not match resolved " + source);
            }

            if (funding.isGuest()) {
                guestUsageService.checkQuota(request.guestToken(), request.ipHash());
            }

            BudgetResult budget = funding.budget();
            if (!budget.canAfford()) {
                throw new InsufficientBalanceException("Insufficient funds for a minimal response from "
                        + request.model(), denialFor(funding));
            }

            int maxOutputTokens = BudgetCalculator.effectiveMaxOutputTokens(budget.maxOutputTokens(),
                    pricing.contextLength(), budget.estimatedInputTokens());
            if (maxOutputTokens < PricingPolicy.MINIMUM_OUTPUT_TOKENS) {
                throw new ContextCapacityTooLowException("Model " + request.model() + " has room for only "
                        + maxOutputTokens + " output tokens after the prompt", pricing.contextLength(),
                        budget.estimatedInputTokens());
            }
            double worstCaseCents = BudgetCalculator.computeWorstCaseCents(budget.estimatedInputCost(),
                    maxOutputTokens, budget.outputCostPerToken());
            span.setAttribute("max_output_tokens", maxOutputTokens);

            ChatTurnResultType result;
            try (Reservation reservation = reserve(funding, request, worstCaseCents)) {
                if (reservation != null) {
                    span.setAttribute("reserved.cents", reservation.getAmountCents());
                }
                InferenceResult inference = complete(request, maxOutputTokens, listener);
                result = settle(request, funding, pricing, inference, maxOutputTokens);
            }

            span.setStatus(StatusCode.OK);
            return result;

        } catch (RuntimeException e) {
            LOG.debugf("Chat turn failed: userId=%s, conversationId=%s, error=%s", request.userId(),
                    request.conversationId(), e.getClass().getSimpleName());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Stores a user message in a group conversation without invoking the model or charging anyone.
     *
     * @return sequence number of the stored message
     */
    public int sendUserOnlyMessage(UUID conversationId, UUID userMessageId, UUID senderId, String plaintext) {
        return settlementService.saveUserOnlyMessage(conversationId, userMessageId, senderId, plaintext);
    }

    private void rejectIfDenied(FundingContext funding, ChatTurnRequestType request) {
        if (!funding.decision().isDenied()) {
            return;
        }
        DenialReason reason = funding.decision().denialReason();
        metrics.recordBillingDecision("denied_" + reason.getValue());
        LOG.infof("Chat turn denied: userId=%s, tier=%s, model=%s, reason=%s", request.userId(),
                funding.tier().getValue(), request.model(), reason.getValue());

        switch (reason) {
            case PREMIUM_REQUIRES_BALANCE -> throw new PremiumRequiresBalanceException(
                    "Model " + request.model() + " requires a purchased balance");
            case PREMIUM_REQUIRES_ACCOUNT -> throw new PremiumRequiresAccountException(
                    "Model " + request.model() + " requires an account");
            default -> throw new InsufficientBalanceException("Insufficient funds for " + request.model(), reason);
        }
    }

    private static DenialReason denialFor(FundingContext funding) {
        return switch (funding.fundingSource()) {
            case FREE_ALLOWANCE -> DenialReason.INSUFFICIENT_FREE_ALLOWANCE;
            case GUEST_FIXED -> DenialReason.GUEST_LIMIT_EXCEEDED;
            default -> DenialReason.INSUFFICIENT_BALANCE;
        };
    }

    private Reservation reserve(FundingContext funding, ChatTurnRequestType request, double worstCaseCents) {
        if (funding.isGuest()) {
            return null;
        }
        if (funding.isGroupFunded()) {
            return reservationService.reserveGroup(funding.payerId(), request.conversationId(), funding.memberId(),
                    worstCaseCents, funding.groupCeilings());
        }
        return reservationService.reservePersonal(funding.payerId(), worstCaseCents, funding.personalCeilingCents());
    }

    private InferenceResult complete(ChatTurnRequestType request, int maxOutputTokens,
            StreamOutcomeListener listener) {
        InferenceRequest inferenceRequest = new InferenceRequest(request.model(), request.promptMessages(),
                maxOutputTokens);
        try {
            InferenceResult inference = capacityGuard.complete(inferenceRequest, listener::onToken);
            listener.onOutcome(StreamOutcomeListener.StreamOutcome.COMPLETED);
            return inference;
        } catch (ProviderException e) {
            listener.onOutcome(e.getKind() == ProviderException.Kind.ABORTED
                    ? StreamOutcomeListener.StreamOutcome.ABORTED
                    : StreamOutcomeListener.StreamOutcome.FAILED);
            LOG.warnf("Provider call failed, turn not charged: model=%s, kind=%s, message=%s", request.model(),
                    e.getKind(), e.getMessage());
            throw e;
        } catch (ContextCapacityTooLowException e) {
            listener.onOutcome(StreamOutcomeListener.StreamOutcome.FAILED);
            throw e;
        }
    }

    private ChatTurnResultType settle(ChatTurnRequestType request, FundingContext funding, ModelPricing pricing,
            InferenceResult inference, int maxOutputTokens) {
        double modelCost = PricingPolicy.estimateModelCost(pricing, inference.inputTokens(),
                inference.outputTokens());
        double costDollars = PricingPolicy.calculateMessageCost(modelCost, request.promptCharacterCount(),
                inference.outputCharacterCount());
        FundingSource source = funding.fundingSource();

        if (funding.isGuest()) {
            int count = guestUsageService.recordMessage(request.guestToken(), request.ipHash());
            LOG.infof("Guest turn complete: model=%s, messagesToday=%d, outputTokens=%d", request.model(), count,
                    inference.outputTokens());
            metrics.recordSettlement("guest");
            return new ChatTurnResultType(BigDecimal.ZERO, null, null, maxOutputTokens, source, inference.content(),
                    inference.inputTokens(), inference.outputTokens());
        }

        SettlementRequest settlement = new SettlementRequest(request.conversationId(), request.userMessageId(),
                request.userId(), request.userMessage(), inference.content(), funding.payerId(),
                BigDecimal.valueOf(costDollars), request.model(), inference.inputTokens(), inference.outputTokens(),
                inference.cachedTokens(), source != FundingSource.FREE_ALLOWANCE, funding.memberId());
        SettlementResult settled;
        try {
            settled = settlementService.saveChatTurn(settlement);
        } catch (RuntimeException e) {
            metrics.recordSettlement("rolled_back");
            LOG.errorf(e, "Settlement rolled back: conversationId=%s, payerId=%s, cost=%.8f",
                    request.conversationId(), funding.payerId(), costDollars);
            throw e;
        }
        metrics.recordSettlement("committed");

        return new ChatTurnResultType(settled.cost(), settled.usageRecordId(), settled.assistantMessageId(),
                maxOutputTokens, source, inference.content(), inference.inputTokens(), inference.outputTokens());
    }
}
