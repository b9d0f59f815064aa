/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;

import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import villagecompute.metering.billing.PricingPolicy;
import villagecompute.metering.config.MeteringConfig;
import villagecompute.metering.data.models.Conversation;
import villagecompute.metering.data.models.Epoch;
import villagecompute.metering.data.models.LedgerEntry;
import villagecompute.metering.data.models.LlmCompletion;
import villagecompute.metering.data.models.Message;
import villagecompute.metering.data.models.UsageRecord;
import villagecompute.metering.data.models.Wallet;
import villagecompute.metering.exceptions.ConversationNotFoundException;
import villagecompute.metering.exceptions.DuplicateResourceException;
import villagecompute.metering.exceptions.EpochNotFoundException;
import villagecompute.metering.exceptions.InsufficientBalanceException;
import villagecompute.metering.integration.crypto.MessageEncryptor;

/**
 * Persists a finished turn and charges for it in one transaction.
 *
 * <p>
 * <b>Settlement Steps:</b>
 * <ol>
 * <li>Claim two sequence numbers on the conversation (the UPDATE serializes concurrent turns)</li>
 * <li>Load the epoch current at claim time and seal both messages for its key</li>
 * <li>Insert the user message (client id) and the assistant message (new id, with cost and payer)</li>
 * <li>Debit the payer's wallets in priority order and write a single {@code usage_charge} ledger entry</li>
 * <li>Insert the usage record and completion details</li>
 * <li>On owner-funded turns, add the cost to conversation and member spending</li>
 * </ol>
 *
 * <p>
 * Any failure rolls back every step. A reused message id surfaces as {@link DuplicateResourceException} and nothing is
 * charged.
 */
@ApplicationScoped
public class ChargeSettlementService {

    private static final Logger LOG = Logger.getLogger(ChargeSettlementService.class);

    /** Charges are stored at the 8-decimal precision of wallet balances and never rounded down. */
    static final int MONEY_SCALE = 8;

    private static final BigDecimal MAX_NEGATIVE_BALANCE = BigDecimal
            .valueOf(PricingPolicy.MAX_ALLOWED_NEGATIVE_BALANCE_CENTS).movePointLeft(2).negate();

    @Inject
    MessageEncryptor encryptor;

    @Inject
    ConversationBudgetService budgetService;

    @Inject
    MeteringConfig config;

    /**
     * Stores both messages of a turn and charges the payer.
     *
     * @param request
     *            settled turn
     * @return ids and sequence numbers written
     * @throws ConversationNotFoundException
     *             if the conversation does not exist
     * @throws EpochNotFoundException
     *             if the current epoch has no key row
     * @throws DuplicateResourceException
     *             if the user message id was already used
     * @throws InsufficientBalanceException
     *             if the payer's wallets cannot cover the charge
     */
    @Transactional
    public SettlementResult saveChatTurn(SettlementRequest request) {
        Conversation.SequenceClaim claim = Conversation.claimSequences(request.conversationId(), 2)
                .orElseThrow(() -> new ConversationNotFoundException(
                        "Conversation not found: " + request.conversationId()));
        byte[] epochKey = epochKey(request.conversationId(), claim.currentEpoch());

        BigDecimal cost = request.costDollars().setScale(MONEY_SCALE, RoundingMode.CEILING);
        UUID userMessageId = request.userMessageId() != null ? request.userMessageId() : UUID.randomUUID();
        UUID assistantMessageId = UUID.randomUUID();

        insertMessage(userMessageId, request.conversationId(), Message.SENDER_USER, request.senderId(), null, null,
                encryptor.encryptForEpoch(request.userMessage(), epochKey), claim.currentEpoch(), claim.sequence(0));
        insertMessage(assistantMessageId, request.conversationId(), Message.SENDER_AI, null, request.payerId(), cost,
                encryptor.encryptForEpoch(request.assistantContent(), epochKey), claim.currentEpoch(),
                claim.sequence(1));
        flushMessages(userMessageId);

        UsageRecord usage = UsageRecord.completed(request.payerId(), cost, UsageRecord.SOURCE_MESSAGE,
                assistantMessageId.toString());
        chargeForUsage(request.payerId(), cost, usage.id, request.allowNegativeBalance());

        LlmCompletion completion = new LlmCompletion();
        completion.usageRecordId = usage.id;
        completion.model = request.model();
        completion.provider = config.providerName();
        completion.inputTokens = request.inputTokens();
        completion.outputTokens = request.outputTokens();
        completion.cachedTokens = request.cachedTokens();
        completion.persist();

        if (request.groupMemberId() != null) {
            budgetService.updateGroupSpending(request.conversationId(), request.groupMemberId(), cost);
        }

        LOG.infof("Settled turn: conversationId=%s, payerId=%s, usageRecordId=%s, cost=%s, sequences=%d-%d",
                request.conversationId(), request.payerId(), usage.id, cost.toPlainString(), claim.sequence(0),
                claim.sequence(1));
        return new SettlementResult(userMessageId, assistantMessageId, usage.id, cost, claim.sequence(0),
                claim.sequence(1));
    }

    /**
     * Stores only the user message, without any charge. Used for group-chat messages that do not invoke the AI.
     *
     * @return sequence number assigned to the message
     */
    @Transactional
    public int saveUserOnlyMessage(UUID conversationId, UUID userMessageId, UUID senderId, String plaintext) {
        Conversation.SequenceClaim claim = Conversation.claimSequences(conversationId, 1).orElseThrow(
                () -> new ConversationNotFoundException("Conversation not found: " + conversationId));
        byte[] epochKey = epochKey(conversationId, claim.currentEpoch());

        UUID messageId = userMessageId != null ? userMessageId : UUID.randomUUID();
        insertMessage(messageId, conversationId, Message.SENDER_USER, senderId, null, null,
                encryptor.encryptForEpoch(plaintext, epochKey), claim.currentEpoch(), claim.sequence(0));
        flushMessages(messageId);

        LOG.infof("Saved user-only message: conversationId=%s, messageId=%s, sequence=%d", conversationId, messageId,
                claim.sequence(0));
        return claim.sequence(0);
    }

    /**
     * Debits {@code cost} from the payer's wallets in ascending priority. Each wallet covers what its positive balance
     * allows; a remainder falls to the purchased wallet, which may go down to the negative cushion when
     * {@code allowNegativeBalance} is set.
     *
     * <p>
     * One {@code usage_charge} entry records the whole cost against the first wallet debited, so a usage record maps to
     * exactly one ledger entry.
     *
     * @throws InsufficientBalanceException
     *             if a remainder is left after every wallet
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public void chargeForUsage(UUID payerId, BigDecimal cost, UUID usageRecordId, boolean allowNegativeBalance) {
        List<Wallet> wallets = Wallet.findByUserIdForUpdate(payerId);
        Map<Wallet, BigDecimal> debits = new LinkedHashMap<>();
        BigDecimal remaining = cost;

        for (Wallet wallet : wallets) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (wallet.balance.signum() <= 0) {
                continue;
            }
            BigDecimal take = wallet.balance.min(remaining);
            wallet.balance = wallet.balance.subtract(take);
            debits.merge(wallet, take, BigDecimal::add);
            remaining = remaining.subtract(take);
        }

        if (remaining.signum() > 0) {
            Wallet fallback = allowNegativeBalance ? lastPurchasedWallet(wallets) : null;
            if (fallback == null || fallback.balance.subtract(remaining).compareTo(MAX_NEGATIVE_BALANCE) < 0) {
                LOG.warnf("Charge exceeds funds: payerId=%s, cost=%s, uncovered=%s", payerId, cost.toPlainString(),
                        remaining.toPlainString());
                throw new InsufficientBalanceException(
                        "Insufficient balance to settle charge of $" + cost.toPlainString());
            }
            fallback.balance = fallback.balance.subtract(remaining);
            debits.merge(fallback, remaining, BigDecimal::add);
        }

        if (debits.isEmpty()) {
            // zero-cost turn
            if (wallets.isEmpty()) {
                throw new InsufficientBalanceException("No wallet to record charge for user " + payerId);
            }
            debits.put(wallets.get(0), BigDecimal.ZERO);
        }
        Map.Entry<Wallet, BigDecimal> primary = debits.entrySet().iterator().next();
        LedgerEntry.usageCharge(primary.getKey().id, cost.negate(), primary.getKey().balance, usageRecordId);
        if (debits.size() > 1) {
            LOG.debugf("Charge split across %d wallets: payerId=%s, usageRecordId=%s", debits.size(), payerId,
                    usageRecordId);
        }
    }

    private static Wallet lastPurchasedWallet(List<Wallet> wallets) {
        Wallet purchased = null;
        for (Wallet wallet : wallets) {
            if (Wallet.TYPE_PURCHASED.equals(wallet.type)) {
                purchased = wallet;
            }
        }
        return purchased;
    }

    private static byte[] epochKey(UUID conversationId, int epochNumber) {
        return Epoch.findByConversationAndNumber(conversationId, epochNumber).map(epoch -> epoch.epochPublicKey)
                .orElseThrow(() -> new EpochNotFoundException(
                        "Epoch " + epochNumber + " not found for conversation " + conversationId));
    }

    private static void insertMessage(UUID id, UUID conversationId, String senderType, UUID senderId, UUID payerId,
            BigDecimal cost, byte[] blob, int epochNumber, int sequenceNumber) {
        Message message = new Message();
        message.id = id;
        message.conversationId = conversationId;
        message.senderType = senderType;
        message.senderId = senderId;
        message.payerId = payerId;
        message.cost = cost;
        message.encryptedBlob = blob;
        message.epochNumber = epochNumber;
        message.sequenceNumber = sequenceNumber;
        message.createdAt = Instant.now();
        message.persist();
    }

    private static void flushMessages(UUID userMessageId) {
        try {
            Message.getEntityManager().flush();
        } catch (PersistenceException e) {
            if (e instanceof ConstraintViolationException || e.getCause() instanceof ConstraintViolationException) {
                throw new DuplicateResourceException("Message " + userMessageId + " already exists", e);
            }
            throw e;
        }
    }
}
