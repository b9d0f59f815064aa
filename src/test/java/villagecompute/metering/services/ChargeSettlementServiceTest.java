package villagecompute.metering.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.metering.TestConstants;
import villagecompute.metering.TestFixtures;
import villagecompute.metering.data.models.ConversationSpending;
import villagecompute.metering.data.models.LedgerEntry;
import villagecompute.metering.data.models.LlmCompletion;
import villagecompute.metering.data.models.MemberBudget;
import villagecompute.metering.data.models.Message;
import villagecompute.metering.data.models.UsageRecord;
import villagecompute.metering.data.models.Wallet;
import villagecompute.metering.exceptions.DuplicateResourceException;
import villagecompute.metering.exceptions.InsufficientBalanceException;
import villagecompute.metering.integration.crypto.X25519MessageEncryptor;
import villagecompute.metering.testing.H2TestResource;

/**
 * Tests for the settlement transaction: messages, usage record, ledger entry and wallet debit commit or roll back
 * together.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class ChargeSettlementServiceTest {

    /** $0.000017 model cost with fees plus 61 stored characters. */
    private static final BigDecimal TURN_COST = new BigDecimal("0.00003785");

    @Inject
    ChargeSettlementService settlementService;

    @Inject
    X25519MessageEncryptor encryptor;

    @BeforeEach
    void setUp() {
        TestFixtures.cleanDatabase();
    }

    private static SettlementRequest turn(UUID conversationId, UUID userMessageId, UUID senderId, UUID payerId,
            BigDecimal cost, boolean allowNegative, UUID groupMemberId) {
        return new SettlementRequest(conversationId, userMessageId, senderId, TestConstants.USER_MESSAGE,
                TestConstants.ASSISTANT_REPLY, payerId, cost, TestConstants.BASIC_MODEL_ID, 10, 8, 0, allowNegative,
                groupMemberId);
    }

    @Test
    void testSaveChatTurn_CommitsMessagesUsageAndCharge() {
        // Given: a paid user with $1.00
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "1.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);
        UUID userMessageId = UUID.randomUUID();

        // When
        SettlementResult result = settlementService
                .saveChatTurn(turn(conversation.id(), userMessageId, userId, userId, TURN_COST, true, null));

        // Then: consecutive sequences and one row of each kind
        assertEquals(userMessageId, result.userMessageId());
        assertEquals(1, result.userSequence());
        assertEquals(2, result.assistantSequence());
        assertEquals(3, TestFixtures.nextSequence(conversation.id()));
        assertEquals(2, TestFixtures.count(Message.class));
        assertEquals(1, TestFixtures.count(UsageRecord.class));
        assertEquals(1, TestFixtures.count(LedgerEntry.class));
        assertEquals(1, TestFixtures.count(LlmCompletion.class));

        // And: the purchased wallet paid the exact cost
        assertEquals(0, new BigDecimal("0.99996215")
                .compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));

        QuarkusTransaction.requiringNew().run(() -> {
            List<Message> messages = Message.findByConversation(conversation.id());
            assertEquals(TestConstants.USER_MESSAGE,
                    encryptor.decrypt(messages.get(0).encryptedBlob, conversation.epochKeys().getPrivate()));
            assertEquals(TestConstants.ASSISTANT_REPLY,
                    encryptor.decrypt(messages.get(1).encryptedBlob, conversation.epochKeys().getPrivate()));
            assertEquals(Message.SENDER_USER, messages.get(0).senderType);
            assertNull(messages.get(0).cost);
            assertEquals(Message.SENDER_AI, messages.get(1).senderType);
            assertEquals(userId, messages.get(1).payerId);
            assertEquals(0, TURN_COST.compareTo(messages.get(1).cost));

            List<LedgerEntry> entries = LedgerEntry.findByUsageRecord(result.usageRecordId());
            assertEquals(1, entries.size());
            assertEquals(0, TURN_COST.negate().compareTo(entries.get(0).amount));

            LlmCompletion completion = LlmCompletion.findByUsageRecord(result.usageRecordId()).orElseThrow();
            assertEquals(10, completion.inputTokens);
            assertEquals(8, completion.outputTokens);
        });
    }

    @Test
    void testSaveChatTurn_InsufficientFundsRollsBackEverything() {
        // Given: wallets that cannot cover a tenth of a cent and no negative cushion
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0", "0.00001");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);

        // When/Then
        assertThrows(InsufficientBalanceException.class, () -> settlementService.saveChatTurn(
                turn(conversation.id(), UUID.randomUUID(), userId, userId, new BigDecimal("0.001"), false, null)));

        // And: nothing was written, the sequence did not advance
        assertEquals(1, TestFixtures.nextSequence(conversation.id()));
        assertEquals(0, TestFixtures.count(Message.class));
        assertEquals(0, TestFixtures.count(UsageRecord.class));
        assertEquals(0, TestFixtures.count(LedgerEntry.class));
        assertEquals(0, new BigDecimal("0.00001")
                .compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_FREE_TIER)));
    }

    @Test
    void testSaveChatTurn_DuplicateMessageIdChargesOnce() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "1.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);
        UUID userMessageId = UUID.randomUUID();
        SettlementRequest request = turn(conversation.id(), userMessageId, userId, userId, TURN_COST, true, null);

        settlementService.saveChatTurn(request);
        assertThrows(DuplicateResourceException.class, () -> settlementService.saveChatTurn(request));

        assertEquals(2, TestFixtures.count(Message.class));
        assertEquals(1, TestFixtures.count(UsageRecord.class));
        assertEquals(3, TestFixtures.nextSequence(conversation.id()));
        assertEquals(0, new BigDecimal("0.99996215")
                .compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));
    }

    @Test
    void testSaveChatTurn_RemainderFallsToNextWallet() {
        // Given: purchased covers only 2 thousandths of a cent
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0.00002", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);

        settlementService
                .saveChatTurn(turn(conversation.id(), UUID.randomUUID(), userId, userId, TURN_COST, false, null));

        assertEquals(0, BigDecimal.ZERO.compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));
        assertEquals(0, new BigDecimal("0.04998215")
                .compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_FREE_TIER)));
        // one ledger entry per usage record even when split
        assertEquals(1, TestFixtures.count(LedgerEntry.class));
    }

    @Test
    void testSaveChatTurn_PurchasedWalletAbsorbsRemainderWithinCushion() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0.00001", "0");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);

        settlementService.saveChatTurn(
                turn(conversation.id(), UUID.randomUUID(), userId, userId, new BigDecimal("0.001"), true, null));

        assertEquals(0, new BigDecimal("-0.00099")
                .compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));
    }

    @Test
    void testSaveChatTurn_BeyondCushionRejected() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0", "0");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);

        // 60¢ would take the purchased wallet below -50¢
        assertThrows(InsufficientBalanceException.class, () -> settlementService.saveChatTurn(
                turn(conversation.id(), UUID.randomUUID(), userId, userId, new BigDecimal("0.60"), true, null)));

        assertEquals(0, BigDecimal.ZERO.compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));
        assertEquals(0, TestFixtures.count(Message.class));
    }

    @Test
    void testSaveChatTurn_OwnerFundedUpdatesGroupSpending() {
        // Given: owner pays for a member's turn
        UUID ownerId = UUID.randomUUID();
        TestFixtures.createWallets(ownerId, "10.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(ownerId);
        TestFixtures.setConversationBudget(conversation.id(), "2.00");
        UUID requesterId = UUID.randomUUID();
        UUID memberId = TestFixtures.addMember(conversation.id(), requesterId, "0.50");

        // When
        settlementService.saveChatTurn(
                turn(conversation.id(), UUID.randomUUID(), requesterId, ownerId, TURN_COST, true, memberId));

        // Then
        assertEquals(0, new BigDecimal("9.99996215")
                .compareTo(TestFixtures.walletBalance(ownerId, Wallet.TYPE_PURCHASED)));
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(0, TURN_COST.compareTo(
                    ConversationSpending.findByConversationId(conversation.id()).orElseThrow().totalSpent));
            assertEquals(0, TURN_COST.compareTo(MemberBudget.findByMemberId(memberId).orElseThrow().spent));
        });
    }

    @Test
    void testSaveUserOnlyMessage_NoCharge() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "1.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(userId);

        int sequence = settlementService.saveUserOnlyMessage(conversation.id(), UUID.randomUUID(), userId,
                TestConstants.USER_MESSAGE);

        assertEquals(1, sequence);
        assertEquals(2, TestFixtures.nextSequence(conversation.id()));
        assertEquals(1, TestFixtures.count(Message.class));
        assertEquals(0, TestFixtures.count(UsageRecord.class));
        assertEquals(0, new BigDecimal("1.00").compareTo(TestFixtures.walletBalance(userId, Wallet.TYPE_PURCHASED)));
    }

    @Test
    void testLedgerEntry_ExactlyOneReferenceEnforced() {
        // Given: an entry pointing at both a usage record and a source wallet
        UUID walletId = UUID.randomUUID();

        // When/Then: the database rejects it
        assertThrows(PersistenceException.class, () -> QuarkusTransaction.requiringNew().run(() -> {
            LedgerEntry entry = LedgerEntry.usageCharge(walletId, new BigDecimal("-0.01"), BigDecimal.ZERO,
                    UUID.randomUUID());
            entry.sourceWalletId = walletId;
            LedgerEntry.flush();
        }));
        assertEquals(0, TestFixtures.count(LedgerEntry.class));
    }
}
