package villagecompute.metering;

import java.math.BigDecimal;
import java.security.KeyPair;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;

import villagecompute.metering.billing.ModelPricing;
import villagecompute.metering.data.models.Conversation;
import villagecompute.metering.data.models.ConversationMember;
import villagecompute.metering.data.models.ConversationSpending;
import villagecompute.metering.data.models.Epoch;
import villagecompute.metering.data.models.GuestUsage;
import villagecompute.metering.data.models.LedgerEntry;
import villagecompute.metering.data.models.LlmCompletion;
import villagecompute.metering.data.models.MemberBudget;
import villagecompute.metering.data.models.Message;
import villagecompute.metering.data.models.ModelPrice;
import villagecompute.metering.data.models.UsageRecord;
import villagecompute.metering.data.models.Wallet;
import villagecompute.metering.integration.crypto.X25519MessageEncryptor;

/**
 * Factory methods for persisted test data.
 *
 * <p>
 * Every method commits in its own transaction. Settlement, renewal and guest counting run in transactions of their
 * own, so data created inside a test transaction would be invisible to them.
 */
public final class TestFixtures {

    /** Prevent instantiation. */
    private TestFixtures() {
    }

    /** A conversation with its first epoch, and the epoch key pair for decrypting stored messages. */
    public record ConversationFixture(UUID id, UUID ownerId, KeyPair epochKeys) {
    }

    /**
     * Deletes every row written by the metering tables, children first.
     */
    public static void cleanDatabase() {
        QuarkusTransaction.requiringNew().run(() -> {
            LlmCompletion.deleteAll();
            LedgerEntry.deleteAll();
            UsageRecord.deleteAll();
            Message.deleteAll();
            MemberBudget.deleteAll();
            ConversationSpending.deleteAll();
            ConversationMember.deleteAll();
            Epoch.deleteAll();
            Conversation.deleteAll();
            Wallet.deleteAll();
            GuestUsage.deleteAll();
            ModelPrice.deleteAll();
        });
    }

    /**
     * Creates both wallets for a user. The free-tier wallet gets a renewal entry dated now, so the balance given here
     * is not topped up by today's lazy renewal.
     */
    public static void createWallets(UUID userId, String purchasedDollars, String freeTierDollars) {
        QuarkusTransaction.requiringNew().run(() -> {
            Wallet.create(userId, Wallet.TYPE_PURCHASED, Wallet.PRIORITY_PURCHASED, new BigDecimal(purchasedDollars));
            Wallet freeTier = Wallet.create(userId, Wallet.TYPE_FREE_TIER, Wallet.PRIORITY_FREE_TIER,
                    new BigDecimal(freeTierDollars));
            LedgerEntry.renewal(freeTier.id, BigDecimal.ZERO, freeTier.balance);
        });
    }

    public static BigDecimal walletBalance(UUID userId, String type) {
        return QuarkusTransaction.requiringNew()
                .call(() -> Wallet.findByUserAndType(userId, type).map(wallet -> wallet.balance).orElseThrow());
    }

    /**
     * Creates a conversation owned by {@code ownerId} with epoch 1 and an owner membership row.
     */
    public static ConversationFixture createConversation(UUID ownerId) {
        KeyPair keys = X25519MessageEncryptor.generateEpochKeyPair();
        UUID conversationId = QuarkusTransaction.requiringNew().call(() -> {
            Conversation conversation = Conversation.create(ownerId, "Test conversation");
            Epoch.create(conversation.id, conversation.currentEpoch, keys.getPublic().getEncoded());
            ConversationMember.join(conversation.id, ownerId, ConversationMember.PRIVILEGE_OWNER);
            return conversation.id;
        });
        return new ConversationFixture(conversationId, ownerId, keys);
    }

    public static void setConversationBudget(UUID conversationId, String dollars) {
        QuarkusTransaction.requiringNew().run(() -> {
            Conversation conversation = Conversation.findById(conversationId);
            conversation.conversationBudget = new BigDecimal(dollars);
        });
    }

    /**
     * Adds a writing member with a budget row.
     *
     * @return the membership id
     */
    public static UUID addMember(UUID conversationId, UUID userId, String budgetDollars) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ConversationMember member = ConversationMember.join(conversationId, userId,
                    ConversationMember.PRIVILEGE_WRITE);
            MemberBudget budget = new MemberBudget();
            budget.memberId = member.id;
            budget.budget = new BigDecimal(budgetDollars);
            budget.persist();
            return member.id;
        });
    }

    public static int nextSequence(UUID conversationId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> Conversation.<Conversation> findById(conversationId).nextSequence);
    }

    public static void createModel(ModelPricing pricing) {
        QuarkusTransaction.requiringNew().run(() -> {
            ModelPrice price = new ModelPrice();
            price.modelId = pricing.modelId();
            price.inputPricePerToken = pricing.inputPricePerToken();
            price.outputPricePerToken = pricing.outputPricePerToken();
            price.contextLength = pricing.contextLength();
            price.premium = pricing.premium();
            price.persist();
        });
    }

    public static long count(Class<?> entity) {
        return QuarkusTransaction.requiringNew().call(() -> {
            if (entity == Message.class) {
                return Message.count();
            } else if (entity == UsageRecord.class) {
                return UsageRecord.count();
            } else if (entity == LedgerEntry.class) {
                return LedgerEntry.count("entryType", LedgerEntry.TYPE_USAGE_CHARGE);
            } else if (entity == LlmCompletion.class) {
                return LlmCompletion.count();
            }
            throw new IllegalArgumentException("Unsupported entity: " + entity.getSimpleName());
        });
    }
}
