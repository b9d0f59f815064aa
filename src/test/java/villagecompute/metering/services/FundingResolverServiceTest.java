package villagecompute.metering.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.UUID;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;

import org.junit.jupiter.api.Test;

import villagecompute.metering.TestConstants;
import villagecompute.metering.TestFixtures;
import villagecompute.metering.api.types.ChatTurnRequestType;
import villagecompute.metering.billing.DenialReason;
import villagecompute.metering.billing.FundingSource;
import villagecompute.metering.billing.UserTier;
import villagecompute.metering.exceptions.ConversationNotFoundException;
import villagecompute.metering.exceptions.MemberNotFoundException;
import villagecompute.metering.testing.H2TestResource;

/**
 * Tests for funding resolution against persisted wallets, memberships and budgets.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class FundingResolverServiceTest {

    @Inject
    FundingResolverService fundingResolver;

    private static ChatTurnRequestType request(UUID userId, UUID conversationId) {
        return new ChatTurnRequestType(UserTier.FREE, null, conversationId, userId, null, null,
                TestConstants.BASIC_MODEL_ID, UUID.randomUUID(), TestConstants.USER_MESSAGE, List.of());
    }

    @Test
    void testResolve_PaidUserPaysPersonally() {
        // Given: $10.00 purchased
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "10.00", "0.05");

        // When
        FundingContext context = fundingResolver.resolve(request(userId, null), TestConstants.BASIC_MODEL);

        // Then: personal ceiling includes the 50¢ cushion
        assertEquals(UserTier.PAID, context.tier());
        assertEquals(FundingSource.PERSONAL_BALANCE, context.fundingSource());
        assertEquals(userId, context.payerId());
        assertEquals(1_050, context.personalCeilingCents(), 1e-6);
        assertNull(context.groupCeilings());
        assertTrue(context.budget().canAfford());
    }

    @Test
    void testResolve_FreeUserUsesAllowance() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0", "0.05");

        FundingContext context = fundingResolver.resolve(request(userId, null), TestConstants.BASIC_MODEL);

        assertEquals(FundingSource.FREE_ALLOWANCE, context.fundingSource());
        assertEquals(5, context.personalCeilingCents(), 1e-6);
        // 5¢ buys more output than the 16k context window holds
        assertTrue(context.budget().maxOutputTokens() > TestConstants.BASIC_MODEL.contextLength());
        assertEquals(15, context.budget().estimatedInputTokens());
    }

    @Test
    void testResolve_FreeUserDeniedPremium() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "0", "0.05");

        FundingContext context = fundingResolver.resolve(request(userId, null), TestConstants.PREMIUM_MODEL);

        assertEquals(DenialReason.PREMIUM_REQUIRES_BALANCE, context.decision().denialReason());
    }

    @Test
    void testResolve_OwnerFundsActiveMember() {
        // Given: paid owner, $2.00 conversation budget, member budget 50¢
        UUID ownerId = UUID.randomUUID();
        TestFixtures.createWallets(ownerId, "10.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(ownerId);
        TestFixtures.setConversationBudget(conversation.id(), "2.00");
        UUID requesterId = UUID.randomUUID();
        TestFixtures.createWallets(requesterId, "0", "0.05");
        UUID memberId = TestFixtures.addMember(conversation.id(), requesterId, "0.50");

        // When
        FundingContext context = fundingResolver.resolve(request(requesterId, conversation.id()),
                TestConstants.BASIC_MODEL);

        // Then: owner pays, ceilings come from owner balance and both budgets
        assertEquals(FundingSource.OWNER_BALANCE, context.fundingSource());
        assertEquals(ownerId, context.payerId());
        assertEquals(memberId, context.memberId());
        assertEquals(1_050, context.groupCeilings().payerCents(), 1e-6);
        assertEquals(50, context.groupCeilings().memberCents(), 1e-6);
        assertEquals(200, context.groupCeilings().conversationCents(), 1e-6);
    }

    @Test
    void testResolve_ExhaustedMemberBudgetFallsBackToPersonal() {
        UUID ownerId = UUID.randomUUID();
        TestFixtures.createWallets(ownerId, "10.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(ownerId);
        TestFixtures.setConversationBudget(conversation.id(), "2.00");
        UUID requesterId = UUID.randomUUID();
        TestFixtures.createWallets(requesterId, "0", "0.05");
        TestFixtures.addMember(conversation.id(), requesterId, "0");

        FundingContext context = fundingResolver.resolve(request(requesterId, conversation.id()),
                TestConstants.BASIC_MODEL);

        assertEquals(FundingSource.FREE_ALLOWANCE, context.fundingSource());
        assertEquals(requesterId, context.payerId());
        assertNull(context.memberId());
    }

    @Test
    void testResolve_OwnerOfConversationPaysPersonally() {
        UUID ownerId = UUID.randomUUID();
        TestFixtures.createWallets(ownerId, "10.00", "0.05");
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(ownerId);
        TestFixtures.setConversationBudget(conversation.id(), "2.00");

        FundingContext context = fundingResolver.resolve(request(ownerId, conversation.id()),
                TestConstants.BASIC_MODEL);

        assertEquals(FundingSource.PERSONAL_BALANCE, context.fundingSource());
    }

    @Test
    void testResolve_NonMemberRejected() {
        TestFixtures.ConversationFixture conversation = TestFixtures.createConversation(UUID.randomUUID());
        UUID outsiderId = UUID.randomUUID();
        TestFixtures.createWallets(outsiderId, "1.00", "0.05");

        assertThrows(MemberNotFoundException.class,
                () -> fundingResolver.resolve(request(outsiderId, conversation.id()), TestConstants.BASIC_MODEL));
    }

    @Test
    void testResolve_UnknownConversationRejected() {
        UUID userId = UUID.randomUUID();
        TestFixtures.createWallets(userId, "1.00", "0.05");

        assertThrows(ConversationNotFoundException.class,
                () -> fundingResolver.resolve(request(userId, UUID.randomUUID()), TestConstants.BASIC_MODEL));
    }

    @Test
    void testResolve_GuestTierFromSessionOnlyWhenUnauthenticated() {
        ChatTurnRequestType guest = new ChatTurnRequestType(UserTier.PAID, null, null, null,
                TestConstants.GUEST_TOKEN, TestConstants.GUEST_IP_HASH, TestConstants.BASIC_MODEL_ID,
                UUID.randomUUID(), TestConstants.USER_MESSAGE, List.of());

        FundingContext context = fundingResolver.resolve(guest, TestConstants.BASIC_MODEL);

        // a claimed PAID tier without a user id is treated as a guest
        assertEquals(UserTier.GUEST, context.tier());
        assertEquals(FundingSource.GUEST_FIXED, context.fundingSource());
        assertNull(context.payerId());
    }
}
