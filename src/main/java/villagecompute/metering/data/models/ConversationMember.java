/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

/**
 * Membership of a user (or share link) in a group conversation. A member is active while {@code left_at} is null.
 */
@Entity
@Table(
        name = "conversation_members")
@NamedQuery(
        name = ConversationMember.QUERY_FIND_ACTIVE_BY_CONVERSATION,
        query = ConversationMember.JPQL_FIND_ACTIVE_BY_CONVERSATION)
@NamedQuery(
        name = ConversationMember.QUERY_FIND_ACTIVE_MEMBER,
        query = ConversationMember.JPQL_FIND_ACTIVE_MEMBER)
public class ConversationMember extends PanacheEntityBase {

    public static final String PRIVILEGE_OWNER = "owner";
    public static final String PRIVILEGE_ADMIN = "admin";
    public static final String PRIVILEGE_WRITE = "write";
    public static final String PRIVILEGE_READ = "read";

    public static final String JPQL_FIND_ACTIVE_BY_CONVERSATION = "FROM ConversationMember WHERE conversationId = ?1 AND leftAt IS NULL ORDER BY joinedAt ASC";
    public static final String QUERY_FIND_ACTIVE_BY_CONVERSATION = "ConversationMember.findActiveByConversation";

    public static final String JPQL_FIND_ACTIVE_MEMBER = "FROM ConversationMember WHERE conversationId = ?1 AND userId = ?2 AND leftAt IS NULL";
    public static final String QUERY_FIND_ACTIVE_MEMBER = "ConversationMember.findActiveMember";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "conversation_id",
            nullable = false)
    public UUID conversationId;

    @Column(
            name = "user_id")
    public UUID userId;

    @Column(
            name = "link_id")
    public UUID linkId;

    @Column(
            nullable = false)
    public String privilege = PRIVILEGE_WRITE;

    @Column(
            name = "visible_from_epoch",
            nullable = false)
    public int visibleFromEpoch = 1;

    @Column(
            name = "joined_at",
            nullable = false)
    public Instant joinedAt = Instant.now();

    @Column(
            name = "left_at")
    public Instant leftAt;

    public static List<ConversationMember> findActiveByConversation(UUID conversationId) {
        return find("#" + QUERY_FIND_ACTIVE_BY_CONVERSATION, conversationId).list();
    }

    public static Optional<ConversationMember> findActiveMember(UUID conversationId, UUID userId) {
        return find("#" + QUERY_FIND_ACTIVE_MEMBER, conversationId, userId).firstResultOptional();
    }

    public static ConversationMember join(UUID conversationId, UUID userId, String privilege) {
        ConversationMember member = new ConversationMember();
        member.conversationId = conversationId;
        member.userId = userId;
        member.privilege = privilege;
        member.joinedAt = Instant.now();
        member.persist();
        return member;
    }
}
