/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.billing;

/**
 * Messages produced alongside a budget calculation, for display next to the prompt input.
 *
 * <p>
 * {@link Severity#ERROR} notices block sending; warnings and info notices do not.
 */
public enum BudgetNotice {

    /**
     * Prompt plus minimum output exceeds the model's context window.
     */
    CAPACITY_EXCEEDED("capacity_exceeded", Severity.ERROR,
            "Message exceeds model capacity. Shorten your message or start a new conversation."),

    /**
     * Paid tier cannot cover the minimum cost.
     */
    INSUFFICIENT_PAID("insufficient_paid", Severity.ERROR,
            "Insufficient balance. Top up or try a more affordable model."),

    /**
     * Free allowance cannot cover the minimum cost.
     */
    INSUFFICIENT_FREE("insufficient_free", Severity.ERROR,
            "Your free daily usage can't cover this message. Try a shorter conversation or more affordable model."),

    /**
     * Guest or trial message exceeds the fixed cap.
     */
    INSUFFICIENT_GUEST("insufficient_guest", Severity.ERROR,
            "This message exceeds guest limits. Sign up for more capacity."),

    /**
     * Conversation is close to the model's context window.
     */
    CAPACITY_WARNING("capacity_warning", Severity.WARNING,
            "Your conversation is near this model's memory limit. Responses may be cut short."),

    /**
     * Paid tier can afford the call, but not a long response.
     */
    LOW_BALANCE("low_balance", Severity.WARNING, "Low balance. Long responses may be shortened."),

    FREE_TIER_NOTICE("free_tier_notice", Severity.INFO, "Using free allowance. Top up for longer conversations."),

    GUEST_NOTICE("guest_notice", Severity.INFO, "Free preview. Sign up for full access.");

    public enum Severity {
        ERROR, WARNING, INFO
    }

    private final String id;
    private final Severity severity;
    private final String message;

    BudgetNotice(String id, Severity severity, String message) {
        this.id = id;
        this.severity = severity;
        this.message = message;
    }

    public String getId() {
        return id;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public boolean isBlocking() {
        return severity == Severity.ERROR;
    }
}
