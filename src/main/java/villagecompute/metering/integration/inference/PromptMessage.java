package villagecompute.metering.integration.inference;

/**
 * One chat message sent to the provider. Role is {@code system}, {@code user} or {@code assistant}.
 */
public record PromptMessage(String role, String content) {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static PromptMessage user(String content) {
        return new PromptMessage(ROLE_USER, content);
    }

    public int characterCount() {
        return content == null ? 0 : content.length();
    }
}
