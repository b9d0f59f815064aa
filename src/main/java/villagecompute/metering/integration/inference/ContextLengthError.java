package villagecompute.metering.integration.inference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Details extracted from a provider's context-length rejection, e.g. "maximum context length is 204800 tokens. However,
 * you requested about 4262473 tokens (65 of text input, 4262408 in the output)". Image and tool input segments between
 * the text input and the output are ignored.
 */
public record ContextLengthError(int maxContext, int textInput, int requestedOutput) {

    private static final Pattern PATTERN = Pattern.compile(
            "maximum context length is (\\d+) tokens.*?\\((\\d+) of text input.*?(\\d+) in the output\\)",
            Pattern.DOTALL);

    /**
     * Parses a provider error message.
     *
     * @param message
     *            raw error text, possibly prefixed or multiline
     * @return parsed details, or empty if the message is not a context-length rejection
     */
    public static Optional<ContextLengthError> parse(String message) {
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ContextLengthError(Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3))));
        } catch (NumberFormatException e) {
            // Counts beyond int range are not a usable correction
            return Optional.empty();
        }
    }
}
