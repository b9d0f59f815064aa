package villagecompute.metering.integration.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for parsing provider context-length rejections.
 */
class ContextLengthErrorTest {

    @Test
    void testParse_TextOnly() {
        String message = "This endpoint's maximum context length is 204800 tokens. However, you requested about 4262473"
                + " tokens (65 of text input, 4262408 in the output). Please reduce the length of either one, or use"
                + " the \"middle-out\" transform to compress your prompt automatically.";

        Optional<ContextLengthError> result = ContextLengthError.parse(message);

        assertEquals(Optional.of(new ContextLengthError(204_800, 65, 4_262_408)), result);
    }

    @Test
    void testParse_ImageInputSkipped() {
        String message = "This endpoint's maximum context length is 200000 tokens. However, you requested about 239846"
                + " tokens (223654 of text input, 8000 of image input, 8192 in the output).";

        assertEquals(Optional.of(new ContextLengthError(200_000, 223_654, 8_192)), ContextLengthError.parse(message));
    }

    @Test
    void testParse_ToolInputSkipped() {
        String message = "This endpoint's maximum context length is 200000 tokens. However, you requested about 5028244"
                + " tokens (4945291 of text input, 2953 of tool input, 80000 in the output).";

        assertEquals(Optional.of(new ContextLengthError(200_000, 4_945_291, 80_000)),
                ContextLengthError.parse(message));
    }

    @Test
    void testParse_MultilineAndPrefixed() {
        String multiline = """
                This endpoint's maximum context length is 204800 tokens.
                However, you requested about 4262473 tokens
                (65 of text input, 4262408 in the output).
                """;
        String prefixed = "OpenRouter error: This endpoint's maximum context length is 10000 tokens. However, you"
                + " requested about 12500 tokens (9500 of text input, 3000 in the output).";

        assertEquals(Optional.of(new ContextLengthError(204_800, 65, 4_262_408)), ContextLengthError.parse(multiline));
        assertEquals(Optional.of(new ContextLengthError(10_000, 9_500, 3_000)), ContextLengthError.parse(prefixed));
    }

    @Test
    void testParse_UnrelatedMessages() {
        assertTrue(ContextLengthError.parse("Rate limit exceeded. Please try again later.").isEmpty());
        assertTrue(ContextLengthError.parse("").isEmpty());
        assertTrue(ContextLengthError.parse(null).isEmpty());
        assertTrue(ContextLengthError.parse("Context length exceeded: 204800 max, 300000 requested").isEmpty());
    }

    @Test
    void testParse_MissingOutputSegment() {
        String message = "This endpoint's maximum context length is 204800 tokens. However, you requested about 4262473"
                + " tokens (65 of text input).";

        assertTrue(ContextLengthError.parse(message).isEmpty());
    }

    @Test
    void testParse_CountBeyondIntRange() {
        String message = "maximum context length is 99999999999 tokens. (65 of text input, 10 in the output)";

        assertTrue(ContextLengthError.parse(message).isEmpty());
    }
}
