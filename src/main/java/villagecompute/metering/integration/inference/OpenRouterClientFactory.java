/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.inference;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Produces the streaming chat model used for billable turns. OpenRouter speaks the OpenAI wire protocol, so the OpenAI
 * module is pointed at its base URL. The model name here is only a default; each request names its own model.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code villagecompute.metering.provider.base-url} - default {@code https://openrouter.ai/api/v1}</li>
 * <li>{@code villagecompute.metering.provider.api-key} - provider API key</li>
 * <li>{@code villagecompute.metering.provider.timeout-seconds} - request timeout (default: 120)</li>
 * </ul>
 */
@ApplicationScoped
public class OpenRouterClientFactory {

    private static final Logger LOG = Logger.getLogger(OpenRouterClientFactory.class);

    @ConfigProperty(
            name = "villagecompute.metering.provider.base-url",
            defaultValue = "https://openrouter.ai/api/v1")
    String baseUrl;

    @ConfigProperty(
            name = "villagecompute.metering.provider.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "villagecompute.metering.provider.default-model",
            defaultValue = "openai/gpt-4o-mini")
    String defaultModel;

    @ConfigProperty(
            name = "villagecompute.metering.provider.timeout-seconds",
            defaultValue = "120")
    int timeoutSeconds;

    @Produces
    @ApplicationScoped
    public StreamingChatModel streamingChatModel() {
        String key = apiKey.filter(value -> !value.isBlank()).orElseThrow(
                () -> new IllegalStateException("villagecompute.metering.provider.api-key is required"));
        LOG.infof("Creating streaming chat model: baseUrl=%s, defaultModel=%s, timeout=%ds", baseUrl, defaultModel,
                timeoutSeconds);

        // No client-side retries: a retried streaming call could be billed twice by the provider
        return OpenAiStreamingChatModel.builder().baseUrl(baseUrl).apiKey(key).modelName(defaultModel)
                .timeout(Duration.ofSeconds(timeoutSeconds)).customHeaders(Map.of("X-Title", "VillageCompute Chat"))
                .logRequests(false).logResponses(false).build();
    }

    int timeoutSeconds() {
        return timeoutSeconds;
    }
}
