/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.metering.integration.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * {@link InferenceClient} over the OpenAI-compatible streaming API of OpenRouter.
 *
 * <p>
 * Provider failures are mapped onto {@link ProviderException.Kind} from the HTTP status of the underlying
 * {@link HttpException}. A context-length rejection is recognised by its message, so the capacity guard can retry with
 * a corrected output ceiling.
 */
@ApplicationScoped
public class OpenRouterInferenceClient implements InferenceClient {

    private static final Logger LOG = Logger.getLogger(OpenRouterInferenceClient.class);

    @Inject
    StreamingChatModel chatModel;

    @Inject
    OpenRouterClientFactory factory;

    @Override
    public InferenceResult streamCompletion(InferenceRequest request, Consumer<String> onToken) {
        ChatRequest chatRequest = ChatRequest.builder().messages(toChatMessages(request.messages()))
                .modelName(request.model()).maxOutputTokens(request.maxTokens()).build();

        CompletableFuture<ChatResponse> completion = new CompletableFuture<>();
        AtomicBoolean streamed = new AtomicBoolean(false);
        AtomicBoolean aborted = new AtomicBoolean(false);

        chatModel.chat(chatRequest, new StreamingChatResponseHandler() {

            @Override
            public void onPartialResponse(String partialResponse) {
                if (aborted.get()) {
                    return;
                }
                streamed.set(true);
                try {
                    onToken.accept(partialResponse);
                } catch (RuntimeException e) {
                    aborted.set(true);
                    completion.completeExceptionally(
                            new ProviderException(ProviderException.Kind.ABORTED, "Stream aborted by consumer", e));
                }
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                completion.complete(completeResponse);
            }

            @Override
            public void onError(Throwable error) {
                completion.completeExceptionally(error);
            }
        });

        ChatResponse response = await(completion, request, streamed);
        String content = response.aiMessage() == null ? "" : response.aiMessage().text();
        TokenUsage usage = response.tokenUsage();
        int inputTokens = usage == null || usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
        int outputTokens = usage == null || usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();

        LOG.debugf("Completion finished: model=%s, inputTokens=%d, outputTokens=%d", request.model(), inputTokens,
                outputTokens);
        return new InferenceResult(content == null ? "" : content, inputTokens, outputTokens, 0);
    }

    private ChatResponse await(CompletableFuture<ChatResponse> completion, InferenceRequest request,
            AtomicBoolean streamed) {
        try {
            return completion.get(factory.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.ABORTED, "Interrupted while streaming", e);
        } catch (TimeoutException e) {
            throw new ProviderException(ProviderException.Kind.TIMEOUT,
                    "Provider did not finish within " + factory.timeoutSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), request, streamed.get());
        }
    }

    /**
     * Maps a LangChain4j failure onto the provider error taxonomy.
     */
    static ProviderException translate(Throwable error, InferenceRequest request, boolean streamed) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();

        Optional<ContextLengthError> contextError = ContextLengthError.parse(message);
        if (contextError.isPresent()) {
            LOG.infof("Context length rejected for model %s: max=%d, textInput=%d, requestedOutput=%d",
                    request.model(), contextError.get().maxContext(), contextError.get().textInput(),
                    contextError.get().requestedOutput());
            return ProviderException.contextLength(message, contextError.get(), error);
        }

        HttpException http = findHttpException(error);
        ProviderException.Kind kind;
        if (http == null) {
            kind = streamed ? ProviderException.Kind.ABORTED : ProviderException.Kind.UNKNOWN;
        } else if (http.statusCode() == 401 || http.statusCode() == 403) {
            kind = ProviderException.Kind.AUTHENTICATION;
        } else if (http.statusCode() == 429) {
            kind = ProviderException.Kind.RATE_LIMITED;
        } else if (http.statusCode() >= 500) {
            kind = ProviderException.Kind.UNAVAILABLE;
        } else {
            kind = ProviderException.Kind.INVALID_REQUEST;
        }
        LOG.warnf("Provider error for model %s: kind=%s, message=%s", request.model(), kind, message);
        return new ProviderException(kind, message, error);
    }

    private static HttpException findHttpException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpException http) {
                return http;
            }
            current = current.getCause();
        }
        return null;
    }

    private static List<ChatMessage> toChatMessages(List<PromptMessage> messages) {
        List<ChatMessage> chatMessages = new ArrayList<>(messages.size());
        for (PromptMessage message : messages) {
            switch (message.role()) {
                case PromptMessage.ROLE_SYSTEM -> chatMessages.add(SystemMessage.from(message.content()));
                case PromptMessage.ROLE_ASSISTANT -> chatMessages.add(AiMessage.from(message.content()));
                default -> chatMessages.add(UserMessage.from(message.content()));
            }
        }
        return chatMessages;
    }
}
