package com.voxagent.agent;

import com.voxagent.providers.ChatRequest;
import com.voxagent.providers.ModelProvider;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Generation through a chat-completion {@link ModelProvider}. */
public class ProviderResponseGenerator implements ResponseGenerator {

    private final ModelProvider provider;
    private final PromptBuilder promptBuilder;
    private final Executor executor;

    public ProviderResponseGenerator(ModelProvider provider, PromptBuilder promptBuilder, Executor executor) {
        this.provider = provider;
        this.promptBuilder = promptBuilder;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            var settings = request.agent().modelSettings();
            var messages = promptBuilder.build(request);
            var resp = provider.chat(new ChatRequest(
                    settings.model(), messages, settings.temperature(), settings.maxTokens()));
            return resp.content();
        }, executor);
    }
}
