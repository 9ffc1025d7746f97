package com.cape.runtime.model;

import com.cape.runtime.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Model adapter backed by Spring AI's {@link ChatClient}. The chat client is
 * built on first use, so the engine starts without a configured model.
 */
@Component
public class SpringAiModelAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelAdapter.class);

    private final ObjectProvider<ChatClient.Builder> builder;
    private final String name;
    private volatile ChatClient chatClient;

    public SpringAiModelAdapter(ObjectProvider<ChatClient.Builder> builder,
                                @Value("${cape.models.spring-ai.name:openai}") String name) {
        this.builder = builder;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AdapterResponse execute(ModelPrompt prompt, ExecutionContext context) {
        log.info("Model call started → {} (trace {})", name, context.traceId());
        long start = System.currentTimeMillis();
        ChatResponse response = client().prompt()
                .system(prompt.system())
                .user(prompt.user())
                .call()
                .chatResponse();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Model call complete → {} ({}s)", name, String.format("%.1f", elapsed / 1000.0));

        String content = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText() : null;
        if (content == null || content.isBlank()) {
            throw new AdapterFailureException("Model '" + name + "' returned empty content");
        }
        return new AdapterResponse(content, totalTokens(response));
    }

    private ChatClient client() {
        ChatClient client = chatClient;
        if (client == null) {
            ChatClient.Builder available = builder.getIfAvailable();
            if (available == null) {
                throw new AdapterFailureException("No Spring AI chat model is configured for adapter '" + name + "'");
            }
            client = available.build();
            chatClient = client;
        }
        return client;
    }

    private static long totalTokens(ChatResponse response) {
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage == null || usage.getTotalTokens() == null) {
            return 0;
        }
        return usage.getTotalTokens();
    }
}
