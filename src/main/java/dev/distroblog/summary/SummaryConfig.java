package dev.distroblog.summary;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the chat model used by {@link LlmSummarizer}. The bean only exists when summarization
 * is enabled, so no API key is needed otherwise.
 */
@Configuration
public class SummaryConfig {

    @Bean
    @ConditionalOnProperty(prefix = "distroblog.summary", name = "enabled", havingValue = "true")
    public ChatModel summaryChatModel(SummaryProperties properties) {
        return OpenAiChatModel.builder()
                .baseUrl(properties.baseUrl())
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .timeout(properties.timeout())
                .temperature(0.1)
                .maxTokens(200)
                .build();
    }
}
