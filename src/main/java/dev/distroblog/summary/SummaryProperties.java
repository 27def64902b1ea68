package dev.distroblog.summary;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Language-model summarization settings. With {@code enabled=false} only extractive summaries are
 * produced.
 *
 * @param baseUrl         OpenAI-compatible endpoint
 * @param maxContentChars article text sent to the model is cut to this length
 */
@ConfigurationProperties(prefix = "distroblog.summary")
public record SummaryProperties(
        boolean enabled,
        String baseUrl,
        String apiKey,
        String modelName,
        Duration timeout,
        int maxContentChars
) {
    public SummaryProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.openai.com/v1";
        }
        if (modelName == null || modelName.isBlank()) {
            modelName = "gpt-4o-mini";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (maxContentChars <= 0) {
            maxContentChars = 4_000;
        }
    }
}
