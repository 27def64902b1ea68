package dev.distroblog.summary;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * {@link Summarizer} backed by an OpenAI-compatible chat model, falling back to
 * {@link ExtractiveSummaries} when the model is not configured, fails or declines.
 */
@Service
public class LlmSummarizer implements Summarizer {

  private static final Logger log = LoggerFactory.getLogger(LlmSummarizer.class);

  static final String NO_CONTENT = "NO FACTUAL CONTENT";

  private static final String SUMMARY_INSTRUCTIONS =
      """
      You summarize news and blog articles for journalists.
      Only include facts stated in the source. Keep quotes, names, dates and numbers exact.
      Never add interpretation or outside context. Stay under 150 words and do not repeat the title.
      If there is no substantial factual content, answer exactly "NO FACTUAL CONTENT".
      """;

  private static final String HOOK_INSTRUCTIONS =
      """
      You write one-line hooks for an article review queue.
      Answer with a single sentence under 25 words saying what the article is about.
      Do not repeat the title verbatim.
      """;

  private final @Nullable ChatModel chatModel;
  private final SummaryProperties properties;

  public LlmSummarizer(ObjectProvider<ChatModel> chatModel, SummaryProperties properties) {
    this.chatModel = chatModel.getIfAvailable();
    this.properties = properties;
  }

  @Override
  public String summarize(String title, String content, String sourceName) {
    String answer = ask(SUMMARY_INSTRUCTIONS, prompt(title, content, sourceName));
    if (answer == null || answer.equals(NO_CONTENT)) {
      return ExtractiveSummaries.summary(content);
    }
    return answer;
  }

  @Override
  public String hook(String title, String content, String sourceName) {
    String answer = ask(HOOK_INSTRUCTIONS, prompt(title, content, sourceName));
    return answer == null ? ExtractiveSummaries.description(title, content) : answer;
  }

  private String prompt(String title, String content, String sourceName) {
    String body = content == null ? "" : content.strip();
    if (body.length() > properties.maxContentChars()) {
      body = body.substring(0, properties.maxContentChars());
    }
    if (body.length() < 50) {
      return "Source: " + sourceName + "\nTitle: " + title
          + "\n\nThis is a link-only article. Work from the title alone.";
    }
    return "Source: " + sourceName + "\nTitle: " + title + "\n\nArticle:\n" + body;
  }

  private @Nullable String ask(String instructions, String prompt) {
    if (chatModel == null || !properties.enabled()) {
      return null;
    }
    try {
      String text =
          chatModel
              .chat(SystemMessage.from(instructions), UserMessage.from(prompt))
              .aiMessage()
              .text();
      return text == null || text.isBlank() ? null : text.strip();
    } catch (RuntimeException e) {
      log.warn("Chat model call failed, using extractive text: {}", e.getMessage());
      return null;
    }
  }
}
