package dev.distroblog.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class LlmSummarizerTest {

  private static final String CONTENT =
      "The new release improves boot time considerably. It also adds a new installer for laptops. "
          + "Users can upgrade with one command today.";

  @Mock private ChatModel chatModel;

  @Mock private ObjectProvider<ChatModel> chatModelProvider;

  private LlmSummarizer summarizer(boolean enabled) {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    return new LlmSummarizer(
        chatModelProvider, new SummaryProperties(enabled, null, "key", null, null, 4000));
  }

  private void modelAnswers(String text) {
    when(chatModel.chat(any(SystemMessage.class), any(UserMessage.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
  }

  @Test
  void model_summary_is_used() {
    modelAnswers("  Boot is faster and a laptop installer ships.  ");

    assertThat(summarizer(true).summarize("Release", CONTENT, "Example"))
        .isEqualTo("Boot is faster and a laptop installer ships.");
  }

  @Test
  void declined_summary_falls_back_to_extractive() {
    modelAnswers(LlmSummarizer.NO_CONTENT);

    assertThat(summarizer(true).summarize("Release", CONTENT, "Example"))
        .isEqualTo(ExtractiveSummaries.summary(CONTENT));
  }

  @Test
  void failing_model_falls_back() {
    when(chatModel.chat(any(SystemMessage.class), any(UserMessage.class)))
        .thenThrow(new RuntimeException("429 Too Many Requests"));

    assertThat(summarizer(true).hook("Release", CONTENT, "Example"))
        .isEqualTo("The new release improves boot time considerably.");
  }

  @Test
  void disabled_model_is_never_called() {
    LlmSummarizer summarizer = summarizer(false);

    assertThat(summarizer.summarize("Release", CONTENT, "Example"))
        .isEqualTo(ExtractiveSummaries.summary(CONTENT));
    verifyNoInteractions(chatModel);
  }

  @Test
  void missing_model_bean_uses_extractive_text() {
    when(chatModelProvider.getIfAvailable()).thenReturn(null);
    LlmSummarizer summarizer =
        new LlmSummarizer(chatModelProvider, new SummaryProperties(true, null, null, null, null, 0));

    assertThat(summarizer.hook("Release 2.0", "tiny", "Example")).isEqualTo("Read more about: Release 2.0");
  }

  @Test
  void hook_from_model() {
    modelAnswers("A faster, friendlier release.");

    assertThat(summarizer(true).hook("Release", CONTENT, "Example")).isEqualTo("A faster, friendlier release.");
  }
}
