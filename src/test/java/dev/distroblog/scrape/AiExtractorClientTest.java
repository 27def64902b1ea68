package dev.distroblog.scrape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.distroblog.extract.RawItem;
import dev.distroblog.fixture.MutableClock;
import dev.distroblog.fixture.RecordingSleeper;
import dev.distroblog.fixture.SourceBuilder;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class AiExtractorClientTest {

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private MutableClock clock;
  private RecordingSleeper sleeper;
  private Source source;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-06-01T00:00:00Z");
    sleeper = new RecordingSleeper(clock);
    source =
        new SourceBuilder()
            .url("https://www.example.org")
            .name("Example Org")
            .type(MonitoringType.ADK)
            .build();
  }

  private AiExtractorClient client(boolean enabled) {
    return new AiExtractorClient(
        restClient,
        new AiExtractorProperties(enabled, "http://localhost:8000", 1000, 60_000, 7000, 3, null),
        clock,
        sleeper);
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/extract")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(AiExtractRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  @Test
  void disabled_client_returns_nothing_without_calling() {
    assertThat(client(false).extractArticles(source)).isEmpty();
    verifyNoInteractions(restClient);
  }

  @Test
  void articles_are_mapped_to_raw_items() {
    stubRestClientChain();
    when(responseSpec.body(AiExtractResponse.class))
        .thenReturn(
            new AiExtractResponse(
                List.of(
                    new AiExtractResponse.Article(
                        "Annual report",
                        " https://www.example.org/news/annual-report ",
                        "Highlights of the year",
                        "2025-05-02"),
                    new AiExtractResponse.Article("No link", "  ", null, null))));

    List<RawItem> items = client(true).extractArticles(source);

    assertThat(items).hasSize(1);
    RawItem item = items.get(0);
    assertThat(item.link()).isEqualTo("https://www.example.org/news/annual-report");
    assertThat(item.title()).isEqualTo("Annual report");
    assertThat(item.description()).isEqualTo("Highlights of the year");
    assertThat(item.dateCandidates()).containsExactly("2025-05-02");
  }

  @Test
  void request_carries_url_name_and_limit() {
    stubRestClientChain();
    when(responseSpec.body(AiExtractResponse.class)).thenReturn(new AiExtractResponse(null));
    ArgumentCaptor<AiExtractRequest> request = ArgumentCaptor.forClass(AiExtractRequest.class);

    client(true).extractArticles(source);

    verify(requestBodySpec).body(request.capture());
    assertThat(request.getValue()).isEqualTo(new AiExtractRequest("https://www.example.org", "Example Org", 3));
  }

  @Test
  void consecutive_calls_are_spaced() {
    stubRestClientChain();
    when(responseSpec.body(AiExtractResponse.class)).thenReturn(new AiExtractResponse(List.of()));
    AiExtractorClient client = client(true);

    client.extractArticles(source);
    client.extractArticles(source);

    assertThat(sleeper.sleeps()).containsExactly(7000L);
  }

  @Test
  void null_body_is_empty() {
    stubRestClientChain();
    when(responseSpec.body(AiExtractResponse.class)).thenReturn(null);

    assertThat(client(true).extractArticles(source)).isEmpty();
  }

  @Test
  void transport_failure_propagates_to_the_retry_layer() {
    when(restClient.post()).thenThrow(new ResourceAccessException("connection refused"));

    assertThatThrownBy(() -> client(true).extractArticles(source))
        .isInstanceOf(ResourceAccessException.class);
  }

  @Test
  void exhausted_retries_recover_with_empty_list() {
    assertThat(client(true).recoverExtract(new ResourceAccessException("down"), source)).isEmpty();
  }

  @Test
  void response_drops_null_articles() {
    assertThat(new AiExtractResponse(Arrays.asList(null, new AiExtractResponse.Article("t", "u", null, null)))
            .articles())
        .hasSize(1);
  }
}
