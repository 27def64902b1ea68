package dev.distroblog;

import dev.distroblog.article.ArticleRepository;
import dev.distroblog.source.SourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance shared by every subclass and empties
 * the article and source tables before each test. The headless browser, the AI extractor and the
 * summarizer are switched off so no test leaves the machine.
 */
@SpringBootTest(properties = {
    "distroblog.browser.enabled=false",
    "distroblog.ai-extractor.enabled=false",
    "distroblog.summary.enabled=false",
    "distroblog.ingestion.auto-start=false"
})
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @Autowired protected ArticleRepository articleRepository;

  @Autowired protected SourceRepository sourceRepository;

  @BeforeEach
  void cleanTables() {
    articleRepository.deleteAllInBatch();
    sourceRepository.deleteAllInBatch();
  }
}
