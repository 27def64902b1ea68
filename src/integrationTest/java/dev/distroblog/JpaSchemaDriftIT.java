package dev.distroblog;

import dev.distroblog.article.Article;
import dev.distroblog.article.ArticleStatus;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=validate by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Test
    void sourceEntityRoundtripsAgainstFlywaySchema() {
        Source source = new Source("https://distro.example.org/blog", "Example Distro", MonitoringType.SCRAPING);
        source.setCategory("Distros");
        source.setPaused(true);

        Source saved = sourceRepository.saveAndFlush(source);
        Source found = sourceRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getUrl()).isEqualTo("https://distro.example.org/blog");
        assertThat(found.getMonitoringType()).isEqualTo(MonitoringType.SCRAPING);
        assertThat(found.getCategory()).isEqualTo("Distros");
        assertThat(found.isPaused()).isTrue();
        assertThat(found.getLastCheckedAt()).isNull();
        assertThat(found.getCreatedAt()).isNotNull();
    }

    @Test
    void articleEntityRoundtripsAgainstFlywaySchema() {
        Source source = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/feed.xml", "Example Distro", MonitoringType.RSS));
        Article article = new Article("https://distro.example.org/posts/release", "Release ".repeat(60));
        article.setContent("Full body");
        article.setPreview("Preview");
        article.setPublisherDescription("Description");
        article.setArticleHook("Hook");
        article.setAuthor("Jane");
        article.setPubDate(Instant.parse("2025-05-01T10:00:00Z"));
        article.setSourceId(source.getId());
        article.setSourceName(source.getName());
        article.setCategory("Distros");
        article.setSessionId("session_1748779200000_abc");

        Article saved = articleRepository.saveAndFlush(article);
        Article found = articleRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getTitle()).hasSize(480);
        assertThat(found.getPubDate()).isEqualTo(Instant.parse("2025-05-01T10:00:00Z"));
        assertThat(found.getSourceId()).isEqualTo(source.getId());
        assertThat(found.getStatus()).isEqualTo(ArticleStatus.NEW);
        assertThat(found.isSeen()).isFalse();
        assertThat(found.isManual()).isFalse();
        assertThat(found.getCreatedAt()).isNotNull();
    }
}
