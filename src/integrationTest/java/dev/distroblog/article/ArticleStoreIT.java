package dev.distroblog.article;

import dev.distroblog.BaseIntegrationTest;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleStoreIT extends BaseIntegrationTest {

    @Autowired
    ArticleStore articleStore;

    private Article article(String link, Source source) {
        Article article = new Article(link, "Article at " + link);
        article.setSourceId(source.getId());
        article.setSourceName(source.getName());
        return article;
    }

    @Test
    void secondInsertOfSameLinkIsDuplicate() {
        Source source = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/feed.xml", "Feed", MonitoringType.RSS));

        InsertOutcome first = articleStore.insertArticle(article("https://distro.example.org/a", source));
        InsertOutcome second = articleStore.insertArticle(article("https://distro.example.org/a", source));

        assertThat(first.kind()).isEqualTo(InsertOutcome.Kind.INSERTED);
        assertThat(first.id()).isNotNull();
        assertThat(second.isDuplicate()).isTrue();
        assertThat(articleRepository.count()).isEqualTo(1);
        assertThat(articleStore.articleExistsByLink("https://distro.example.org/a")).isTrue();
    }

    @Test
    void undatedQueryReturnsOnlyRecentScrapedArticlesNewestFirst() throws InterruptedException {
        Source scraped = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/blog", "Blog", MonitoringType.SCRAPING));
        Source feed = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/feed.xml", "Feed", MonitoringType.RSS));
        Instant since = Instant.now().minus(Duration.ofMinutes(5));

        articleStore.insertArticle(article("https://distro.example.org/blog/older", scraped));
        Thread.sleep(5);
        articleStore.insertArticle(article("https://distro.example.org/blog/newer", scraped));
        Article dated = article("https://distro.example.org/blog/dated", scraped);
        dated.setPubDate(Instant.parse("2025-05-01T00:00:00Z"));
        articleStore.insertArticle(dated);
        articleStore.insertArticle(article("https://distro.example.org/from-feed", feed));

        List<Article> undated = articleStore.findRecentUndatedScrapedArticles(since, 10);

        assertThat(undated).extracting(Article::getLink).containsExactly(
                "https://distro.example.org/blog/newer", "https://distro.example.org/blog/older");
        assertThat(articleStore.findRecentUndatedScrapedArticles(since, 1)).hasSize(1);
        assertThat(articleStore.findRecentUndatedScrapedArticles(Instant.now().plusSeconds(60), 10)).isEmpty();
    }

    @Test
    void pubDateUpdateRemovesArticleFromUndatedQuery() {
        Source scraped = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/blog", "Blog", MonitoringType.SCRAPING));
        InsertOutcome outcome = articleStore.insertArticle(article("https://distro.example.org/blog/post", scraped));

        articleStore.updateArticlePubDate(outcome.id(), Instant.parse("2025-05-01T00:00:00Z"));

        assertThat(articleRepository.findById(outcome.id()).orElseThrow().getPubDate())
                .isEqualTo(Instant.parse("2025-05-01T00:00:00Z"));
        assertThat(articleStore.findRecentUndatedScrapedArticles(Instant.EPOCH, 10)).isEmpty();
    }

    @Test
    void lastCheckedIsRecordedOnSource() {
        Source source = sourceRepository.saveAndFlush(
                new Source("https://distro.example.org/feed.xml", "Feed", MonitoringType.RSS));

        articleStore.updateSourceLastChecked(source.getId());

        assertThat(sourceRepository.findById(source.getId()).orElseThrow().getLastCheckedAt()).isNotNull();
        assertThat(articleStore.listSources()).extracting(Source::getId).containsExactly(source.getId());
    }
}
