package dev.distroblog.article;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import dev.distroblog.source.Source;
import dev.distroblog.source.SourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Persistence operations used by ingestion. Inserting a link that already exists is a normal
 * outcome, reported as {@link InsertOutcome.Kind#DUPLICATE} instead of an exception.
 */
@Service
public class ArticleStore {

    private static final Logger log = LoggerFactory.getLogger(ArticleStore.class);

    static final String UNIQUE_VIOLATION = "23505";

    private final ArticleRepository articleRepository;
    private final SourceRepository sourceRepository;
    private final Clock clock;

    public ArticleStore(ArticleRepository articleRepository, SourceRepository sourceRepository, Clock clock) {
        this.articleRepository = articleRepository;
        this.sourceRepository = sourceRepository;
        this.clock = clock;
    }

    public List<Source> listSources() {
        return sourceRepository.findAllByOrderByCreatedAtAsc();
    }

    public boolean articleExistsByLink(String link) {
        return articleRepository.existsByLink(link);
    }

    public InsertOutcome insertArticle(Article article) {
        try {
            Article saved = articleRepository.saveAndFlush(article);
            return InsertOutcome.inserted(saved.getId());
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                log.debug("Article already stored: {}", article.getLink());
                return InsertOutcome.duplicate();
            }
            throw e;
        }
    }

    public void updateArticlePubDate(UUID articleId, Instant pubDate) {
        articleRepository.updatePubDate(articleId, pubDate, clock.instant());
    }

    public void updateSourceLastChecked(UUID sourceId) {
        sourceRepository.updateLastCheckedAt(sourceId, clock.instant());
    }

    public List<Article> findRecentUndatedScrapedArticles(Instant since, int limit) {
        return articleRepository.findRecentUndatedScraped(since, PageRequest.of(0, limit));
    }

    /**
     * A violation is a duplicate only when the driver reports SQL state 23505. Without a SQL state
     * the violation cannot be attributed to the link constraint and is rethrown.
     */
    static boolean isUniqueViolation(DataIntegrityViolationException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return UNIQUE_VIOLATION.equals(sql.getSQLState());
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
