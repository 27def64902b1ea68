package dev.distroblog.ingestion;

import dev.distroblog.article.ArticleStore;
import org.springframework.stereotype.Component;

/** Cheap existence check run before any extraction work on an item. */
@Component
public class DeduplicationGuard {

    private final ArticleStore articleStore;

    public DeduplicationGuard(ArticleStore articleStore) {
        this.articleStore = articleStore;
    }

    public boolean shouldIngest(String link) {
        if (link == null || link.isBlank()) {
            return false;
        }
        return !articleStore.articleExistsByLink(link.trim());
    }
}
