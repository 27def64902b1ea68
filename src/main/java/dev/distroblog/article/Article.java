package dev.distroblog.article;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A canonical article awaiting review.
 *
 * <p>{@code link} is unique and is the only deduplication key. {@code pubDate} stays null when no
 * plausible publication date was found; it is never filled with the ingestion time.
 *
 * <p>Maps to the {@code articles} table managed by Flyway migrations.
 */
@Entity
@Table(name = "articles")
public class Article {

    public static final int PREVIEW_MAX = 300;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(length = PREVIEW_MAX)
    private String preview;

    @Column(name = "publisher_description", length = PREVIEW_MAX)
    private String publisherDescription;

    @Column(name = "article_hook", columnDefinition = "TEXT")
    private String articleHook;

    private String author;

    @Column(nullable = false, unique = true, length = 2048)
    private String link;

    @Column(name = "pub_date")
    private Instant pubDate;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "source_name")
    private String sourceName;

    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ArticleStatus status = ArticleStatus.NEW;

    @Column(nullable = false)
    private boolean seen;

    @Column(nullable = false)
    private boolean viewed;

    @Column(nullable = false)
    private boolean manual;

    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Article() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a {@link ArticleStatus#NEW}, unseen article.
     *
     * @param link  canonical article URL (must be unique)
     * @param title display title, never blank and never a bare URL
     */
    public Article(String link, String title) {
        this.link = link;
        this.title = title;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getPreview() {
        return preview;
    }

    public void setPreview(String preview) {
        this.preview = truncate(preview);
    }

    public String getPublisherDescription() {
        return publisherDescription;
    }

    public void setPublisherDescription(String publisherDescription) {
        this.publisherDescription = truncate(publisherDescription);
    }

    public String getArticleHook() {
        return articleHook;
    }

    public void setArticleHook(String articleHook) {
        this.articleHook = articleHook;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getLink() {
        return link;
    }

    public Instant getPubDate() {
        return pubDate;
    }

    public void setPubDate(Instant pubDate) {
        this.pubDate = pubDate;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public void setSourceId(UUID sourceId) {
        this.sourceId = sourceId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public ArticleStatus getStatus() {
        return status;
    }

    public void setStatus(ArticleStatus status) {
        this.status = status;
    }

    public boolean isSeen() {
        return seen;
    }

    public void setSeen(boolean seen) {
        this.seen = seen;
    }

    public boolean isViewed() {
        return viewed;
    }

    public void setViewed(boolean viewed) {
        this.viewed = viewed;
    }

    public boolean isManual() {
        return manual;
    }

    public void setManual(boolean manual) {
        this.manual = manual;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= PREVIEW_MAX) {
            return value;
        }
        return value.substring(0, PREVIEW_MAX - 3) + "...";
    }
}
