package dev.distroblog.source;

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
 * A monitored publisher: either a feed, or a website whose listing page is scraped.
 *
 * <p>For {@link MonitoringType#RSS} sources {@link #getUrl()} is the feed URL itself, discovered
 * once at setup time and never re-discovered during ingestion. For the other types it is the
 * site or listing URL.
 *
 * <p>Maps to the {@code sources} table managed by Flyway migrations.
 *
 * @see MonitoringType
 * @see SourceRepository
 */
@Entity
@Table(name = "sources")
public class Source {

    public static final String DEFAULT_CATEGORY = "General";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 2048)
    private String url;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String category = DEFAULT_CATEGORY;

    @Enumerated(EnumType.STRING)
    @Column(name = "monitoring_type", nullable = false)
    private MonitoringType monitoringType = MonitoringType.RSS;

    @Column(nullable = false)
    private boolean paused;

    @Column(name = "last_checked_at")
    private Instant lastCheckedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Source() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an active source in the default category.
     *
     * @param url            feed URL for RSS sources, site URL otherwise (must be unique)
     * @param name           display name, also stored on every article of the source
     * @param monitoringType how articles are obtained
     */
    public Source(String url, String name, MonitoringType monitoringType) {
        this.url = url;
        this.name = name;
        this.monitoringType = monitoringType;
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

    public String getUrl() {
        return url;
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    public MonitoringType getMonitoringType() {
        return monitoringType;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public Instant getLastCheckedAt() {
        return lastCheckedAt;
    }

    public void setLastCheckedAt(Instant lastCheckedAt) {
        this.lastCheckedAt = lastCheckedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /** True for sources whose articles come from scraping or the AI extractor. */
    public boolean usesBrowser() {
        return monitoringType != MonitoringType.RSS;
    }
}
