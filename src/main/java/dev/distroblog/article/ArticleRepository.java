package dev.distroblog.article;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Article} entities. */
public interface ArticleRepository extends JpaRepository<Article, UUID> {

  boolean existsByLink(String link);

  /**
   * Undated articles created after {@code since} whose source is scraped, newest first.
   *
   * @param since lower bound on {@code createdAt}
   * @param page  limits the number of rows
   */
  @Query(
      """
      SELECT a FROM Article a
      WHERE a.pubDate IS NULL
        AND a.createdAt >= :since
        AND a.sourceId IN (
          SELECT s.id FROM Source s WHERE s.monitoringType = dev.distroblog.source.MonitoringType.SCRAPING)
      ORDER BY a.createdAt DESC
      """)
  List<Article> findRecentUndatedScraped(@Param("since") Instant since, Pageable page);

  @Modifying
  @Transactional
  @Query("UPDATE Article a SET a.pubDate = :pubDate, a.updatedAt = :now WHERE a.id = :id")
  int updatePubDate(
      @Param("id") UUID id, @Param("pubDate") Instant pubDate, @Param("now") Instant now);
}
