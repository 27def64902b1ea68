package dev.distroblog.source;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Source} entities. */
public interface SourceRepository extends JpaRepository<Source, UUID> {

  /** All sources in listing order (oldest first), paused ones included. */
  List<Source> findAllByOrderByCreatedAtAsc();

  boolean existsByUrl(String url);

  @Modifying
  @Transactional
  @Query("UPDATE Source s SET s.lastCheckedAt = :checkedAt WHERE s.id = :id")
  int updateLastCheckedAt(@Param("id") UUID id, @Param("checkedAt") Instant checkedAt);
}
