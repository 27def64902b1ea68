package dev.distroblog;

import dev.distroblog.ingestion.IngestionScheduler;
import dev.distroblog.ingestion.IngestionState;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationContextIT extends BaseIntegrationTest {

    @Autowired
    Flyway flyway;

    @Autowired
    IngestionScheduler scheduler;

    @Test
    void contextLoadsWithMigratedSchema() {
        // Reaching this point means Flyway migrated and Hibernate validated every entity
        assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("1");
    }

    @Test
    void monitoringDoesNotStartByItself() {
        assertThat(scheduler.state()).isEqualTo(IngestionState.STOPPED);
    }
}
