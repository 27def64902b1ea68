package dev.distroblog.api;

import dev.distroblog.ingestion.IngestionScheduler;
import dev.distroblog.ingestion.IngestionState;
import dev.distroblog.ingestion.SourceResult;
import dev.distroblog.source.MonitoringType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonitorControllerTest {

    @Mock
    IngestionScheduler scheduler;

    @InjectMocks
    MonitorController controller;

    @Test
    void triggerSumsNewArticles() {
        List<SourceResult> results = List.of(
                new SourceResult("A", "https://a.org", 2, true, null, false, MonitoringType.RSS),
                new SourceResult("B", "https://b.org", 0, false, "boom", false, MonitoringType.SCRAPING),
                new SourceResult("C", "https://c.org", 3, true, null, false, MonitoringType.ADK));
        when(scheduler.triggerManualPass()).thenReturn(results);

        MonitorController.TriggerResponse response = controller.trigger();

        assertThat(response.newArticles()).isEqualTo(5);
        assertThat(response.results()).isEqualTo(results);
    }

    @Test
    void startAndStopReportState() {
        Instant last = Instant.parse("2025-06-01T12:00:00Z");
        when(scheduler.state()).thenReturn(IngestionState.IDLE, IngestionState.STOPPED);
        when(scheduler.lastPassAt()).thenReturn(Optional.of(last), Optional.empty());

        assertThat(controller.start()).isEqualTo(new MonitorController.StatusResponse(IngestionState.IDLE, last));
        assertThat(controller.stop()).isEqualTo(new MonitorController.StatusResponse(IngestionState.STOPPED, null));
        verify(scheduler).start();
        verify(scheduler).stop();
    }
}
