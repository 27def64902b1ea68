package dev.distroblog.api;

import dev.distroblog.extract.ContentExtractionPipeline;
import dev.distroblog.extract.PageMetadata;
import dev.distroblog.ingestion.DateEnrichmentService;
import dev.distroblog.ingestion.ManualArticleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Article metadata, manual add-by-URL and maintenance endpoints. */
@RestController
@RequestMapping("/api")
public class ArticleController {

    private final ContentExtractionPipeline pipeline;
    private final ManualArticleService manualArticles;
    private final DateEnrichmentService dateEnrichment;

    public ArticleController(ContentExtractionPipeline pipeline, ManualArticleService manualArticles,
                             DateEnrichmentService dateEnrichment) {
        this.pipeline = pipeline;
        this.manualArticles = manualArticles;
        this.dateEnrichment = dateEnrichment;
    }

    @PostMapping("/articles/metadata")
    public PageMetadata metadata(@Valid @RequestBody UrlRequest request) {
        return pipeline.extractArticleMetadata(request.url());
    }

    @PostMapping("/articles/fetch-url")
    public ManualArticleService.Result fetchUrl(@Valid @RequestBody UrlRequest request) {
        return manualArticles.addByUrl(request.url());
    }

    @PostMapping("/maintenance/enrich-dates")
    public EnrichResponse enrichDates(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        return new EnrichResponse(dateEnrichment.enrichMissingDates(limit));
    }

    public record UrlRequest(@NotBlank String url) {}

    public record EnrichResponse(int enriched) {}
}
