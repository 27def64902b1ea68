package dev.distroblog.scrape;

/** JSON body of the extraction service's {@code /extract} endpoint. */
public record AiExtractRequest(String url, String name, int limit) {}
