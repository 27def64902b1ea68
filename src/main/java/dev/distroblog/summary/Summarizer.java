package dev.distroblog.summary;

/**
 * Produces short texts shown next to an article in the review queue. Implementations never throw;
 * they degrade to an extractive text.
 */
public interface Summarizer {

  /** Factual summary of at most a few sentences. */
  String summarize(String title, String content, String sourceName);

  /** One-line teaser telling a reviewer what the article is about. */
  String hook(String title, String content, String sourceName);
}
