package dev.distroblog.article;

/** Review state of an {@link Article}. Ingestion only ever creates {@code NEW} articles. */
public enum ArticleStatus {
  NEW,
  SELECTED,
  DISMISSED,
  SENT
}
