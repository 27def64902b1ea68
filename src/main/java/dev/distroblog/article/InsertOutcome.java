package dev.distroblog.article;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Result of an insert-if-absent.
 *
 * @param id the new article id, null for {@link Kind#DUPLICATE}
 */
public record InsertOutcome(Kind kind, @Nullable UUID id) {

  public enum Kind {
    INSERTED,
    DUPLICATE
  }

  public static InsertOutcome inserted(UUID id) {
    return new InsertOutcome(Kind.INSERTED, id);
  }

  public static InsertOutcome duplicate() {
    return new InsertOutcome(Kind.DUPLICATE, null);
  }

  public boolean isDuplicate() {
    return kind == Kind.DUPLICATE;
  }
}
