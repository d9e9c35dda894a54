package jfhall.filelog;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/** One log event. Immutable once built; the writer never changes a submitted record. */
@Value
@Builder
@With
public class LogRecord {
  private final Level level;

  @Builder.Default private final Instant created = Instant.now();

  /** Where the event came from, e.g. {@code some/dir/file.java:42}. */
  private final String source;

  private final String message;

  /**
   * A record carrying only a timestamp, used to render headers and footers.
   *
   * @param created The moment to stamp the header or footer with.
   */
  public static LogRecord stamp(final Instant created) {
    return LogRecord.builder().created(created).build();
  }
}
