package jfhall.filelog;

import java.time.Duration;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a file writer needs besides its path. A writer takes a snapshot of this value when it
 * is constructed; there is no way to change the format, thresholds or templates of a live writer.
 *
 * <p>All rotation thresholds are disabled by default and old files are not retained.
 */
@Value
@Builder(toBuilder = true)
public class WriterConfig {
  public static final String DEFAULT_FORMAT = "[%D %T] [%L] (%S) %M";
  public static final int DEFAULT_ENTRY_CAPACITY = 32;
  public static final int DEFAULT_BUFFER_SIZE = 4096;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(100);

  /** Template every record is rendered through. */
  @Builder.Default private final String format = DEFAULT_FORMAT;

  /** Written at the start of every file session, stamped with the moment it was opened. */
  @Builder.Default private final String header = "";

  /** Written at the end of every file session, stamped with the moment it was closed. */
  @Builder.Default private final String footer = "";

  /** Rotate once this many records went into the current file; 0 disables. */
  private final int maxLines;

  /** Rotate once this many record bytes went into the current file; 0 disables. */
  private final long maxBytes;

  private final boolean rotateDaily;
  private final boolean rotateHourly;

  /** Rename retired files to dated archives instead of appending to the same file again. */
  private final boolean retainOldFiles;

  /** Stripped from the front of every record source before formatting. */
  @Builder.Default private final String sourcePrefix = "";

  /** How many submitted records may wait for the relay before submitters block. */
  @Builder.Default private final int entryCapacity = DEFAULT_ENTRY_CAPACITY;

  @Builder.Default private final int bufferSize = DEFAULT_BUFFER_SIZE;
  @Builder.Default private final Duration flushInterval = DEFAULT_FLUSH_INTERVAL;

  /** Zone used for rotation boundaries, archive names and the default formatter. */
  @Builder.Default private final ZoneId zoneId = ZoneId.systemDefault();

  /** Null means a {@link PatternRecordFormatter} in {@link #zoneId}. */
  private final RecordFormatter formatter;

  @Builder.Default private final ErrorListener errorListener = new Slf4jErrorListener();

  /** The formatter to render records with, falling back to the pattern formatter. */
  public RecordFormatter resolveFormatter() {
    return this.formatter != null ? this.formatter : new PatternRecordFormatter(this.zoneId);
  }

  /**
   * Check the values for consistency.
   *
   * @throws IllegalArgumentException If a threshold is negative or a capacity is not positive.
   */
  public void validate() {
    if (this.maxLines < 0) {
      throw new IllegalArgumentException("maxLines must not be negative: " + this.maxLines);
    }
    if (this.maxBytes < 0) {
      throw new IllegalArgumentException("maxBytes must not be negative: " + this.maxBytes);
    }
    if (this.entryCapacity <= 0) {
      throw new IllegalArgumentException("entryCapacity must be positive: " + this.entryCapacity);
    }
    if (this.bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive: " + this.bufferSize);
    }
    if (this.flushInterval == null
        || this.flushInterval.isZero()
        || this.flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive: " + this.flushInterval);
    }
    if (this.format == null || this.header == null || this.footer == null) {
      throw new IllegalArgumentException("Templates must not be null.");
    }
    if (this.zoneId == null || this.errorListener == null) {
      throw new IllegalArgumentException("zoneId and errorListener are required.");
    }
  }

  /** Builder additions on top of the generated setters. */
  public static class WriterConfigBuilder {
    /** Set the header and footer templates together. */
    public WriterConfigBuilder headFoot(final String header, final String footer) {
      return this.header(header).footer(footer);
    }
  }
}
