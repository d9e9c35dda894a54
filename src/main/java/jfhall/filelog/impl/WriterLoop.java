package jfhall.filelog.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import jfhall.filelog.ErrorListener;
import jfhall.filelog.LogRecord;
import jfhall.filelog.RecordFormatter;
import jfhall.filelog.RotationTrigger;
import jfhall.filelog.WriterConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * The single consumer of a {@link HandoffQueue}. It owns the open {@link FileSession} and the
 * {@link RotationState}; everything but {@link #requestRotation()} and {@link #cancel()} must be
 * called from one thread at a time.
 */
@Slf4j
class WriterLoop implements Runnable {
  private final Path path;
  private final WriterConfig config;
  private final RecordFormatter formatter;
  private final RotationPolicy policy;
  private final RotationState state = new RotationState();
  private final HandoffQueue<LogRecord> handoff;
  private final Supplier<Instant> instantSupplier;
  private final ErrorListener errorListener;
  private final long flushIntervalNanos;
  private final FileSession.Opener opener;

  private final AtomicBoolean rotationRequested = new AtomicBoolean();
  private volatile boolean cancelled;

  private FileSession session;

  WriterLoop(
      final Path path,
      final WriterConfig config,
      final HandoffQueue<LogRecord> handoff,
      final Supplier<Instant> instantSupplier) {
    this(path, config, handoff, instantSupplier, FileSession::open);
  }

  /** VisibleForTesting. */
  WriterLoop(
      final Path path,
      final WriterConfig config,
      final HandoffQueue<LogRecord> handoff,
      final Supplier<Instant> instantSupplier,
      final FileSession.Opener opener) {
    this.path = path;
    this.config = config;
    this.formatter = config.resolveFormatter();
    this.policy = new RotationPolicy(config);
    this.handoff = handoff;
    this.instantSupplier = instantSupplier;
    this.errorListener = config.getErrorListener();
    this.flushIntervalNanos = config.getFlushInterval().toNanos();
    this.opener = opener;
  }

  /**
   * Open the first session, archiving a file left at the path if old files are retained.
   *
   * @throws IOException If the file can not be archived or opened.
   */
  void open() throws IOException {
    final ZonedDateTime now = now();
    archive(now, RotationTrigger.OPEN);
    startSession(now);
  }

  @Override
  public void run() {
    long nextFlush = System.nanoTime() + this.flushIntervalNanos;

    try {
      while (!this.cancelled) {
        if (this.rotationRequested.getAndSet(false)) {
          rotate(RotationTrigger.REQUESTED);
        }

        final long wait = nextFlush - System.nanoTime();
        if (wait <= 0) {
          flush();
          nextFlush = System.nanoTime() + this.flushIntervalNanos;
          continue;
        }

        final LogRecord record = this.handoff.poll(wait, TimeUnit.NANOSECONDS);
        if (record != null) {
          write(record, true);
        }
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Rotate before the next record. Safe to call from any thread. */
  void requestRotation() {
    this.rotationRequested.set(true);
  }

  /** Stop {@link #run()} after the record it is working on. Safe to call from any thread. */
  void cancel() {
    this.cancelled = true;
  }

  /**
   * Format and buffer one record.
   *
   * @param record The record to write.
   * @param rotationAllowed False while draining, thresholds are then ignored.
   */
  void write(final LogRecord record, final boolean rotationAllowed) {
    if (this.session == null) {
      if (!reopen(now())) {
        this.errorListener.onError(this.path, "No open file, record dropped", null);
        return;
      }
    } else if (rotationAllowed) {
      final Optional<RotationTrigger> trigger = this.policy.evaluate(this.state, now());
      if (trigger.isPresent() && !rotate(trigger.get())) {
        return;
      }
    }

    final String text;
    try {
      text = this.formatter.format(this.config.getFormat(), stripSource(record));
    } catch (final RuntimeException e) {
      this.errorListener.onError(this.path, "Failed to format record, record dropped", e);
      return;
    }

    try {
      this.state.recordWrite(this.session.write(text));
    } catch (final IOException e) {
      this.errorListener.onError(this.path, "Failed to write record", e);
    }
  }

  /**
   * Retire the current session and open a new one.
   *
   * <p>If the retiring file can not be archived, the file is reopened as it is with fresh counters
   * and false is returned, so the record that caused the rotation is dropped.
   *
   * @return Whether the rotation completed.
   */
  boolean rotate(final RotationTrigger trigger) {
    final ZonedDateTime now = now();

    closeSession();

    try {
      archive(now, trigger);
      startSession(now);
      log.debug("Rotated {} ({})", this.path, trigger);
      return true;
    } catch (final IOException e) {
      this.errorListener.onError(this.path, "Rotate: " + e.getMessage(), e);
      reopen(now);
      return false;
    }
  }

  void flush() {
    if (this.session == null) {
      return;
    }

    try {
      this.session.flush();
    } catch (final IOException e) {
      this.errorListener.onError(this.path, "Failed to flush", e);
    }
  }

  /** Close the current session for good, writing the footer. */
  void close() {
    closeSession();
    log.debug("Closed {}", this.path);
  }

  private void archive(final ZonedDateTime now, final RotationTrigger trigger)
      throws IOException {
    if (!this.config.isRetainOldFiles() || !Files.exists(this.path, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }

    final Path archive =
        this.policy.archivePath(
            this.path,
            now,
            trigger,
            candidate -> Files.exists(candidate, LinkOption.NOFOLLOW_LINKS));

    try {
      Files.move(this.path, archive);
    } catch (final IOException e) {
      throw new RotationException("Failed to rename " + this.path + " to " + archive, e);
    }
  }

  private void startSession(final ZonedDateTime now) throws IOException {
    this.session = this.opener.open(this.path, this.config.getBufferSize());
    this.state.reset(now);

    try {
      this.session.write(
          this.formatter.format(this.config.getHeader(), LogRecord.stamp(now.toInstant())));
    } catch (final IOException | RuntimeException e) {
      this.errorListener.onError(this.path, "Failed to write header", e);
    }
  }

  private boolean reopen(final ZonedDateTime now) {
    try {
      startSession(now);
      return true;
    } catch (final IOException e) {
      this.errorListener.onError(this.path, "Failed to open file", e);
      return false;
    }
  }

  private void closeSession() {
    if (this.session == null) {
      return;
    }

    final FileSession closing = this.session;
    this.session = null;

    String footer = "";
    try {
      footer = this.formatter.format(this.config.getFooter(), LogRecord.stamp(now().toInstant()));
    } catch (final RuntimeException e) {
      this.errorListener.onError(this.path, "Failed to format footer", e);
    }

    try {
      closing.close(footer);
    } catch (final IOException e) {
      this.errorListener.onError(this.path, "Failed to close file", e);
    }
  }

  private LogRecord stripSource(final LogRecord record) {
    final String prefix = this.config.getSourcePrefix();
    final String source = record.getSource();

    if (prefix == null || prefix.isEmpty() || source == null || !source.startsWith(prefix)) {
      return record;
    }
    return record.withSource(source.substring(prefix.length()));
  }

  private ZonedDateTime now() {
    return this.instantSupplier.get().atZone(this.config.getZoneId());
  }
}
