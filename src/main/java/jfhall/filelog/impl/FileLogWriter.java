package jfhall.filelog.impl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import jfhall.filelog.ErrorListener;
import jfhall.filelog.LogRecord;
import jfhall.filelog.SimpleLogger;
import jfhall.filelog.WriterConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * A SimpleLogger that writes records to a physical file from a background thread, rotating to a
 * new file when the configured thresholds are crossed.
 *
 * <p>{@link #write} never touches the disk: it hands the record to a relay thread and returns,
 * waiting only while {@link WriterConfig#getEntryCapacity()} records are already queued for the
 * relay. A writer thread takes records from the relay in submission order, rotates when needed,
 * formats and buffers them, and flushes every {@link WriterConfig#getFlushInterval()}.
 *
 * <p>{@link #close()} must be called exactly once. It writes every record whose {@link #write}
 * returned before the close started, then closes the file.
 */
@Slf4j
public class FileLogWriter implements SimpleLogger<LogRecord> {
  private static final AtomicInteger WRITER_COUNT = new AtomicInteger();

  /** Lifecycle of a writer, only ever moving forward. */
  enum State {
    RUNNING,
    DRAINING,
    CLOSED
  }

  private final Path path;
  private final ErrorListener errorListener;
  private final HandoffQueue<LogRecord> handoff;
  private final WriterLoop writerLoop;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final ReadWriteLock stateLock = new ReentrantReadWriteLock();

  private final Future<?> relay;
  private final Future<?> writer;

  private volatile State state = State.RUNNING;

  /**
   * @param path The file to write to. Missing parent directories are created.
   * @param config Formatting, rotation and queueing settings, fixed for the life of the writer.
   * @throws UncheckedIOException If the file can not be opened.
   */
  public FileLogWriter(final Path path, final WriterConfig config) {
    this(path, config, newExecutor(path), true, Instant::now);
  }

  /**
   * VisibleForTesting.
   *
   * @param path The file to write to. Missing parent directories are created.
   * @param config Formatting, rotation and queueing settings.
   * @param executor Runs the relay and the writer loop, needs at least two threads.
   * @param ownsExecutor Whether to shut the executor down on close.
   * @param instantSupplier Get an Instant for now.
   */
  FileLogWriter(
      final Path path,
      final WriterConfig config,
      final ExecutorService executor,
      final boolean ownsExecutor,
      final Supplier<Instant> instantSupplier) {
    config.validate();

    this.path = path;
    this.errorListener = config.getErrorListener();
    this.handoff = new HandoffQueue<>(config.getEntryCapacity());
    this.writerLoop = new WriterLoop(path, config, this.handoff, instantSupplier);
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;

    try {
      final Path parentDir = path.toAbsolutePath().getParent();
      if (parentDir != null) {
        Files.createDirectories(parentDir);
      }

      this.writerLoop.open();
    } catch (final IOException e) {
      if (ownsExecutor) {
        executor.shutdownNow();
      }
      throw new UncheckedIOException("Failed to open log file " + path, e);
    }

    this.relay = executor.submit(this.handoff);
    this.writer = executor.submit(this.writerLoop);

    log.debug("Opened {}", path);
  }

  /** {@inheritDoc}. */
  @Override
  public void write(final LogRecord input) {
    this.stateLock.readLock().lock();
    try {
      if (this.state != State.RUNNING) {
        this.errorListener.onError(this.path, "Record written after close, dropped", null);
        return;
      }

      this.handoff.put(input);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      this.errorListener.onError(this.path, "Interrupted while queueing, record dropped", e);
    } finally {
      this.stateLock.readLock().unlock();
    }
  }

  /** {@inheritDoc}. */
  @Override
  public void rotate() {
    if (this.state != State.RUNNING) {
      this.errorListener.onError(this.path, "Rotation requested after close, ignored", null);
      return;
    }

    this.writerLoop.requestRotation();
  }

  /** {@inheritDoc}. */
  @Override
  public void close() {
    this.stateLock.writeLock().lock();
    try {
      if (this.state != State.RUNNING) {
        this.errorListener.onError(this.path, "Closed more than once", null);
        return;
      }
      this.state = State.DRAINING;
    } finally {
      this.stateLock.writeLock().unlock();
    }

    this.handoff.cancel();
    this.writerLoop.cancel();

    final boolean interrupted = awaitExit(this.relay) | awaitExit(this.writer);

    // Both tasks are gone, the queue and the file now belong to this thread.
    for (final LogRecord record : this.handoff.drain()) {
      this.writerLoop.write(record, false);
    }
    this.writerLoop.close();

    this.state = State.CLOSED;

    if (this.ownsExecutor) {
      this.executor.shutdown();
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** VisibleForTesting. */
  State getState() {
    return this.state;
  }

  /**
   * Wait for a background task to return, even when interrupted.
   *
   * @return Whether the calling thread was interrupted while waiting.
   */
  private boolean awaitExit(final Future<?> task) {
    boolean interrupted = false;

    while (true) {
      try {
        task.get();
        return interrupted;
      } catch (final InterruptedException e) {
        interrupted = true;
      } catch (final ExecutionException e) {
        this.errorListener.onError(this.path, "Background task failed", e.getCause());
        return interrupted;
      }
    }
  }

  private static ExecutorService newExecutor(final Path path) {
    final String name = "filelog-" + WRITER_COUNT.incrementAndGet() + "-" + path.getFileName();
    final AtomicInteger threadIndex = new AtomicInteger();
    final ThreadFactory threadFactory =
        runnable -> {
          final Thread thread = new Thread(runnable, name + "-" + threadIndex.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(2, threadFactory);
  }
}
