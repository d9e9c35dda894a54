package jfhall.filelog.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Carries entries from any number of producers to a single consumer in submission order.
 *
 * <p>Producers put into a bounded entry queue. The relay, run as a {@link Runnable} on its own
 * thread, does nothing but wait for entries and move them to the back of an unbounded overflow
 * deque, so admission never waits on the consumer. The consumer takes from the front of the deque.
 * Producers therefore only wait while the entry queue is full and the relay has not caught up,
 * regardless of how slow the consumer is.
 *
 * <p>{@link #drain()} may only be called once the relay has returned from {@link #run()}.
 *
 * @param <T> The type of the entries.
 */
class HandoffQueue<T> implements Runnable {
  static final long RELAY_POLL_MILLIS = 10;

  private final BlockingQueue<T> entries;
  private final Deque<T> overflow = new ArrayDeque<>();
  private final Lock lock = new ReentrantLock();
  private final Condition notEmpty = this.lock.newCondition();

  private volatile boolean cancelled;

  /** @param capacity How many entries may wait for the relay before {@link #put} blocks. */
  HandoffQueue(final int capacity) {
    this.entries = new ArrayBlockingQueue<>(capacity);
  }

  /** Submit an entry, waiting only while the entry queue is full. */
  void put(final T entry) throws InterruptedException {
    this.entries.put(entry);
  }

  /**
   * Take the oldest entry the relay has moved over.
   *
   * @return The entry, or null if none arrived within the timeout.
   */
  T poll(final long timeout, final TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);

    this.lock.lockInterruptibly();
    try {
      while (this.overflow.isEmpty()) {
        if (nanos <= 0) {
          return null;
        }
        nanos = this.notEmpty.awaitNanos(nanos);
      }
      return this.overflow.pollFirst();
    } finally {
      this.lock.unlock();
    }
  }

  /** Ask the relay to stop. Entries nobody took stay queued for {@link #drain()}. */
  void cancel() {
    this.cancelled = true;
  }

  @Override
  public void run() {
    final List<T> batch = new ArrayList<>();

    try {
      while (!this.cancelled) {
        final T entry = this.entries.poll(RELAY_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (entry == null) {
          continue;
        }

        batch.add(entry);
        this.entries.drainTo(batch);
        append(batch);
        batch.clear();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Remove every entry the consumer has not taken yet: the overflow first, then the entry queue.
   *
   * @return The remaining entries in submission order.
   */
  List<T> drain() {
    final List<T> remaining;

    this.lock.lock();
    try {
      remaining = new ArrayList<>(this.overflow);
      this.overflow.clear();
    } finally {
      this.lock.unlock();
    }

    this.entries.drainTo(remaining);
    return remaining;
  }

  private void append(final List<T> batch) {
    this.lock.lock();
    try {
      this.overflow.addAll(batch);
      this.notEmpty.signal();
    } finally {
      this.lock.unlock();
    }
  }
}
