package jfhall.filelog;

/**
 * The core interface for this library, used for logging a specific type of message to a specific
 * destination.
 *
 * <p>Implementations accept input from any number of threads. {@link #close()} must be called
 * exactly once, after which no further input is accepted.
 *
 * @param <T> The type of the object to be logged.
 */
public interface SimpleLogger<T> extends AutoCloseable {
  /** Submit an entry. Never fails towards the caller; problems go to the error listener. */
  void write(T input);

  /** Ask for the destination to be rotated. Returns without waiting for the rotation. */
  void rotate();

  /** Write everything accepted so far and release the destination. Blocks until done. */
  @Override
  void close();
}
