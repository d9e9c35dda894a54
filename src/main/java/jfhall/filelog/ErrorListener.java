package jfhall.filelog;

import java.nio.file.Path;

/**
 * Side channel for operational failures of a file writer. Failures are never thrown back to the
 * threads submitting records, they are handed to this listener instead.
 */
@FunctionalInterface
public interface ErrorListener {
  /**
   * @param path The primary file the writer is responsible for.
   * @param message What went wrong.
   * @param cause The underlying exception, may be null.
   */
  void onError(Path path, String message, Throwable cause);
}
