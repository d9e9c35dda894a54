package jfhall.filelog.impl;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A buffered output stream to one file, appending to whatever the file already holds. Not thread
 * safe: a session is only ever used by the thread that runs the writer loop.
 */
class FileSession {
  /** How the writer loop opens sessions, {@link #open} outside of tests. */
  @FunctionalInterface
  interface Opener {
    FileSession open(Path path, int bufferSize) throws IOException;
  }

  private final OutputStream file;
  private final BufferedOutputStream buffer;

  FileSession(final OutputStream file, final int bufferSize) {
    this.file = file;
    this.buffer = new BufferedOutputStream(file, bufferSize);
  }

  /**
   * Open the file, creating it if needed.
   *
   * @throws IOException If the file can not be opened for appending.
   */
  static FileSession open(final Path path, final int bufferSize) throws IOException {
    final OutputStream file =
        Files.newOutputStream(
            path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    return new FileSession(file, bufferSize);
  }

  /**
   * Buffer the text, UTF-8 encoded.
   *
   * @return The number of bytes written.
   */
  int write(final String text) throws IOException {
    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    this.buffer.write(bytes);
    return bytes.length;
  }

  void flush() throws IOException {
    this.buffer.flush();
  }

  /**
   * Write the trailer, flush and release the file. The file is released even if writing the
   * trailer or flushing fails, the first failure is rethrown afterwards.
   */
  void close(final String trailer) throws IOException {
    try {
      if (!trailer.isEmpty()) {
        write(trailer);
      }
      this.buffer.flush();
    } finally {
      this.file.close();
    }
  }
}
