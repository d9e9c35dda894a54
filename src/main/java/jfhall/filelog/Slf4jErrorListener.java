package jfhall.filelog;

import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** The default {@link ErrorListener}, reporting every failure at error level. */
@Slf4j
public class Slf4jErrorListener implements ErrorListener {
  @Override
  public void onError(final Path path, final String message, final Throwable cause) {
    if (cause == null) {
      log.error("FileLogWriter({}): {}", path, message);
    } else {
      log.error("FileLogWriter({}): {}", path, message, cause);
    }
  }
}
