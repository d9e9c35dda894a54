package jfhall.filelog;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Severity of a {@link LogRecord}, ordered from least to most severe. */
@AllArgsConstructor
@Getter
public enum Level {
  FINEST("FNST"),
  FINE("FINE"),
  DEBUG("DEBG"),
  TRACE("TRAC"),
  INFO("INFO"),
  WARNING("WARN"),
  ERROR("EROR"),
  CRITICAL("CRIT");

  /** The four letter label rendered by the {@code %L} placeholder. */
  private final String label;
}
