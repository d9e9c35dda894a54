package jfhall.filelog.impl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Predicate;
import jfhall.filelog.RotationTrigger;
import jfhall.filelog.WriterConfig;

/** Decides when the current file has to be retired and what the retired file is renamed to. */
class RotationPolicy {
  static final int MAX_ARCHIVE_SEQUENCE = 999;

  private final WriterConfig config;

  RotationPolicy(final WriterConfig config) {
    this.config = config;
  }

  /**
   * Check the thresholds in a fixed order, lines, bytes, day and then hour, returning the first
   * one crossed.
   *
   * @param state The counters of the current session.
   * @param now The moment the next record is about to be written.
   * @return The trigger to rotate for, or empty to keep writing to the current file.
   */
  Optional<RotationTrigger> evaluate(final RotationState state, final ZonedDateTime now) {
    if (this.config.getMaxLines() > 0 && state.getLines() >= this.config.getMaxLines()) {
      return Optional.of(RotationTrigger.LINES);
    }
    if (this.config.getMaxBytes() > 0 && state.getBytes() >= this.config.getMaxBytes()) {
      return Optional.of(RotationTrigger.SIZE);
    }
    if (this.config.isRotateDaily() && now.getDayOfMonth() != state.getOpenDay()) {
      return Optional.of(RotationTrigger.DAILY);
    }
    if (this.config.isRotateHourly() && now.getHour() != state.getOpenHour()) {
      return Optional.of(RotationTrigger.HOURLY);
    }
    return Optional.empty();
  }

  /**
   * Find the first free archive name for the file at {@code path}.
   *
   * @param path The primary file about to be retired.
   * @param now The rotation moment.
   * @param trigger Why the file is retired, time based triggers stamp the previous hour.
   * @param exists Tells whether a candidate name is already taken.
   * @return A path named {@code {path}-{yyyy}-{MM}-{dd}-{HH}+{seq}} that does not exist yet.
   * @throws RotationException If all {@value #MAX_ARCHIVE_SEQUENCE} sequence numbers are taken.
   */
  Path archivePath(
      final Path path,
      final ZonedDateTime now,
      final RotationTrigger trigger,
      final Predicate<Path> exists)
      throws RotationException {
    final ZonedDateTime stamp = trigger.isPreviousPeriod() ? now.minus(1, ChronoUnit.HOURS) : now;

    for (int seq = 1; seq <= MAX_ARCHIVE_SEQUENCE; seq++) {
      final Path candidate = Paths.get(archiveName(path.toString(), stamp, seq));
      if (!exists.test(candidate)) {
        return candidate;
      }
    }

    throw new RotationException("Cannot find free log number to rename " + path);
  }

  static String archiveName(final String path, final ZonedDateTime stamp, final int seq) {
    return String.format(
        "%s-%d-%02d-%02d-%02d+%03d",
        path, stamp.getYear(), stamp.getMonthValue(), stamp.getDayOfMonth(), stamp.getHour(), seq);
  }
}
