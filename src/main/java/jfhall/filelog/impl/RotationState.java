package jfhall.filelog.impl;

import java.time.ZonedDateTime;
import lombok.Getter;

/** Counters of the current file session. Only the writer loop thread touches these. */
@Getter
class RotationState {
  private long lines;
  private long bytes;
  private int openDay;
  private int openHour;

  /** Start counting for a session opened at {@code now}. */
  void reset(final ZonedDateTime now) {
    this.lines = 0;
    this.bytes = 0;
    this.openDay = now.getDayOfMonth();
    this.openHour = now.getHour();
  }

  void recordWrite(final int byteCount) {
    this.lines++;
    this.bytes += byteCount;
  }
}
