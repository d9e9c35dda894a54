package jfhall.filelog;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** The reasons a file writer starts a new file session. */
@AllArgsConstructor
@Getter
public enum RotationTrigger {
  /** The first session, opened while the writer is being constructed. */
  OPEN(false),
  /** An explicit {@link SimpleLogger#rotate()} call. */
  REQUESTED(false),
  LINES(false),
  SIZE(false),
  /** The day of month changed since the session was opened. */
  DAILY(true),
  /** The hour of day changed since the session was opened. */
  HOURLY(true);

  /**
   * Whether the retired file belongs to the period that just ended. Archives for such triggers
   * are stamped one hour before the rotation moment.
   */
  private final boolean previousPeriod;
}
