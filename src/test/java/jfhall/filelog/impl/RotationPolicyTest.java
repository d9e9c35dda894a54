package jfhall.filelog.impl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import jfhall.filelog.RotationTrigger;
import jfhall.filelog.WriterConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RotationPolicyTest {
  private static final ZonedDateTime OPENED =
      ZonedDateTime.of(2022, 3, 1, 0, 30, 0, 0, ZoneOffset.UTC);
  private static final Path LOG = Paths.get("/var/log/app.log");

  @Test
  public void testNothingConfiguredNeverRotates() {
    final RotationPolicy policy = new RotationPolicy(WriterConfig.builder().build());
    final RotationState state = stateWith(1_000_000, 1_000_000_000L);

    Assertions.assertEquals(Optional.empty(), policy.evaluate(state, OPENED.plusDays(3)));
  }

  @Test
  public void testLinesAreCheckedBeforeBytes() {
    final RotationPolicy policy =
        new RotationPolicy(
            WriterConfig.builder().maxLines(3).maxBytes(10).rotateDaily(true).build());

    Assertions.assertEquals(
        Optional.of(RotationTrigger.LINES), policy.evaluate(stateWith(3, 100), OPENED.plusDays(1)));
    Assertions.assertEquals(
        Optional.of(RotationTrigger.SIZE), policy.evaluate(stateWith(2, 10), OPENED.plusDays(1)));
    Assertions.assertEquals(
        Optional.of(RotationTrigger.DAILY), policy.evaluate(stateWith(2, 9), OPENED.plusDays(1)));
    Assertions.assertEquals(Optional.empty(), policy.evaluate(stateWith(2, 9), OPENED));
  }

  @Test
  public void testDailyIsCheckedBeforeHourly() {
    final RotationPolicy policy =
        new RotationPolicy(WriterConfig.builder().rotateDaily(true).rotateHourly(true).build());

    Assertions.assertEquals(
        Optional.of(RotationTrigger.DAILY), policy.evaluate(stateWith(0, 0), OPENED.plusDays(1)));
    Assertions.assertEquals(
        Optional.of(RotationTrigger.HOURLY), policy.evaluate(stateWith(0, 0), OPENED.plusHours(1)));
    Assertions.assertEquals(
        Optional.empty(), policy.evaluate(stateWith(0, 0), OPENED.plusMinutes(29)));
  }

  @Test
  public void testArchiveNameUsesFirstFreeSequence() throws RotationException {
    final RotationPolicy policy = new RotationPolicy(WriterConfig.builder().build());
    final Set<Path> taken = new HashSet<>();
    taken.add(Paths.get("/var/log/app.log-2022-03-01-00+001"));
    taken.add(Paths.get("/var/log/app.log-2022-03-01-00+002"));

    Assertions.assertEquals(
        Paths.get("/var/log/app.log-2022-03-01-00+003"),
        policy.archivePath(LOG, OPENED, RotationTrigger.LINES, taken::contains));
  }

  @Test
  public void testTimeTriggersStampThePeriodThatEnded() throws RotationException {
    final RotationPolicy policy = new RotationPolicy(WriterConfig.builder().build());

    Assertions.assertEquals(
        Paths.get("/var/log/app.log-2022-02-28-23+001"),
        policy.archivePath(LOG, OPENED, RotationTrigger.DAILY, path -> false));
    Assertions.assertEquals(
        Paths.get("/var/log/app.log-2022-03-01-00+001"),
        policy.archivePath(LOG, OPENED, RotationTrigger.REQUESTED, path -> false));
  }

  @Test
  public void testExhaustedSequenceFails() {
    final RotationPolicy policy = new RotationPolicy(WriterConfig.builder().build());

    final RotationException e =
        Assertions.assertThrows(
            RotationException.class,
            () -> policy.archivePath(LOG, OPENED, RotationTrigger.SIZE, path -> true));
    Assertions.assertTrue(e.getMessage().contains("Cannot find free log number"));
  }

  private static RotationState stateWith(final int lines, final long bytes) {
    final RotationState state = new RotationState();
    state.reset(OPENED);
    // All bytes go to the last line.
    for (int i = 1; i < lines; i++) {
      state.recordWrite(0);
    }
    if (lines > 0) {
      state.recordWrite((int) bytes);
    }
    return state;
  }
}
