package jfhall.filelog;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PatternRecordFormatterTest {
  private static final LogRecord RECORD =
      LogRecord.builder()
          .level(Level.WARNING)
          .created(Instant.parse("2022-01-01T04:57:53.868486Z"))
          .source("server/conn/handler.go:81")
          .message("connection reset")
          .build();

  private final PatternRecordFormatter formatter = new PatternRecordFormatter(ZoneOffset.UTC);

  @Test
  public void testDefaultFormat() {
    Assertions.assertEquals(
        "[2022/01/01 04:57:53] [WARN] (server/conn/handler.go:81) connection reset\n",
        this.formatter.format(WriterConfig.DEFAULT_FORMAT, RECORD));
  }

  @Test
  public void testShortForms() {
    Assertions.assertEquals(
        "01/01/22 04:57 handler.go:81\n", this.formatter.format("%d %t %s", RECORD));
  }

  @Test
  public void testPercentAndUnknownDirectives() {
    Assertions.assertEquals("100% %q done %\n", this.formatter.format("100%% %q done %", RECORD));
  }

  @Test
  public void testEmptyTemplateRendersNothing() {
    Assertions.assertEquals("", this.formatter.format("", RECORD));
  }

  @Test
  public void testStampOnlyRecord() {
    final LogRecord stamp = LogRecord.stamp(Instant.parse("2022-06-30T23:00:00Z"));

    Assertions.assertEquals(
        "<log created=\"2022/06/30 23:00:00\" level=\"\">\n",
        this.formatter.format("<log created=\"%D %T\" level=\"%L\">", stamp));
  }

  @Test
  public void testZoneIsApplied() {
    final PatternRecordFormatter tokyo =
        new PatternRecordFormatter(ZoneId.of("Asia/Tokyo"));

    Assertions.assertEquals("2022/01/01 13:57:53\n", tokyo.format("%D %T", RECORD));
  }
}
