package jfhall.filelog;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A {@link RecordFormatter} expanding {@code %} placeholders:
 *
 * <ul>
 *   <li>{@code %T} time as {@code HH:mm:ss}, {@code %t} time as {@code HH:mm}
 *   <li>{@code %D} date as {@code yyyy/MM/dd}, {@code %d} date as {@code MM/dd/yy}
 *   <li>{@code %L} level label
 *   <li>{@code %S} source, {@code %s} the part of the source after its last {@code /}
 *   <li>{@code %M} message
 *   <li>{@code %%} a literal percent sign
 * </ul>
 *
 * Unknown placeholders are copied verbatim. A non-empty template always renders with a trailing
 * line separator, an empty template renders as an empty string.
 */
public class PatternRecordFormatter implements RecordFormatter {
  private static final DateTimeFormatter LONG_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final DateTimeFormatter SHORT_TIME = DateTimeFormatter.ofPattern("HH:mm");
  private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");
  private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MM/dd/yy");

  private final ZoneId zoneId;

  /** @param zoneId The zone the record timestamps are rendered in. */
  public PatternRecordFormatter(final ZoneId zoneId) {
    this.zoneId = zoneId;
  }

  /** {@inheritDoc}. */
  @Override
  public String format(final String template, final LogRecord record) {
    if (template == null || template.isEmpty()) {
      return "";
    }

    final ZonedDateTime created = record.getCreated().atZone(this.zoneId);
    final StringBuilder out = new StringBuilder(template.length() + 64);

    for (int i = 0; i < template.length(); i++) {
      final char c = template.charAt(i);

      if (c != '%' || i + 1 == template.length()) {
        out.append(c);
        continue;
      }

      final char directive = template.charAt(++i);
      switch (directive) {
        case 'T':
          out.append(LONG_TIME.format(created));
          break;
        case 't':
          out.append(SHORT_TIME.format(created));
          break;
        case 'D':
          out.append(LONG_DATE.format(created));
          break;
        case 'd':
          out.append(SHORT_DATE.format(created));
          break;
        case 'L':
          out.append(record.getLevel() == null ? "" : record.getLevel().getLabel());
          break;
        case 'S':
          out.append(nullToEmpty(record.getSource()));
          break;
        case 's':
          out.append(shortSource(nullToEmpty(record.getSource())));
          break;
        case 'M':
          out.append(nullToEmpty(record.getMessage()));
          break;
        case '%':
          out.append('%');
          break;
        default:
          out.append('%').append(directive);
      }
    }

    return out.append('\n').toString();
  }

  private static String shortSource(final String source) {
    return source.substring(source.lastIndexOf('/') + 1);
  }

  private static String nullToEmpty(final String value) {
    return value == null ? "" : value;
  }
}
