package jfhall.filelog;

/**
 * An abstraction for the mechanism used to render a {@link LogRecord} through a template into the
 * text that is written to the destination. Headers and footers go through the same formatter, so
 * they may use the same placeholders as regular records.
 */
@FunctionalInterface
public interface RecordFormatter {
  String format(String template, LogRecord record);
}
