package jfhall.filelog;

import java.nio.file.Path;
import jfhall.filelog.impl.FileLogWriter;

public class SimpleLoggerFactory {
  public static final String XML_FORMAT =
      "\t<record level=\"%L\">\n"
          + "\t\t<timestamp>%D %T</timestamp>\n"
          + "\t\t<source>%S</source>\n"
          + "\t\t<message>%M</message>\n"
          + "\t</record>";
  public static final String XML_HEADER = "<log created=\"%D %T\">";
  public static final String XML_FOOTER = "</log>";

  /**
   * @param path The file to write the log records to.
   * @param config How to format records and when to rotate the file.
   * @return A logger that has to be closed once, when the application is done logging.
   */
  public static SimpleLogger<LogRecord> createFileLogger(
      final Path path, final WriterConfig config) {
    return new FileLogWriter(path, config);
  }

  /**
   * A file logger with the default record format and no rotation thresholds.
   *
   * @param path The file to write the log records to.
   * @param retainOldFiles Whether files retired by {@link SimpleLogger#rotate()} are kept as
   *     dated archives.
   */
  public static SimpleLogger<LogRecord> createFileLogger(
      final Path path, final boolean retainOldFiles) {
    return createFileLogger(path, WriterConfig.builder().retainOldFiles(retainOldFiles).build());
  }

  /**
   * A file logger writing every record as an XML element, each file wrapped in a {@code log}
   * element.
   *
   * @param path The file to write the log records to.
   * @param retainOldFiles Whether retired files are kept as dated archives.
   */
  public static SimpleLogger<LogRecord> createXmlLogger(
      final Path path, final boolean retainOldFiles) {
    return createFileLogger(path, xmlConfig().retainOldFiles(retainOldFiles).build());
  }

  /** A config builder preset with the XML record format, header and footer. */
  public static WriterConfig.WriterConfigBuilder xmlConfig() {
    return WriterConfig.builder().format(XML_FORMAT).headFoot(XML_HEADER, XML_FOOTER);
  }
}
