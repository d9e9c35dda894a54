package jfhall.filelog.impl;

import java.io.IOException;

/** The retiring file could not be moved to an archive name. */
public class RotationException extends IOException {
  private static final long serialVersionUID = 1L;

  public RotationException(final String message) {
    super(message);
  }

  public RotationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
