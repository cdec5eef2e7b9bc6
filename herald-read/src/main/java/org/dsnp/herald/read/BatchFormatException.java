package org.dsnp.herald.read;

/**
 * Thrown when a batch file is truncated, has a bad magic header or an unknown layout.
 */
public class BatchFormatException extends RuntimeException {
  private static final long serialVersionUID = -7745029914170932351L;

  public BatchFormatException(String message) {
    super(message);
  }

  public BatchFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
