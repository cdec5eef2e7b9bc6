package org.dsnp.herald.write;

public class BatchException extends RuntimeException {
  private static final long serialVersionUID = 4718409356628120934L;

  public BatchException(String message) {
    super(message);
  }
}
