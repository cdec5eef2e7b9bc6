package org.dsnp.herald.write;

/**
 * Thrown when a batch is requested over an input with no announcements. Nothing is written to the store.
 */
public class EmptyBatchException extends BatchException {
  private static final long serialVersionUID = -2330188513187906233L;
  private final String key;

  public EmptyBatchException(String key) {
    super("Unable to create an empty batch at " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
