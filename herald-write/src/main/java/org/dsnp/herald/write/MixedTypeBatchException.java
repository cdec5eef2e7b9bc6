package org.dsnp.herald.write;

import org.dsnp.herald.announcement.AnnouncementType;

/**
 * Thrown when an announcement's type differs from the type of the first announcement of the batch.
 */
public class MixedTypeBatchException extends BatchException {
  private static final long serialVersionUID = 8873024413452264507L;
  private final AnnouncementType expected;
  private final AnnouncementType actual;
  private final long index;

  public MixedTypeBatchException(AnnouncementType expected, AnnouncementType actual, long index) {
    super("Batches must hold a single announcement type, expected " + expected + " but found " + actual + " at index " + index);
    this.expected = expected;
    this.actual = actual;
    this.index = index;
  }

  public AnnouncementType getExpected() {
    return expected;
  }

  public AnnouncementType getActual() {
    return actual;
  }

  /**
   * @return Zero based position of the offending announcement in the input.
   */
  public long getIndex() {
    return index;
  }
}
