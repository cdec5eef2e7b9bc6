package org.dsnp.herald.schema;

/**
 * Thrown when an announcement type has no batch schema, such as tombstones or unknown type codes.
 */
public class UnsupportedAnnouncementTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 2915731360441985716L;
  private final int dsnpType;

  public UnsupportedAnnouncementTypeException(int dsnpType) {
    super("No batch schema exists for announcement type " + dsnpType);
    this.dsnpType = dsnpType;
  }

  public int getDsnpType() {
    return dsnpType;
  }
}
