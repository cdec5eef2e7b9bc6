package org.dsnp.herald.announcement;

/**
 * The closed set of announcement kinds. The code is the integer carried in the {@code dsnpType} field.
 */
public enum AnnouncementType {
  TOMBSTONE(0),
  GRAPH_CHANGE(1),
  BROADCAST(2),
  REPLY(3),
  REACTION(4),
  PROFILE(5);

  private final int code;

  AnnouncementType(int code) {
    this.code = code;
  }

  /**
   * @param code The discriminant value.
   *
   * @return The matching type or {@code null} if the code is not a known announcement type.
   */
  public static AnnouncementType fromCode(int code) {
    for (AnnouncementType type : AnnouncementType.values()) {
      if (type.code == code)
        return type;
    }
    return null;
  }

  public int getCode() {
    return code;
  }

  /**
   * Tombstones are never written into batch files.
   */
  public boolean isBatchable() {
    return this != TOMBSTONE;
  }

  /**
   * Only broadcasts, replies and reactions can be retracted with a tombstone.
   */
  public boolean isTombstoneTarget() {
    return this == BROADCAST || this == REPLY || this == REACTION;
  }
}
