package org.dsnp.herald.announcement;

public enum GraphChangeType {
  UNFOLLOW(0),
  FOLLOW(1);

  private final int code;

  GraphChangeType(int code) {
    this.code = code;
  }

  public static GraphChangeType fromCode(int code) {
    for (GraphChangeType type : GraphChangeType.values()) {
      if (type.code == code)
        return type;
    }
    return null;
  }

  public int getCode() {
    return code;
  }
}
