package org.dsnp.herald.signing;

/**
 * Permissions a signing identity can hold over a user id.
 */
public enum Permission {
  NONE(0),
  ANNOUNCE(1),
  OWNERSHIP_TRANSFER(2),
  DELEGATE_ADD(3),
  DELEGATE_REMOVE(4);

  private final int code;

  Permission(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }
}
