package org.dsnp.herald.signing;

public interface PermissionResolver {
  /**
   * @param identity The identity recovered from a signature.
   * @param fromId The user id the announcement claims to come from.
   * @param permission The permission that is required.
   *
   * @return {@code true} if the identity holds the permission for the user id.
   */
  boolean isAuthorized(String identity, String fromId, Permission permission);
}
