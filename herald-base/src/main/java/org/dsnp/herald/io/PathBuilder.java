package org.dsnp.herald.io;

import org.dsnp.herald.Constants;

public class PathBuilder {

  /**
   * Joins non empty parts with the store delimiter, collapsing duplicate delimiters at the joins.
   */
  public static String buildPath(String... parts) {
    StringBuilder sb = new StringBuilder();
    for (String part : parts) {
      if (part == null || part.isEmpty())
        continue;
      String trimmed = part;
      if (sb.length() > 0) {
        while (trimmed.startsWith(Constants.STORE_DELIMETER))
          trimmed = trimmed.substring(1);
        if (trimmed.isEmpty())
          continue;
        sb.append(Constants.STORE_DELIMETER);
      }
      while (trimmed.endsWith(Constants.STORE_DELIMETER))
        trimmed = trimmed.substring(0, trimmed.length() - 1);
      sb.append(trimmed);
    }
    return sb.toString();
  }
}
