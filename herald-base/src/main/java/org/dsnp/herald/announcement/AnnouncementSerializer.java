package org.dsnp.herald.announcement;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Produces the byte layout that signatures are computed over. Fields are sorted by name and concatenated as
 * {@code name + value} with no delimiters, numbers in decimal. Any change here invalidates every existing signature.
 */
public final class AnnouncementSerializer {

  public static String serialize(Announcement announcement) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Object> field : announcement.toFields().entrySet()) {
      sb.append(field.getKey());
      sb.append(field.getValue());
    }
    return sb.toString();
  }

  public static byte[] serializeToBytes(Announcement announcement) {
    return serialize(announcement).getBytes(StandardCharsets.UTF_8);
  }

  private AnnouncementSerializer() {}
}
