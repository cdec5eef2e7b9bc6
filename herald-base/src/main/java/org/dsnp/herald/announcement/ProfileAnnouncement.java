package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.CONTENT_HASH;
import static org.dsnp.herald.Constants.URL;

import java.util.Map;

public final class ProfileAnnouncement extends Announcement {
  private final String url;
  private final String contentHash;

  ProfileAnnouncement(String fromId, String url, String contentHash) {
    super(fromId);
    this.url = url;
    this.contentHash = contentHash;
  }

  @Override
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.PROFILE;
  }

  public String getUrl() {
    return url;
  }

  public String getContentHash() {
    return contentHash;
  }

  @Override
  void addFields(Map<String, Object> fields) {
    fields.put(URL, url);
    fields.put(CONTENT_HASH, contentHash);
  }
}
