package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.CONTENT_HASH;
import static org.dsnp.herald.Constants.IN_REPLY_TO;
import static org.dsnp.herald.Constants.URL;

import java.util.Map;

public final class ReplyAnnouncement extends Announcement {
  private final String url;
  private final String contentHash;
  private final String inReplyTo;

  ReplyAnnouncement(String fromId, String url, String contentHash, String inReplyTo) {
    super(fromId);
    this.url = url;
    this.contentHash = contentHash;
    this.inReplyTo = inReplyTo;
  }

  @Override
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.REPLY;
  }

  public String getUrl() {
    return url;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getInReplyTo() {
    return inReplyTo;
  }

  @Override
  void addFields(Map<String, Object> fields) {
    fields.put(URL, url);
    fields.put(CONTENT_HASH, contentHash);
    fields.put(IN_REPLY_TO, inReplyTo);
  }
}
