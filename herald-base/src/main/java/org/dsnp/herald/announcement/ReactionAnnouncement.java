package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.EMOJI;
import static org.dsnp.herald.Constants.IN_REPLY_TO;

import java.util.Map;

public final class ReactionAnnouncement extends Announcement {
  private final String emoji;
  private final String inReplyTo;

  ReactionAnnouncement(String fromId, String emoji, String inReplyTo) {
    super(fromId);
    this.emoji = emoji;
    this.inReplyTo = inReplyTo;
  }

  @Override
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.REACTION;
  }

  public String getEmoji() {
    return emoji;
  }

  public String getInReplyTo() {
    return inReplyTo;
  }

  @Override
  void addFields(Map<String, Object> fields) {
    fields.put(EMOJI, emoji);
    fields.put(IN_REPLY_TO, inReplyTo);
  }
}
