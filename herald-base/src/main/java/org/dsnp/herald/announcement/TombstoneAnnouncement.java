package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.CREATED_AT;
import static org.dsnp.herald.Constants.TARGET_ANNOUNCEMENT_TYPE;
import static org.dsnp.herald.Constants.TARGET_SIGNATURE;

import java.util.Map;

/**
 * Retracts an earlier broadcast, reply or reaction identified by its signature.
 */
public final class TombstoneAnnouncement extends Announcement {
  private final long createdAt;
  private final AnnouncementType targetAnnouncementType;
  private final String targetSignature;

  TombstoneAnnouncement(String fromId, long createdAt, AnnouncementType targetAnnouncementType, String targetSignature) {
    super(fromId);
    this.createdAt = createdAt;
    this.targetAnnouncementType = targetAnnouncementType;
    this.targetSignature = targetSignature;
  }

  @Override
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.TOMBSTONE;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public AnnouncementType getTargetAnnouncementType() {
    return targetAnnouncementType;
  }

  public String getTargetSignature() {
    return targetSignature;
  }

  @Override
  void addFields(Map<String, Object> fields) {
    fields.put(CREATED_AT, createdAt);
    fields.put(TARGET_ANNOUNCEMENT_TYPE, targetAnnouncementType.getCode());
    fields.put(TARGET_SIGNATURE, targetSignature);
  }
}
