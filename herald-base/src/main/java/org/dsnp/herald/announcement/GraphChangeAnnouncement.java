package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.CHANGE_TYPE;
import static org.dsnp.herald.Constants.CREATED_AT;
import static org.dsnp.herald.Constants.OBJECT_ID;

import java.util.Map;

public final class GraphChangeAnnouncement extends Announcement {
  private final GraphChangeType changeType;
  private final String objectId;
  private final long createdAt;

  GraphChangeAnnouncement(String fromId, GraphChangeType changeType, String objectId, long createdAt) {
    super(fromId);
    this.changeType = changeType;
    this.objectId = objectId;
    this.createdAt = createdAt;
  }

  @Override
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.GRAPH_CHANGE;
  }

  public GraphChangeType getChangeType() {
    return changeType;
  }

  public String getObjectId() {
    return objectId;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  @Override
  void addFields(Map<String, Object> fields) {
    fields.put(CHANGE_TYPE, changeType.getCode());
    fields.put(OBJECT_ID, objectId);
    fields.put(CREATED_AT, createdAt);
  }
}
