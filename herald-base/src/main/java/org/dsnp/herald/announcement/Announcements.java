package org.dsnp.herald.announcement;

import java.util.Objects;

/**
 * Factories for each announcement variant. Factories only reject nulls, use {@link AnnouncementValidator} to check
 * field formats.
 */
public final class Announcements {

  public static GraphChangeAnnouncement createGraphChange(String fromId, GraphChangeType changeType, String objectId, long createdAt) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(changeType, "changeType cannot be null");
    Objects.requireNonNull(objectId, "objectId cannot be null");
    return new GraphChangeAnnouncement(fromId, changeType, objectId, createdAt);
  }

  public static GraphChangeAnnouncement createFollowGraphChange(String fromId, String followeeId, long createdAt) {
    return createGraphChange(fromId, GraphChangeType.FOLLOW, followeeId, createdAt);
  }

  public static GraphChangeAnnouncement createUnfollowGraphChange(String fromId, String followeeId, long createdAt) {
    return createGraphChange(fromId, GraphChangeType.UNFOLLOW, followeeId, createdAt);
  }

  public static BroadcastAnnouncement createBroadcast(String fromId, String url, String contentHash) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(contentHash, "contentHash cannot be null");
    return new BroadcastAnnouncement(fromId, url, contentHash);
  }

  public static ReplyAnnouncement createReply(String fromId, String url, String contentHash, String inReplyTo) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(contentHash, "contentHash cannot be null");
    Objects.requireNonNull(inReplyTo, "inReplyTo cannot be null");
    return new ReplyAnnouncement(fromId, url, contentHash, inReplyTo);
  }

  public static ReactionAnnouncement createReaction(String fromId, String emoji, String inReplyTo) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(emoji, "emoji cannot be null");
    Objects.requireNonNull(inReplyTo, "inReplyTo cannot be null");
    return new ReactionAnnouncement(fromId, emoji, inReplyTo);
  }

  public static ProfileAnnouncement createProfile(String fromId, String url, String contentHash) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(contentHash, "contentHash cannot be null");
    return new ProfileAnnouncement(fromId, url, contentHash);
  }

  public static TombstoneAnnouncement createTombstone(String fromId, long createdAt, AnnouncementType targetAnnouncementType, String targetSignature) {
    Objects.requireNonNull(fromId, "fromId cannot be null");
    Objects.requireNonNull(targetAnnouncementType, "targetAnnouncementType cannot be null");
    Objects.requireNonNull(targetSignature, "targetSignature cannot be null");
    return new TombstoneAnnouncement(fromId, createdAt, targetAnnouncementType, targetSignature);
  }

  /**
   * Builds a tombstone retracting the given signed announcement.
   */
  public static TombstoneAnnouncement createTombstone(SignedAnnouncement target, long createdAt) {
    return createTombstone(target.getAnnouncement().getFromId(), createdAt, target.getAnnouncementType(), target.getSignature());
  }

  private Announcements() {}
}
