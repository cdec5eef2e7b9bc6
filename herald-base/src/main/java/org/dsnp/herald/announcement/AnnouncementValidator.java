package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.CHANGE_TYPE;
import static org.dsnp.herald.Constants.CONTENT_HASH;
import static org.dsnp.herald.Constants.CREATED_AT;
import static org.dsnp.herald.Constants.DSNP_TYPE;
import static org.dsnp.herald.Constants.EMOJI;
import static org.dsnp.herald.Constants.FROM_ID;
import static org.dsnp.herald.Constants.IN_REPLY_TO;
import static org.dsnp.herald.Constants.OBJECT_ID;
import static org.dsnp.herald.Constants.SIGNATURE;
import static org.dsnp.herald.Constants.TARGET_ANNOUNCEMENT_TYPE;
import static org.dsnp.herald.Constants.TARGET_SIGNATURE;
import static org.dsnp.herald.Constants.URL;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Structural validation of untyped announcement records, such as maps decoded from JSON or batch rows. Each
 * validator checks that the input is a record, that the discriminant matches, then every field in turn and fails
 * on the first bad field.
 */
public final class AnnouncementValidator {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Validates a record of any announcement type, dispatching on its {@code dsnpType}.
   *
   * @param obj The record to validate, expected to be a {@link Map} keyed by wire field names.
   *
   * @return The typed announcement.
   *
   * @throws UnknownAnnouncementTypeException If the discriminant is not a known announcement type.
   * @throws AnnouncementValidationException If the record or any of its fields is malformed.
   */
  public static Announcement validate(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    AnnouncementType type = requireAnnouncementType(record);
    switch (type) {
      case TOMBSTONE:
        return validateTombstone(record);
      case GRAPH_CHANGE:
        return validateGraphChange(record);
      case BROADCAST:
        return validateBroadcast(record);
      case REPLY:
        return validateReply(record);
      case REACTION:
        return validateReaction(record);
      case PROFILE:
        return validateProfile(record);
    }
    throw new UnknownAnnouncementTypeException(type);
  }

  /**
   * Re-validates an already typed announcement, for instance one built with {@link Announcements}.
   */
  public static Announcement validate(Announcement announcement) {
    return validate(announcement.toFields());
  }

  /**
   * Validates a JSON encoded announcement record.
   */
  public static Announcement validateJson(String json) {
    return validate(readJson(json));
  }

  /**
   * Validates a record that must carry a {@code signature} field in addition to the announcement fields. The
   * signature is checked before the payload.
   *
   * @param obj The record to validate.
   *
   * @return The typed signed announcement.
   */
  public static SignedAnnouncement validateSigned(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    Object signature = record.get(SIGNATURE);
    if (signature == null)
      throw new AnnouncementValidationException(SIGNATURE, "is required");
    if (!Identifiers.isSignature(signature))
      throw new AnnouncementValidationException(SIGNATURE, "must be 0x followed by " + Identifiers.SIGNATURE_HEX_LENGTH + " hex digits but was '" + signature + "'");
    return new SignedAnnouncement(validate(record), (String) signature);
  }

  public static SignedAnnouncement validateSigned(SignedAnnouncement signedAnnouncement) {
    return validateSigned(signedAnnouncement.toFields());
  }

  public static SignedAnnouncement validateSignedJson(String json) {
    return validateSigned(readJson(json));
  }

  public static boolean isAnnouncement(Object obj) {
    try {
      validate(obj);
      return true;
    } catch (AnnouncementValidationException ave) {
      return false;
    }
  }

  public static boolean isSignedAnnouncement(Object obj) {
    try {
      validateSigned(obj);
      return true;
    } catch (AnnouncementValidationException ave) {
      return false;
    }
  }

  public static GraphChangeAnnouncement validateGraphChange(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.GRAPH_CHANGE);
    String fromId = requireUserId(record, FROM_ID);
    int changeTypeCode = requireInt(record, CHANGE_TYPE);
    GraphChangeType changeType = GraphChangeType.fromCode(changeTypeCode);
    if (changeType == null)
      throw new AnnouncementValidationException(CHANGE_TYPE, "must be a graph change type but was " + changeTypeCode);
    String objectId = requireUserId(record, OBJECT_ID);
    long createdAt = requireTimestamp(record, CREATED_AT);
    return new GraphChangeAnnouncement(fromId, changeType, objectId, createdAt);
  }

  public static BroadcastAnnouncement validateBroadcast(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.BROADCAST);
    String fromId = requireUserId(record, FROM_ID);
    String url = requireUrl(record, URL);
    String contentHash = requireContentHash(record, CONTENT_HASH);
    return new BroadcastAnnouncement(fromId, url, contentHash);
  }

  public static ReplyAnnouncement validateReply(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.REPLY);
    String fromId = requireUserId(record, FROM_ID);
    String url = requireUrl(record, URL);
    String contentHash = requireContentHash(record, CONTENT_HASH);
    String inReplyTo = requireAnnouncementId(record, IN_REPLY_TO);
    return new ReplyAnnouncement(fromId, url, contentHash, inReplyTo);
  }

  public static ReactionAnnouncement validateReaction(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.REACTION);
    String fromId = requireUserId(record, FROM_ID);
    Object emoji = requirePresent(record, EMOJI);
    if (!Identifiers.isEmoji(emoji))
      throw new AnnouncementValidationException(EMOJI, "must only contain emoji code points but was '" + emoji + "'");
    String inReplyTo = requireAnnouncementId(record, IN_REPLY_TO);
    return new ReactionAnnouncement(fromId, (String) emoji, inReplyTo);
  }

  public static ProfileAnnouncement validateProfile(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.PROFILE);
    String fromId = requireUserId(record, FROM_ID);
    String url = requireUrl(record, URL);
    String contentHash = requireContentHash(record, CONTENT_HASH);
    return new ProfileAnnouncement(fromId, url, contentHash);
  }

  public static TombstoneAnnouncement validateTombstone(Object obj) {
    Map<?, ?> record = requireRecord(obj);
    requireType(record, AnnouncementType.TOMBSTONE);
    String fromId = requireUserId(record, FROM_ID);
    long createdAt = requireTimestamp(record, CREATED_AT);
    int targetCode = requireInt(record, TARGET_ANNOUNCEMENT_TYPE);
    AnnouncementType targetType = AnnouncementType.fromCode(targetCode);
    if (targetType == null || !targetType.isTombstoneTarget())
      throw new AnnouncementValidationException(TARGET_ANNOUNCEMENT_TYPE, "must be a broadcast, reply or reaction type but was " + targetCode);
    Object targetSignature = requirePresent(record, TARGET_SIGNATURE);
    if (!Identifiers.isSignature(targetSignature))
      throw new AnnouncementValidationException(TARGET_SIGNATURE, "must be 0x followed by " + Identifiers.SIGNATURE_HEX_LENGTH + " hex digits but was '" + targetSignature + "'");
    return new TombstoneAnnouncement(fromId, createdAt, targetType, (String) targetSignature);
  }

  private static Object readJson(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, Object.class);
    } catch (JsonProcessingException jpe) {
      throw new AnnouncementValidationException(null, "not well formed JSON", jpe);
    }
  }

  private static Map<?, ?> requireRecord(Object obj) {
    if (!(obj instanceof Map))
      throw new AnnouncementValidationException(null, "must be a structured record but was " + (obj == null ? "null" : obj.getClass().getSimpleName()));
    return (Map<?, ?>) obj;
  }

  private static AnnouncementType requireAnnouncementType(Map<?, ?> record) {
    Object value = requirePresent(record, DSNP_TYPE);
    if (!isIntegral(value))
      throw new UnknownAnnouncementTypeException(value);
    long code = ((Number) value).longValue();
    AnnouncementType type = code >= Integer.MIN_VALUE && code <= Integer.MAX_VALUE ? AnnouncementType.fromCode((int) code) : null;
    if (type == null)
      throw new UnknownAnnouncementTypeException(value);
    return type;
  }

  private static void requireType(Map<?, ?> record, AnnouncementType expected) {
    Object value = requirePresent(record, DSNP_TYPE);
    if (!isIntegral(value) || ((Number) value).longValue() != expected.getCode())
      throw new AnnouncementValidationException(DSNP_TYPE, "expected " + expected.getCode() + " (" + expected + ") but was " + value);
  }

  private static Object requirePresent(Map<?, ?> record, String field) {
    Object value = record.get(field);
    if (value == null)
      throw new AnnouncementValidationException(field, "is required");
    return value;
  }

  private static String requireUserId(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!Identifiers.isUserId(value))
      throw new AnnouncementValidationException(field, "must be a DSNP user id but was '" + value + "'");
    return (String) value;
  }

  private static String requireUrl(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!(value instanceof String) || ((String) value).isEmpty())
      throw new AnnouncementValidationException(field, "must be a non empty string");
    return (String) value;
  }

  private static String requireContentHash(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!Identifiers.isContentHash(value))
      throw new AnnouncementValidationException(field, "must be " + Identifiers.CONTENT_HASH_HEX_LENGTH + " hex digits but was '" + value + "'");
    return (String) value;
  }

  private static String requireAnnouncementId(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!Identifiers.isAnnouncementId(value))
      throw new AnnouncementValidationException(field, "must be a DSNP announcement id but was '" + value + "'");
    return (String) value;
  }

  private static int requireInt(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!isIntegral(value))
      throw new AnnouncementValidationException(field, "must be an integer but was '" + value + "'");
    long longValue = ((Number) value).longValue();
    if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE)
      throw new AnnouncementValidationException(field, "is out of range: " + value);
    return (int) longValue;
  }

  private static long requireTimestamp(Map<?, ?> record, String field) {
    Object value = requirePresent(record, field);
    if (!isIntegral(value))
      throw new AnnouncementValidationException(field, "must be a numeric timestamp but was '" + value + "'");
    long timestamp = ((Number) value).longValue();
    if (timestamp < 0)
      throw new AnnouncementValidationException(field, "must not be negative but was " + timestamp);
    return timestamp;
  }

  // BigInteger and floating point values are rejected, JSON numbers that fit a long decode as Integer or Long.
  private static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
  }

  private AnnouncementValidator() {}
}
