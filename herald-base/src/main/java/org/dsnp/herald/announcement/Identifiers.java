package org.dsnp.herald.announcement;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Format checks for the identifier and hash strings carried by announcements.
 */
public final class Identifiers {
  public final static String ANNOUNCEMENT_ID_SCHEME = "dsnp://";
  public final static String HEX_PREFIX = "0x";
  public final static int CONTENT_HASH_HEX_LENGTH = 64;
  public final static int SIGNATURE_HEX_LENGTH = 130;

  private static final Pattern DECIMAL_USER_ID = Pattern.compile("0|[1-9][0-9]{0,19}");
  private static final Pattern HEX_USER_ID = Pattern.compile("0x[0-9a-fA-F]{1,16}");
  private static final Pattern CONTENT_HASH = Pattern.compile("(0x)?[0-9a-fA-F]{" + CONTENT_HASH_HEX_LENGTH + "}");
  private static final Pattern SIGNATURE = Pattern.compile("0x[0-9a-fA-F]{" + SIGNATURE_HEX_LENGTH + "}");
  private static final Pattern ANNOUNCEMENT_ID = Pattern.compile(
      "dsnp://0x[0-9a-fA-F]{1,16}/0x[0-9a-fA-F]{" + CONTENT_HASH_HEX_LENGTH + "}");

  /**
   * A user id is either decimal or {@code 0x} prefixed hex and must fit an unsigned 64 bit integer.
   */
  public static boolean isUserId(Object obj) {
    if (!(obj instanceof String))
      return false;
    String value = (String) obj;
    if (HEX_USER_ID.matcher(value).matches())
      return true;
    if (!DECIMAL_USER_ID.matcher(value).matches())
      return false;
    try {
      Long.parseUnsignedLong(value);
      return true;
    } catch (NumberFormatException nfe) {
      return false;
    }
  }

  public static boolean isContentHash(Object obj) {
    return obj instanceof String && CONTENT_HASH.matcher((String) obj).matches();
  }

  public static boolean isSignature(Object obj) {
    return obj instanceof String && SIGNATURE.matcher((String) obj).matches();
  }

  /**
   * An announcement id has the form {@code dsnp://<user id as hex>/<0x + 64 hex digits>}.
   */
  public static boolean isAnnouncementId(Object obj) {
    return obj instanceof String && ANNOUNCEMENT_ID.matcher((String) obj).matches();
  }

  /**
   * Every code point must fall in the general punctuation through misc symbols block, the private use and
   * presentation forms area or the supplementary emoji planes.
   */
  public static boolean isEmoji(Object obj) {
    if (!(obj instanceof String))
      return false;
    String value = (String) obj;
    if (value.isEmpty())
      return false;
    return value.codePoints().allMatch(cp ->
        (cp >= 0x2000 && cp <= 0x2BFF) ||
        (cp >= 0xE000 && cp <= 0xFFFF) ||
        (cp >= 0x1F000 && cp <= 0x10FFFF));
  }

  /**
   * Converts a user id into its {@code 0x} hex form.
   *
   * @param userId A valid user id in decimal or hex form.
   *
   * @return The lower case hex form without leading zeros.
   */
  public static String toHexUserId(String userId) {
    if (!isUserId(userId))
      throw new IllegalArgumentException("Not a valid user id: " + userId);
    long value;
    if (userId.startsWith(HEX_PREFIX))
      value = Long.parseUnsignedLong(userId.substring(2), 16);
    else
      value = Long.parseUnsignedLong(userId);
    return HEX_PREFIX + Long.toHexString(value);
  }

  /**
   * Builds the id other announcements use to reference an announcement.
   *
   * @param userId The author's user id.
   * @param hash A 32 byte hash as hex, with or without the {@code 0x} prefix.
   *
   * @return The announcement id.
   */
  public static String buildAnnouncementId(String userId, String hash) {
    if (!isContentHash(hash))
      throw new IllegalArgumentException("Not a valid hash: " + hash);
    return ANNOUNCEMENT_ID_SCHEME + toHexUserId(userId) + "/" + HEX_PREFIX + normalizeHex(hash);
  }

  /**
   * Strips an optional {@code 0x} prefix and lower cases the digits.
   */
  public static String normalizeHex(String hex) {
    String digits = hex.startsWith(HEX_PREFIX) ? hex.substring(HEX_PREFIX.length()) : hex;
    return digits.toLowerCase(Locale.ROOT);
  }

  private Identifiers() {}
}
