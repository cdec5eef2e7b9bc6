package org.dsnp.herald.announcement;

/**
 * Thrown when an announcement fails structural validation. The offending field is available so that callers can
 * tell a malformed field apart from a record of the wrong variant.
 */
public class AnnouncementValidationException extends RuntimeException {
  private static final long serialVersionUID = -3304513735932818475L;
  private final String field;

  public AnnouncementValidationException(String field, String reason) {
    super(buildMessage(field, reason));
    this.field = field;
  }

  public AnnouncementValidationException(String field, String reason, Throwable cause) {
    super(buildMessage(field, reason), cause);
    this.field = field;
  }

  /**
   * @return The wire name of the field that failed, or {@code null} if the record as a whole was rejected.
   */
  public String getField() {
    return field;
  }

  private static String buildMessage(String field, String reason) {
    if (field == null)
      return "Invalid announcement: " + reason;
    return "Invalid announcement field '" + field + "': " + reason;
  }
}
