package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.SIGNATURE;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An announcement together with the signature produced over its canonical serialization.
 */
public final class SignedAnnouncement {
  private final Announcement announcement;
  private final String signature;

  public SignedAnnouncement(Announcement announcement, String signature) {
    this.announcement = Objects.requireNonNull(announcement, "The announcement cannot be null");
    this.signature = Objects.requireNonNull(signature, "The signature cannot be null");
  }

  public Announcement getAnnouncement() {
    return announcement;
  }

  public String getSignature() {
    return signature;
  }

  public AnnouncementType getAnnouncementType() {
    return announcement.getAnnouncementType();
  }

  /**
   * @return The announcement fields plus the {@code signature} field, sorted by name.
   */
  public SortedMap<String, Object> toFields() {
    SortedMap<String, Object> fields = new TreeMap<>(announcement.toFields());
    fields.put(SIGNATURE, signature);
    return Collections.unmodifiableSortedMap(fields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SignedAnnouncement that = (SignedAnnouncement) o;
    return announcement.equals(that.announcement) && signature.equals(that.signature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(announcement, signature);
  }

  @Override
  public String toString() {
    return "SignedAnnouncement{" +
        "announcement=" + announcement +
        ", signature='" + signature + '\'' +
        '}';
  }
}
