package org.dsnp.herald.announcement;

import static org.dsnp.herald.Constants.DSNP_TYPE;
import static org.dsnp.herald.Constants.FROM_ID;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Base of the announcement variants. The set of subclasses is closed, every variant lives in this package
 * and is final. Values are immutable once built.
 */
public abstract class Announcement {
  private final String fromId;

  Announcement(String fromId) {
    this.fromId = fromId;
  }

  public abstract AnnouncementType getAnnouncementType();

  /**
   * Adds the variant specific fields, keyed by their wire names.
   */
  abstract void addFields(Map<String, Object> fields);

  public int getDsnpType() {
    return getAnnouncementType().getCode();
  }

  public String getFromId() {
    return fromId;
  }

  /**
   * Returns the announcement as a flat map of wire field names to values, sorted by field name. The discriminant
   * is included as {@code dsnpType}. Integral fields are {@link Integer} except timestamps which are {@link Long}.
   *
   * @return An unmodifiable sorted view of the fields.
   */
  public SortedMap<String, Object> toFields() {
    SortedMap<String, Object> fields = new TreeMap<>();
    fields.put(DSNP_TYPE, getDsnpType());
    fields.put(FROM_ID, fromId);
    addFields(fields);
    return Collections.unmodifiableSortedMap(fields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Announcement that = (Announcement) o;
    return Objects.equals(toFields(), that.toFields());
  }

  @Override
  public int hashCode() {
    return toFields().hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + toFields();
  }
}
