package org.dsnp.herald.row;

import java.util.Map;
import org.dsnp.herald.announcement.AnnouncementValidator;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.schema.BatchColumn;
import org.dsnp.herald.schema.BatchSchema;

/**
 * Maps signed announcements onto rows of a batch schema and back.
 */
public final class RowCodec {

  /**
   * @return The values of the announcement in schema order, coerced to their column types.
   *
   * @throws IllegalArgumentException If the announcement lacks a column of the schema.
   */
  public static Object[] toValues(BatchSchema schema, SignedAnnouncement announcement) {
    Map<String, Object> fields = announcement.toFields();
    Object[] values = new Object[schema.size()];
    for (int i = 0; i < schema.size(); i++) {
      BatchColumn column = schema.getColumn(i);
      Object value = fields.get(column.getName());
      if (value == null)
        throw new IllegalArgumentException("The announcement " + announcement + " has no value for column " + column.getName());
      values[i] = column.getType().coerce(value);
    }
    return values;
  }

  public static BatchRow toRow(BatchSchema schema, SignedAnnouncement announcement) {
    return new BatchRow(schema, toValues(schema, announcement));
  }

  /**
   * Rebuilds the signed announcement a row was written from. The row is validated as any other untyped record.
   */
  public static SignedAnnouncement toSignedAnnouncement(BatchRow row) {
    return AnnouncementValidator.validateSigned(row.toMap());
  }

  private RowCodec() {}
}
