package org.dsnp.herald.schema;

import static org.dsnp.herald.Constants.CHANGE_TYPE;
import static org.dsnp.herald.Constants.CONTENT_HASH;
import static org.dsnp.herald.Constants.CREATED_AT;
import static org.dsnp.herald.Constants.DSNP_TYPE;
import static org.dsnp.herald.Constants.EMOJI;
import static org.dsnp.herald.Constants.FROM_ID;
import static org.dsnp.herald.Constants.IN_REPLY_TO;
import static org.dsnp.herald.Constants.OBJECT_ID;
import static org.dsnp.herald.Constants.SIGNATURE;
import static org.dsnp.herald.Constants.URL;
import static org.dsnp.herald.schema.ColumnType.BYTE_ARRAY;
import static org.dsnp.herald.schema.ColumnType.INT32;
import static org.dsnp.herald.schema.ColumnType.INT64;

import com.google.common.collect.ImmutableMap;
import org.dsnp.herald.announcement.AnnouncementType;

/**
 * Maps each batchable announcement type to the columns of its batch file and the columns that carry bloom filters.
 * Columns are in field name order with {@code signature} last.
 */
public final class SchemaSelector {
  private static final ImmutableMap<AnnouncementType, BatchSchema> SCHEMAS = ImmutableMap.<AnnouncementType, BatchSchema>builder()
      .put(AnnouncementType.GRAPH_CHANGE, BatchSchema.of(
          BatchColumn.of(CHANGE_TYPE, INT32),
          BatchColumn.of(CREATED_AT, INT64),
          BatchColumn.of(DSNP_TYPE, INT32),
          BatchColumn.of(FROM_ID, BYTE_ARRAY),
          BatchColumn.of(OBJECT_ID, BYTE_ARRAY),
          BatchColumn.of(SIGNATURE, BYTE_ARRAY)))
      .put(AnnouncementType.BROADCAST, BatchSchema.of(
          BatchColumn.of(CONTENT_HASH, BYTE_ARRAY),
          BatchColumn.of(DSNP_TYPE, INT32),
          BatchColumn.of(FROM_ID, BYTE_ARRAY),
          BatchColumn.of(URL, BYTE_ARRAY),
          BatchColumn.of(SIGNATURE, BYTE_ARRAY)))
      .put(AnnouncementType.REPLY, BatchSchema.of(
          BatchColumn.of(CONTENT_HASH, BYTE_ARRAY),
          BatchColumn.of(DSNP_TYPE, INT32),
          BatchColumn.of(FROM_ID, BYTE_ARRAY),
          BatchColumn.of(IN_REPLY_TO, BYTE_ARRAY),
          BatchColumn.of(URL, BYTE_ARRAY),
          BatchColumn.of(SIGNATURE, BYTE_ARRAY)))
      .put(AnnouncementType.REACTION, BatchSchema.of(
          BatchColumn.of(DSNP_TYPE, INT32),
          BatchColumn.of(EMOJI, BYTE_ARRAY),
          BatchColumn.of(FROM_ID, BYTE_ARRAY),
          BatchColumn.of(IN_REPLY_TO, BYTE_ARRAY),
          BatchColumn.of(SIGNATURE, BYTE_ARRAY)))
      .put(AnnouncementType.PROFILE, BatchSchema.of(
          BatchColumn.of(CONTENT_HASH, BYTE_ARRAY),
          BatchColumn.of(DSNP_TYPE, INT32),
          BatchColumn.of(FROM_ID, BYTE_ARRAY),
          BatchColumn.of(URL, BYTE_ARRAY),
          BatchColumn.of(SIGNATURE, BYTE_ARRAY)))
      .build();

  private static final ImmutableMap<AnnouncementType, BloomFilterSpec> BLOOM_FILTERS = ImmutableMap.<AnnouncementType, BloomFilterSpec>builder()
      .put(AnnouncementType.GRAPH_CHANGE, BloomFilterSpec.of(FROM_ID))
      .put(AnnouncementType.BROADCAST, BloomFilterSpec.of(FROM_ID))
      .put(AnnouncementType.REPLY, BloomFilterSpec.of(FROM_ID, IN_REPLY_TO))
      .put(AnnouncementType.REACTION, BloomFilterSpec.of(EMOJI, FROM_ID, IN_REPLY_TO))
      .put(AnnouncementType.PROFILE, BloomFilterSpec.of(FROM_ID))
      .build();

  public static BatchSchema schemaFor(AnnouncementType type) {
    BatchSchema schema = type == null ? null : SCHEMAS.get(type);
    if (schema == null)
      throw new UnsupportedAnnouncementTypeException(type == null ? -1 : type.getCode());
    return schema;
  }

  public static BatchSchema schemaFor(int dsnpType) {
    return schemaFor(requireType(dsnpType));
  }

  public static BloomFilterSpec bloomFilterSpecFor(AnnouncementType type) {
    BloomFilterSpec spec = type == null ? null : BLOOM_FILTERS.get(type);
    if (spec == null)
      throw new UnsupportedAnnouncementTypeException(type == null ? -1 : type.getCode());
    return spec;
  }

  public static BloomFilterSpec bloomFilterSpecFor(int dsnpType) {
    return bloomFilterSpecFor(requireType(dsnpType));
  }

  private static AnnouncementType requireType(int dsnpType) {
    AnnouncementType type = AnnouncementType.fromCode(dsnpType);
    if (type == null)
      throw new UnsupportedAnnouncementTypeException(dsnpType);
    return type;
  }

  private SchemaSelector() {}
}
