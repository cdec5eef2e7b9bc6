package org.dsnp.herald.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.dsnp.herald.announcement.AnnouncementType;
import org.junit.jupiter.api.Test;

public class SchemaSelectorTest {

  @Test
  public void broadcastSchema() {
    BatchSchema schema = SchemaSelector.schemaFor(AnnouncementType.BROADCAST);
    assertEquals(ImmutableList.of("contentHash", "dsnpType", "fromId", "url", "signature"), schema.getColumnNames());
    assertEquals(ColumnType.INT32, schema.getColumn(schema.indexOf("dsnpType")).getType());
    assertEquals(ColumnType.BYTE_ARRAY, schema.getColumn(schema.indexOf("url")).getType());
    assertSame(schema, SchemaSelector.schemaFor(2));
  }

  @Test
  public void graphChangeSchema() {
    BatchSchema schema = SchemaSelector.schemaFor(AnnouncementType.GRAPH_CHANGE);
    assertEquals(BatchSchema.of(
        BatchColumn.of("changeType", ColumnType.INT32),
        BatchColumn.of("createdAt", ColumnType.INT64),
        BatchColumn.of("dsnpType", ColumnType.INT32),
        BatchColumn.of("fromId", ColumnType.BYTE_ARRAY),
        BatchColumn.of("objectId", ColumnType.BYTE_ARRAY),
        BatchColumn.of("signature", ColumnType.BYTE_ARRAY)), schema);
  }

  @Test
  public void everySchemaEndsWithSignature() {
    for (AnnouncementType type : AnnouncementType.values()) {
      if (!type.isBatchable())
        continue;
      BatchSchema schema = SchemaSelector.schemaFor(type);
      assertEquals("signature", schema.getColumn(schema.size() - 1).getName());
      for (String bloomColumn : SchemaSelector.bloomFilterSpecFor(type).getColumns())
        assertEquals(true, schema.hasColumn(bloomColumn), bloomColumn + " missing from " + type);
    }
  }

  @Test
  public void bloomColumns() {
    assertEquals(ImmutableList.of("fromId"), SchemaSelector.bloomFilterSpecFor(AnnouncementType.BROADCAST).getColumns().asList());
    assertEquals(ImmutableList.of("fromId", "inReplyTo"), SchemaSelector.bloomFilterSpecFor(3).getColumns().asList());
    assertEquals(ImmutableList.of("emoji", "fromId", "inReplyTo"), SchemaSelector.bloomFilterSpecFor(AnnouncementType.REACTION).getColumns().asList());
    assertEquals(ImmutableList.of("fromId"), SchemaSelector.bloomFilterSpecFor(AnnouncementType.PROFILE).getColumns().asList());
  }

  @Test
  public void unsupportedTypes() {
    UnsupportedAnnouncementTypeException e = assertThrows(UnsupportedAnnouncementTypeException.class, () -> SchemaSelector.schemaFor(AnnouncementType.TOMBSTONE));
    assertEquals(0, e.getDsnpType());
    assertThrows(UnsupportedAnnouncementTypeException.class, () -> SchemaSelector.schemaFor(42));
    assertThrows(IllegalArgumentException.class, () -> SchemaSelector.bloomFilterSpecFor(-3));
  }

  @Test
  public void schemasAreImmutable() {
    BatchSchema schema = SchemaSelector.schemaFor(AnnouncementType.REPLY);
    assertThrows(UnsupportedOperationException.class, () -> schema.getColumns().add(BatchColumn.of("x", ColumnType.INT32)));
    assertThrows(IllegalArgumentException.class, () -> BatchSchema.of(BatchColumn.of("a", ColumnType.INT32), BatchColumn.of("a", ColumnType.INT64)));
  }

  @Test
  public void columnTypeCoercion() {
    assertEquals(7, ColumnType.INT32.coerce(7L));
    assertEquals(7L, ColumnType.INT64.coerce(7));
    assertEquals("x", ColumnType.BYTE_ARRAY.coerce("x"));
    assertThrows(IllegalArgumentException.class, () -> ColumnType.INT32.coerce(Long.MAX_VALUE));
    assertThrows(IllegalArgumentException.class, () -> ColumnType.INT32.coerce("7"));
    assertThrows(IllegalArgumentException.class, () -> ColumnType.BYTE_ARRAY.coerce(7));
  }
}
