package org.dsnp.herald.write.component;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.hash.BloomFilter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Map;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.BloomFilterSpec;
import org.dsnp.herald.schema.ColumnType;
import org.dsnp.herald.schema.SchemaSelector;
import org.junit.jupiter.api.Test;

public class RowGroupWriterTest {
  private static final BatchSchema GRAPH_SCHEMA = SchemaSelector.schemaFor(AnnouncementType.GRAPH_CHANGE);
  private static final BloomFilterSpec GRAPH_BLOOM = SchemaSelector.bloomFilterSpecFor(AnnouncementType.GRAPH_CHANGE);

  // changeType, createdAt, dsnpType, fromId, objectId, signature
  private static Object[] follow(int i) {
    return new Object[] {1, 1700000000000L + i, 1, "0x" + Integer.toHexString(100 + i), "0x" + Integer.toHexString(i + 1), "0xsig" + i};
  }

  @Test
  public void columnChunks() throws IOException {
    ColumnBuffer ints = new ColumnBuffer(ColumnType.INT32, 2);
    ints.add(1);
    ints.add(-1);
    assertArrayEquals(new byte[] {0, 0, 0, 1, -1, -1, -1, -1}, ints.encode());

    ColumnBuffer longs = new ColumnBuffer(ColumnType.INT64, 1);
    longs.add(258L);
    assertArrayEquals(new byte[] {0, 0, 0, 0, 0, 0, 1, 2}, longs.encode());
    assertEquals(258L, longs.get(0));

    ColumnBuffer strings = new ColumnBuffer(ColumnType.BYTE_ARRAY, 1);
    strings.add("ab");
    assertArrayEquals(new byte[] {0, 0, 0, 2, 'a', 'b'}, strings.encode());
    strings.clear();
    assertEquals(0, strings.size());
  }

  @Test
  public void uncompressedSectionLayout() throws IOException {
    RowGroupWriter writer = new RowGroupWriter(GRAPH_SCHEMA, GRAPH_BLOOM, Compression.NONE, 4);
    writer.addRow(follow(0));
    writer.addRow(follow(1));
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      writer.writeTo(out);
    }

    DataInputStream in = new DataInputStream(new ByteArrayInputStream(baos.toByteArray()));
    assertEquals(2, in.readInt());
    assertEquals(2, in.readInt());
    assertEquals(GRAPH_SCHEMA.size(), in.readInt());
    // changeType chunk, stored raw
    assertEquals(0, in.readInt());
    assertEquals(8, in.readInt());
    assertEquals(1, in.readInt());
    assertEquals(1, in.readInt());
    // createdAt chunk
    assertEquals(0, in.readInt());
    assertEquals(16, in.readInt());
    assertEquals(1700000000000L, in.readLong());
    assertEquals(1700000000001L, in.readLong());
  }

  @Test
  public void bloomFiltersCoverTheBufferedRows() {
    RowGroupWriter writer = new RowGroupWriter(GRAPH_SCHEMA, GRAPH_BLOOM, Compression.ZSTD, 8);
    for (int i = 0; i < 8; i++)
      writer.addRow(follow(i));
    Map<String, BloomFilter<Object>> filters = writer.buildBloomFilters(0.01);
    assertEquals(GRAPH_BLOOM.getColumns(), filters.keySet());
    for (int i = 0; i < 8; i++)
      assertTrue(filters.get("fromId").mightContain("0x" + Integer.toHexString(100 + i)));

    writer.reset();
    assertTrue(writer.isEmpty());
    assertFalse(writer.numRows() > 0);
  }

  @Test
  public void rejectsShortRows() {
    RowGroupWriter writer = new RowGroupWriter(GRAPH_SCHEMA, GRAPH_BLOOM, Compression.NONE, 1);
    assertThrows(IllegalArgumentException.class, () -> writer.addRow(new Object[] {1, 2L}));
  }
}
