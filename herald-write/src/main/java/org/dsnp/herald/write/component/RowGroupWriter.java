package org.dsnp.herald.write.component;

import com.google.common.hash.BloomFilter;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.dsnp.herald.columnfile.BatchFileSection;
import org.dsnp.herald.columnfile.ColumnValueFunnel;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.BloomFilterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffers rows column by column and writes them out as a single row group section.
 */
public class RowGroupWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RowGroupWriter.class);
  private final BatchSchema schema;
  private final BloomFilterSpec bloomFilterSpec;
  private final Compression compression;
  private final ColumnBuffer[] columns;
  private int numRows;

  public RowGroupWriter(BatchSchema schema, BloomFilterSpec bloomFilterSpec, Compression compression, int expectedRows) {
    this.schema = schema;
    this.bloomFilterSpec = bloomFilterSpec;
    this.compression = compression;
    this.columns = new ColumnBuffer[schema.size()];
    for (int i = 0; i < columns.length; i++)
      columns[i] = new ColumnBuffer(schema.getColumn(i).getType(), expectedRows);
  }

  /**
   * @param values One value per column in schema order, coerced to the column types.
   */
  public void addRow(Object[] values) {
    if (values.length != columns.length)
      throw new IllegalArgumentException("Expected " + columns.length + " values but got " + values.length);
    for (int i = 0; i < columns.length; i++)
      columns[i].add(values[i]);
    numRows++;
  }

  public int numRows() {
    return numRows;
  }

  public boolean isEmpty() {
    return numRows == 0;
  }

  /**
   * Writes the buffered rows. A chunk is stored raw, with a compressed length of 0, when compression is off.
   */
  public void writeTo(DataOutputStream out) throws IOException {
    out.writeInt(BatchFileSection.ROWGROUP.getSectionID());
    out.writeInt(numRows);
    out.writeInt(columns.length);
    long rawBytes = 0;
    long storedBytes = 0;
    for (ColumnBuffer column : columns) {
      byte[] raw = column.encode();
      rawBytes += raw.length;
      if (compression == Compression.NONE) {
        out.writeInt(0);
        out.writeInt(raw.length);
        out.write(raw);
        storedBytes += raw.length;
      } else {
        byte[] compressed = compression.compress(raw);
        out.writeInt(compressed.length);
        out.writeInt(raw.length);
        out.write(compressed);
        storedBytes += compressed.length;
      }
    }
    LOGGER.debug("Wrote a row group of {} rows, {} raw bytes stored as {}", numRows, rawBytes, storedBytes);
  }

  /**
   * Builds one bloom filter per indexed column over the buffered rows, in indexed column order.
   */
  public Map<String, BloomFilter<Object>> buildBloomFilters(double fpp) {
    Map<String, BloomFilter<Object>> filters = new LinkedHashMap<>();
    for (String column : bloomFilterSpec.getColumns()) {
      int index = schema.indexOf(column);
      if (index < 0)
        throw new IllegalStateException("The bloom filter column " + column + " is not part of " + schema);
      BloomFilter<Object> filter = BloomFilter.create(ColumnValueFunnel.INSTANCE, Math.max(numRows, 1), fpp);
      ColumnBuffer buffer = columns[index];
      for (int row = 0; row < numRows; row++)
        filter.put(buffer.get(row));
      filters.put(column, filter);
    }
    return filters;
  }

  public void reset() {
    for (ColumnBuffer column : columns)
      column.clear();
    numRows = 0;
  }
}
