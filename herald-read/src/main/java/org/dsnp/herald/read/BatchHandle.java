package org.dsnp.herald.read;

import static org.dsnp.herald.Constants.LENGTH_BYTE_LENGTH;
import static org.dsnp.herald.Constants.SECTION_ID_BYTE_LENGTH;

import com.google.common.hash.BloomFilter;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.columnfile.BatchFileSection;
import org.dsnp.herald.columnfile.ColumnValueFunnel;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.meta.BatchFooter;
import org.dsnp.herald.meta.BatchMetadata;
import org.dsnp.herald.meta.BloomFilterMetadata;
import org.dsnp.herald.meta.RowGroupMetadata;
import org.dsnp.herald.row.BatchRow;
import org.dsnp.herald.row.RowCodec;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.BloomFilterSpec;
import org.dsnp.herald.store.ReadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An open batch file. Not thread safe.
 */
public class BatchHandle implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchHandle.class);
  private final ReadStore store;
  private final String key;
  private final BatchMetadata metadata;
  private final BatchFooter footer;
  private final BatchSchema schema;
  private final BloomFilterSpec bloomFilterSpec;
  private final RowGroupReader rowGroupReader;
  private final Map<BloomFilterMetadata, BloomFilter<Object>> bloomFilters = new HashMap<>();
  private boolean closed;

  BatchHandle(ReadStore store, String key, BatchMetadata metadata, BatchFooter footer, Compression compression) {
    this.store = store;
    this.key = key;
    this.metadata = metadata;
    this.footer = footer;
    try {
      this.schema = new BatchSchema(metadata.getColumns());
    } catch (IllegalArgumentException iae) {
      throw new BatchFormatException("Invalid schema in " + key, iae);
    }
    this.bloomFilterSpec = new BloomFilterSpec(metadata.getBloomFilterColumns());
    this.rowGroupReader = new RowGroupReader(schema, compression);
  }

  public String getKey() {
    return key;
  }

  public BatchSchema getSchema() {
    return schema;
  }

  public BloomFilterSpec getBloomFilterSpec() {
    return bloomFilterSpec;
  }

  /**
   * @return The type of every announcement in the batch, or {@code null} if the file names an unknown type.
   */
  public AnnouncementType getAnnouncementType() {
    return AnnouncementType.fromCode(metadata.getDsnpType());
  }

  public long getNumRows() {
    return footer.getNumRows();
  }

  public int getNumRowGroups() {
    return footer.getRowGroups().size();
  }

  /**
   * Visits every row in storage order, which is the order the batch was written in. One row group is held in
   * memory at a time.
   */
  public void forEachRow(RowVisitor visitor) {
    ensureOpen();
    for (RowGroupMetadata rowGroup : footer.getRowGroups()) {
      List<BatchRow> rows;
      try (InputStream in = store.getRange(key, rowGroup.getOffset(), rowGroup.getLength())) {
        rows = rowGroupReader.read(in, rowGroup);
      } catch (IOException ioe) {
        throw new UncheckedIOException("Unable to read row group " + rowGroup.getIndex() + " of " + key, ioe);
      }
      LOGGER.debug("Decoded row group {} of {} with {} rows", rowGroup.getIndex(), key, rows.size());
      for (BatchRow row : rows)
        visitor.visit(row);
    }
  }

  /**
   * Visits every row converted back into the signed announcement it was written from.
   */
  public void forEachAnnouncement(Consumer<SignedAnnouncement> visitor) {
    forEachRow(row -> visitor.accept(RowCodec.toSignedAnnouncement(row)));
  }

  /**
   * Tests whether a value may be present in a bloom indexed column. A {@code false} answer is definite, a
   * {@code true} answer may be a false positive.
   *
   * @param column The column to probe.
   * @param value The value, converted to the column type first.
   *
   * @throws IllegalArgumentException If the column has no bloom filter or the value does not fit the column type.
   */
  public boolean probe(String column, Object value) {
    ensureOpen();
    if (!bloomFilterSpec.contains(column))
      throw new IllegalArgumentException("The column " + column + " of " + key + " has no bloom filter, indexed columns are " + bloomFilterSpec.getColumns());
    int index = schema.indexOf(column);
    if (index < 0)
      throw new BatchFormatException("The bloom filter column " + column + " is not part of the schema of " + key);
    Object coerced = schema.getColumn(index).getType().coerce(value);
    for (BloomFilterMetadata bloomMetadata : footer.getBloomFilters()) {
      if (!bloomMetadata.getColumn().equals(column))
        continue;
      if (loadBloomFilter(bloomMetadata).mightContain(coerced))
        return true;
    }
    return false;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    bloomFilters.clear();
    LOGGER.debug("Closed batch {}", key);
  }

  private BloomFilter<Object> loadBloomFilter(BloomFilterMetadata bloomMetadata) {
    BloomFilter<Object> cached = bloomFilters.get(bloomMetadata);
    if (cached != null)
      return cached;
    try (DataInputStream dis = new DataInputStream(store.getRange(key, bloomMetadata.getOffset(), bloomMetadata.getLength()))) {
      int sectionId = dis.readInt();
      if (BatchFileSection.fromID(sectionId) != BatchFileSection.BLOOM_FILTER)
        throw new BatchFormatException("Expected a bloom filter at offset " + bloomMetadata.getOffset() + " of " + key + " but found section id " + sectionId);
      int length = dis.readInt();
      if (length != bloomMetadata.getLength() - SECTION_ID_BYTE_LENGTH - LENGTH_BYTE_LENGTH)
        throw new BatchFormatException("The bloom filter at offset " + bloomMetadata.getOffset() + " of " + key + " has an inconsistent length");
      BloomFilter<Object> bloomFilter = BloomFilter.readFrom(dis, ColumnValueFunnel.INSTANCE);
      bloomFilters.put(bloomMetadata, bloomFilter);
      return bloomFilter;
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to read the bloom filter of " + bloomMetadata.getColumn() + " in " + key, ioe);
    }
  }

  private void ensureOpen() {
    if (closed)
      throw new IllegalStateException("The batch " + key + " is closed");
  }
}
