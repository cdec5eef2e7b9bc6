package org.dsnp.herald.write;

import static org.dsnp.herald.Constants.MAGIC_HEADER;
import static org.dsnp.herald.Constants.VERSION;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.BloomFilter;
import com.google.common.io.CountingOutputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.columnfile.BatchFileSection;
import org.dsnp.herald.config.BatchConfig;
import org.dsnp.herald.meta.BatchFooter;
import org.dsnp.herald.meta.BatchMetadata;
import org.dsnp.herald.meta.BloomFilterMetadata;
import org.dsnp.herald.meta.RowGroupMetadata;
import org.dsnp.herald.row.RowCodec;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.BloomFilterSpec;
import org.dsnp.herald.write.component.RowGroupWriter;

/**
 * Lays out one batch file on an output stream: header and schema, row groups as they fill up, then bloom filters,
 * footer and trailer. Offsets in the footer are relative to the first byte written.
 */
public class BatchFileWriter {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private final CountingOutputStream counter;
  private final DataOutputStream out;
  private final AnnouncementType type;
  private final BatchSchema schema;
  private final BloomFilterSpec bloomFilterSpec;
  private final BatchConfig config;
  private final RowGroupWriter rowGroupWriter;
  private final List<RowGroupMetadata> rowGroups = new ArrayList<>();
  private final List<PendingBloomFilter> bloomFilters = new ArrayList<>();
  private long numRows;
  private boolean finished;

  public BatchFileWriter(OutputStream sink, AnnouncementType type, BatchSchema schema, BloomFilterSpec bloomFilterSpec, BatchConfig config) {
    this.counter = new CountingOutputStream(new BufferedOutputStream(sink));
    this.out = new DataOutputStream(counter);
    this.type = type;
    this.schema = schema;
    this.bloomFilterSpec = bloomFilterSpec;
    this.config = config;
    this.rowGroupWriter = new RowGroupWriter(schema, bloomFilterSpec, config.getCompression(), config.getRowGroupSize());
  }

  public void writeHeader() throws IOException {
    out.writeShort(MAGIC_HEADER);
    out.writeInt(VERSION);
    BatchMetadata metadata = new BatchMetadata();
    metadata.setFormatVersion(VERSION);
    metadata.setDsnpType(type.getCode());
    metadata.setCompressionAlgorithm(config.getCompression().name().toLowerCase(Locale.ROOT));
    metadata.setColumns(schema.getColumns());
    metadata.setBloomFilterColumns(bloomFilterSpec.getColumns().asList());
    writeMetadataSection(BatchFileSection.SCHEMA, metadata);
  }

  /**
   * Adds a row, flushing the current row group once it is full.
   */
  public void append(SignedAnnouncement announcement) throws IOException {
    if (finished)
      throw new IllegalStateException("The batch has already been finished");
    rowGroupWriter.addRow(RowCodec.toValues(schema, announcement));
    numRows++;
    if (rowGroupWriter.numRows() >= config.getRowGroupSize())
      flushRowGroup();
  }

  public long getNumRows() {
    return numRows;
  }

  public int getNumRowGroups() {
    return rowGroups.size();
  }

  /**
   * Writes the remaining rows, bloom filters, footer and trailer then flushes the underlying stream.
   */
  public void finish() throws IOException {
    if (finished)
      return;
    flushRowGroup();

    BatchFooter footer = new BatchFooter();
    footer.setNumRows(numRows);
    footer.setRowGroups(rowGroups);
    List<BloomFilterMetadata> bloomMetadata = new ArrayList<>();
    for (PendingBloomFilter pending : bloomFilters) {
      long offset = counter.getCount();
      ByteArrayOutputStream serialized = new ByteArrayOutputStream();
      pending.filter.writeTo(serialized);
      out.writeInt(BatchFileSection.BLOOM_FILTER.getSectionID());
      out.writeInt(serialized.size());
      serialized.writeTo(out);
      bloomMetadata.add(new BloomFilterMetadata(pending.column, pending.rowGroup, offset, counter.getCount() - offset));
    }
    footer.setBloomFilters(bloomMetadata);

    long footerOffset = counter.getCount();
    writeMetadataSection(BatchFileSection.FOOTER, footer);
    out.writeLong(footerOffset);
    out.writeShort(MAGIC_HEADER);
    out.flush();
    finished = true;
  }

  private void flushRowGroup() throws IOException {
    if (rowGroupWriter.isEmpty())
      return;
    int index = rowGroups.size();
    long offset = counter.getCount();
    rowGroupWriter.writeTo(out);
    rowGroups.add(new RowGroupMetadata(index, offset, counter.getCount() - offset, rowGroupWriter.numRows()));
    for (Map.Entry<String, BloomFilter<Object>> entry : rowGroupWriter.buildBloomFilters(config.getBloomFilterFpp()).entrySet())
      bloomFilters.add(new PendingBloomFilter(entry.getKey(), index, entry.getValue()));
    rowGroupWriter.reset();
  }

  private void writeMetadataSection(BatchFileSection section, Object value) throws IOException {
    byte[] payload = OBJECT_MAPPER.writeValueAsBytes(value);
    out.writeInt(section.getSectionID());
    out.writeInt(0);
    out.writeInt(payload.length);
    out.write(payload);
  }

  private static final class PendingBloomFilter {
    private final String column;
    private final int rowGroup;
    private final BloomFilter<Object> filter;

    private PendingBloomFilter(String column, int rowGroup, BloomFilter<Object> filter) {
      this.column = column;
      this.rowGroup = rowGroup;
      this.filter = filter;
    }
  }
}
