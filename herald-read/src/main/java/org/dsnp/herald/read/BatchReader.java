package org.dsnp.herald.read;

import static org.dsnp.herald.Constants.HEADER_BYTE_LENGTH;
import static org.dsnp.herald.Constants.MAGIC_HEADER;
import static org.dsnp.herald.Constants.METADATA_SECTION_PREAMBLE_LENGTH;
import static org.dsnp.herald.Constants.TRAILER_BYTE_LENGTH;
import static org.dsnp.herald.Constants.VERSION;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.dsnp.herald.columnfile.BatchFileSection;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.io.IOTools;
import org.dsnp.herald.meta.BatchFooter;
import org.dsnp.herald.meta.BatchMetadata;
import org.dsnp.herald.store.ReadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens batch files held in a {@link ReadStore}. Only the header, schema, footer and trailer are read on open, row
 * groups and bloom filters are fetched with ranged reads as they are needed.
 */
public class BatchReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchReader.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private final ReadStore store;

  public BatchReader(ReadStore store) {
    this.store = Objects.requireNonNull(store, "The read store cannot be null");
  }

  /**
   * @param key The key the batch was written under.
   *
   * @return A handle over the batch, close it when done.
   *
   * @throws BatchFormatException If the object is not a batch file of a supported version.
   */
  public BatchHandle open(String key) {
    long size = store.size(key);
    if (size < HEADER_BYTE_LENGTH + METADATA_SECTION_PREAMBLE_LENGTH + TRAILER_BYTE_LENGTH)
      throw new BatchFormatException("The object " + key + " is too small to be a batch file: " + size + " bytes");

    try {
      readHeader(key);
      long footerOffset = readFooterOffset(key, size);
      if (footerOffset < HEADER_BYTE_LENGTH || footerOffset > size - TRAILER_BYTE_LENGTH - METADATA_SECTION_PREAMBLE_LENGTH)
        throw new BatchFormatException("The footer offset " + footerOffset + " of " + key + " is out of bounds");

      BatchMetadata metadata = readMetadataSection(key, HEADER_BYTE_LENGTH, BatchFileSection.SCHEMA, BatchMetadata.class);
      if (metadata.getFormatVersion() != VERSION)
        throw new BatchFormatException("Unsupported batch schema version " + metadata.getFormatVersion() + " in " + key);
      Compression compression = Compression.getCompression(metadata.getCompressionAlgorithm());
      if (compression == null)
        throw new BatchFormatException("Unknown compression " + metadata.getCompressionAlgorithm() + " in " + key);
      BatchFooter footer = readMetadataSection(key, footerOffset, BatchFileSection.FOOTER, BatchFooter.class);

      LOGGER.debug("Opened batch {} of type {} with {} rows in {} row groups", key, metadata.getDsnpType(), footer.getNumRows(), footer.getRowGroups().size());
      return new BatchHandle(store, key, metadata, footer, compression);
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to open batch " + key, ioe);
    }
  }

  private void readHeader(String key) throws IOException {
    try (DataInputStream dis = new DataInputStream(store.getRange(key, 0, HEADER_BYTE_LENGTH))) {
      short magic = dis.readShort();
      if (magic != MAGIC_HEADER)
        throw new BatchFormatException("The object " + key + " does not start with the batch magic header");
      int version = dis.readInt();
      if (version != VERSION)
        throw new BatchFormatException("Unsupported batch format version " + version + " in " + key);
    }
  }

  private long readFooterOffset(String key, long size) throws IOException {
    try (DataInputStream dis = new DataInputStream(store.getRange(key, size - TRAILER_BYTE_LENGTH, TRAILER_BYTE_LENGTH))) {
      long footerOffset = dis.readLong();
      short magic = dis.readShort();
      if (magic != MAGIC_HEADER)
        throw new BatchFormatException("The object " + key + " does not end with the batch magic trailer, it may be truncated");
      return footerOffset;
    }
  }

  private <T> T readMetadataSection(String key, long offset, BatchFileSection expected, Class<T> type) throws IOException {
    int compressedLength;
    int length;
    try (DataInputStream dis = new DataInputStream(store.getRange(key, offset, METADATA_SECTION_PREAMBLE_LENGTH))) {
      int sectionId = dis.readInt();
      if (BatchFileSection.fromID(sectionId) != expected)
        throw new BatchFormatException("Expected the " + expected + " section at offset " + offset + " of " + key + " but found section id " + sectionId);
      compressedLength = dis.readInt();
      length = dis.readInt();
    }
    if (compressedLength < 0 || length < 0)
      throw new BatchFormatException("Corrupt " + expected + " section lengths in " + key);
    int storedLength = compressedLength == 0 ? length : compressedLength;
    byte[] payload;
    try (InputStream in = store.getRange(key, offset + METADATA_SECTION_PREAMBLE_LENGTH, storedLength)) {
      payload = IOTools.readFully(in, storedLength);
    }
    if (compressedLength != 0)
      payload = Compression.ZSTD.decompress(payload, length);
    return OBJECT_MAPPER.readValue(payload, type);
  }
}
