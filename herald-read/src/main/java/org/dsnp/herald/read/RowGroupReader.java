package org.dsnp.herald.read;

import static org.dsnp.herald.Constants.LENGTH_BYTE_LENGTH;
import static org.dsnp.herald.Constants.SECTION_ID_BYTE_LENGTH;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.dsnp.herald.columnfile.BatchFileSection;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.io.IOTools;
import org.dsnp.herald.meta.RowGroupMetadata;
import org.dsnp.herald.row.BatchRow;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.ColumnType;

/**
 * Decodes a single row group section. Each column chunk is read and decompressed in turn, then the rows are
 * assembled in storage order.
 */
public class RowGroupReader {
  // Section id, row count and column count
  private static final int ROWGROUP_PREAMBLE_LENGTH = SECTION_ID_BYTE_LENGTH + 2 * LENGTH_BYTE_LENGTH;
  // Compressed and uncompressed lengths
  private static final int CHUNK_PREAMBLE_LENGTH = 2 * LENGTH_BYTE_LENGTH;
  private final BatchSchema schema;
  private final Compression compression;

  public RowGroupReader(BatchSchema schema, Compression compression) {
    this.schema = schema;
    this.compression = compression;
  }

  public List<BatchRow> read(InputStream in, RowGroupMetadata rowGroup) throws IOException {
    DataInputStream dis = new DataInputStream(in);
    int sectionId = dis.readInt();
    if (BatchFileSection.fromID(sectionId) != BatchFileSection.ROWGROUP)
      throw new BatchFormatException("Expected a row group section at offset " + rowGroup.getOffset() + " but found section id " + sectionId);
    int rowCount = dis.readInt();
    int columnCount = dis.readInt();
    if (rowCount < 0)
      throw new BatchFormatException("Row group " + rowGroup.getIndex() + " has a negative row count " + rowCount);
    if (rowCount != rowGroup.getNumRows())
      throw new BatchFormatException("Row group " + rowGroup.getIndex() + " holds " + rowCount + " rows but the footer records " + rowGroup.getNumRows());
    if (columnCount != schema.size())
      throw new BatchFormatException("Row group " + rowGroup.getIndex() + " holds " + columnCount + " columns but the schema has " + schema.size());

    Object[][] columns = new Object[columnCount][];
    long remaining = rowGroup.getLength() - ROWGROUP_PREAMBLE_LENGTH;
    for (int c = 0; c < columnCount; c++) {
      int compressedLength = dis.readInt();
      int uncompressedLength = dis.readInt();
      if (compressedLength < 0 || uncompressedLength < 0)
        throw new BatchFormatException("Corrupt lengths for column " + c + " of row group " + rowGroup.getIndex() + ": compressed=" + compressedLength + " uncompressed=" + uncompressedLength);
      int storedLength = compressedLength == 0 ? uncompressedLength : compressedLength;
      remaining -= CHUNK_PREAMBLE_LENGTH + (long) storedLength;
      if (remaining < 0)
        throw new BatchFormatException("Column " + c + " of row group " + rowGroup.getIndex() + " claims " + storedLength + " bytes, more than the " + rowGroup.getLength() + " byte row group holds");
      ColumnType type = schema.getColumn(c).getType();
      if (type.isFixedWidth() && uncompressedLength != (long) type.getByteLength() * rowCount)
        throw new BatchFormatException("A " + type + " column chunk of " + rowCount + " rows cannot be " + uncompressedLength + " bytes");
      byte[] chunk;
      if (compressedLength == 0) {
        chunk = IOTools.readFully(dis, uncompressedLength);
      } else {
        byte[] stored = IOTools.readFully(dis, compressedLength);
        try {
          chunk = compression.decompress(stored, uncompressedLength);
        } catch (RuntimeException e) {
          throw new BatchFormatException("Unable to decompress column " + c + " of row group " + rowGroup.getIndex(), e);
        }
      }
      columns[c] = decodeColumn(type, chunk, rowCount);
    }

    List<BatchRow> rows = new ArrayList<>(rowCount);
    for (int r = 0; r < rowCount; r++) {
      Object[] values = new Object[columnCount];
      for (int c = 0; c < columnCount; c++)
        values[c] = columns[c][r];
      rows.add(new BatchRow(schema, values));
    }
    return rows;
  }

  private static Object[] decodeColumn(ColumnType type, byte[] chunk, int rowCount) {
    if (type.isFixedWidth() && chunk.length != type.getByteLength() * rowCount)
      throw new BatchFormatException("A " + type + " column chunk of " + rowCount + " rows cannot be " + chunk.length + " bytes");
    Object[] values = new Object[rowCount];
    try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(chunk))) {
      for (int r = 0; r < rowCount; r++)
        values[r] = type.readValue(dis);
      if (dis.available() > 0)
        throw new BatchFormatException("A " + type + " column chunk has " + dis.available() + " trailing bytes");
    } catch (IOException ioe) {
      throw new BatchFormatException("Corrupt " + type + " column chunk of " + rowCount + " rows", ioe);
    }
    return values;
  }
}
