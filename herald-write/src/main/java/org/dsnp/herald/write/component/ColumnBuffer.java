package org.dsnp.herald.write.component;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import org.dsnp.herald.schema.ColumnType;

/**
 * Buffers the values of one column for the current row group. Fixed width values are held in primitive lists.
 */
public class ColumnBuffer {
  private final ColumnType type;
  private final IntArrayList ints;
  private final LongArrayList longs;
  private final ObjectArrayList<String> strings;

  public ColumnBuffer(ColumnType type, int expectedRows) {
    this.type = type;
    this.ints = type == ColumnType.INT32 ? new IntArrayList(expectedRows) : null;
    this.longs = type == ColumnType.INT64 ? new LongArrayList(expectedRows) : null;
    this.strings = type == ColumnType.BYTE_ARRAY ? new ObjectArrayList<>(expectedRows) : null;
  }

  public ColumnType getType() {
    return type;
  }

  /**
   * @param value A value already coerced to the column type.
   */
  public void add(Object value) {
    switch (type) {
      case INT32:
        ints.add(((Integer) value).intValue());
        break;
      case INT64:
        longs.add(((Long) value).longValue());
        break;
      case BYTE_ARRAY:
        strings.add((String) value);
        break;
    }
  }

  public int size() {
    switch (type) {
      case INT32:
        return ints.size();
      case INT64:
        return longs.size();
      default:
        return strings.size();
    }
  }

  public Object get(int row) {
    switch (type) {
      case INT32:
        return ints.getInt(row);
      case INT64:
        return longs.getLong(row);
      default:
        return strings.get(row);
    }
  }

  /**
   * @return The raw column chunk for the buffered rows.
   */
  public byte[] encode() throws IOException {
    switch (type) {
      case INT32: {
        ByteBuffer buffer = ByteBuffer.allocate(ints.size() * type.getByteLength());
        for (int i = 0; i < ints.size(); i++)
          buffer.putInt(ints.getInt(i));
        return buffer.array();
      }
      case INT64: {
        ByteBuffer buffer = ByteBuffer.allocate(longs.size() * type.getByteLength());
        for (int i = 0; i < longs.size(); i++)
          buffer.putLong(longs.getLong(i));
        return buffer.array();
      }
      default: {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (DataOutputStream dos = new DataOutputStream(baos)) {
          for (String value : strings)
            type.writeValue(dos, value);
        }
        return baos.toByteArray();
      }
    }
  }

  public void clear() {
    switch (type) {
      case INT32:
        ints.clear();
        break;
      case INT64:
        longs.clear();
        break;
      case BYTE_ARRAY:
        strings.clear();
        break;
    }
  }
}
