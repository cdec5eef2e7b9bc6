package org.dsnp.herald.schema;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Physical column types of a batch file. Fixed width types are written big endian, byte arrays as an int length
 * followed by the UTF-8 bytes.
 */
public enum ColumnType {
  INT32(4),
  INT64(8),
  BYTE_ARRAY(-1);

  private final int byteLength;

  ColumnType(int byteLength) {
    this.byteLength = byteLength;
  }

  /**
   * @return The width of a value in bytes, or -1 for variable width.
   */
  public int getByteLength() {
    return byteLength;
  }

  public boolean isFixedWidth() {
    return byteLength > 0;
  }

  /**
   * Converts a value to the java type stored for this column: {@link Integer}, {@link Long} or {@link String}.
   *
   * @throws IllegalArgumentException If the value cannot be represented by this column type.
   */
  public Object coerce(Object value) {
    if (value == null)
      throw new IllegalArgumentException("Column values cannot be null for " + this);
    switch (this) {
      case INT32:
        if (value instanceof Integer)
          return value;
        if (value instanceof Short || value instanceof Byte)
          return ((Number) value).intValue();
        if (value instanceof Long) {
          long longValue = (Long) value;
          if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE)
            return (int) longValue;
        }
        break;
      case INT64:
        if (value instanceof Long)
          return value;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
          return ((Number) value).longValue();
        break;
      case BYTE_ARRAY:
        if (value instanceof String)
          return value;
        break;
    }
    throw new IllegalArgumentException("The value " + value + " of type " + value.getClass().getSimpleName() + " is not a valid " + this);
  }

  public void writeValue(DataOutputStream out, Object value) throws IOException {
    switch (this) {
      case INT32:
        out.writeInt((Integer) value);
        break;
      case INT64:
        out.writeLong((Long) value);
        break;
      case BYTE_ARRAY:
        byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
        break;
    }
  }

  public Object readValue(DataInputStream in) throws IOException {
    switch (this) {
      case INT32:
        return in.readInt();
      case INT64:
        return in.readLong();
      case BYTE_ARRAY:
        int length = in.readInt();
        if (length < 0)
          throw new IOException("Negative byte array length " + length);
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
    throw new IllegalStateException("Unhandled column type " + this);
  }
}
