package org.dsnp.herald.columnfile;

import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;
import java.nio.charset.StandardCharsets;

/**
 * Feeds column values into bloom filters. Writers and readers must agree on this layout, values are expected to be
 * coerced to their column type first.
 */
public enum ColumnValueFunnel implements Funnel<Object> {
  INSTANCE;

  @Override
  public void funnel(Object value, PrimitiveSink into) {
    if (value instanceof Integer)
      into.putInt((Integer) value);
    else if (value instanceof Long)
      into.putLong((Long) value);
    else if (value instanceof String)
      into.putString((String) value, StandardCharsets.UTF_8);
    else
      throw new IllegalArgumentException("Unsupported column value " + value);
  }
}
