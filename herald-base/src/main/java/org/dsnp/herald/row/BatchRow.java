package org.dsnp.herald.row;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.dsnp.herald.schema.BatchSchema;

/**
 * A single decoded row. Values are in schema order.
 */
public class BatchRow {
  private final BatchSchema schema;
  private final Object[] values;

  public BatchRow(BatchSchema schema, Object... values) {
    this.schema = Objects.requireNonNull(schema, "The schema cannot be null");
    if (values.length != schema.size())
      throw new IllegalArgumentException("The shape of the columns to values doesn't match up, expected " + schema.size() + " values but got " + values.length);
    this.values = values.clone();
  }

  public BatchSchema getSchema() {
    return schema;
  }

  public int numColumns() {
    return values.length;
  }

  public Object get(int index) {
    return values[index];
  }

  /**
   * @throws IllegalArgumentException If the schema has no such column.
   */
  public Object get(String column) {
    int index = schema.indexOf(column);
    if (index < 0)
      throw new IllegalArgumentException("The column " + column + " is not part of " + schema);
    return values[index];
  }

  public List<Object> getValues() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  /**
   * @return The row as column name to value, in schema order.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++)
      map.put(schema.getColumn(i).getName(), values[i]);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BatchRow row = (BatchRow) o;
    return schema.equals(row.schema) && Arrays.equals(values, row.values);
  }

  @Override
  public int hashCode() {
    return 31 * schema.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "BatchRow" + toMap();
  }
}
