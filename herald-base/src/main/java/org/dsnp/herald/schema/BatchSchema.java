package org.dsnp.herald.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of the columns of a batch file.
 */
public final class BatchSchema {
  private final ImmutableList<BatchColumn> columns;
  private final ImmutableMap<String, Integer> columnIndexes;

  public BatchSchema(List<BatchColumn> columns) {
    if (columns == null || columns.isEmpty())
      throw new IllegalArgumentException("A schema needs at least one column");
    this.columns = ImmutableList.copyOf(columns);
    ImmutableMap.Builder<String, Integer> indexes = ImmutableMap.builder();
    for (int i = 0; i < this.columns.size(); i++)
      indexes.put(this.columns.get(i).getName(), i);
    // buildOrThrow rejects duplicate column names
    this.columnIndexes = indexes.buildOrThrow();
  }

  public static BatchSchema of(BatchColumn... columns) {
    return new BatchSchema(ImmutableList.copyOf(columns));
  }

  public ImmutableList<BatchColumn> getColumns() {
    return columns;
  }

  public ImmutableList<String> getColumnNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (BatchColumn column : columns)
      names.add(column.getName());
    return names.build();
  }

  public int size() {
    return columns.size();
  }

  public BatchColumn getColumn(int index) {
    return columns.get(index);
  }

  /**
   * @return The position of the column or -1 if the schema has no such column.
   */
  public int indexOf(String columnName) {
    Integer index = columnIndexes.get(columnName);
    return index == null ? -1 : index;
  }

  public boolean hasColumn(String columnName) {
    return columnIndexes.containsKey(columnName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return columns.equals(((BatchSchema) o).columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns);
  }

  @Override
  public String toString() {
    return "BatchSchema" + columns;
  }
}
