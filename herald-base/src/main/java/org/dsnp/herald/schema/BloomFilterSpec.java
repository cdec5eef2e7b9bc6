package org.dsnp.herald.schema;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Objects;

/**
 * The ordered set of columns that get a bloom filter in each row group.
 */
public final class BloomFilterSpec {
  private final ImmutableSet<String> columns;

  public BloomFilterSpec(Collection<String> columns) {
    this.columns = ImmutableSet.copyOf(columns);
  }

  public static BloomFilterSpec of(String... columns) {
    return new BloomFilterSpec(ImmutableSet.copyOf(columns));
  }

  public ImmutableSet<String> getColumns() {
    return columns;
  }

  public boolean contains(String column) {
    return columns.contains(column);
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return columns.asList().equals(((BloomFilterSpec) o).columns.asList());
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns.asList());
  }

  @Override
  public String toString() {
    return "BloomFilterSpec" + columns;
  }
}
