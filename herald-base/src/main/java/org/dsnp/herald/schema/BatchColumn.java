package org.dsnp.herald.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

@JsonPropertyOrder({"name", "type"})
public final class BatchColumn {
  private final String name;
  private final ColumnType type;

  @JsonCreator
  public BatchColumn(@JsonProperty("name") String name, @JsonProperty("type") ColumnType type) {
    this.name = Objects.requireNonNull(name, "The column name cannot be null");
    this.type = Objects.requireNonNull(type, "The column type cannot be null");
  }

  public static BatchColumn of(String name, ColumnType type) {
    return new BatchColumn(name, type);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BatchColumn that = (BatchColumn) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name + ":" + type;
  }
}
