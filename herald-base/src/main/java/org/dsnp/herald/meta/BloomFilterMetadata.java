package org.dsnp.herald.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"column", "rowGroup", "offset", "length"})
public class BloomFilterMetadata {
  private String column;
  private int rowGroup;
  private long offset;
  private long length;

  public BloomFilterMetadata() {
  }

  public BloomFilterMetadata(String column, int rowGroup, long offset, long length) {
    this.column = column;
    this.rowGroup = rowGroup;
    this.offset = offset;
    this.length = length;
  }

  public String getColumn() {
    return column;
  }

  public void setColumn(String column) {
    this.column = column;
  }

  public int getRowGroup() {
    return rowGroup;
  }

  public void setRowGroup(int rowGroup) {
    this.rowGroup = rowGroup;
  }

  /**
   * @return Offset of the bloom filter section, including its section id and length prefix.
   */
  public long getOffset() {
    return offset;
  }

  public void setOffset(long offset) {
    this.offset = offset;
  }

  public long getLength() {
    return length;
  }

  public void setLength(long length) {
    this.length = length;
  }
}
