package org.dsnp.herald.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Location of a row group section within a batch file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"index", "offset", "length", "numRows"})
public class RowGroupMetadata {
  private int index;
  private long offset;
  private long length;
  private int numRows;

  public RowGroupMetadata() {
  }

  public RowGroupMetadata(int index, long offset, long length, int numRows) {
    this.index = index;
    this.offset = offset;
    this.length = length;
    this.numRows = numRows;
  }

  public int getIndex() {
    return index;
  }

  public void setIndex(int index) {
    this.index = index;
  }

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

  public int getNumRows() {
    return numRows;
  }

  public void setNumRows(int numRows) {
    this.numRows = numRows;
  }

  @Override
  public String toString() {
    return "RowGroupMetadata{" +
        "index=" + index +
        ", offset=" + offset +
        ", length=" + length +
        ", numRows=" + numRows +
        '}';
  }
}
