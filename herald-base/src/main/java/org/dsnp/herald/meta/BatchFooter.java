package org.dsnp.herald.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Index of a batch file, written after the last bloom filter. The trailer points at it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"numRows", "rowGroups", "bloomFilters"})
public class BatchFooter {
  private long numRows;
  private List<RowGroupMetadata> rowGroups = new ArrayList<>();
  private List<BloomFilterMetadata> bloomFilters = new ArrayList<>();

  public long getNumRows() {
    return numRows;
  }

  public void setNumRows(long numRows) {
    this.numRows = numRows;
  }

  public List<RowGroupMetadata> getRowGroups() {
    return rowGroups;
  }

  public void setRowGroups(List<RowGroupMetadata> rowGroups) {
    this.rowGroups = rowGroups;
  }

  public List<BloomFilterMetadata> getBloomFilters() {
    return bloomFilters;
  }

  public void setBloomFilters(List<BloomFilterMetadata> bloomFilters) {
    this.bloomFilters = bloomFilters;
  }
}
