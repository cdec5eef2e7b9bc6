package org.dsnp.herald.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import org.dsnp.herald.schema.BatchColumn;

/**
 * Written at the head of a batch file, describes the announcement type and the column layout.
 */
@JsonInclude(value = Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"formatVersion", "dsnpType", "compressionAlgorithm", "columns", "bloomFilterColumns"})
public class BatchMetadata {
  private int formatVersion;
  private int dsnpType;
  private String compressionAlgorithm = "zstd";
  private List<BatchColumn> columns = new ArrayList<>();
  private List<String> bloomFilterColumns = new ArrayList<>();

  public int getFormatVersion() {
    return formatVersion;
  }

  public void setFormatVersion(int formatVersion) {
    this.formatVersion = formatVersion;
  }

  public int getDsnpType() {
    return dsnpType;
  }

  public void setDsnpType(int dsnpType) {
    this.dsnpType = dsnpType;
  }

  public String getCompressionAlgorithm() {
    return compressionAlgorithm;
  }

  public void setCompressionAlgorithm(String compressionAlgorithm) {
    this.compressionAlgorithm = compressionAlgorithm;
  }

  public List<BatchColumn> getColumns() {
    return columns;
  }

  public void setColumns(List<BatchColumn> columns) {
    this.columns = columns;
  }

  public List<String> getBloomFilterColumns() {
    return bloomFilterColumns;
  }

  public void setBloomFilterColumns(List<String> bloomFilterColumns) {
    this.bloomFilterColumns = bloomFilterColumns;
  }
}
