package org.dsnp.herald.config;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.Objects;
import org.dsnp.herald.Constants;
import org.dsnp.herald.io.Compression;

/**
 * Settings shared by batch writers and announcement verifiers. Instances are immutable, build them with
 * {@link #builder()}.
 */
public final class BatchConfig {
  public static final BatchConfig DEFAULT = builder().build();

  private final Compression compression;
  private final int rowGroupSize;
  private final double bloomFilterFpp;
  private final HashFunction contentHashFunction;

  private BatchConfig(Builder builder) {
    this.compression = builder.compression;
    this.rowGroupSize = builder.rowGroupSize;
    this.bloomFilterFpp = builder.bloomFilterFpp;
    this.contentHashFunction = builder.contentHashFunction;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .compression(compression)
        .rowGroupSize(rowGroupSize)
        .bloomFilterFpp(bloomFilterFpp)
        .contentHashFunction(contentHashFunction);
  }

  public Compression getCompression() {
    return compression;
  }

  /**
   * @return The maximum number of rows buffered before a row group is flushed.
   */
  public int getRowGroupSize() {
    return rowGroupSize;
  }

  public double getBloomFilterFpp() {
    return bloomFilterFpp;
  }

  /**
   * @return The function used for batch content hashes and for content integrity checks.
   */
  public HashFunction getContentHashFunction() {
    return contentHashFunction;
  }

  @Override
  public String toString() {
    return "BatchConfig{" +
        "compression=" + compression +
        ", rowGroupSize=" + rowGroupSize +
        ", bloomFilterFpp=" + bloomFilterFpp +
        ", contentHashFunction=" + contentHashFunction +
        '}';
  }

  public static final class Builder {
    private Compression compression = Compression.ZSTD;
    private int rowGroupSize = Constants.DEFAULT_ROW_GROUP_SIZE;
    private double bloomFilterFpp = Constants.DEFAULT_BLOOM_FILTER_FPP;
    private HashFunction contentHashFunction = Hashing.sha256();

    private Builder() {}

    public Builder compression(Compression compression) {
      this.compression = Objects.requireNonNull(compression, "compression cannot be null");
      return this;
    }

    public Builder rowGroupSize(int rowGroupSize) {
      if (rowGroupSize <= 0)
        throw new IllegalArgumentException("The row group size must be positive but was " + rowGroupSize);
      this.rowGroupSize = rowGroupSize;
      return this;
    }

    public Builder bloomFilterFpp(double bloomFilterFpp) {
      if (!(bloomFilterFpp > 0.0d && bloomFilterFpp < 1.0d))
        throw new IllegalArgumentException("The bloom filter false positive probability must be in (0, 1) but was " + bloomFilterFpp);
      this.bloomFilterFpp = bloomFilterFpp;
      return this;
    }

    public Builder contentHashFunction(HashFunction contentHashFunction) {
      this.contentHashFunction = Objects.requireNonNull(contentHashFunction, "contentHashFunction cannot be null");
      return this;
    }

    public BatchConfig build() {
      return new BatchConfig(this);
    }
  }
}
