package org.dsnp.herald.io;

import com.github.luben.zstd.Zstd;
import org.dsnp.herald.Constants;

public enum Compression {
  NONE,
  ZSTD;

  public static Compression getCompression(String value) {
    for (Compression compression : Compression.values()) {
      if (compression.name().equalsIgnoreCase(value))
        return compression;
    }
    return null;
  }

  public byte[] compress(byte[] raw) {
    if (this == ZSTD)
      return Zstd.compress(raw, Constants.ZSTD_LEVEL);
    return raw;
  }

  /**
   * @param compressed The stored bytes.
   * @param uncompressedLength The length recorded when the bytes were written.
   */
  public byte[] decompress(byte[] compressed, int uncompressedLength) {
    if (this == ZSTD)
      return Zstd.decompress(compressed, uncompressedLength);
    return compressed;
  }
}
