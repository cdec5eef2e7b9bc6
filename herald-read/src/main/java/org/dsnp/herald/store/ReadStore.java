package org.dsnp.herald.store;

import java.io.InputStream;

/**
 * Read access to published batch files. Keys are store relative paths delimited by {@code /}.
 */
public interface ReadStore {

  boolean exists(String key);

  /**
   * @return The size of the object in bytes.
   */
  long size(String key);

  byte[] get(String key);

  /**
   * Opens a stream over a slice of an object. The caller closes the stream.
   *
   * @param key The object key.
   * @param offset The first byte of the slice.
   * @param length The number of bytes in the slice.
   *
   * @return A stream that yields exactly {@code length} bytes unless the object is shorter.
   */
  InputStream getRange(String key, long offset, long length);
}
