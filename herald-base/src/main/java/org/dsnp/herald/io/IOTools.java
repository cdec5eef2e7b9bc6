package org.dsnp.herald.io;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

public class IOTools {
  public static int readFully(InputStream in, byte[] buf, int off, int len)
      throws IOException {
    if (off < 0)
      throw new IllegalArgumentException("invalid offset: " + off);

    if (len < 0 || (off + len) > buf.length)
      throw new IllegalArgumentException("illegal length: " + len);

    int bytesRead = 0;
    int bytesRemaining = len;

    while (bytesRemaining > 0) {
      int read = in.read(buf, off + bytesRead, bytesRemaining);

      if (read < 0)
        throw new EOFException("end of stream reached: only " + bytesRead + " out of " + len + " bytes read");

      bytesRead += read;
      bytesRemaining -= read;
    }
    return bytesRead;
  }

  /**
   * Reads exactly {@code len} bytes.
   */
  public static byte[] readFully(InputStream in, int len) throws IOException {
    if (len < 0)
      throw new IllegalArgumentException("illegal length: " + len);
    byte[] buf = new byte[len];
    readFully(in, buf, 0, len);
    return buf;
  }

  public static long skipFully(InputStream in, long len)
      throws IOException {
    if (len < 0L)
      throw new IllegalArgumentException("illegal length: " + len);

    long bytesSkipped = 0L;
    long bytesRemaining = len;

    while (bytesRemaining > 0L) {
      long skipped = in.skip(bytesRemaining);
      if (skipped <= 0L) {
        // skip may legally return 0, fall back to reading a byte to detect the end of the stream
        if (in.read() < 0)
          throw new EOFException("end of stream reached: only " + bytesSkipped + " out of " + len + " bytes skipped");
        skipped = 1;
      }
      bytesSkipped += skipped;
      bytesRemaining -= skipped;
    }
    return bytesSkipped;
  }
}
